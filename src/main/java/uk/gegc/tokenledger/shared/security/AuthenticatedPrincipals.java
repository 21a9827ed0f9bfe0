package uk.gegc.tokenledger.shared.security;

import org.springframework.security.core.Authentication;

import java.util.UUID;

/**
 * Utility for extracting the principal id that {@link BearerTokenAuthenticationFilter} installed.
 */
public final class AuthenticatedPrincipals {

    private AuthenticatedPrincipals() {
    }

    /**
     * @throws InvalidIdentityTokenException if there is no authenticated principal or its name is not a UUID
     */
    public static UUID requirePrincipalId(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new InvalidIdentityTokenException("No authenticated principal");
        }
        String name = authentication.getName();
        if (name == null || name.isBlank()) {
            throw new InvalidIdentityTokenException("Principal id not found in authentication");
        }
        try {
            return UUID.fromString(name);
        } catch (IllegalArgumentException e) {
            throw new InvalidIdentityTokenException("Invalid principal id format in authentication", e);
        }
    }
}
