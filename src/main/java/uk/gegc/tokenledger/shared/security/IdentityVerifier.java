package uk.gegc.tokenledger.shared.security;

/**
 * Port to the external identity provider. Implementations turn a bearer token into the
 * principal it was issued for, or reject it.
 */
public interface IdentityVerifier {

    /**
     * @param bearerToken raw token without the {@code Bearer } prefix
     * @return the verified identity
     * @throws InvalidIdentityTokenException if the token is malformed, expired or not signed by the issuer
     */
    VerifiedIdentity verify(String bearerToken);
}
