package uk.gegc.tokenledger.shared.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.SecretKey;
import java.util.UUID;

/**
 * Verifies HS256 bearer tokens issued by the identity provider. The {@code sub} claim
 * carries the principal id.
 */
@Slf4j
@Component
public class JwtIdentityVerifier implements IdentityVerifier {

    private final JwtParser parser;

    public JwtIdentityVerifier(IdentityProperties properties) {
        SecretKey key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(properties.getSecret()));
        JwtParserBuilder builder = Jwts.parser().verifyWith(key);
        if (StringUtils.hasText(properties.getIssuer())) {
            builder.requireIssuer(properties.getIssuer());
        }
        this.parser = builder.build();
    }

    @Override
    public VerifiedIdentity verify(String bearerToken) {
        if (!StringUtils.hasText(bearerToken)) {
            throw new InvalidIdentityTokenException("Bearer token is empty");
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(bearerToken).getPayload();
        } catch (ExpiredJwtException ex) {
            log.debug("Bearer token expired: {}", ex.getMessage());
            throw new InvalidIdentityTokenException("Bearer token expired", ex);
        } catch (JwtException | IllegalArgumentException ex) {
            log.warn("Bearer token rejected: {}", ex.getMessage());
            throw new InvalidIdentityTokenException("Bearer token invalid", ex);
        }

        String subject = claims.getSubject();
        if (!StringUtils.hasText(subject)) {
            throw new InvalidIdentityTokenException("Bearer token missing subject");
        }
        try {
            return new VerifiedIdentity(UUID.fromString(subject));
        } catch (IllegalArgumentException ex) {
            throw new InvalidIdentityTokenException("Bearer token subject is not a principal id", ex);
        }
    }
}
