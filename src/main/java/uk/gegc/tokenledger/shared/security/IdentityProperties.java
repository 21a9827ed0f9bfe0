package uk.gegc.tokenledger.shared.security;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Bearer token verification settings.
 */
@Configuration
@ConfigurationProperties(prefix = "security.identity")
@Validated
@Data
public class IdentityProperties {

    /** Base64-encoded HMAC key shared with the identity provider (at least 256 bits). */
    @NotBlank
    private String secret;

    /** Expected {@code iss} claim; not checked when blank. */
    private String issuer;
}
