package uk.gegc.tokenledger.features.payment.application;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Razorpay credentials. The key secret both authenticates API calls and signs payment proofs.
 */
@Configuration
@ConfigurationProperties(prefix = "razorpay")
@Data
public class RazorpayProperties {

    /** Public key id, handed to the checkout widget. */
    private String keyId;

    /** API secret, server-side only. */
    private String keySecret;

    /** Whether to create the SDK client at all; disabled in tests. */
    private boolean apiEnabled = true;
}
