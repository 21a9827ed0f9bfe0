package uk.gegc.tokenledger.features.payment.application;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Checks the provider's payment proof: lower-case hex HMAC-SHA256 over {@code orderId|paymentId}
 * keyed with the API secret.
 */
@Component
public class PaymentSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKeySpec key;

    public PaymentSignatureVerifier(RazorpayProperties properties) {
        if (!StringUtils.hasText(properties.getKeySecret())) {
            throw new IllegalStateException("razorpay.key-secret must be configured");
        }
        this.key = new SecretKeySpec(properties.getKeySecret().getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public boolean verify(String orderId, String paymentId, String signature) {
        if (orderId == null || paymentId == null || signature == null) {
            return false;
        }
        byte[] expected = sign(orderId, paymentId).getBytes(StandardCharsets.UTF_8);
        byte[] actual = signature.getBytes(StandardCharsets.UTF_8);
        // constant-time compare
        return MessageDigest.isEqual(expected, actual);
    }

    public String sign(String orderId, String paymentId) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            byte[] digest = mac.doFinal((orderId + "|" + paymentId).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC calculation failed", e);
        }
    }
}
