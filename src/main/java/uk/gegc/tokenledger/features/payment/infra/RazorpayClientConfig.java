package uk.gegc.tokenledger.features.payment.infra;

import com.razorpay.RazorpayClient;
import com.razorpay.RazorpayException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import uk.gegc.tokenledger.features.payment.application.PaymentProviderClient;
import uk.gegc.tokenledger.features.payment.application.RazorpayProperties;
import uk.gegc.tokenledger.features.payment.infra.provider.RazorpayPaymentProviderClient;

/**
 * Razorpay client configuration. Exposes the SDK client and the provider port built on it.
 */
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "razorpay.api-enabled", havingValue = "true", matchIfMissing = true)
public class RazorpayClientConfig {

    private final RazorpayProperties razorpay;

    @Bean
    public RazorpayClient razorpayClient() throws RazorpayException {
        if (!StringUtils.hasText(razorpay.getKeyId()) || !StringUtils.hasText(razorpay.getKeySecret())) {
            throw new IllegalStateException("razorpay.key-id and razorpay.key-secret must be configured");
        }
        return new RazorpayClient(razorpay.getKeyId(), razorpay.getKeySecret());
    }

    @Bean
    public PaymentProviderClient paymentProviderClient(RazorpayClient razorpayClient) {
        return new RazorpayPaymentProviderClient(razorpayClient);
    }
}
