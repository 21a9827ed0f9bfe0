package uk.gegc.tokenledger.features.payment.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token purchase configuration (pricing and limits).
 */
@Configuration
@ConfigurationProperties(prefix = "payments")
@Validated
@Data
public class PaymentProperties {

    /**
     * Single supported ISO currency code.
     */
    @NotBlank
    @Pattern(regexp = "[A-Z]{3}")
    private String currency = "INR";

    /**
     * Largest quantity a single order may buy.
     */
    @Positive
    private int maxQuantity = 100_000;

    /**
     * Unit price per token in minor currency units, keyed by tier code.
     */
    @NotEmpty
    private Map<String, Long> unitPrices = new LinkedHashMap<>(Map.of("basic", 50L, "premium", 7500L));

    /**
     * Prefix of the receipt label sent to the provider.
     */
    @NotBlank
    private String receiptPrefix = "tp_";

    @Valid
    @NotNull
    private Reconciliation reconciliation = new Reconciliation();

    @Data
    public static class Reconciliation {

        private boolean enabled = true;

        @NotBlank
        private String cron = "0 15 * * * *";

        /**
         * Age after which a pending intent is reported as stale.
         */
        @NotNull
        private Duration staleAfter = Duration.ofHours(24);

        @Positive
        private int batchSize = 100;
    }
}
