package uk.gegc.tokenledger.features.payment.application;

import java.util.Map;

/**
 * @param notes metadata echoed back by the provider, used for reconciliation
 */
public record ProviderOrderRequest(
        long amountMinor,
        String currency,
        String receipt,
        Map<String, String> notes
) {
}
