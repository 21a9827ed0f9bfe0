package uk.gegc.tokenledger.features.payment.application;

public record ProviderOrder(
        String orderId,
        long amountMinor,
        String currency,
        String receipt
) {
}
