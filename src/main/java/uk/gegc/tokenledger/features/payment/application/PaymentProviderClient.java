package uk.gegc.tokenledger.features.payment.application;

import uk.gegc.tokenledger.features.payment.domain.exception.PaymentProviderException;

/**
 * Port to the external payment provider.
 */
public interface PaymentProviderClient {

    /**
     * Opens a provider-side order the customer can pay against.
     *
     * @throws PaymentProviderException if the provider rejects the order or cannot be reached
     */
    ProviderOrder createOrder(ProviderOrderRequest request);
}
