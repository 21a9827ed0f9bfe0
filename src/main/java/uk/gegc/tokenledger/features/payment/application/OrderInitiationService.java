package uk.gegc.tokenledger.features.payment.application;

import uk.gegc.tokenledger.features.payment.api.dto.CreateOrderRequest;
import uk.gegc.tokenledger.features.payment.api.dto.CreateOrderResponse;

import java.util.UUID;

public interface OrderInitiationService {

    /**
     * Prices the request, opens a provider order and records a pending purchase intent.
     * Gates run in order: tenant admin role, tier, quantity.
     */
    CreateOrderResponse createOrder(UUID principalId, CreateOrderRequest request);
}
