package uk.gegc.tokenledger.features.payment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "CreateOrderResponse", description = "Provider order opened for a pending purchase")
public record CreateOrderResponse(
        @Schema(description = "Provider order id to pass to the checkout widget", example = "order_NzGr1ZVZ0vPp7X")
        String orderId,

        @Schema(description = "Amount in minor currency units", example = "500")
        long amount,

        @Schema(description = "ISO currency code", example = "INR")
        String currency,

        @Schema(description = "Purchase intent UUID, required for verification")
        UUID intentId,

        @Schema(description = "Provider public key id for the checkout widget", example = "rzp_test_1DP5mmOlF5G5ag")
        String providerPublicKey
) {}
