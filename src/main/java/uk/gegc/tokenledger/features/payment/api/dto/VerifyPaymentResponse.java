package uk.gegc.tokenledger.features.payment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "VerifyPaymentResponse", description = "Result of a successful credit")
public record VerifyPaymentResponse(
        @Schema(description = "Always true on a 200 response")
        boolean success,

        @Schema(description = "Pool that was credited", example = "basic")
        String purchaseType,

        @Schema(description = "Tokens credited", example = "10")
        long tokensAdded,

        @Schema(description = "Pool balance after the credit", example = "110")
        long newBalance
) {}
