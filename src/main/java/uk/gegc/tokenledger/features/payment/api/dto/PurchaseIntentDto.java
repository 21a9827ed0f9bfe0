package uk.gegc.tokenledger.features.payment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntentStatus;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "PurchaseIntentDto", description = "One token purchase attempt")
public record PurchaseIntentDto(
        UUID intentId,

        @Schema(description = "Purchase tier", example = "premium")
        String purchaseType,

        int quantity,

        @Schema(description = "Amount in minor currency units", example = "37500")
        long amount,

        String currency,

        PurchaseIntentStatus status,

        String orderId,

        @Schema(description = "Set once the payment is verified")
        String paymentId,

        LocalDateTime createdAt,

        LocalDateTime completedAt
) {}
