package uk.gegc.tokenledger.features.payment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "VerifyPaymentRequest", description = "Payment proof returned by the provider checkout")
public record VerifyPaymentRequest(
        @Schema(description = "Provider order id", example = "order_NzGr1ZVZ0vPp7X")
        @NotBlank @Size(max = 64)
        String orderId,

        @Schema(description = "Provider payment id", example = "pay_NzGs8bFYtQ7mRk")
        @NotBlank @Size(max = 64)
        String paymentId,

        @Schema(description = "Hex HMAC-SHA256 signature over orderId|paymentId")
        @NotBlank @Size(max = 128)
        String signature,

        @Schema(description = "Purchase intent UUID returned at order creation")
        @NotNull
        UUID intentId
) {}
