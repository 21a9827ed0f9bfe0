package uk.gegc.tokenledger.features.payment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

/**
 * Fields are checked by the order service after the tenant role check, so nothing is
 * annotated for bean validation here.
 */
@Schema(name = "CreateOrderRequest", description = "Request to buy a block of tokens for a tenant")
public record CreateOrderRequest(
        @Schema(description = "Purchase tier", allowableValues = {"basic", "premium"}, example = "basic",
                requiredMode = Schema.RequiredMode.REQUIRED)
        String tier,

        @Schema(description = "Number of tokens to buy", example = "10", minimum = "1", maximum = "100000",
                requiredMode = Schema.RequiredMode.REQUIRED)
        Integer quantity,

        @Schema(description = "Tenant (agency) UUID", requiredMode = Schema.RequiredMode.REQUIRED)
        UUID tenantId
) {}
