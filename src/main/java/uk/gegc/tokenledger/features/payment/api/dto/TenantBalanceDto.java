package uk.gegc.tokenledger.features.payment.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.LocalDateTime;
import java.util.UUID;

@Schema(name = "TenantBalanceDto", description = "Tenant's prepaid token pools")
public record TenantBalanceDto(
        @Schema(description = "Tenant UUID")
        UUID tenantId,

        @Schema(description = "Basic tokens available", example = "1200")
        long basicTokens,

        @Schema(description = "Premium tokens available", example = "15")
        long premiumTokens,

        @Schema(description = "Last balance update timestamp, null if never credited")
        LocalDateTime updatedAt
) {}
