package uk.gegc.tokenledger.features.payment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "tenant_balances")
@Getter
@Setter
public class TenantBalance {

    @Id
    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "basic_tokens", nullable = false)
    private long basicTokens;

    @Column(name = "premium_tokens", nullable = false)
    private long premiumTokens;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    // Null until first insert, so a fresh row is persisted and never merged over an existing one
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public long tokensFor(PurchaseTier tier) {
        return tier == PurchaseTier.PREMIUM ? premiumTokens : basicTokens;
    }

    public static TenantBalance empty(UUID tenantId, LocalDateTime now) {
        TenantBalance balance = new TenantBalance();
        balance.setTenantId(tenantId);
        balance.setBasicTokens(0L);
        balance.setPremiumTokens(0L);
        balance.setUpdatedAt(now);
        return balance;
    }
}
