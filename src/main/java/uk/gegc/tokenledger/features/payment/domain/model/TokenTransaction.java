package uk.gegc.tokenledger.features.payment.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Append-only credit entry. At most one per purchase intent.
 */
@Entity
@Table(name = "token_transactions")
@Getter
@Setter
public class TokenTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private UUID tenantId;

    @Column(name = "intent_id", nullable = false, unique = true, updatable = false)
    private UUID intentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 32)
    private TokenTransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "pool", nullable = false, updatable = false, length = 16)
    private PurchaseTier pool;

    @Column(name = "amount_tokens", nullable = false, updatable = false)
    private long amountTokens;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private long balanceAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
