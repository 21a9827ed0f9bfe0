package uk.gegc.tokenledger.features.payment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.tokenledger.features.payment.application.LedgerCredit;
import uk.gegc.tokenledger.features.payment.application.PurchaseLedgerService;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseAlreadyProcessedException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseIntentNotFoundException;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntent;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntentStatus;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseTier;
import uk.gegc.tokenledger.features.payment.domain.model.TenantBalance;
import uk.gegc.tokenledger.features.payment.domain.model.TokenTransaction;
import uk.gegc.tokenledger.features.payment.domain.model.TokenTransactionType;
import uk.gegc.tokenledger.features.payment.infra.repository.PurchaseIntentRepository;
import uk.gegc.tokenledger.features.payment.infra.repository.TenantBalanceRepository;
import uk.gegc.tokenledger.features.payment.infra.repository.TokenTransactionRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseLedgerServiceImpl implements PurchaseLedgerService {

    private final PurchaseIntentRepository intentRepository;
    private final TenantBalanceRepository balanceRepository;
    private final TokenTransactionRepository transactionRepository;
    private final Clock clock;

    @Override
    @Transactional
    public LedgerCredit completeAndCredit(UUID intentId, String providerOrderId, String paymentId, String signature) {
        PurchaseIntent intent = intentRepository.findByIdAndProviderOrderId(intentId, providerOrderId)
                .orElseThrow(() -> new PurchaseIntentNotFoundException(intentId));

        if (intent.getStatus() != PurchaseIntentStatus.PENDING) {
            throw new PurchaseAlreadyProcessedException(intentId, intent.getStatus());
        }

        // The conditional update decides the winner; the read above is only a fast path
        int updated = intentRepository.markCompleted(intentId, providerOrderId, paymentId, signature,
                LocalDateTime.now(clock), PurchaseIntentStatus.PENDING, PurchaseIntentStatus.COMPLETED);
        if (updated == 0) {
            PurchaseIntentStatus current = intentRepository.findStatusByIdAndProviderOrderId(intentId, providerOrderId)
                    .orElse(intent.getStatus());
            throw new PurchaseAlreadyProcessedException(intentId, current);
        }

        return credit(intent, TokenTransactionType.PURCHASE);
    }

    @Override
    @Transactional
    public boolean failIfPending(UUID intentId, String providerOrderId) {
        return intentRepository.markFailed(intentId, providerOrderId,
                PurchaseIntentStatus.PENDING, PurchaseIntentStatus.FAILED) == 1;
    }

    @Override
    @Transactional
    public Optional<LedgerCredit> creditMissingEntry(UUID intentId) {
        Optional<PurchaseIntent> intent = intentRepository.findById(intentId);
        if (intent.isEmpty() || intent.get().getStatus() != PurchaseIntentStatus.COMPLETED) {
            return Optional.empty();
        }
        if (transactionRepository.existsByIntentId(intentId)) {
            return Optional.empty();
        }
        return Optional.of(credit(intent.get(), TokenTransactionType.RECONCILIATION));
    }

    private LedgerCredit credit(PurchaseIntent intent, TokenTransactionType type) {
        UUID tenantId = intent.getTenantId();
        PurchaseTier tier = intent.getTier();
        long delta = intent.getQuantity();
        LocalDateTime now = LocalDateTime.now(clock);

        if (increment(tenantId, tier, delta, now) == 0) {
            log.warn("Tenant {} had no balance row at credit time, creating it", tenantId);
            balanceRepository.saveAndFlush(TenantBalance.empty(tenantId, now));
            if (increment(tenantId, tier, delta, now) == 0) {
                throw new IllegalStateException("Balance row for tenant " + tenantId + " vanished during credit");
            }
        }

        TenantBalance balance = balanceRepository.findById(tenantId)
                .orElseThrow(() -> new IllegalStateException("Balance row for tenant " + tenantId + " not found after credit"));
        long newBalance = balance.tokensFor(tier);

        // Unique intent_id: a second credit for the same intent fails here and rolls back the increment
        TokenTransaction entry = new TokenTransaction();
        entry.setTenantId(tenantId);
        entry.setIntentId(intent.getId());
        entry.setType(type);
        entry.setPool(tier);
        entry.setAmountTokens(delta);
        entry.setBalanceAfter(newBalance);
        entry.setCreatedAt(now);
        transactionRepository.saveAndFlush(entry);

        return new LedgerCredit(tenantId, intent.getId(), intent.getProviderOrderId(), tier, delta, newBalance, type);
    }

    private int increment(UUID tenantId, PurchaseTier tier, long delta, LocalDateTime now) {
        return switch (tier) {
            case BASIC -> balanceRepository.incrementBasicTokens(tenantId, delta, now);
            case PREMIUM -> balanceRepository.incrementPremiumTokens(tenantId, delta, now);
        };
    }
}
