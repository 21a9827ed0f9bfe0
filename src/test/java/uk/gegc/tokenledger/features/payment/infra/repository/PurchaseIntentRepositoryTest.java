package uk.gegc.tokenledger.features.payment.infra.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntent;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntentStatus;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseTier;
import uk.gegc.tokenledger.features.payment.domain.model.TokenTransaction;
import uk.gegc.tokenledger.features.payment.domain.model.TokenTransactionType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.tokenledger.features.payment.PurchaseFixtures.pendingIntent;

@DataJpaTest
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
@DisplayName("PurchaseIntentRepository")
class PurchaseIntentRepositoryTest {

    @Autowired
    private PurchaseIntentRepository intentRepository;

    @Autowired
    private TokenTransactionRepository transactionRepository;

    private final UUID tenantId = UUID.randomUUID();
    private final LocalDateTime now = LocalDateTime.of(2026, 3, 1, 12, 0);

    @Test
    @DisplayName("markCompleted wins exactly once")
    void markCompletedOnlyOnce() {
        PurchaseIntent intent = intentRepository.saveAndFlush(pendingIntent(tenantId, PurchaseTier.BASIC, 10, "order_1"));

        int first = intentRepository.markCompleted(intent.getId(), "order_1", "pay_1", "sig_1", now,
                PurchaseIntentStatus.PENDING, PurchaseIntentStatus.COMPLETED);
        int second = intentRepository.markCompleted(intent.getId(), "order_1", "pay_2", "sig_2", now.plusMinutes(1),
                PurchaseIntentStatus.PENDING, PurchaseIntentStatus.COMPLETED);

        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();

        PurchaseIntent stored = intentRepository.findById(intent.getId()).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(PurchaseIntentStatus.COMPLETED);
        assertThat(stored.getProviderPaymentId()).isEqualTo("pay_1");
        assertThat(stored.getProviderSignature()).isEqualTo("sig_1");
        assertThat(stored.getCompletedAt()).isEqualTo(now);
    }

    @Test
    @DisplayName("markCompleted requires the matching provider order id")
    void markCompletedChecksOrderId() {
        PurchaseIntent intent = intentRepository.saveAndFlush(pendingIntent(tenantId, PurchaseTier.BASIC, 10, "order_2"));

        int updated = intentRepository.markCompleted(intent.getId(), "order_other", "pay_1", "sig_1", now,
                PurchaseIntentStatus.PENDING, PurchaseIntentStatus.COMPLETED);

        assertThat(updated).isZero();
        assertThat(intentRepository.findStatusByIdAndProviderOrderId(intent.getId(), "order_2"))
                .contains(PurchaseIntentStatus.PENDING);
    }

    @Test
    @DisplayName("markFailed never leaves a terminal state")
    void markFailedOnlyFromPending() {
        PurchaseIntent intent = intentRepository.saveAndFlush(pendingIntent(tenantId, PurchaseTier.PREMIUM, 5, "order_3"));
        intentRepository.markCompleted(intent.getId(), "order_3", "pay_3", "sig_3", now,
                PurchaseIntentStatus.PENDING, PurchaseIntentStatus.COMPLETED);

        int failed = intentRepository.markFailed(intent.getId(), "order_3",
                PurchaseIntentStatus.PENDING, PurchaseIntentStatus.FAILED);

        assertThat(failed).isZero();
        assertThat(intentRepository.findById(intent.getId()).orElseThrow().getStatus())
                .isEqualTo(PurchaseIntentStatus.COMPLETED);
    }

    @Test
    @DisplayName("provider order id is unique")
    void uniqueProviderOrderId() {
        intentRepository.saveAndFlush(pendingIntent(tenantId, PurchaseTier.BASIC, 1, "order_dup"));

        assertThatThrownBy(() -> intentRepository.saveAndFlush(pendingIntent(tenantId, PurchaseTier.BASIC, 2, "order_dup")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("finds completed intents that have no ledger entry")
    void findsUncreditedCompletedIntents() {
        PurchaseIntent credited = intentRepository.saveAndFlush(pendingIntent(tenantId, PurchaseTier.BASIC, 10, "order_c"));
        PurchaseIntent uncredited = intentRepository.saveAndFlush(pendingIntent(tenantId, PurchaseTier.BASIC, 20, "order_u"));
        intentRepository.saveAndFlush(pendingIntent(tenantId, PurchaseTier.BASIC, 30, "order_p"));
        for (PurchaseIntent intent : List.of(credited, uncredited)) {
            intentRepository.markCompleted(intent.getId(), intent.getProviderOrderId(), "pay", "sig", now,
                    PurchaseIntentStatus.PENDING, PurchaseIntentStatus.COMPLETED);
        }

        TokenTransaction entry = new TokenTransaction();
        entry.setTenantId(tenantId);
        entry.setIntentId(credited.getId());
        entry.setType(TokenTransactionType.PURCHASE);
        entry.setPool(PurchaseTier.BASIC);
        entry.setAmountTokens(10L);
        entry.setBalanceAfter(10L);
        entry.setCreatedAt(now);
        transactionRepository.saveAndFlush(entry);

        List<PurchaseIntent> found = intentRepository.findWithoutLedgerEntry(PurchaseIntentStatus.COMPLETED, PageRequest.of(0, 10));

        assertThat(found).extracting(PurchaseIntent::getId).containsExactly(uncredited.getId());
    }

    @Test
    @DisplayName("lists a tenant's purchases newest first")
    void listsByTenant() {
        PurchaseIntent older = pendingIntent(tenantId, PurchaseTier.BASIC, 1, "order_old");
        older.setCreatedAt(now.minusDays(1));
        PurchaseIntent newer = pendingIntent(tenantId, PurchaseTier.BASIC, 2, "order_new");
        newer.setCreatedAt(now);
        intentRepository.saveAndFlush(older);
        intentRepository.saveAndFlush(newer);
        intentRepository.saveAndFlush(pendingIntent(UUID.randomUUID(), PurchaseTier.BASIC, 3, "order_foreign"));

        var page = intentRepository.findByTenantId(tenantId, PageRequest.of(0, 10, Sort.by(Sort.Direction.DESC, "createdAt")));

        assertThat(page.getContent()).extracting(PurchaseIntent::getProviderOrderId)
                .containsExactly("order_new", "order_old");
    }

    @Test
    @DisplayName("counts stale pending intents")
    void countsStalePending() {
        PurchaseIntent stale = pendingIntent(tenantId, PurchaseTier.BASIC, 1, "order_stale");
        stale.setCreatedAt(now.minusDays(2));
        PurchaseIntent fresh = pendingIntent(tenantId, PurchaseTier.BASIC, 1, "order_fresh");
        fresh.setCreatedAt(now.minusHours(1));
        intentRepository.saveAndFlush(stale);
        intentRepository.saveAndFlush(fresh);

        assertThat(intentRepository.countByStatusAndCreatedAtBefore(PurchaseIntentStatus.PENDING, now.minusHours(24)))
                .isEqualTo(1L);
    }
}
