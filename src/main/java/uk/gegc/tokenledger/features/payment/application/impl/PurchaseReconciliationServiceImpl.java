package uk.gegc.tokenledger.features.payment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import uk.gegc.tokenledger.features.payment.application.LedgerCredit;
import uk.gegc.tokenledger.features.payment.application.PaymentMetricsService;
import uk.gegc.tokenledger.features.payment.application.PaymentProperties;
import uk.gegc.tokenledger.features.payment.application.PaymentStructuredLogger;
import uk.gegc.tokenledger.features.payment.application.PurchaseLedgerService;
import uk.gegc.tokenledger.features.payment.application.PurchaseReconciliationService;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntent;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntentStatus;
import uk.gegc.tokenledger.features.payment.infra.repository.PurchaseIntentRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class PurchaseReconciliationServiceImpl implements PurchaseReconciliationService {

    private final PurchaseIntentRepository intentRepository;
    private final PurchaseLedgerService ledgerService;
    private final PaymentProperties paymentProperties;
    private final PaymentMetricsService metricsService;
    private final Clock clock;

    @Override
    public ReconciliationReport reconcile() {
        PaymentProperties.Reconciliation config = paymentProperties.getReconciliation();
        PageRequest batch = PageRequest.of(0, config.getBatchSize());

        int repaired = 0;
        int failed = 0;
        List<PurchaseIntent> uncredited = intentRepository.findWithoutLedgerEntry(PurchaseIntentStatus.COMPLETED, batch);
        for (PurchaseIntent intent : uncredited) {
            try {
                Optional<LedgerCredit> credit = ledgerService.creditMissingEntry(intent.getId());
                if (credit.isPresent()) {
                    repaired++;
                    metricsService.incrementReconciliationRepair();
                    metricsService.incrementTokensCredited(credit.get().tier(), credit.get().tokensAdded(), credit.get().type());
                    PaymentStructuredLogger.logLedgerCredit(log, "warn",
                            "Reconciliation credited {} tokens for completed intent that had no ledger entry",
                            credit.get(), credit.get().tokensAdded());
                }
            } catch (DataIntegrityViolationException e) {
                log.info("Intent {} was credited concurrently, skipping: {}", intent.getId(), e.getMessage());
            } catch (DataAccessException e) {
                failed++;
                log.error("Reconciliation failed to credit intent {}", intent.getId(), e);
            }
        }

        LocalDateTime cutoff = LocalDateTime.now(clock).minus(config.getStaleAfter());
        long stale = intentRepository.countByStatusAndCreatedAtBefore(PurchaseIntentStatus.PENDING, cutoff);
        metricsService.recordStalePendingIntents(stale);
        if (stale > 0) {
            List<PurchaseIntent> oldest = intentRepository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
                    PurchaseIntentStatus.PENDING, cutoff, batch);
            for (PurchaseIntent intent : oldest) {
                PaymentStructuredLogger.logOrderOperation(log, "warn",
                        "Purchase intent pending since {}, check provider order status manually",
                        intent.getTenantId(), intent.getId(), intent.getProviderOrderId(), null, intent.getCreatedAt());
            }
        }

        if (repaired > 0 || failed > 0 || stale > 0) {
            log.info("Reconciliation finished: repaired={}, failed={}, stalePending={}", repaired, failed, stale);
        }
        return new ReconciliationReport(repaired, failed, stale);
    }
}
