package uk.gegc.tokenledger.features.payment.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import uk.gegc.tokenledger.features.payment.application.PurchaseReconciliationService;

/**
 * Periodically runs the purchase reconciliation sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "payments.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
public class PurchaseReconciliationScheduler {

    private final PurchaseReconciliationService reconciliationService;

    @Scheduled(cron = "${payments.reconciliation.cron:0 15 * * * *}")
    public void reconcile() {
        try {
            reconciliationService.reconcile();
        } catch (Exception e) {
            log.warn("PurchaseReconciliationScheduler: error during reconciliation", e);
        }
    }
}
