package uk.gegc.tokenledger.features.payment.application;

/**
 * Repairs completed intents that were never credited and reports pending intents that went stale.
 */
public interface PurchaseReconciliationService {

    ReconciliationReport reconcile();

    record ReconciliationReport(int repaired, int failed, long stalePending) {
    }
}
