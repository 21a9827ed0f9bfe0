package uk.gegc.tokenledger.features.payment.application;

import uk.gegc.tokenledger.features.payment.domain.model.PurchaseTier;
import uk.gegc.tokenledger.features.payment.domain.model.TokenTransactionType;

/**
 * Counters and gauges for the purchase pipeline.
 */
public interface PaymentMetricsService {

    void incrementOrderCreated(PurchaseTier tier, long amountMinor);

    void incrementProviderFailure();

    void incrementOrphanedOrder();

    /**
     * @param outcome one of {@code completed}, {@code invalid_signature}, {@code not_found},
     *                {@code conflict}, {@code error}
     */
    void incrementVerification(String outcome);

    void incrementTokensCredited(PurchaseTier tier, long tokens, TokenTransactionType type);

    void incrementReconciliationRepair();

    void recordStalePendingIntents(long count);
}
