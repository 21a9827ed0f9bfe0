package uk.gegc.tokenledger.features.payment.application;

import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseAlreadyProcessedException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseIntentNotFoundException;

import java.util.Optional;
import java.util.UUID;

/**
 * Transactional state transitions of purchase intents and the balance credits tied to them.
 * Each method is one database transaction.
 */
public interface PurchaseLedgerService {

    /**
     * Moves the intent from PENDING to COMPLETED, increments the tenant pool and appends the ledger entry.
     *
     * @throws PurchaseIntentNotFoundException   if no intent matches the id and provider order id
     * @throws PurchaseAlreadyProcessedException if the intent is no longer pending
     */
    LedgerCredit completeAndCredit(UUID intentId, String providerOrderId, String paymentId, String signature);

    /**
     * @return true when this call moved the intent from PENDING to FAILED
     */
    boolean failIfPending(UUID intentId, String providerOrderId);

    /**
     * Credits a completed intent that has no ledger entry yet. Empty when there is nothing to repair.
     */
    Optional<LedgerCredit> creditMissingEntry(UUID intentId);
}
