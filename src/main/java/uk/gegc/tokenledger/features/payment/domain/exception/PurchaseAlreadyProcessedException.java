package uk.gegc.tokenledger.features.payment.domain.exception;

import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntentStatus;

import java.util.UUID;

/**
 * The intent already left {@code PENDING}. Clients should treat this as "already handled",
 * not retry it.
 */
public class PurchaseAlreadyProcessedException extends RuntimeException {

    private final UUID intentId;
    private final PurchaseIntentStatus currentStatus;

    public PurchaseAlreadyProcessedException(UUID intentId, PurchaseIntentStatus currentStatus) {
        super("Purchase already processed");
        this.intentId = intentId;
        this.currentStatus = currentStatus;
    }

    public UUID getIntentId() {
        return intentId;
    }

    public PurchaseIntentStatus getCurrentStatus() {
        return currentStatus;
    }
}
