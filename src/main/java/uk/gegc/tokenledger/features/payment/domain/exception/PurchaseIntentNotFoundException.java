package uk.gegc.tokenledger.features.payment.domain.exception;

import java.util.UUID;

public class PurchaseIntentNotFoundException extends RuntimeException {

    private final UUID intentId;

    public PurchaseIntentNotFoundException(UUID intentId) {
        super("Purchase record not found");
        this.intentId = intentId;
    }

    public UUID getIntentId() {
        return intentId;
    }
}
