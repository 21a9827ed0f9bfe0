package uk.gegc.tokenledger.features.payment.domain.model;

public enum PurchaseIntentStatus {
    PENDING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
