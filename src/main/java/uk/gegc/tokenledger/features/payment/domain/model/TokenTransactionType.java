package uk.gegc.tokenledger.features.payment.domain.model;

public enum TokenTransactionType {
    PURCHASE,
    RECONCILIATION
}
