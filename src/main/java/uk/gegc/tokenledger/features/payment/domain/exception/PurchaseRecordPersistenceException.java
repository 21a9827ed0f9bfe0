package uk.gegc.tokenledger.features.payment.domain.exception;

/**
 * A purchase record could not be written. Raised both for orphaned provider orders and for
 * verifications that kept losing storage races; the caller may retry.
 */
public class PurchaseRecordPersistenceException extends RuntimeException {

    public PurchaseRecordPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
