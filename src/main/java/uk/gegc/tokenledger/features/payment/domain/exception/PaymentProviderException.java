package uk.gegc.tokenledger.features.payment.domain.exception;

/**
 * The payment provider rejected or failed a call. Nothing has been persisted when this is thrown.
 */
public class PaymentProviderException extends RuntimeException {

    public PaymentProviderException(String message) {
        super(message);
    }

    public PaymentProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
