package uk.gegc.tokenledger.features.payment.domain.exception;

public class InvalidPurchaseRequestException extends RuntimeException {

    public InvalidPurchaseRequestException(String message) {
        super(message);
    }
}
