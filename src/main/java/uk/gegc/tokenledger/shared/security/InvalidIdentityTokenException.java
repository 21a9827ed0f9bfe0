package uk.gegc.tokenledger.shared.security;

public class InvalidIdentityTokenException extends RuntimeException {

    public InvalidIdentityTokenException(String message) {
        super(message);
    }

    public InvalidIdentityTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
