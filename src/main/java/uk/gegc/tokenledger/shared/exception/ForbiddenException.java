package uk.gegc.tokenledger.shared.exception;

/**
 * Thrown when an authenticated principal lacks the tenant role an operation requires.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
