package uk.gegc.tokenledger.shared.api.problem;

/**
 * Stable, machine-readable error category carried as the {@code kind} property
 * of every problem response. Clients branch on this value, never on {@code detail}.
 */
public enum ErrorKind {
    UNAUTHORIZED,
    FORBIDDEN,
    INVALID_ARGUMENT,
    INVALID_SIGNATURE,
    NOT_FOUND,
    CONFLICT,
    INTERNAL
}
