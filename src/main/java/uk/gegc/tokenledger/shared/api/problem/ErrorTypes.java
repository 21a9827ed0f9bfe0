package uk.gegc.tokenledger.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 * Each constant should point to documentation describing the error.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://tokenledger.gegc.uk/docs/errors";

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Payment Errors ====================
    public static final URI INVALID_PAYMENT_SIGNATURE = URI.create(BASE_URL + "/invalid-payment-signature");
    public static final URI PURCHASE_NOT_FOUND = URI.create(BASE_URL + "/purchase-not-found");
    public static final URI PURCHASE_ALREADY_PROCESSED = URI.create(BASE_URL + "/purchase-already-processed");
    public static final URI PAYMENT_PROVIDER_ERROR = URI.create(BASE_URL + "/payment-provider-error");
    public static final URI PURCHASE_RECORD_FAILED = URI.create(BASE_URL + "/purchase-record-failed");
    public static final URI STORAGE_UNAVAILABLE = URI.create(BASE_URL + "/storage-unavailable");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
