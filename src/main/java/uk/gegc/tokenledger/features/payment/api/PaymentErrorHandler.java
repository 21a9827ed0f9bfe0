package uk.gegc.tokenledger.features.payment.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import uk.gegc.tokenledger.features.payment.domain.exception.InvalidPaymentSignatureException;
import uk.gegc.tokenledger.features.payment.domain.exception.InvalidPurchaseRequestException;
import uk.gegc.tokenledger.features.payment.domain.exception.PaymentProviderException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseAlreadyProcessedException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseIntentNotFoundException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseRecordPersistenceException;
import uk.gegc.tokenledger.shared.api.problem.ErrorKind;
import uk.gegc.tokenledger.shared.api.problem.ErrorTypes;
import uk.gegc.tokenledger.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.tokenledger.shared.exception.ForbiddenException;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps purchase pipeline exceptions to RFC 7807 Problem Detail responses.
 * Internal failures never echo exception messages.
 */
@Slf4j
@RestControllerAdvice(basePackages = "uk.gegc.tokenledger.features.payment.api")
public class PaymentErrorHandler {

    @ExceptionHandler(InvalidPaymentSignatureException.class)
    public ResponseEntity<ProblemDetail> handleInvalidSignature(InvalidPaymentSignatureException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_PAYMENT_SIGNATURE,
                ErrorKind.INVALID_SIGNATURE,
                "Invalid Payment Signature",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(PurchaseIntentNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleNotFound(PurchaseIntentNotFoundException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.NOT_FOUND,
                ErrorTypes.PURCHASE_NOT_FOUND,
                ErrorKind.NOT_FOUND,
                "Purchase Not Found",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problem);
    }

    @ExceptionHandler(PurchaseAlreadyProcessedException.class)
    public ResponseEntity<ProblemDetail> handleAlreadyProcessed(PurchaseAlreadyProcessedException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.CONFLICT,
                ErrorTypes.PURCHASE_ALREADY_PROCESSED,
                ErrorKind.CONFLICT,
                "Purchase Already Processed",
                ex.getMessage(),
                request,
                Map.of("currentStatus", ex.getCurrentStatus().name().toLowerCase())
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(problem);
    }

    @ExceptionHandler(InvalidPurchaseRequestException.class)
    public ResponseEntity<ProblemDetail> handleInvalidRequest(InvalidPurchaseRequestException ex, HttpServletRequest request) {
        log.warn("Invalid purchase request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_ARGUMENT,
                ErrorKind.INVALID_ARGUMENT,
                "Invalid Argument",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidationErrors(MethodArgumentNotValidException ex, HttpServletRequest request) {
        log.warn("Validation errors: {}", ex.getMessage());
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                ErrorKind.INVALID_ARGUMENT,
                "Validation Failed",
                "Validation failed for one or more fields",
                request
        );
        problem.setProperty("errors", errors);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        log.warn("Type mismatch error: {}", ex.getMessage());
        String param = ex.getName();
        Class<?> type = ex.getRequiredType();
        String requiredType = type != null ? type.getSimpleName() : "unknown";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TYPE_MISMATCH,
                ErrorKind.INVALID_ARGUMENT,
                "Type Mismatch Error",
                "Invalid value for parameter '" + param + "'. Expected type: " + requiredType + ".",
                request
        );
        problem.setProperty("parameter", param);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ProblemDetail> handleMissingParameter(MissingServletRequestParameterException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_ARGUMENT,
                ErrorKind.INVALID_ARGUMENT,
                "Missing Parameter",
                "Required parameter '" + ex.getParameterName() + "' is missing",
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Invalid request body: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_JSON,
                ErrorKind.INVALID_ARGUMENT,
                "Invalid Request Body",
                "Request body is missing or malformed",
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(ForbiddenException.class)
    public ResponseEntity<ProblemDetail> handleForbidden(ForbiddenException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.FORBIDDEN,
                ErrorTypes.ACCESS_DENIED,
                ErrorKind.FORBIDDEN,
                "Forbidden",
                ex.getMessage(),
                request
        );
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(problem);
    }

    @ExceptionHandler(PaymentProviderException.class)
    public ResponseEntity<ProblemDetail> handleProviderError(PaymentProviderException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.BAD_GATEWAY,
                ErrorTypes.PAYMENT_PROVIDER_ERROR,
                ErrorKind.INTERNAL,
                "Payment Provider Error",
                "Failed to create payment order",
                request,
                Map.of("retryable", true)
        );
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(problem);
    }

    @ExceptionHandler(PurchaseRecordPersistenceException.class)
    public ResponseEntity<ProblemDetail> handleRecordFailure(PurchaseRecordPersistenceException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.PURCHASE_RECORD_FAILED,
                ErrorKind.INTERNAL,
                "Purchase Record Failed",
                ex.getMessage(),
                request,
                Map.of("retryable", true)
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ProblemDetail> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        log.error("Storage error in payments API: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.SERVICE_UNAVAILABLE,
                ErrorTypes.STORAGE_UNAVAILABLE,
                ErrorKind.INTERNAL,
                "Storage Unavailable",
                "Storage is temporarily unavailable",
                request,
                Map.of("retryable", true)
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error in payments API: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                ErrorKind.INTERNAL,
                "Internal Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }
}
