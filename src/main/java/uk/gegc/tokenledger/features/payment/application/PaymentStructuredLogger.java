package uk.gegc.tokenledger.features.payment.application;

import org.slf4j.Logger;
import org.slf4j.MDC;

import java.util.UUID;

/**
 * Structured logging utility for purchase operations. Each call scopes its MDC keys to one log line.
 */
public class PaymentStructuredLogger {

    private PaymentStructuredLogger() {
    }

    /**
     * Log an order operation with structured fields.
     */
    public static void logOrderOperation(Logger logger, String level, String message,
            UUID tenantId, UUID intentId, String orderId, String receipt, Object... additionalArgs) {

        MDC.put("payments.tenantId", asString(tenantId));
        MDC.put("payments.intentId", asString(intentId));
        MDC.put("payments.orderId", orderId);
        MDC.put("payments.receipt", receipt);

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearPaymentsMDC();
        }
    }

    /**
     * Log a ledger credit with structured fields.
     */
    public static void logLedgerCredit(Logger logger, String level, String message, LedgerCredit credit,
            Object... additionalArgs) {

        MDC.put("payments.tenantId", asString(credit.tenantId()));
        MDC.put("payments.intentId", asString(credit.intentId()));
        MDC.put("payments.orderId", credit.providerOrderId());
        MDC.put("payments.pool", credit.tier().getCode());
        MDC.put("payments.txType", credit.type().name());
        MDC.put("payments.amount", String.valueOf(credit.tokensAdded()));
        MDC.put("payments.balanceAfter", String.valueOf(credit.newBalance()));

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearPaymentsMDC();
        }
    }

    /**
     * Log the outcome of a verification attempt.
     */
    public static void logVerification(Logger logger, String level, String message,
            UUID intentId, String orderId, String outcome, Object... additionalArgs) {

        MDC.put("payments.intentId", asString(intentId));
        MDC.put("payments.orderId", orderId);
        MDC.put("payments.outcome", outcome);

        try {
            log(logger, level, message, additionalArgs);
        } finally {
            clearPaymentsMDC();
        }
    }

    public static void clearPaymentsMDC() {
        MDC.remove("payments.tenantId");
        MDC.remove("payments.intentId");
        MDC.remove("payments.orderId");
        MDC.remove("payments.receipt");
        MDC.remove("payments.pool");
        MDC.remove("payments.txType");
        MDC.remove("payments.amount");
        MDC.remove("payments.balanceAfter");
        MDC.remove("payments.outcome");
    }

    private static void log(Logger logger, String level, String message, Object... args) {
        switch (level.toLowerCase()) {
            case "warn" -> logger.warn(message, args);
            case "error" -> logger.error(message, args);
            case "debug" -> logger.debug(message, args);
            default -> logger.info(message, args);
        }
    }

    private static String asString(UUID id) {
        return id != null ? id.toString() : null;
    }
}
