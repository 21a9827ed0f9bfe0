package uk.gegc.tokenledger.features.payment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import uk.gegc.tokenledger.features.payment.api.dto.VerifyPaymentRequest;
import uk.gegc.tokenledger.features.payment.api.dto.VerifyPaymentResponse;
import uk.gegc.tokenledger.features.payment.application.LedgerCredit;
import uk.gegc.tokenledger.features.payment.application.PaymentMetricsService;
import uk.gegc.tokenledger.features.payment.application.PaymentSignatureVerifier;
import uk.gegc.tokenledger.features.payment.application.PaymentStructuredLogger;
import uk.gegc.tokenledger.features.payment.application.PaymentVerificationService;
import uk.gegc.tokenledger.features.payment.application.PurchaseLedgerService;
import uk.gegc.tokenledger.features.payment.domain.exception.InvalidPaymentSignatureException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseAlreadyProcessedException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseIntentNotFoundException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseRecordPersistenceException;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntentStatus;
import uk.gegc.tokenledger.features.payment.infra.repository.PurchaseIntentRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Runs each ledger step in its own transaction and retries the credit when it loses a storage
 * race. Retrying is safe: the pending-status guard turns a repeat into a conflict.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentVerificationServiceImpl implements PaymentVerificationService {

    static final int MAX_ATTEMPTS = 3;

    private final PaymentSignatureVerifier signatureVerifier;
    private final PurchaseLedgerService ledgerService;
    private final PurchaseIntentRepository intentRepository;
    private final PaymentMetricsService metricsService;

    @Override
    public VerifyPaymentResponse verifyAndCredit(UUID principalId, VerifyPaymentRequest request) {
        UUID intentId = request.intentId();
        String orderId = request.orderId();

        if (!signatureVerifier.verify(orderId, request.paymentId(), request.signature())) {
            rejectSignature(intentId, orderId);
        }

        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                LedgerCredit credit = ledgerService.completeAndCredit(
                        intentId, orderId, request.paymentId(), request.signature());
                metricsService.incrementVerification("completed");
                metricsService.incrementTokensCredited(credit.tier(), credit.tokensAdded(), credit.type());
                PaymentStructuredLogger.logLedgerCredit(log, "info",
                        "Credited {} {} tokens to tenant {} (verified by {})", credit,
                        credit.tokensAdded(), credit.tier().getCode(), credit.tenantId(), principalId);
                return new VerifyPaymentResponse(true, credit.tier().getCode(), credit.tokensAdded(), credit.newBalance());
            } catch (PurchaseIntentNotFoundException e) {
                metricsService.incrementVerification("not_found");
                PaymentStructuredLogger.logVerification(log, "warn",
                        "Verification for unknown purchase intent", intentId, orderId, "not_found");
                throw e;
            } catch (PurchaseAlreadyProcessedException e) {
                metricsService.incrementVerification("conflict");
                PaymentStructuredLogger.logVerification(log, "info",
                        "Purchase intent already {}", intentId, orderId, "conflict", e.getCurrentStatus());
                throw e;
            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                lastFailure = e;
                log.warn("Credit attempt {}/{} for intent {} lost a storage race: {}",
                        attempt, MAX_ATTEMPTS, intentId, e.getMessage());
            }
        }

        metricsService.incrementVerification("error");
        PaymentStructuredLogger.logVerification(log, "error",
                "Giving up on crediting intent after {} attempts", intentId, orderId, "error", MAX_ATTEMPTS, lastFailure);
        throw new PurchaseRecordPersistenceException("Failed to record payment", lastFailure);
    }

    private void rejectSignature(UUID intentId, String orderId) {
        if (ledgerService.failIfPending(intentId, orderId)) {
            metricsService.incrementVerification("invalid_signature");
            PaymentStructuredLogger.logVerification(log, "warn",
                    "Invalid payment signature, purchase intent marked failed", intentId, orderId, "invalid_signature");
            throw new InvalidPaymentSignatureException("Invalid payment signature");
        }

        Optional<PurchaseIntentStatus> status = intentRepository.findStatusByIdAndProviderOrderId(intentId, orderId);
        if (status.isPresent() && status.get().isTerminal()) {
            metricsService.incrementVerification("conflict");
            PaymentStructuredLogger.logVerification(log, "warn",
                    "Invalid payment signature for purchase intent already {}", intentId, orderId, "conflict", status.get());
            throw new PurchaseAlreadyProcessedException(intentId, status.get());
        }

        metricsService.incrementVerification("invalid_signature");
        PaymentStructuredLogger.logVerification(log, "warn",
                "Invalid payment signature for unknown purchase intent", intentId, orderId, "invalid_signature");
        throw new InvalidPaymentSignatureException("Invalid payment signature");
    }
}
