package uk.gegc.tokenledger.features.payment.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.tokenledger.BaseUnitTest;
import uk.gegc.tokenledger.features.payment.api.dto.VerifyPaymentRequest;
import uk.gegc.tokenledger.features.payment.api.dto.VerifyPaymentResponse;
import uk.gegc.tokenledger.features.payment.application.LedgerCredit;
import uk.gegc.tokenledger.features.payment.application.PaymentMetricsService;
import uk.gegc.tokenledger.features.payment.application.PaymentSignatureVerifier;
import uk.gegc.tokenledger.features.payment.application.PurchaseLedgerService;
import uk.gegc.tokenledger.features.payment.application.RazorpayProperties;
import uk.gegc.tokenledger.features.payment.domain.exception.InvalidPaymentSignatureException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseAlreadyProcessedException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseIntentNotFoundException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseRecordPersistenceException;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntentStatus;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseTier;
import uk.gegc.tokenledger.features.payment.domain.model.TokenTransactionType;
import uk.gegc.tokenledger.features.payment.infra.repository.PurchaseIntentRepository;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("PaymentVerificationServiceImpl")
class PaymentVerificationServiceImplTest extends BaseUnitTest {

    private static final String ORDER_ID = "order_9A33XWu170gUtm";
    private static final String PAYMENT_ID = "pay_29QQoUBi66xm2f";

    @Mock
    private PurchaseLedgerService ledgerService;
    @Mock
    private PurchaseIntentRepository intentRepository;
    @Mock
    private PaymentMetricsService metricsService;

    private PaymentSignatureVerifier signatureVerifier;
    private PaymentVerificationServiceImpl service;

    private final UUID principalId = UUID.randomUUID();
    private final UUID intentId = UUID.randomUUID();
    private final UUID tenantId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        RazorpayProperties properties = new RazorpayProperties();
        properties.setKeySecret("test-razorpay-secret");
        signatureVerifier = new PaymentSignatureVerifier(properties);
        service = new PaymentVerificationServiceImpl(signatureVerifier, ledgerService, intentRepository, metricsService);
    }

    private VerifyPaymentRequest validRequest() {
        return new VerifyPaymentRequest(ORDER_ID, PAYMENT_ID, signatureVerifier.sign(ORDER_ID, PAYMENT_ID), intentId);
    }

    private VerifyPaymentRequest forgedRequest() {
        return new VerifyPaymentRequest(ORDER_ID, PAYMENT_ID, "0".repeat(64), intentId);
    }

    private LedgerCredit credit(long newBalance) {
        return new LedgerCredit(tenantId, intentId, ORDER_ID, PurchaseTier.BASIC, 10L, newBalance, TokenTransactionType.PURCHASE);
    }

    @Nested
    @DisplayName("valid signature")
    class ValidSignature {

        @Test
        @DisplayName("credits and reports the new balance")
        void credits() {
            VerifyPaymentRequest request = validRequest();
            when(ledgerService.completeAndCredit(intentId, ORDER_ID, PAYMENT_ID, request.signature())).thenReturn(credit(110L));

            VerifyPaymentResponse response = service.verifyAndCredit(principalId, request);

            assertThat(response.success()).isTrue();
            assertThat(response.purchaseType()).isEqualTo("basic");
            assertThat(response.tokensAdded()).isEqualTo(10L);
            assertThat(response.newBalance()).isEqualTo(110L);
            verify(metricsService).incrementVerification("completed");
            verify(metricsService).incrementTokensCredited(PurchaseTier.BASIC, 10L, TokenTransactionType.PURCHASE);
            verify(ledgerService, never()).failIfPending(any(), anyString());
        }

        @Test
        @DisplayName("already processed intent surfaces a conflict without retrying")
        void conflict() {
            VerifyPaymentRequest request = validRequest();
            when(ledgerService.completeAndCredit(any(), anyString(), anyString(), anyString()))
                    .thenThrow(new PurchaseAlreadyProcessedException(intentId, PurchaseIntentStatus.COMPLETED));

            assertThatThrownBy(() -> service.verifyAndCredit(principalId, request))
                    .isInstanceOf(PurchaseAlreadyProcessedException.class)
                    .extracting("currentStatus").isEqualTo(PurchaseIntentStatus.COMPLETED);
            verify(ledgerService, times(1)).completeAndCredit(any(), anyString(), anyString(), anyString());
            verify(metricsService).incrementVerification("conflict");
        }

        @Test
        @DisplayName("unknown intent surfaces not found")
        void notFound() {
            VerifyPaymentRequest request = validRequest();
            when(ledgerService.completeAndCredit(any(), anyString(), anyString(), anyString()))
                    .thenThrow(new PurchaseIntentNotFoundException(intentId));

            assertThatThrownBy(() -> service.verifyAndCredit(principalId, request))
                    .isInstanceOf(PurchaseIntentNotFoundException.class);
            verify(metricsService).incrementVerification("not_found");
        }

        @Test
        @DisplayName("storage race is retried and then succeeds")
        void retriesOnRace() {
            VerifyPaymentRequest request = validRequest();
            when(ledgerService.completeAndCredit(any(), anyString(), anyString(), anyString()))
                    .thenThrow(new CannotAcquireLockException("lock timeout"))
                    .thenThrow(new DataIntegrityViolationException("duplicate balance row"))
                    .thenReturn(credit(10L));

            VerifyPaymentResponse response = service.verifyAndCredit(principalId, request);

            assertThat(response.newBalance()).isEqualTo(10L);
            verify(ledgerService, times(3)).completeAndCredit(any(), anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("gives up after the last attempt with a retryable error")
        void exhaustsRetries() {
            VerifyPaymentRequest request = validRequest();
            when(ledgerService.completeAndCredit(any(), anyString(), anyString(), anyString()))
                    .thenThrow(new CannotAcquireLockException("lock timeout"));

            assertThatThrownBy(() -> service.verifyAndCredit(principalId, request))
                    .isInstanceOf(PurchaseRecordPersistenceException.class)
                    .hasCauseInstanceOf(CannotAcquireLockException.class);
            verify(ledgerService, times(PaymentVerificationServiceImpl.MAX_ATTEMPTS))
                    .completeAndCredit(any(), anyString(), anyString(), anyString());
            verify(metricsService).incrementVerification("error");
        }
    }

    @Nested
    @DisplayName("invalid signature")
    class InvalidSignature {

        @Test
        @DisplayName("pending intent is marked failed and no credit happens")
        void marksFailed() {
            when(ledgerService.failIfPending(intentId, ORDER_ID)).thenReturn(true);

            assertThatThrownBy(() -> service.verifyAndCredit(principalId, forgedRequest()))
                    .isInstanceOf(InvalidPaymentSignatureException.class);
            verify(ledgerService, never()).completeAndCredit(any(), anyString(), anyString(), anyString());
            verifyNoInteractions(intentRepository);
            verify(metricsService).incrementVerification("invalid_signature");
        }

        @Test
        @DisplayName("terminal intent answers with a conflict")
        void terminalIntent() {
            when(ledgerService.failIfPending(intentId, ORDER_ID)).thenReturn(false);
            when(intentRepository.findStatusByIdAndProviderOrderId(intentId, ORDER_ID))
                    .thenReturn(Optional.of(PurchaseIntentStatus.COMPLETED));

            assertThatThrownBy(() -> service.verifyAndCredit(principalId, forgedRequest()))
                    .isInstanceOf(PurchaseAlreadyProcessedException.class);
            verify(ledgerService, never()).completeAndCredit(any(), anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("unknown intent still answers invalid signature")
        void unknownIntent() {
            when(ledgerService.failIfPending(intentId, ORDER_ID)).thenReturn(false);
            when(intentRepository.findStatusByIdAndProviderOrderId(intentId, ORDER_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.verifyAndCredit(principalId, forgedRequest()))
                    .isInstanceOf(InvalidPaymentSignatureException.class);
        }

        @Test
        @DisplayName("a valid signature for a different payment id is rejected")
        void signatureReplayedForOtherPayment() {
            String signature = signatureVerifier.sign(ORDER_ID, PAYMENT_ID);
            when(ledgerService.failIfPending(intentId, ORDER_ID)).thenReturn(true);

            VerifyPaymentRequest replay = new VerifyPaymentRequest(ORDER_ID, "pay_other", signature, intentId);

            assertThatThrownBy(() -> service.verifyAndCredit(principalId, replay))
                    .isInstanceOf(InvalidPaymentSignatureException.class);
        }
    }
}
