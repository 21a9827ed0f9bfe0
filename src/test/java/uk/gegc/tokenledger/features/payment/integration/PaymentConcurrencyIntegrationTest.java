package uk.gegc.tokenledger.features.payment.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import uk.gegc.tokenledger.features.payment.api.dto.VerifyPaymentRequest;
import uk.gegc.tokenledger.features.payment.api.dto.VerifyPaymentResponse;
import uk.gegc.tokenledger.features.payment.application.PaymentProviderClient;
import uk.gegc.tokenledger.features.payment.application.PaymentSignatureVerifier;
import uk.gegc.tokenledger.features.payment.application.PaymentVerificationService;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseAlreadyProcessedException;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntent;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntentStatus;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseTier;
import uk.gegc.tokenledger.features.payment.domain.model.TenantBalance;
import uk.gegc.tokenledger.features.payment.infra.repository.PurchaseIntentRepository;
import uk.gegc.tokenledger.features.payment.infra.repository.TenantBalanceRepository;
import uk.gegc.tokenledger.features.payment.infra.repository.TokenTransactionRepository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static uk.gegc.tokenledger.features.payment.PurchaseFixtures.pendingIntent;

/**
 * Runs against committed data: every verification below uses its own transactions.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Concurrent payment verification")
class PaymentConcurrencyIntegrationTest {

    private static final int THREADS = 8;

    @Autowired
    private PaymentVerificationService verificationService;
    @Autowired
    private PaymentSignatureVerifier signatureVerifier;
    @Autowired
    private PurchaseIntentRepository intentRepository;
    @Autowired
    private TenantBalanceRepository balanceRepository;
    @Autowired
    private TokenTransactionRepository transactionRepository;

    @MockitoBean
    private PaymentProviderClient paymentProviderClient;

    @AfterEach
    void cleanUp() {
        transactionRepository.deleteAll();
        intentRepository.deleteAll();
        balanceRepository.deleteAll();
    }

    @Test
    @DisplayName("simultaneous verifications of one payment credit it exactly once")
    void creditsExactlyOnce() throws Exception {
        UUID tenantId = UUID.randomUUID();
        TenantBalance balance = TenantBalance.empty(tenantId, LocalDateTime.now());
        balance.setPremiumTokens(3L);
        balanceRepository.saveAndFlush(balance);
        PurchaseIntent intent = intentRepository.saveAndFlush(
                pendingIntent(tenantId, PurchaseTier.PREMIUM, 25, "order_race"));

        VerifyPaymentRequest request = new VerifyPaymentRequest(
                "order_race", "pay_race", signatureVerifier.sign("order_race", "pay_race"), intent.getId());

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<VerifyPaymentResponse>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < THREADS; i++) {
                UUID caller = UUID.randomUUID();
                futures.add(executor.submit(() -> {
                    start.await();
                    return verificationService.verifyAndCredit(caller, request);
                }));
            }
            start.countDown();

            int successes = 0;
            List<Throwable> failures = new ArrayList<>();
            for (Future<VerifyPaymentResponse> future : futures) {
                try {
                    VerifyPaymentResponse response = future.get(30, TimeUnit.SECONDS);
                    successes++;
                    assertThat(response.tokensAdded()).isEqualTo(25L);
                    assertThat(response.newBalance()).isEqualTo(28L);
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }

            assertThat(successes).isEqualTo(1);
            assertThat(failures).hasSize(THREADS - 1)
                    .allSatisfy(failure -> assertThat(failure).isInstanceOf(PurchaseAlreadyProcessedException.class));
        } finally {
            executor.shutdownNow();
        }

        assertThat(balanceRepository.findById(tenantId).orElseThrow().getPremiumTokens()).isEqualTo(28L);
        assertThat(transactionRepository.findByTenantIdOrderByCreatedAtAsc(tenantId)).hasSize(1);
        assertThat(intentRepository.findById(intent.getId()).orElseThrow().getStatus())
                .isEqualTo(PurchaseIntentStatus.COMPLETED);
    }
}
