package uk.gegc.tokenledger.features.payment.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;
import uk.gegc.tokenledger.features.payment.application.PaymentMetricsService;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseTier;
import uk.gegc.tokenledger.features.payment.domain.model.TokenTransactionType;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-backed purchase metrics.
 */
@Service
public class PaymentMetricsServiceImpl implements PaymentMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter providerFailureCounter;
    private final Counter orphanedOrderCounter;
    private final Counter reconciliationRepairCounter;

    private final AtomicLong stalePendingIntents = new AtomicLong();

    public PaymentMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.providerFailureCounter = Counter.builder("payments.provider.failures")
                .description("Provider order creations that failed")
                .register(meterRegistry);
        this.orphanedOrderCounter = Counter.builder("payments.orders.orphaned")
                .description("Provider orders created without a persisted purchase intent")
                .register(meterRegistry);
        this.reconciliationRepairCounter = Counter.builder("payments.reconciliation.repairs")
                .description("Completed intents credited by the reconciliation sweep")
                .register(meterRegistry);

        Gauge.builder("payments.intents.stale_pending", stalePendingIntents, AtomicLong::get)
                .description("Pending purchase intents older than the stale threshold")
                .register(meterRegistry);
    }

    @Override
    public void incrementOrderCreated(PurchaseTier tier, long amountMinor) {
        meterRegistry.counter("payments.orders.created", "tier", tier.getCode()).increment();
        meterRegistry.counter("payments.orders.amount_minor", "tier", tier.getCode()).increment(amountMinor);
    }

    @Override
    public void incrementProviderFailure() {
        providerFailureCounter.increment();
    }

    @Override
    public void incrementOrphanedOrder() {
        orphanedOrderCounter.increment();
    }

    @Override
    public void incrementVerification(String outcome) {
        meterRegistry.counter("payments.verifications", "outcome", outcome).increment();
    }

    @Override
    public void incrementTokensCredited(PurchaseTier tier, long tokens, TokenTransactionType type) {
        meterRegistry.counter("payments.tokens.credited", "pool", tier.getCode(), "type", type.name())
                .increment(tokens);
    }

    @Override
    public void incrementReconciliationRepair() {
        reconciliationRepairCounter.increment();
    }

    @Override
    public void recordStalePendingIntents(long count) {
        stalePendingIntents.set(count);
    }
}
