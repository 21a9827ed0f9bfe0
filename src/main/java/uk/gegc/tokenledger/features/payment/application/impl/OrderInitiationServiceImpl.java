package uk.gegc.tokenledger.features.payment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import uk.gegc.tokenledger.features.payment.api.dto.CreateOrderRequest;
import uk.gegc.tokenledger.features.payment.api.dto.CreateOrderResponse;
import uk.gegc.tokenledger.features.payment.application.OrderInitiationService;
import uk.gegc.tokenledger.features.payment.application.PaymentMetricsService;
import uk.gegc.tokenledger.features.payment.application.PaymentProperties;
import uk.gegc.tokenledger.features.payment.application.PaymentProviderClient;
import uk.gegc.tokenledger.features.payment.application.PaymentStructuredLogger;
import uk.gegc.tokenledger.features.payment.application.PriceCatalog;
import uk.gegc.tokenledger.features.payment.application.ProviderOrder;
import uk.gegc.tokenledger.features.payment.application.ProviderOrderRequest;
import uk.gegc.tokenledger.features.payment.application.RazorpayProperties;
import uk.gegc.tokenledger.features.payment.application.TenantBalanceProvisioner;
import uk.gegc.tokenledger.features.payment.domain.exception.InvalidPurchaseRequestException;
import uk.gegc.tokenledger.features.payment.domain.exception.PaymentProviderException;
import uk.gegc.tokenledger.features.payment.domain.exception.PurchaseRecordPersistenceException;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntent;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntentStatus;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseTier;
import uk.gegc.tokenledger.features.payment.infra.repository.PurchaseIntentRepository;
import uk.gegc.tokenledger.features.tenant.domain.model.TenantRole;
import uk.gegc.tokenledger.shared.exception.ForbiddenException;
import uk.gegc.tokenledger.shared.security.MembershipResolver;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Not transactional: the provider call must not hold a database transaction open, and the
 * intent insert has to fail inside this method so an orphaned order can be reported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderInitiationServiceImpl implements OrderInitiationService {

    private final MembershipResolver membershipResolver;
    private final PriceCatalog priceCatalog;
    private final PaymentProviderClient paymentProviderClient;
    private final TenantBalanceProvisioner balanceProvisioner;
    private final PurchaseIntentRepository intentRepository;
    private final PaymentProperties paymentProperties;
    private final RazorpayProperties razorpayProperties;
    private final PaymentMetricsService metricsService;
    private final Clock clock;

    @Override
    public CreateOrderResponse createOrder(UUID principalId, CreateOrderRequest request) {
        if (request.tenantId() == null) {
            throw new InvalidPurchaseRequestException("tenantId is required");
        }
        UUID tenantId = request.tenantId();

        if (!membershipResolver.hasTenantRole(principalId, tenantId, TenantRole.AGENCY_ADMIN)) {
            log.warn("User {} attempted to buy tokens for tenant {} without admin role", principalId, tenantId);
            throw new ForbiddenException("Only agency admins can purchase tokens");
        }

        PurchaseTier tier = PurchaseTier.fromCode(request.tier())
                .orElseThrow(() -> new InvalidPurchaseRequestException("Invalid purchase type"));

        Integer quantity = request.quantity();
        if (quantity == null || quantity < 1 || quantity > paymentProperties.getMaxQuantity()) {
            throw new InvalidPurchaseRequestException(
                    "Quantity must be between 1 and " + paymentProperties.getMaxQuantity());
        }

        long amount = priceCatalog.amountFor(tier, quantity);
        String currency = paymentProperties.getCurrency();
        UUID intentId = UUID.randomUUID();
        String receipt = paymentProperties.getReceiptPrefix() + intentId.toString().replace("-", "");

        Map<String, String> notes = new LinkedHashMap<>();
        notes.put("tenantId", tenantId.toString());
        notes.put("purchaseType", tier.getCode());
        notes.put("quantity", String.valueOf(quantity));
        notes.put("intentId", intentId.toString());

        ProviderOrder order;
        try {
            order = paymentProviderClient.createOrder(new ProviderOrderRequest(amount, currency, receipt, notes));
        } catch (PaymentProviderException e) {
            metricsService.incrementProviderFailure();
            log.error("Provider order creation failed for tenant {} (receipt {}): {}", tenantId, receipt, e.getMessage());
            throw e;
        }

        PurchaseIntent intent = new PurchaseIntent();
        intent.setId(intentId);
        intent.setTenantId(tenantId);
        intent.setTier(tier);
        intent.setQuantity(quantity);
        intent.setAmountMinor(amount);
        intent.setCurrency(currency);
        intent.setStatus(PurchaseIntentStatus.PENDING);
        intent.setProviderOrderId(order.orderId());
        intent.setCreatedBy(principalId);
        intent.setCreatedAt(LocalDateTime.now(clock));

        try {
            balanceProvisioner.ensureBalanceRow(tenantId);
            intentRepository.saveAndFlush(intent);
        } catch (DataAccessException e) {
            metricsService.incrementOrphanedOrder();
            PaymentStructuredLogger.logOrderOperation(log, "error",
                    "Orphaned provider order {}: purchase intent could not be recorded", tenantId, intentId,
                    order.orderId(), receipt, order.orderId(), e);
            throw new PurchaseRecordPersistenceException("Failed to record purchase", e);
        }

        metricsService.incrementOrderCreated(tier, amount);
        PaymentStructuredLogger.logOrderOperation(log, "info",
                "Opened order {} for {} {} tokens ({} {})", tenantId, intentId, order.orderId(), receipt,
                order.orderId(), quantity, tier.getCode(), amount, currency);

        return new CreateOrderResponse(order.orderId(), amount, currency, intentId, razorpayProperties.getKeyId());
    }
}
