package uk.gegc.tokenledger.features.payment.application;

import org.springframework.stereotype.Component;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseTier;

import java.util.EnumMap;
import java.util.Map;

/**
 * Integer price table in minor currency units. Checked once at startup so every tier has a price.
 */
@Component
public class PriceCatalog {

    private final Map<PurchaseTier, Long> unitPrices = new EnumMap<>(PurchaseTier.class);

    public PriceCatalog(PaymentProperties properties) {
        for (PurchaseTier tier : PurchaseTier.values()) {
            Long price = properties.getUnitPrices().get(tier.getCode());
            if (price == null || price <= 0) {
                throw new IllegalStateException("payments.unit-prices." + tier.getCode() + " must be a positive integer");
            }
            unitPrices.put(tier, price);
        }
    }

    public long unitPrice(PurchaseTier tier) {
        return unitPrices.get(tier);
    }

    /**
     * @throws ArithmeticException if the amount overflows a {@code long}
     */
    public long amountFor(PurchaseTier tier, int quantity) {
        return Math.multiplyExact(unitPrice(tier), (long) quantity);
    }
}
