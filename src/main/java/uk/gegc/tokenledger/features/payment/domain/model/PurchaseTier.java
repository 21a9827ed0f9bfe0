package uk.gegc.tokenledger.features.payment.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Token pool a purchase credits. The lower-case code is the value clients send and receive.
 */
public enum PurchaseTier {
    BASIC("basic"),
    PREMIUM("premium");

    private final String code;

    PurchaseTier(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<PurchaseTier> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(tier -> tier.code.equals(code))
                .findFirst();
    }
}
