package uk.gegc.tokenledger.features.payment.application;

import uk.gegc.tokenledger.features.payment.domain.model.PurchaseTier;
import uk.gegc.tokenledger.features.payment.domain.model.TokenTransactionType;

import java.util.UUID;

/**
 * Outcome of one committed credit: the pool that grew and its value afterwards.
 */
public record LedgerCredit(
        UUID tenantId,
        UUID intentId,
        String providerOrderId,
        PurchaseTier tier,
        long tokensAdded,
        long newBalance,
        TokenTransactionType type
) {
}
