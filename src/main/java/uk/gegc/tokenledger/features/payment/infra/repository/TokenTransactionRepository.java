package uk.gegc.tokenledger.features.payment.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.tokenledger.features.payment.domain.model.TokenTransaction;

import java.util.List;
import java.util.UUID;

public interface TokenTransactionRepository extends JpaRepository<TokenTransaction, UUID> {

    boolean existsByIntentId(UUID intentId);

    List<TokenTransaction> findByTenantIdOrderByCreatedAtAsc(UUID tenantId);
}
