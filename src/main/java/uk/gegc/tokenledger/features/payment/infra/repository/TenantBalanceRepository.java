package uk.gegc.tokenledger.features.payment.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.tokenledger.features.payment.domain.model.TenantBalance;

import java.time.LocalDateTime;
import java.util.UUID;

public interface TenantBalanceRepository extends JpaRepository<TenantBalance, UUID> {

    /**
     * Atomic in-place increment of the basic pool. Returns 0 when the tenant has no balance row yet.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TenantBalance b SET b.basicTokens = b.basicTokens + :delta, b.updatedAt = :now, b.version = b.version + 1 " +
            "WHERE b.tenantId = :tenantId")
    int incrementBasicTokens(@Param("tenantId") UUID tenantId,
                             @Param("delta") long delta,
                             @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TenantBalance b SET b.premiumTokens = b.premiumTokens + :delta, b.updatedAt = :now, b.version = b.version + 1 " +
            "WHERE b.tenantId = :tenantId")
    int incrementPremiumTokens(@Param("tenantId") UUID tenantId,
                               @Param("delta") long delta,
                               @Param("now") LocalDateTime now);
}
