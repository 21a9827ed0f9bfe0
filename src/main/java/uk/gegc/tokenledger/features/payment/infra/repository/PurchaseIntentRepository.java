package uk.gegc.tokenledger.features.payment.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntent;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntentStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface PurchaseIntentRepository extends JpaRepository<PurchaseIntent, UUID> {

    Optional<PurchaseIntent> findByIdAndProviderOrderId(UUID id, String providerOrderId);

    @Query("SELECT p.status FROM PurchaseIntent p WHERE p.id = :id AND p.providerOrderId = :providerOrderId")
    Optional<PurchaseIntentStatus> findStatusByIdAndProviderOrderId(@Param("id") UUID id,
                                                                    @Param("providerOrderId") String providerOrderId);

    Page<PurchaseIntent> findByTenantId(UUID tenantId, Pageable pageable);

    /**
     * Compare-and-set from {@code PENDING} to {@code COMPLETED}. Returns 1 for the single caller that wins.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PurchaseIntent p SET p.status = :completed, p.providerPaymentId = :paymentId, " +
            "p.providerSignature = :signature, p.completedAt = :completedAt " +
            "WHERE p.id = :id AND p.providerOrderId = :providerOrderId AND p.status = :pending")
    int markCompleted(@Param("id") UUID id,
                      @Param("providerOrderId") String providerOrderId,
                      @Param("paymentId") String paymentId,
                      @Param("signature") String signature,
                      @Param("completedAt") LocalDateTime completedAt,
                      @Param("pending") PurchaseIntentStatus pending,
                      @Param("completed") PurchaseIntentStatus completed);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PurchaseIntent p SET p.status = :failed " +
            "WHERE p.id = :id AND p.providerOrderId = :providerOrderId AND p.status = :pending")
    int markFailed(@Param("id") UUID id,
                   @Param("providerOrderId") String providerOrderId,
                   @Param("pending") PurchaseIntentStatus pending,
                   @Param("failed") PurchaseIntentStatus failed);

    @Query("SELECT p FROM PurchaseIntent p WHERE p.status = :status " +
            "AND NOT EXISTS (SELECT t.id FROM TokenTransaction t WHERE t.intentId = p.id) " +
            "ORDER BY p.completedAt ASC")
    List<PurchaseIntent> findWithoutLedgerEntry(@Param("status") PurchaseIntentStatus status, Pageable pageable);

    List<PurchaseIntent> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(PurchaseIntentStatus status,
                                                                          LocalDateTime cutoff,
                                                                          Pageable pageable);

    long countByStatusAndCreatedAtBefore(PurchaseIntentStatus status, LocalDateTime cutoff);
}
