package uk.gegc.tokenledger.features.tenant.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.tokenledger.features.tenant.domain.model.TenantMembership;
import uk.gegc.tokenledger.features.tenant.domain.model.TenantRole;

import java.util.UUID;

public interface TenantMembershipRepository extends JpaRepository<TenantMembership, UUID> {

    boolean existsByTenantIdAndUserId(UUID tenantId, UUID userId);

    boolean existsByTenantIdAndUserIdAndRole(UUID tenantId, UUID userId, TenantRole role);
}
