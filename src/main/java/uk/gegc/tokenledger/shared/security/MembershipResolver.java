package uk.gegc.tokenledger.shared.security;

import uk.gegc.tokenledger.features.tenant.domain.model.TenantRole;

import java.util.UUID;

/**
 * SPI that exposes tenant membership and role lookup to the rest of the service.
 * Membership itself is managed by the agency administration system.
 */
public interface MembershipResolver {

    boolean isMemberOfTenant(UUID userId, UUID tenantId);

    boolean hasTenantRole(UUID userId, UUID tenantId, TenantRole role);
}
