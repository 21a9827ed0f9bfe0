package uk.gegc.tokenledger.features.tenant.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.tokenledger.features.tenant.domain.model.TenantRole;
import uk.gegc.tokenledger.features.tenant.infra.repository.TenantMembershipRepository;
import uk.gegc.tokenledger.shared.security.MembershipResolver;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaMembershipResolver implements MembershipResolver {

    private final TenantMembershipRepository membershipRepository;

    @Override
    public boolean isMemberOfTenant(UUID userId, UUID tenantId) {
        if (userId == null || tenantId == null) {
            return false;
        }
        return membershipRepository.existsByTenantIdAndUserId(tenantId, userId);
    }

    @Override
    public boolean hasTenantRole(UUID userId, UUID tenantId, TenantRole role) {
        if (userId == null || tenantId == null || role == null) {
            return false;
        }
        return membershipRepository.existsByTenantIdAndUserIdAndRole(tenantId, userId, role);
    }
}
