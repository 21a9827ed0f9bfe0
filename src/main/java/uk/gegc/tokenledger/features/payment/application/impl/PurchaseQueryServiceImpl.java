package uk.gegc.tokenledger.features.payment.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.tokenledger.features.payment.api.dto.PurchaseIntentDto;
import uk.gegc.tokenledger.features.payment.api.dto.TenantBalanceDto;
import uk.gegc.tokenledger.features.payment.application.PurchaseQueryService;
import uk.gegc.tokenledger.features.payment.infra.mapping.PurchaseIntentMapper;
import uk.gegc.tokenledger.features.payment.infra.mapping.TenantBalanceMapper;
import uk.gegc.tokenledger.features.payment.infra.repository.PurchaseIntentRepository;
import uk.gegc.tokenledger.features.payment.infra.repository.TenantBalanceRepository;
import uk.gegc.tokenledger.shared.exception.ForbiddenException;
import uk.gegc.tokenledger.shared.security.MembershipResolver;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PurchaseQueryServiceImpl implements PurchaseQueryService {

    private final MembershipResolver membershipResolver;
    private final TenantBalanceRepository balanceRepository;
    private final PurchaseIntentRepository intentRepository;
    private final TenantBalanceMapper balanceMapper;
    private final PurchaseIntentMapper intentMapper;

    @Override
    public TenantBalanceDto getBalance(UUID principalId, UUID tenantId) {
        requireMembership(principalId, tenantId);
        return balanceRepository.findById(tenantId)
                .map(balanceMapper::toDto)
                .orElseGet(() -> new TenantBalanceDto(tenantId, 0L, 0L, null));
    }

    @Override
    public Page<PurchaseIntentDto> listPurchases(UUID principalId, UUID tenantId, Pageable pageable) {
        requireMembership(principalId, tenantId);
        return intentRepository.findByTenantId(tenantId, pageable).map(intentMapper::toDto);
    }

    private void requireMembership(UUID principalId, UUID tenantId) {
        if (!membershipResolver.isMemberOfTenant(principalId, tenantId)) {
            log.warn("User {} attempted to read token data of tenant {} without membership", principalId, tenantId);
            throw new ForbiddenException("Not a member of this agency");
        }
    }
}
