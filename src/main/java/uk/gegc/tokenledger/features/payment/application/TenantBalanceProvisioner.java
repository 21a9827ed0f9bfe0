package uk.gegc.tokenledger.features.payment.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import uk.gegc.tokenledger.features.payment.domain.model.TenantBalance;
import uk.gegc.tokenledger.features.payment.infra.repository.TenantBalanceRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Creates a zeroed balance row for a tenant that has none. Runs outside any caller transaction:
 * a duplicate insert from a concurrent request just means the row is already there.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantBalanceProvisioner {

    private final TenantBalanceRepository balanceRepository;
    private final Clock clock;

    public void ensureBalanceRow(UUID tenantId) {
        if (balanceRepository.existsById(tenantId)) {
            return;
        }
        try {
            balanceRepository.saveAndFlush(TenantBalance.empty(tenantId, LocalDateTime.now(clock)));
            log.info("Provisioned token balance for tenant {}", tenantId);
        } catch (DataIntegrityViolationException e) {
            log.debug("Token balance for tenant {} was provisioned concurrently: {}", tenantId, e.getMessage());
        }
    }
}
