package uk.gegc.tokenledger.features.payment.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.tokenledger.features.payment.api.dto.PurchaseIntentDto;
import uk.gegc.tokenledger.features.payment.api.dto.TenantBalanceDto;

import java.util.UUID;

public interface PurchaseQueryService {

    TenantBalanceDto getBalance(UUID principalId, UUID tenantId);

    Page<PurchaseIntentDto> listPurchases(UUID principalId, UUID tenantId, Pageable pageable);
}
