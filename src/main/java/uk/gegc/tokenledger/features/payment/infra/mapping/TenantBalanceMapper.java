package uk.gegc.tokenledger.features.payment.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.tokenledger.features.payment.api.dto.TenantBalanceDto;
import uk.gegc.tokenledger.features.payment.domain.model.TenantBalance;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface TenantBalanceMapper {
    TenantBalanceDto toDto(TenantBalance entity);
}
