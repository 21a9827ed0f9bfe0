package uk.gegc.tokenledger.features.payment.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;
import uk.gegc.tokenledger.features.payment.api.dto.PurchaseIntentDto;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseIntent;
import uk.gegc.tokenledger.features.payment.domain.model.PurchaseTier;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface PurchaseIntentMapper {

    @Mapping(target = "intentId", source = "id")
    @Mapping(target = "purchaseType", source = "tier")
    @Mapping(target = "amount", source = "amountMinor")
    @Mapping(target = "orderId", source = "providerOrderId")
    @Mapping(target = "paymentId", source = "providerPaymentId")
    PurchaseIntentDto toDto(PurchaseIntent entity);

    default String tierCode(PurchaseTier tier) {
        return tier != null ? tier.getCode() : null;
    }
}
