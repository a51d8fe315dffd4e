package uk.gegc.xpeconomy.features.store.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.xpeconomy.features.store.api.dto.FeatureBundleDto;
import uk.gegc.xpeconomy.features.store.api.dto.FeaturePurchaseDto;
import uk.gegc.xpeconomy.features.store.domain.model.FeatureBundle;
import uk.gegc.xpeconomy.features.store.domain.model.FeaturePurchase;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface StoreMapper {

    FeatureBundleDto toDto(FeatureBundle bundle);

    List<FeatureBundleDto> toBundleDtos(List<FeatureBundle> bundles);

    FeaturePurchaseDto toDto(FeaturePurchase purchase);

    List<FeaturePurchaseDto> toPurchaseDtos(List<FeaturePurchase> purchases);
}
