package uk.gegc.xpeconomy.features.reward.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.xpeconomy.features.reward.api.dto.ContentMetricsDto;
import uk.gegc.xpeconomy.features.reward.api.dto.RewardResultDto;
import uk.gegc.xpeconomy.features.reward.domain.model.ContentMetrics;
import uk.gegc.xpeconomy.features.reward.domain.model.RewardResult;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface RewardMapper {
    RewardResultDto toDto(RewardResult result);
    ContentMetricsDto toDto(ContentMetrics entity);
}
