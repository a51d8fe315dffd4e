package uk.gegc.xpeconomy.features.monitoring.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.xpeconomy.features.monitoring.api.dto.AccountReviewFlagDto;
import uk.gegc.xpeconomy.features.monitoring.domain.model.AccountReviewFlag;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface ReviewFlagMapper {

    AccountReviewFlagDto toDto(AccountReviewFlag flag);

    List<AccountReviewFlagDto> toDtos(List<AccountReviewFlag> flags);
}
