package uk.gegc.xpeconomy.features.attempt.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.xpeconomy.features.attempt.api.dto.QuizAttemptDto;
import uk.gegc.xpeconomy.features.attempt.domain.model.QuizAttempt;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface QuizAttemptMapper {
    QuizAttemptDto toDto(QuizAttempt entity);
    List<QuizAttemptDto> toDtos(List<QuizAttempt> entities);
}
