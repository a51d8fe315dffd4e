package uk.gegc.xpeconomy.features.social.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.xpeconomy.features.social.api.dto.CommentChargeDto;
import uk.gegc.xpeconomy.features.social.api.dto.CommentInteractionDto;
import uk.gegc.xpeconomy.features.social.domain.model.CommentCharge;
import uk.gegc.xpeconomy.features.social.domain.model.CommentInteraction;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface SocialMapper {
    CommentChargeDto toDto(CommentCharge entity);
    CommentInteractionDto toDto(CommentInteraction entity);
}
