package uk.gegc.xpeconomy.features.ledger.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.xpeconomy.features.ledger.api.dto.XpTransactionDto;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransaction;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface XpTransactionMapper {
    XpTransactionDto toDto(XpTransaction entity);
    List<XpTransactionDto> toDtos(List<XpTransaction> entities);
}
