package uk.gegc.xpeconomy.features.account.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.xpeconomy.features.account.api.dto.AccountDto;
import uk.gegc.xpeconomy.features.account.domain.model.Account;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface AccountMapper {
    AccountDto toDto(Account entity);
}
