package uk.gegc.xpeconomy.features.monitoring.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.xpeconomy.features.monitoring.domain.model.AccountReviewFlag;
import uk.gegc.xpeconomy.features.monitoring.domain.model.ReviewFlagType;

import java.util.List;
import java.util.UUID;

public interface AccountReviewFlagRepository extends JpaRepository<AccountReviewFlag, UUID> {

    boolean existsByAccountIdAndFlagTypeAndResolvedFalse(UUID accountId, ReviewFlagType flagType);

    List<AccountReviewFlag> findByResolvedFalseOrderByCreatedAtDesc();

    List<AccountReviewFlag> findByAccountIdAndResolvedFalseOrderByCreatedAtDesc(UUID accountId);
}
