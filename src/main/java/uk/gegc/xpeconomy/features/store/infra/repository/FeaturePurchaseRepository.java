package uk.gegc.xpeconomy.features.store.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.xpeconomy.features.store.domain.model.FeaturePurchase;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.UUID;

public interface FeaturePurchaseRepository extends JpaRepository<FeaturePurchase, UUID> {

    boolean existsByAccountIdAndFeatureId(UUID accountId, String featureId);

    List<FeaturePurchase> findByAccountIdOrderByPurchasedAtAsc(UUID accountId);

    long countByPurchasedAtGreaterThanEqual(LocalDateTime since);

    @Query("select p.featureId from FeaturePurchase p where p.accountId = :accountId")
    Set<String> findFeatureIdsByAccountId(@Param("accountId") UUID accountId);
}
