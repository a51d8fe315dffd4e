package uk.gegc.xpeconomy.features.store.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.xpeconomy.features.store.domain.model.FeatureBundle;

import java.util.List;

public interface FeatureBundleRepository extends JpaRepository<FeatureBundle, String> {

    List<FeatureBundle> findByActiveTrueOrderByPriceAsc();
}
