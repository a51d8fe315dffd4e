package uk.gegc.xpeconomy.features.store.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.xpeconomy.features.store.domain.model.FeatureCatalogEntry;
import uk.gegc.xpeconomy.features.store.domain.model.FeatureCategory;

import java.util.List;

public interface FeatureCatalogRepository extends JpaRepository<FeatureCatalogEntry, String> {

    List<FeatureCatalogEntry> findByActiveTrueOrderByCategoryAscPriceAsc();

    List<FeatureCatalogEntry> findByCategoryAndActiveTrueOrderByPriceAsc(FeatureCategory category);
}
