package uk.gegc.xpeconomy.features.reward.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.xpeconomy.features.reward.domain.model.ContentMetrics;

public interface ContentMetricsRepository extends JpaRepository<ContentMetrics, String> {
}
