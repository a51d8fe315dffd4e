package uk.gegc.xpeconomy.features.reward.application;

import uk.gegc.xpeconomy.features.reward.api.dto.ContentMetricsDto;
import uk.gegc.xpeconomy.features.reward.api.dto.UpsertContentMetricsRequest;

public interface ContentMetricsService {

    ContentMetricsDto upsert(String contentId, UpsertContentMetricsRequest request);

    ContentMetricsDto get(String contentId);

    /**
     * @throws uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException if the content was never registered
     */
    ContentInputs resolveInputs(String contentId);
}
