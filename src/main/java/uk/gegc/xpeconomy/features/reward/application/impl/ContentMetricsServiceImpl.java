package uk.gegc.xpeconomy.features.reward.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.xpeconomy.features.reward.api.dto.ContentMetricsDto;
import uk.gegc.xpeconomy.features.reward.api.dto.UpsertContentMetricsRequest;
import uk.gegc.xpeconomy.features.reward.application.ContentInputs;
import uk.gegc.xpeconomy.features.reward.application.ContentMetricsService;
import uk.gegc.xpeconomy.features.reward.application.RewardProperties;
import uk.gegc.xpeconomy.features.reward.domain.model.ContentMetrics;
import uk.gegc.xpeconomy.features.reward.infra.mapping.RewardMapper;
import uk.gegc.xpeconomy.features.reward.infra.repository.ContentMetricsRepository;
import uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.time.Clock;
import java.time.LocalDateTime;

@Slf4j
@Service
@RequiredArgsConstructor
public class ContentMetricsServiceImpl implements ContentMetricsService {

    private final ContentMetricsRepository contentMetricsRepository;
    private final RewardProperties rewardProperties;
    private final RewardMapper rewardMapper;
    private final Clock clock;

    @Override
    @Transactional
    public ContentMetricsDto upsert(String contentId, UpsertContentMetricsRequest request) {
        if (contentId == null || contentId.isBlank()) {
            throw new XpValidationException("contentId must not be blank");
        }
        ContentMetrics metrics = contentMetricsRepository.findById(contentId).orElseGet(() -> {
            ContentMetrics m = new ContentMetrics();
            m.setContentId(contentId);
            return m;
        });
        metrics.setWordCount(request.wordCount());
        metrics.setLetterCount(request.letterCount());
        metrics.setReadingLevel(request.readingLevel());
        metrics.setUpdatedAt(LocalDateTime.now(clock));
        metrics = contentMetricsRepository.save(metrics);

        log.debug("Content metrics for {} set to words={}, letters={}, level={}",
                contentId, request.wordCount(), request.letterCount(), request.readingLevel());
        return rewardMapper.toDto(metrics);
    }

    @Override
    @Transactional(readOnly = true)
    public ContentMetricsDto get(String contentId) {
        return rewardMapper.toDto(find(contentId));
    }

    @Override
    @Transactional(readOnly = true)
    public ContentInputs resolveInputs(String contentId) {
        ContentMetrics metrics = find(contentId);
        return new ContentInputs(contentId, metrics.lengthFor(rewardProperties.getLengthMetric()), metrics.getReadingLevel());
    }

    private ContentMetrics find(String contentId) {
        return contentMetricsRepository.findById(contentId)
                .orElseThrow(() -> new ResourceNotFoundException("No metrics registered for content " + contentId));
    }
}
