package uk.gegc.xpeconomy.features.reward.api.dto;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record ContentMetricsDto(
        String contentId,
        long wordCount,
        long letterCount,
        BigDecimal readingLevel,
        LocalDateTime updatedAt
) {}
