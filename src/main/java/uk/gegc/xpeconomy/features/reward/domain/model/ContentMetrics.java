package uk.gegc.xpeconomy.features.reward.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Size and difficulty of a content item as reported by the content subsystem.
 */
@Entity
@Table(name = "content_metrics")
@Getter
@Setter
public class ContentMetrics {

    @Id
    @Column(name = "content_id", nullable = false, updatable = false, length = 100)
    private String contentId;

    @Column(name = "word_count", nullable = false)
    private long wordCount;

    @Column(name = "letter_count", nullable = false)
    private long letterCount;

    @Column(name = "reading_level", nullable = false, precision = 6, scale = 2)
    private BigDecimal readingLevel;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public long lengthFor(LengthMetric metric) {
        return metric == LengthMetric.LETTERS ? letterCount : wordCount;
    }
}
