package uk.gegc.xpeconomy.features.reward.application;

import java.math.BigDecimal;

/**
 * Reward inputs for one content item, already resolved to the deployment's length metric.
 */
public record ContentInputs(String contentId, long lengthMetric, BigDecimal readingLevel) {}
