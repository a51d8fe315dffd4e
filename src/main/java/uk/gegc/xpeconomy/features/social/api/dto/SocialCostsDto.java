package uk.gegc.xpeconomy.features.social.api.dto;

import uk.gegc.xpeconomy.features.social.domain.model.InteractionTier;

import java.math.BigDecimal;
import java.util.Map;

public record SocialCostsDto(
        long commentCost,
        long replyCost,
        Map<InteractionTier, Long> interactionCosts,
        BigDecimal authorRewardRate
) {}
