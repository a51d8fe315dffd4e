package uk.gegc.xpeconomy.features.social.api.dto;

import java.util.UUID;

public record SocialSummaryDto(
        UUID accountId,
        long commentsPosted,
        long interactionsGiven,
        long interactionsReceived,
        long reportsFiled,
        long xpSpentOnSocial,
        long xpEarnedFromRewards,
        long netSocialXp
) {}
