package uk.gegc.xpeconomy.features.social.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "CommentQuoteDto", description = "What posting a comment would cost right now")
public record CommentQuoteDto(
        boolean unlocked,
        boolean freeCreditAvailable,
        long cost,
        long spendableXp,
        boolean affordable
) {}
