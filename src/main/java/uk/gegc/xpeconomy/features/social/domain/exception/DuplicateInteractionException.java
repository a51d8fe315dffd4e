package uk.gegc.xpeconomy.features.social.domain.exception;

import uk.gegc.xpeconomy.features.social.domain.model.InteractionTier;

public class DuplicateInteractionException extends RuntimeException {

    public DuplicateInteractionException(String commentRef, InteractionTier tier) {
        super("A " + tier + " interaction was already given on comment " + commentRef);
    }
}
