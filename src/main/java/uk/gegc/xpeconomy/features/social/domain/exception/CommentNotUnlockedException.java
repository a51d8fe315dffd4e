package uk.gegc.xpeconomy.features.social.domain.exception;

public class CommentNotUnlockedException extends RuntimeException {

    public CommentNotUnlockedException(String contentId) {
        super("Pass the quiz on content " + contentId + " before commenting");
    }
}
