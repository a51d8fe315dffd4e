package uk.gegc.xpeconomy.features.ledger.application;

import java.util.UUID;

/**
 * Optional references stored alongside a ledger entry. {@code requestId} doubles as the idempotency key.
 */
public record TransactionRefs(
        String requestId,
        UUID quizAttemptId,
        String commentRef,
        String featureRef
) {

    public static TransactionRefs none() {
        return new TransactionRefs(null, null, null, null);
    }

    public static TransactionRefs request(String requestId) {
        return new TransactionRefs(requestId, null, null, null);
    }

    public TransactionRefs withQuizAttempt(UUID attemptId) {
        return new TransactionRefs(requestId, attemptId, commentRef, featureRef);
    }

    public TransactionRefs withComment(String ref) {
        return new TransactionRefs(requestId, quizAttemptId, ref, featureRef);
    }

    public TransactionRefs withFeature(String ref) {
        return new TransactionRefs(requestId, quizAttemptId, commentRef, ref);
    }
}
