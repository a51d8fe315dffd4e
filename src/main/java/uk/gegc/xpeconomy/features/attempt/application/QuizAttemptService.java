package uk.gegc.xpeconomy.features.attempt.application;

import uk.gegc.xpeconomy.features.attempt.api.dto.QuizAttemptDto;
import uk.gegc.xpeconomy.features.attempt.api.dto.QuizAttemptOutcomeDto;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

public interface QuizAttemptService {

    /**
     * Records a graded attempt, credits its reward and applies any speed unlock, all in one transaction.
     * The attempt number is derived from this account's earlier attempts on the content.
     */
    QuizAttemptOutcomeDto recordQuizAttempt(UUID accountId, String contentId, int scorePct, int wpmUsed,
                                            String requestId);

    /**
     * Waits for an asynchronous grade at most {@code xp.quiz.grading-timeout}, then records it.
     *
     * @throws uk.gegc.xpeconomy.features.attempt.domain.exception.GradingTimeoutException if the grade is late;
     *                                                                                      nothing is written
     */
    QuizAttemptOutcomeDto recordGradedAttempt(UUID accountId, String contentId, CompletableFuture<QuizGrade> grade,
                                              String requestId);

    List<QuizAttemptDto> listAttempts(UUID accountId, String contentId);
}
