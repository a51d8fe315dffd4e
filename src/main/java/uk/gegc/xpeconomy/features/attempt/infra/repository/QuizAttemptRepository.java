package uk.gegc.xpeconomy.features.attempt.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.xpeconomy.features.attempt.domain.model.QuizAttempt;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface QuizAttemptRepository extends JpaRepository<QuizAttempt, UUID> {

    int countByAccountIdAndContentId(UUID accountId, String contentId);

    Optional<QuizAttempt> findByRequestId(String requestId);

    boolean existsByAccountIdAndContentIdAndPassedTrue(UUID accountId, String contentId);

    Optional<QuizAttempt> findFirstByAccountIdAndContentIdAndPerfectTrueAndFreeCommentCreditTrueOrderByAttemptNumberAsc(
            UUID accountId, String contentId);

    List<QuizAttempt> findByAccountIdAndContentIdOrderByAttemptNumberAsc(UUID accountId, String contentId);

    List<QuizAttempt> findTop50ByAccountIdOrderByCreatedAtDesc(UUID accountId);
}
