package uk.gegc.xpeconomy.features.social.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.attempt.domain.model.QuizAttempt;
import uk.gegc.xpeconomy.features.attempt.infra.repository.QuizAttemptRepository;
import uk.gegc.xpeconomy.features.ledger.api.dto.XpTransactionDto;
import uk.gegc.xpeconomy.features.ledger.application.LedgerService;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.application.XpMutationExecutor;
import uk.gegc.xpeconomy.features.ledger.domain.exception.IdempotencyConflictException;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.ledger.infra.repository.XpTransactionRepository;
import uk.gegc.xpeconomy.features.social.api.dto.*;
import uk.gegc.xpeconomy.features.social.application.SocialInteractionService;
import uk.gegc.xpeconomy.features.social.application.SocialProperties;
import uk.gegc.xpeconomy.features.social.domain.exception.CommentNotUnlockedException;
import uk.gegc.xpeconomy.features.social.domain.exception.DuplicateInteractionException;
import uk.gegc.xpeconomy.features.social.domain.model.CommentCharge;
import uk.gegc.xpeconomy.features.social.domain.model.CommentInteraction;
import uk.gegc.xpeconomy.features.social.domain.model.InteractionTier;
import uk.gegc.xpeconomy.features.social.infra.mapping.SocialMapper;
import uk.gegc.xpeconomy.features.social.infra.repository.CommentChargeRepository;
import uk.gegc.xpeconomy.features.social.infra.repository.CommentInteractionRepository;
import uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SocialInteractionServiceImpl implements SocialInteractionService {

    private static final List<InteractionTier> POSITIVE_TIERS = Arrays.stream(InteractionTier.values())
            .filter(InteractionTier::isPositive)
            .toList();
    private static final List<InteractionTier> REPORT_TIERS = Arrays.stream(InteractionTier.values())
            .filter(t -> !t.isPositive())
            .toList();
    private static final List<XpTransactionSource> SOCIAL_SPEND_SOURCES = List.of(
            XpTransactionSource.COMMENT_POST,
            XpTransactionSource.COMMENT_REPLY,
            XpTransactionSource.INTERACTION,
            XpTransactionSource.REPORT
    );

    private final AccountRepository accountRepository;
    private final QuizAttemptRepository attemptRepository;
    private final CommentChargeRepository chargeRepository;
    private final CommentInteractionRepository interactionRepository;
    private final XpTransactionRepository transactionRepository;
    private final LedgerService ledgerService;
    private final XpMutationExecutor mutationExecutor;
    private final SocialProperties socialProperties;
    private final SocialMapper socialMapper;
    private final Clock clock;

    @Override
    public CommentChargeDto authorizeComment(UUID accountId, String contentId, String commentRef, boolean reply,
                                             String requestId) {
        requireText(contentId, "contentId");
        requireText(requestId, "requestId");

        return mutationExecutor.execute(accountId, "comment", () -> {
            lockAccount(accountId);

            Optional<CommentCharge> existing = chargeRepository.findByRequestId(requestId);
            if (existing.isPresent()) {
                CommentCharge charge = existing.get();
                if (!charge.getAccountId().equals(accountId) || !charge.getContentId().equals(contentId)) {
                    throw new IdempotencyConflictException(
                            "Request id " + requestId + " was already used for a different comment");
                }
                return socialMapper.toDto(charge);
            }

            if (!attemptRepository.existsByAccountIdAndContentIdAndPassedTrue(accountId, contentId)) {
                throw new CommentNotUnlockedException(contentId);
            }

            CommentCharge charge = new CommentCharge();
            charge.setAccountId(accountId);
            charge.setContentId(contentId);
            charge.setCommentRef(commentRef);
            charge.setReply(reply);
            charge.setRequestId(requestId);
            charge.setCreatedAt(LocalDateTime.now(clock));

            Optional<QuizAttempt> credit = attemptRepository
                    .findFirstByAccountIdAndContentIdAndPerfectTrueAndFreeCommentCreditTrueOrderByAttemptNumberAsc(
                            accountId, contentId);
            if (credit.isPresent()) {
                QuizAttempt attempt = credit.get();
                attempt.setFreeCommentCredit(false);
                attemptRepository.save(attempt);
                charge.setFreeCreditUsed(true);
                charge.setCreditAttemptId(attempt.getId());
                charge.setXpCharged(0L);
                log.info("Account {} used the free comment credit from attempt {} on {}",
                        accountId, attempt.getId(), contentId);
            } else {
                long cost = socialProperties.commentCostFor(reply);
                if (cost > 0) {
                    XpTransactionDto tx = ledgerService.spend(
                            accountId,
                            cost,
                            reply ? XpTransactionSource.COMMENT_REPLY : XpTransactionSource.COMMENT_POST,
                            (reply ? "Reply" : "Comment") + " on " + contentId,
                            TransactionRefs.request(requestId + ":spend").withComment(commentRef)
                    );
                    charge.setTransactionId(tx.id());
                }
                charge.setXpCharged(cost);
            }

            return socialMapper.toDto(chargeRepository.save(charge));
        });
    }

    @Override
    @Transactional(readOnly = true)
    public CommentQuoteDto quoteComment(UUID accountId, String contentId, boolean reply) {
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
        boolean unlocked = attemptRepository.existsByAccountIdAndContentIdAndPassedTrue(accountId, contentId);
        boolean freeCredit = unlocked && attemptRepository
                .findFirstByAccountIdAndContentIdAndPerfectTrueAndFreeCommentCreditTrueOrderByAttemptNumberAsc(
                        accountId, contentId)
                .isPresent();
        long cost = freeCredit ? 0L : socialProperties.commentCostFor(reply);
        return new CommentQuoteDto(unlocked, freeCredit, cost, account.getSpendableXp(),
                unlocked && !account.isSpendingFrozen() && account.getSpendableXp() >= cost);
    }

    @Override
    public CommentInteractionDto interact(UUID actorId, UUID authorId, String commentRef, InteractionTier tier,
                                          String requestId) {
        requireText(commentRef, "commentRef");
        requireText(requestId, "requestId");
        if (tier == null) {
            throw new XpValidationException("tier must be provided");
        }

        CommentInteraction charged = mutationExecutor.execute(actorId, "interaction-spend",
                () -> chargeActor(actorId, authorId, commentRef, tier, requestId));
        if (!charged.rewardPending()) {
            return socialMapper.toDto(charged);
        }

        CommentInteraction rewarded = mutationExecutor.execute(authorId, "interaction-reward",
                () -> rewardAuthor(charged.getId()));
        return socialMapper.toDto(rewarded);
    }

    @Override
    @Scheduled(fixedDelayString = "${xp.social.pending-reward-sweep-millis:60000}",
            initialDelayString = "${xp.social.pending-reward-sweep-millis:60000}")
    public int completePendingRewards() {
        List<CommentInteraction> pending = interactionRepository.findPendingRewards();
        int completed = 0;
        for (CommentInteraction interaction : pending) {
            try {
                mutationExecutor.execute(interaction.getAuthorId(), "interaction-reward",
                        () -> rewardAuthor(interaction.getId()));
                completed++;
            } catch (RuntimeException e) {
                log.warn("Author reward for interaction {} still pending: {}", interaction.getId(), e.getMessage());
            }
        }
        if (completed > 0) {
            log.info("Completed {} pending author rewards", completed);
        }
        return completed;
    }

    @Override
    public SocialCostsDto getCosts() {
        Map<InteractionTier, Long> costs = new EnumMap<>(InteractionTier.class);
        for (InteractionTier tier : InteractionTier.values()) {
            costs.put(tier, socialProperties.costFor(tier));
        }
        return new SocialCostsDto(socialProperties.getCommentCost(), socialProperties.getReplyCost(), costs,
                socialProperties.getAuthorRewardRate());
    }

    @Override
    @Transactional(readOnly = true)
    public SocialSummaryDto getSummary(UUID accountId) {
        if (!accountRepository.existsById(accountId)) {
            throw new ResourceNotFoundException("Account " + accountId + " not found");
        }
        long spent = -transactionRepository.sumAmountByAccountIdAndSourceIn(accountId, SOCIAL_SPEND_SOURCES);
        long earned = transactionRepository.sumAmountByAccountIdAndSourceIn(accountId,
                List.of(XpTransactionSource.INTERACTION_REWARD));
        return new SocialSummaryDto(
                accountId,
                chargeRepository.countByAccountId(accountId),
                interactionRepository.countByActorIdAndTierIn(accountId, POSITIVE_TIERS),
                interactionRepository.countByAuthorIdAndTierIn(accountId, POSITIVE_TIERS),
                interactionRepository.countByActorIdAndTierIn(accountId, REPORT_TIERS),
                spent,
                earned,
                earned - spent
        );
    }

    private CommentInteraction chargeActor(UUID actorId, UUID authorId, String commentRef, InteractionTier tier,
                                           String requestId) {
        lockAccount(actorId);

        Optional<CommentInteraction> existing = interactionRepository.findByRequestId(requestId);
        if (existing.isPresent()) {
            CommentInteraction interaction = existing.get();
            if (!interaction.getActorId().equals(actorId)
                    || !interaction.getCommentRef().equals(commentRef)
                    || interaction.getTier() != tier) {
                throw new IdempotencyConflictException(
                        "Request id " + requestId + " was already used for a different interaction");
            }
            return interaction;
        }

        if (!accountRepository.existsById(authorId)) {
            throw new ResourceNotFoundException("Author account " + authorId + " not found");
        }
        if (interactionRepository.existsByActorIdAndCommentRefAndTier(actorId, commentRef, tier)) {
            throw new DuplicateInteractionException(commentRef, tier);
        }

        long cost = socialProperties.costFor(tier);
        boolean selfInteraction = actorId.equals(authorId);
        long reward = tier.isPositive() && !selfInteraction ? socialProperties.authorRewardFor(cost) : 0L;

        UUID spendTransactionId = null;
        if (cost > 0) {
            spendTransactionId = ledgerService.spend(
                    actorId,
                    cost,
                    tier.spendSource(),
                    tier + " on comment " + commentRef,
                    TransactionRefs.request(requestId + ":spend").withComment(commentRef)
            ).id();
        }

        CommentInteraction interaction = new CommentInteraction();
        interaction.setActorId(actorId);
        interaction.setAuthorId(authorId);
        interaction.setCommentRef(commentRef);
        interaction.setTier(tier);
        interaction.setXpCost(cost);
        interaction.setAuthorReward(reward);
        interaction.setSpendTransactionId(spendTransactionId);
        interaction.setRequestId(requestId);
        interaction.setCreatedAt(LocalDateTime.now(clock));
        return interactionRepository.save(interaction);
    }

    private CommentInteraction rewardAuthor(UUID interactionId) {
        CommentInteraction interaction = interactionRepository.findById(interactionId)
                .orElseThrow(() -> new ResourceNotFoundException("Interaction " + interactionId + " not found"));
        lockAccount(interaction.getAuthorId());
        if (!interaction.rewardPending()) {
            return interaction;
        }

        XpTransactionDto earn = ledgerService.earn(
                interaction.getAuthorId(),
                interaction.getAuthorReward(),
                XpTransactionSource.INTERACTION_REWARD,
                interaction.getTier() + " received on comment " + interaction.getCommentRef(),
                TransactionRefs.request(interaction.getRequestId() + ":reward").withComment(interaction.getCommentRef())
        );
        interaction.setRewardTransactionId(earn.id());
        return interactionRepository.save(interaction);
    }

    private void lockAccount(UUID accountId) {
        accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new XpValidationException(name + " must not be blank");
        }
    }
}
