package uk.gegc.xpeconomy.features.social.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.xpeconomy.features.social.domain.model.CommentCharge;

import java.util.Optional;
import java.util.UUID;

public interface CommentChargeRepository extends JpaRepository<CommentCharge, UUID> {

    Optional<CommentCharge> findByRequestId(String requestId);

    long countByAccountId(UUID accountId);
}
