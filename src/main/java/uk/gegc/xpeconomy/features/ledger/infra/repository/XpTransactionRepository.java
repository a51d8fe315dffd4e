package uk.gegc.xpeconomy.features.ledger.infra.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransaction;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface XpTransactionRepository extends JpaRepository<XpTransaction, UUID> {

    @Query("""
        select t from XpTransaction t
        where t.accountId = :accountId
          and (:type is null or t.type = :type)
          and (:source is null or t.source = :source)
          and (:dateFrom is null or t.createdAt >= :dateFrom)
          and (:dateTo is null or t.createdAt <= :dateTo)
        order by t.createdAt desc
    """)
    Page<XpTransaction> findByFilters(
            @Param("accountId") UUID accountId,
            @Param("type") XpTransactionType type,
            @Param("source") XpTransactionSource source,
            @Param("dateFrom") LocalDateTime dateFrom,
            @Param("dateTo") LocalDateTime dateTo,
            Pageable pageable
    );

    Optional<XpTransaction> findByIdempotencyKey(String idempotencyKey);

    @Query("select coalesce(sum(t.amount), 0) from XpTransaction t where t.accountId = :accountId")
    long sumAmountByAccountId(@Param("accountId") UUID accountId);

    @Query("""
        select coalesce(sum(t.amount), 0) from XpTransaction t
        where t.accountId = :accountId and t.type = :type
    """)
    long sumAmountByAccountIdAndType(@Param("accountId") UUID accountId, @Param("type") XpTransactionType type);

    @Query("""
        select coalesce(sum(t.amount), 0) from XpTransaction t
        where t.accountId = :accountId and t.type = :type and t.createdAt >= :since
    """)
    long sumAmountByAccountIdAndTypeSince(@Param("accountId") UUID accountId,
                                          @Param("type") XpTransactionType type,
                                          @Param("since") LocalDateTime since);

    @Query("""
        select coalesce(sum(t.amount), 0) from XpTransaction t
        where t.accountId = :accountId and t.source in :sources
    """)
    long sumAmountByAccountIdAndSourceIn(@Param("accountId") UUID accountId,
                                         @Param("sources") List<XpTransactionSource> sources);

    @Query("""
        select coalesce(sum(t.amount), 0) from XpTransaction t
        where t.type = :type and t.createdAt >= :since
    """)
    long sumAmountByTypeSince(@Param("type") XpTransactionType type, @Param("since") LocalDateTime since);

    long countByCreatedAtGreaterThanEqual(LocalDateTime since);

    @Query("select count(distinct t.accountId) from XpTransaction t where t.createdAt >= :since")
    long countDistinctAccountsSince(@Param("since") LocalDateTime since);

    List<XpTransaction> findByAmountGreaterThanAndCreatedAtGreaterThanEqual(long amount, LocalDateTime since);

    Optional<XpTransaction> findFirstByAccountIdOrderBySequenceNoDesc(UUID accountId);

    long countByAccountId(UUID accountId);

    List<XpTransaction> findByAccountIdAndAmountGreaterThan(UUID accountId, long amount);
}
