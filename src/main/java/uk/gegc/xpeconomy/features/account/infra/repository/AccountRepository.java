package uk.gegc.xpeconomy.features.account.infra.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.xpeconomy.features.account.domain.model.Account;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AccountRepository extends JpaRepository<Account, UUID> {

    Optional<Account> findByUsername(String username);

    boolean existsByUsername(String username);

    /**
     * Loads the account holding a row-level write lock until the surrounding transaction ends.
     * Every balance mutation goes through here, which serializes writers per account.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Account a WHERE a.id = :id")
    Optional<Account> findByIdForUpdate(@Param("id") UUID id);

    @Query("SELECT a.id FROM Account a ORDER BY a.createdAt")
    List<UUID> findAllIds();

    List<Account> findBySpendingFrozenTrue();

    List<Account> findBySpendableXpLessThan(long threshold);

    List<Account> findBySpendableXpGreaterThan(long threshold);
}
