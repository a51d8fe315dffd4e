package uk.gegc.xpeconomy.features.ledger.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.xpeconomy.features.ledger.api.dto.BalanceDto;
import uk.gegc.xpeconomy.features.ledger.api.dto.DerivedBalanceDto;
import uk.gegc.xpeconomy.features.ledger.api.dto.XpTransactionDto;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionType;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * The only component allowed to move XP. Every call appends exactly one ledger entry and updates
 * the account balances in the same transaction, or changes nothing.
 */
public interface LedgerService {

    /**
     * Credits both accumulated and spendable XP.
     *
     * @param amount strictly positive
     * @param source an earning category
     * @param refs   optional references; a non-null {@code requestId} makes the call idempotent
     */
    XpTransactionDto earn(UUID accountId, long amount, XpTransactionSource source, String description,
                          TransactionRefs refs);

    /**
     * Debits spendable XP only.
     *
     * @throws uk.gegc.xpeconomy.features.ledger.domain.exception.InsufficientXpException when the balance is short
     * @throws uk.gegc.xpeconomy.features.ledger.domain.exception.SpendingFrozenException when monitoring froze the account
     */
    XpTransactionDto spend(UUID accountId, long amount, XpTransactionSource purpose, String description,
                           TransactionRefs refs);

    BalanceDto getBalance(UUID accountId);

    Page<XpTransactionDto> listTransactions(UUID accountId,
                                            XpTransactionType type,
                                            XpTransactionSource source,
                                            LocalDateTime dateFrom,
                                            LocalDateTime dateTo,
                                            Pageable pageable);

    DerivedBalanceDto getDerivedBalance(UUID accountId);
}
