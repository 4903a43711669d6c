package com.flagship.budget_ledger.ledger;

import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.common.Money;
import com.flagship.budget_ledger.common.OwnerLock;
import com.flagship.budget_ledger.common.PagedSequence;
import com.flagship.budget_ledger.config.LedgerProperties;
import com.flagship.budget_ledger.event.TransferPostedEvent;
import com.flagship.budget_ledger.exception.AlreadyReversedException;
import com.flagship.budget_ledger.exception.InvalidAmountException;
import com.flagship.budget_ledger.exception.SameAccountException;
import com.flagship.budget_ledger.exception.UnknownReferenceException;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import com.flagship.budget_ledger.outbox.OutboxService;
import com.flagship.budget_ledger.period.PeriodService;
import com.flagship.budget_ledger.period.WeeklyPeriod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only ledger of signed transactions.
 *
 * This service enforces the core invariants:
 * 1. Amounts are never zero
 * 2. Transfers are two legs with a shared transferId that sum to zero, written in one
 *    database transaction (a deferred trigger re-checks this at commit)
 * 3. Rows are never updated or deleted; corrections are reversing rows
 * 4. Each row is applied to the account's cached balance in the same transaction
 *
 * Writers take the owner lock first; readers run single statements over committed data,
 * so they see both legs of a transfer or neither.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerService {

    private static final String SELECT_TRANSACTION =
        "SELECT t.id, t.owner_id, t.account_id, t.period_id, t.amount, t.kind, t.description, " +
        "t.transfer_id, t.reverses_id, t.created_at, t.sequence_number FROM ledger_transactions t ";

    private final JdbcTemplate jdbcTemplate;
    private final LedgerEntryWriter entryWriter;
    private final AccountService accountService;
    private final PeriodService periodService;
    private final OwnerLock ownerLock;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;

    /**
     * Posts a single signed transaction.
     *
     * Inactive accounts still accept entries so corrections remain possible after an
     * account is retired.
     *
     * @throws InvalidAmountException if the amount is zero or has more than two decimals
     * @throws com.flagship.budget_ledger.exception.UnknownAccountException if the account is not the owner's
     * @throws UnknownReferenceException if the period is not the owner's
     */
    @Transactional
    public LedgerTransaction post(UUID ownerId, PostTransactionCommand command) {
        BigDecimal amount = Money.of(command.getAmount());
        if (Money.isZero(amount)) {
            throw new InvalidAmountException("Transaction amount must be non-zero");
        }
        if (command.getKind() == null) {
            throw new InvalidAmountException("Transaction kind is required");
        }

        ownerLock.acquire(ownerId);
        accountService.require(ownerId, command.getAccountId());
        WeeklyPeriod period = periodService.getPeriod(ownerId, command.getPeriodId());

        LedgerTransaction posted = entryWriter.append(LedgerTransaction.draft(
            ownerId, command.getAccountId(), period.getId(), amount, command.getKind(),
            command.getDescription(), null, null));

        metrics.recordTransactionPosted(command.getKind().name());
        log.info("Transaction posted: ownerId={}, transactionId={}, accountId={}, amount={}, kind={}",
            ownerId, posted.getId(), posted.getAccountId(), amount, command.getKind());
        return posted;
    }

    /**
     * Moves {@code amount} from source to destination as one atomic unit: the source is
     * debited, the destination credited, and either both rows exist or neither does.
     *
     * @throws InvalidAmountException if the amount is not positive
     * @throws SameAccountException if source and destination are the same account
     */
    @Transactional
    public Transfer postTransfer(UUID ownerId, TransferCommand command) {
        BigDecimal amount = Money.positive(command.getAmount(), "Transfer amount");
        if (command.getSourceAccountId() != null && command.getSourceAccountId().equals(command.getDestinationAccountId())) {
            throw new SameAccountException("Cannot transfer from account " + command.getSourceAccountId() + " to itself");
        }
        TransactionKind kind = command.getKind() != null ? command.getKind() : TransactionKind.TRANSFER;

        ownerLock.acquire(ownerId);
        accountService.require(ownerId, command.getSourceAccountId());
        accountService.require(ownerId, command.getDestinationAccountId());
        WeeklyPeriod period = periodService.getPeriod(ownerId, command.getPeriodId());

        UUID transferId = UUID.randomUUID();
        LedgerTransaction debit = entryWriter.append(LedgerTransaction.draft(
            ownerId, command.getSourceAccountId(), period.getId(), amount.negate(), kind,
            command.getDescription(), transferId, null));
        LedgerTransaction credit = entryWriter.append(LedgerTransaction.draft(
            ownerId, command.getDestinationAccountId(), period.getId(), amount, kind,
            command.getDescription(), transferId, null));

        Transfer transfer = new Transfer(transferId, debit, credit);
        outboxService.append(TransferPostedEvent.from(transfer));
        metrics.recordTransferPosted(kind.name());

        log.info("Transfer posted: ownerId={}, transferId={}, from={}, to={}, amount={}, kind={}",
            ownerId, transferId, command.getSourceAccountId(), command.getDestinationAccountId(), amount, kind);
        return transfer;
    }

    /**
     * Posts the equal-and-opposite entry of a transaction in its original period. For a
     * transfer leg, both legs are reversed together as a new transfer.
     *
     * @return the reversing rows
     * @throws UnknownReferenceException if the transaction is not the owner's
     * @throws AlreadyReversedException if it was reversed before or is itself a reversal
     */
    @Transactional
    public List<LedgerTransaction> reverse(UUID ownerId, UUID transactionId, String description) {
        ownerLock.acquire(ownerId);
        LedgerTransaction original = getTransaction(ownerId, transactionId);

        List<LedgerTransaction> targets = original.isTransferLeg()
            ? transferLegs(ownerId, original.getTransferId())
            : List.of(original);

        for (LedgerTransaction target : targets) {
            if (target.isReversal()) {
                throw new AlreadyReversedException("Transaction " + target.getId() + " is a reversal and cannot be reversed");
            }
            if (isReversed(target.getId())) {
                throw new AlreadyReversedException("Transaction " + target.getId() + " has already been reversed");
            }
        }

        UUID reversalTransferId = original.isTransferLeg() ? UUID.randomUUID() : null;
        String reversalDescription = description != null && !description.isBlank()
            ? description
            : "Reversal of " + transactionId;

        List<LedgerTransaction> reversals = new ArrayList<>();
        for (LedgerTransaction target : targets) {
            reversals.add(entryWriter.append(LedgerTransaction.draft(
                ownerId, target.getAccountId(), target.getPeriodId(), target.getAmount().negate(),
                target.getKind(), reversalDescription, reversalTransferId, target.getId())));
        }

        if (reversalTransferId != null) {
            outboxService.append(TransferPostedEvent.from(toTransfer(reversals)));
        }
        metrics.recordReversal();

        log.info("Transaction reversed: ownerId={}, transactionId={}, reversingRows={}",
            ownerId, transactionId, reversals.size());
        return reversals;
    }

    /**
     * Reverses a whole transfer by id.
     */
    @Transactional
    public Transfer reverseTransfer(UUID ownerId, UUID transferId, String description) {
        List<LedgerTransaction> legs = transferLegs(ownerId, transferId);
        if (legs.isEmpty()) {
            throw UnknownReferenceException.of("Transfer", transferId);
        }
        List<LedgerTransaction> reversals = reverse(ownerId, legs.get(0).getId(), description);
        return toTransfer(reversals);
    }

    @Transactional(readOnly = true)
    public Optional<LedgerTransaction> findTransaction(UUID ownerId, UUID transactionId) {
        return jdbcTemplate.query(SELECT_TRANSACTION + "WHERE t.id = ? AND t.owner_id = ?",
            transactionRowMapper(), transactionId, ownerId).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public LedgerTransaction getTransaction(UUID ownerId, UUID transactionId) {
        return findTransaction(ownerId, transactionId)
            .orElseThrow(() -> UnknownReferenceException.of("Transaction", transactionId));
    }

    /**
     * Both legs of a transfer, debit first. Empty when the transfer is unknown.
     */
    @Transactional(readOnly = true)
    public List<LedgerTransaction> transferLegs(UUID ownerId, UUID transferId) {
        return jdbcTemplate.query(
            SELECT_TRANSACTION + "WHERE t.transfer_id = ? AND t.owner_id = ? ORDER BY t.amount ASC",
            transactionRowMapper(), transferId, ownerId);
    }

    @Transactional(readOnly = true)
    public Optional<Transfer> findTransfer(UUID ownerId, UUID transferId) {
        List<LedgerTransaction> legs = transferLegs(ownerId, transferId);
        return legs.size() == 2 ? Optional.of(toTransfer(legs)) : Optional.empty();
    }

    /**
     * An account's transactions, newest first (ties broken by sequence, newest first).
     *
     * Account and period bounds are validated up front; rows are fetched a page at a
     * time only while the caller iterates, and each iteration starts over.
     *
     * @param fromPeriodId optional lower bound, inclusive
     * @param toPeriodId   optional upper bound, inclusive
     */
    public Iterable<LedgerTransaction> history(UUID ownerId, UUID accountId, UUID fromPeriodId, UUID toPeriodId) {
        accountService.require(ownerId, accountId);
        LocalDate fromStart = fromPeriodId != null ? periodService.getPeriod(ownerId, fromPeriodId).getStartDate() : null;
        LocalDate toStart = toPeriodId != null ? periodService.getPeriod(ownerId, toPeriodId).getStartDate() : null;
        int pageSize = properties.getHistory().getPageSize();

        return new PagedSequence<>(after -> {
            StringBuilder sql = new StringBuilder(SELECT_TRANSACTION)
                .append("JOIN weekly_periods p ON p.id = t.period_id WHERE t.owner_id = ? AND t.account_id = ?");
            List<Object> args = new ArrayList<>(List.of(ownerId, accountId));
            if (fromStart != null) {
                sql.append(" AND p.start_date >= ?");
                args.add(fromStart);
            }
            if (toStart != null) {
                sql.append(" AND p.start_date <= ?");
                args.add(toStart);
            }
            if (after != null) {
                sql.append(" AND (t.created_at, t.sequence_number) < (?, ?)");
                args.add(Timestamp.from(after.getCreatedAt()));
                args.add(after.getSequenceNumber());
            }
            sql.append(" ORDER BY t.created_at DESC, t.sequence_number DESC LIMIT ?");
            args.add(pageSize);
            return jdbcTemplate.query(sql.toString(), transactionRowMapper(), args.toArray());
        }, pageSize);
    }

    /**
     * Signed sum of a period's transactions on the given accounts.
     */
    @Transactional(readOnly = true)
    public BigDecimal periodActivity(UUID ownerId, UUID periodId, Collection<UUID> accountIds) {
        periodService.getPeriod(ownerId, periodId);
        if (accountIds.isEmpty()) {
            return Money.ZERO;
        }
        String placeholders = String.join(", ", Collections.nCopies(accountIds.size(), "?"));
        List<Object> args = new ArrayList<>(List.of(ownerId, periodId));
        args.addAll(accountIds);
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_transactions " +
            "WHERE owner_id = ? AND period_id = ? AND account_id IN (" + placeholders + ")",
            BigDecimal.class, args.toArray());
        return Money.round(total != null ? total : BigDecimal.ZERO);
    }

    private boolean isReversed(UUID transactionId) {
        Boolean reversed = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM ledger_transactions WHERE reverses_id = ?)", Boolean.class, transactionId);
        return Boolean.TRUE.equals(reversed);
    }

    private static Transfer toTransfer(List<LedgerTransaction> legs) {
        LedgerTransaction debit = legs.get(0).getAmount().signum() < 0 ? legs.get(0) : legs.get(1);
        LedgerTransaction credit = debit == legs.get(0) ? legs.get(1) : legs.get(0);
        return new Transfer(debit.getTransferId(), debit, credit);
    }

    static RowMapper<LedgerTransaction> transactionRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getObject("id", UUID.class),
            rs.getObject("owner_id", UUID.class),
            rs.getObject("account_id", UUID.class),
            rs.getObject("period_id", UUID.class),
            rs.getBigDecimal("amount"),
            TransactionKind.valueOf(rs.getString("kind")),
            rs.getString("description"),
            rs.getObject("transfer_id", UUID.class),
            rs.getObject("reverses_id", UUID.class),
            rs.getTimestamp("created_at").toInstant(),
            rs.getLong("sequence_number")
        );
    }
}
