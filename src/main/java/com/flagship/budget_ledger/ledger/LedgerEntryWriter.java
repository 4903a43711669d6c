package com.flagship.budget_ledger.ledger;

import com.flagship.budget_ledger.exception.UnknownAccountException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends one ledger row and applies it to the account's cached balance.
 *
 * The insert and the cache update always happen in the caller's transaction, so the
 * cache can never run ahead of or behind the ledger. Callers own validation and the
 * owner lock.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerEntryWriter {

    private final JdbcTemplate jdbcTemplate;

    @Transactional(propagation = Propagation.MANDATORY)
    public LedgerTransaction append(LedgerTransaction draft) {
        LedgerTransaction persisted = jdbcTemplate.queryForObject(
            "INSERT INTO ledger_transactions (id, owner_id, account_id, period_id, amount, kind, description, " +
            "transfer_id, reverses_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING created_at, sequence_number",
            (rs, rowNum) -> draft.persisted(
                rs.getTimestamp("created_at").toInstant(),
                rs.getLong("sequence_number")),
            draft.getId(),
            draft.getOwnerId(),
            draft.getAccountId(),
            draft.getPeriodId(),
            draft.getAmount(),
            draft.getKind().name(),
            draft.getDescription(),
            draft.getTransferId(),
            draft.getReversesId()
        );

        int updated = jdbcTemplate.update(
            "UPDATE accounts SET current_balance = current_balance + ? WHERE id = ? AND owner_id = ?",
            draft.getAmount(), draft.getAccountId(), draft.getOwnerId());
        if (updated != 1) {
            throw UnknownAccountException.of(draft.getAccountId());
        }

        log.debug("Ledger row appended: id={}, accountId={}, amount={}, kind={}, transferId={}",
            draft.getId(), draft.getAccountId(), draft.getAmount(), draft.getKind(), draft.getTransferId());
        return persisted;
    }
}
