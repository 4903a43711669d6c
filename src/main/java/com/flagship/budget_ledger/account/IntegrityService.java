package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.common.OwnerLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the integrity sweep over an owner's accounts and optionally repairs what it finds.
 *
 * Repairs:
 * - ORPHANED, ROOT_WITH_PARENT, CYCLE: the parent link is cleared
 * - CATEGORY_MISMATCH: the account and its subtree adopt the parent's category
 * - BALANCE_DRIFT: the cache is rewritten from the ledger fold
 * - MISSING_DEFAULT_ACCOUNT: the default roots are created
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntegrityService {

    private final AccountService accountService;
    private final JdbcTemplate jdbcTemplate;
    private final OwnerLock ownerLock;

    @Transactional
    public IntegrityReport validateIntegrity(UUID ownerId, boolean fix) {
        if (fix) {
            ownerLock.acquire(ownerId);
        }

        List<Account> accounts = accountService.listAccounts(ownerId, true);
        Map<UUID, BigDecimal> folded = accountService.foldedBalances(ownerId);
        List<IntegrityIssue> issues = IntegrityValidator.validate(accounts, folded);

        if (issues.isEmpty()) {
            log.debug("Integrity check clean: ownerId={}, accounts={}", ownerId, accounts.size());
            return new IntegrityReport(ownerId, List.of(), fix, Instant.now());
        }

        log.warn("Integrity issues found: ownerId={}, count={}, fix={}", ownerId, issues.size(), fix);
        if (!fix) {
            return new IntegrityReport(ownerId, List.copyOf(issues), false, Instant.now());
        }

        List<IntegrityIssue> resolved = new ArrayList<>();
        boolean defaultsCreated = false;
        for (IntegrityIssue issue : issues) {
            switch (issue.getType()) {
                case ORPHANED, ROOT_WITH_PARENT, CYCLE -> detach(issue.getAccountId());
                case CATEGORY_MISMATCH -> adoptParentCategory(ownerId, issue.getAccountId());
                case BALANCE_DRIFT -> rewriteCache(issue.getAccountId(), folded.getOrDefault(issue.getAccountId(), BigDecimal.ZERO));
                case MISSING_DEFAULT_ACCOUNT -> {
                    if (!defaultsCreated) {
                        accountService.setupDefaultAccounts(ownerId);
                        defaultsCreated = true;
                    }
                }
            }
            log.info("Integrity issue fixed: ownerId={}, type={}, accountId={}", ownerId, issue.getType(), issue.getAccountId());
            resolved.add(issue.markFixed());
        }
        return new IntegrityReport(ownerId, List.copyOf(resolved), true, Instant.now());
    }

    private void detach(UUID accountId) {
        jdbcTemplate.update("UPDATE accounts SET parent_id = NULL WHERE id = ?", accountId);
    }

    private void adoptParentCategory(UUID ownerId, UUID accountId) {
        jdbcTemplate.update(
            "WITH RECURSIVE subtree AS (" +
            "  SELECT id FROM accounts WHERE id = ? AND owner_id = ? " +
            "  UNION " +
            "  SELECT a.id FROM accounts a JOIN subtree s ON a.parent_id = s.id" +
            ") " +
            "UPDATE accounts SET category = (SELECT p.category FROM accounts c JOIN accounts p ON p.id = c.parent_id WHERE c.id = ?) " +
            "WHERE id IN (SELECT id FROM subtree)",
            accountId, ownerId, accountId);
    }

    private void rewriteCache(UUID accountId, BigDecimal folded) {
        jdbcTemplate.update("UPDATE accounts SET current_balance = ? WHERE id = ?", folded, accountId);
    }
}
