package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.common.Money;
import com.flagship.budget_ledger.common.OwnerLock;
import com.flagship.budget_ledger.exception.InvalidAmountException;
import com.flagship.budget_ledger.exception.InvalidHierarchyException;
import com.flagship.budget_ledger.exception.UnknownAccountException;
import com.flagship.budget_ledger.exception.UnknownReferenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Date;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Maintains an owner's chart of accounts.
 *
 * Key principles:
 * - Every structural change is validated against the whole owner tree by
 *   {@link AccountHierarchy} before anything is written
 * - Mutations take the owner lock, so two concurrent reparents cannot each pass
 *   validation and together form a cycle
 * - Balances are folded from the ledger; the cached column is only a projection
 *
 * JDBC is used directly: the tree, balances and history are read with set-based
 * queries that an entity mapping would only get in the way of.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountService {

    private static final int MAX_NAME_LENGTH = 100;

    private static final String SELECT_ACCOUNT =
        "SELECT id, owner_id, name, category, parent_id, root_account, target_amount, current_balance, " +
        "is_active, sort_order, description, created_at FROM accounts ";

    private static final String SUBTREE_CTE =
        "WITH RECURSIVE subtree AS (" +
        "  SELECT id FROM accounts WHERE id = ? AND owner_id = ? " +
        "  UNION " +
        "  SELECT a.id FROM accounts a JOIN subtree s ON a.parent_id = s.id" +
        ") ";

    private final JdbcTemplate jdbcTemplate;
    private final OwnerLock ownerLock;

    /**
     * Creates an account, top-level or under an existing parent.
     *
     * @return the created account
     * @throws InvalidHierarchyException if the name is taken among siblings, the parent is
     *         foreign or inactive, or the category differs from the parent's root
     * @throws UnknownAccountException if the parent does not exist
     */
    @Transactional
    public Account createAccount(UUID ownerId, CreateAccountCommand command) {
        String name = validateName(command.getName());
        BigDecimal target = command.getTargetAmount() != null ? Money.of(command.getTargetAmount()) : null;
        if (target != null && target.signum() < 0) {
            throw new InvalidAmountException("Target amount cannot be negative");
        }

        ownerLock.acquire(ownerId);

        Account parent = null;
        AccountCategory category = command.getCategory();
        if (command.getParentId() != null) {
            parent = findAnyOwner(command.getParentId())
                .orElseThrow(() -> UnknownAccountException.of(command.getParentId()));
            if (category == null) {
                category = parent.getCategory();
            }
        } else if (category == null) {
            throw new InvalidHierarchyException("A top-level account requires a category");
        }

        loadHierarchy(ownerId).validatePlacement(ownerId, null, name, category, parent);

        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, owner_id, name, category, parent_id, root_account, target_amount, " +
            "current_balance, is_active, sort_order, description) VALUES (?, ?, ?, ?, ?, FALSE, ?, 0, TRUE, ?, ?)",
            accountId,
            ownerId,
            name,
            category.name(),
            command.getParentId(),
            target,
            command.getSortOrder() != null ? command.getSortOrder() : 0,
            command.getDescription()
        );

        log.info("Account created: ownerId={}, accountId={}, name={}, category={}, parentId={}",
            ownerId, accountId, name, category, command.getParentId());
        return require(ownerId, accountId);
    }

    /**
     * Ensures the owner has one root account per category. Safe to call repeatedly:
     * a top-level account that already carries the default name is promoted instead
     * of duplicated.
     *
     * @return the owner's root accounts in category order
     */
    @Transactional
    public List<Account> setupDefaultAccounts(UUID ownerId) {
        ownerLock.acquire(ownerId);

        List<Account> roots = new ArrayList<>();
        for (AccountCategory category : AccountCategory.values()) {
            Optional<Account> existingRoot = findRoot(ownerId, category);
            if (existingRoot.isPresent()) {
                roots.add(existingRoot.get());
                continue;
            }

            String name = category.defaultRootName();
            List<UUID> sameName = jdbcTemplate.queryForList(
                "SELECT id FROM accounts WHERE owner_id = ? AND parent_id IS NULL AND category = ? AND LOWER(name) = LOWER(?)",
                UUID.class, ownerId, category.name(), name);

            UUID rootId;
            if (!sameName.isEmpty()) {
                rootId = sameName.get(0);
                jdbcTemplate.update("UPDATE accounts SET root_account = TRUE, is_active = TRUE, deactivated_at = NULL WHERE id = ?", rootId);
                log.info("Promoted existing account to default root: ownerId={}, accountId={}, category={}",
                    ownerId, rootId, category);
            } else {
                rootId = UUID.randomUUID();
                jdbcTemplate.update(
                    "INSERT INTO accounts (id, owner_id, name, category, parent_id, root_account, current_balance, " +
                    "is_active, sort_order) VALUES (?, ?, ?, ?, NULL, TRUE, 0, TRUE, ?)",
                    rootId, ownerId, name, category.name(), category.ordinal());
                log.info("Default root account created: ownerId={}, accountId={}, name={}", ownerId, rootId, name);
            }
            roots.add(require(ownerId, rootId));
        }
        return roots;
    }

    /**
     * Moves an account (with its subtree) under a new parent, or to the top level when
     * {@code newParentId} is null.
     *
     * @throws InvalidHierarchyException if the account is a root account, or the move
     *         would create a cycle, cross owners, land under an inactive parent, change the
     *         root category, or clash with a sibling name
     */
    @Transactional
    public Account reparent(UUID ownerId, UUID accountId, UUID newParentId) {
        ownerLock.acquire(ownerId);
        Account account = require(ownerId, accountId);

        if (account.isRootAccount() && newParentId != null) {
            throw new InvalidHierarchyException("Root account '" + account.getName() + "' cannot be moved");
        }

        Account parent = null;
        if (newParentId != null) {
            parent = findAnyOwner(newParentId).orElseThrow(() -> UnknownAccountException.of(newParentId));
        }
        loadHierarchy(ownerId).validatePlacement(ownerId, accountId, account.getName(), account.getCategory(), parent);

        jdbcTemplate.update("UPDATE accounts SET parent_id = ? WHERE id = ? AND owner_id = ?",
            newParentId, accountId, ownerId);

        log.info("Account reparented: ownerId={}, accountId={}, from={}, to={}",
            ownerId, accountId, account.getParentId(), newParentId);
        return require(ownerId, accountId);
    }

    @Transactional
    public Account rename(UUID ownerId, UUID accountId, String newName) {
        String name = validateName(newName);
        ownerLock.acquire(ownerId);
        Account account = require(ownerId, accountId);

        for (Account sibling : loadHierarchy(ownerId).children(account.getParentId())) {
            if (!sibling.getId().equals(accountId) && sibling.getName().equalsIgnoreCase(name)) {
                throw new InvalidHierarchyException("An account named '" + name + "' already exists at this level");
            }
        }

        jdbcTemplate.update("UPDATE accounts SET name = ? WHERE id = ?", name, accountId);
        log.info("Account renamed: ownerId={}, accountId={}, from={}, to={}", ownerId, accountId, account.getName(), name);
        return require(ownerId, accountId);
    }

    /**
     * Deactivates the account and every descendant.
     *
     * @return number of accounts that changed state
     */
    @Transactional
    public int deactivate(UUID ownerId, UUID accountId) {
        ownerLock.acquire(ownerId);
        require(ownerId, accountId);

        int updated = jdbcTemplate.update(
            SUBTREE_CTE +
            "UPDATE accounts SET is_active = FALSE, deactivated_at = CURRENT_TIMESTAMP " +
            "WHERE id IN (SELECT id FROM subtree) AND is_active",
            accountId, ownerId);

        log.info("Account subtree deactivated: ownerId={}, accountId={}, accounts={}", ownerId, accountId, updated);
        return updated;
    }

    /**
     * Reactivates a single account. Descendants keep their own state.
     *
     * @throws InvalidHierarchyException if the parent is inactive
     */
    @Transactional
    public Account activate(UUID ownerId, UUID accountId) {
        ownerLock.acquire(ownerId);
        Account account = require(ownerId, accountId);

        if (account.getParentId() != null) {
            Account parent = require(ownerId, account.getParentId());
            if (!parent.isActive()) {
                throw new InvalidHierarchyException(
                    "Cannot activate '" + account.getName() + "' while parent '" + parent.getName() + "' is inactive");
            }
        }

        jdbcTemplate.update("UPDATE accounts SET is_active = TRUE, deactivated_at = NULL WHERE id = ?", accountId);
        log.info("Account activated: ownerId={}, accountId={}", ownerId, accountId);
        return require(ownerId, accountId);
    }

    /**
     * Deletes an account and its subtree.
     *
     * A subtree with any ledger history, loan or allocation run is deactivated instead,
     * because those rows must keep pointing at their accounts.
     */
    @Transactional
    public DeleteOutcome deleteAccount(UUID ownerId, UUID accountId) {
        ownerLock.acquire(ownerId);
        require(ownerId, accountId);

        Boolean hasHistory = jdbcTemplate.queryForObject(
            SUBTREE_CTE +
            "SELECT EXISTS (SELECT 1 FROM ledger_transactions WHERE account_id IN (SELECT id FROM subtree)) " +
            "    OR EXISTS (SELECT 1 FROM allocation_runs WHERE source_account_id IN (SELECT id FROM subtree)) " +
            "    OR EXISTS (SELECT 1 FROM loans WHERE lender_account_id IN (SELECT id FROM subtree) " +
            "                                      OR borrower_account_id IN (SELECT id FROM subtree))",
            Boolean.class, accountId, ownerId);

        if (Boolean.TRUE.equals(hasHistory)) {
            jdbcTemplate.update(
                SUBTREE_CTE +
                "UPDATE accounts SET is_active = FALSE, deactivated_at = CURRENT_TIMESTAMP " +
                "WHERE id IN (SELECT id FROM subtree) AND is_active",
                accountId, ownerId);
            log.info("Account has history, subtree deactivated instead of deleted: ownerId={}, accountId={}",
                ownerId, accountId);
            return DeleteOutcome.DEACTIVATED;
        }

        // children go with the parent through ON DELETE CASCADE
        jdbcTemplate.update("DELETE FROM accounts WHERE id = ? AND owner_id = ?", accountId, ownerId);
        log.info("Account subtree deleted: ownerId={}, accountId={}", ownerId, accountId);
        return DeleteOutcome.DELETED;
    }

    /**
     * Looks up an account in the owner's scope. Never throws, so callers inside a
     * larger transaction can turn a miss into an outcome instead of a rollback.
     */
    @Transactional(readOnly = true)
    public Optional<Account> find(UUID ownerId, UUID accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return jdbcTemplate.query(SELECT_ACCOUNT + "WHERE id = ? AND owner_id = ?",
            accountRowMapper(), accountId, ownerId).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Account require(UUID ownerId, UUID accountId) {
        return find(ownerId, accountId).orElseThrow(() -> UnknownAccountException.of(accountId));
    }

    /**
     * @throws UnknownAccountException if the account is missing, foreign or inactive
     */
    @Transactional(readOnly = true)
    public Account requireActive(UUID ownerId, UUID accountId) {
        Account account = require(ownerId, accountId);
        if (!account.isActive()) {
            throw new UnknownAccountException("Account is inactive: " + accountId);
        }
        return account;
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(UUID ownerId, boolean includeInactive) {
        return jdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE owner_id = ?" + (includeInactive ? "" : " AND is_active") +
            " ORDER BY sort_order, LOWER(name)",
            accountRowMapper(), ownerId);
    }

    @Transactional(readOnly = true)
    public AccountTree tree(UUID ownerId, boolean includeInactive) {
        return AccountTree.build(ownerId, listAccounts(ownerId, includeInactive));
    }

    @Transactional(readOnly = true)
    public AccountHierarchy loadHierarchy(UUID ownerId) {
        return AccountHierarchy.of(listAccounts(ownerId, true));
    }

    /**
     * Folds the ledger for an account.
     *
     * @param asOfPeriodId when set, only transactions in periods starting on or before
     *                     that period's start date count; all history otherwise
     */
    @Transactional(readOnly = true)
    public BigDecimal balance(UUID ownerId, UUID accountId, UUID asOfPeriodId) {
        require(ownerId, accountId);

        BigDecimal balance;
        if (asOfPeriodId == null) {
            balance = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(amount), 0) FROM ledger_transactions WHERE account_id = ?",
                BigDecimal.class, accountId);
        } else {
            List<Date> start = jdbcTemplate.queryForList(
                "SELECT start_date FROM weekly_periods WHERE id = ? AND owner_id = ?",
                Date.class, asOfPeriodId, ownerId);
            if (start.isEmpty()) {
                throw UnknownReferenceException.of("Period", asOfPeriodId);
            }
            balance = jdbcTemplate.queryForObject(
                "SELECT COALESCE(SUM(t.amount), 0) FROM ledger_transactions t " +
                "JOIN weekly_periods p ON p.id = t.period_id " +
                "WHERE t.account_id = ? AND p.start_date <= ?",
                BigDecimal.class, accountId, start.get(0));
        }
        return Money.round(balance != null ? balance : BigDecimal.ZERO);
    }

    /**
     * O(1) read of the cached balance column.
     */
    @Transactional(readOnly = true)
    public BigDecimal cachedBalance(UUID ownerId, UUID accountId) {
        return require(ownerId, accountId).getCurrentBalance();
    }

    /**
     * Folded balance of the account plus all of its descendants.
     */
    @Transactional(readOnly = true)
    public BigDecimal subtreeBalance(UUID ownerId, UUID accountId) {
        require(ownerId, accountId);
        BigDecimal balance = jdbcTemplate.queryForObject(
            SUBTREE_CTE +
            "SELECT COALESCE(SUM(amount), 0) FROM ledger_transactions WHERE account_id IN (SELECT id FROM subtree)",
            BigDecimal.class, accountId, ownerId);
        return Money.round(balance != null ? balance : BigDecimal.ZERO);
    }

    /**
     * Folded balances of every account of the owner, keyed by account id.
     */
    @Transactional(readOnly = true)
    public Map<UUID, BigDecimal> foldedBalances(UUID ownerId) {
        return jdbcTemplate.query(
            "SELECT a.id, COALESCE(SUM(t.amount), 0) AS balance FROM accounts a " +
            "LEFT JOIN ledger_transactions t ON t.account_id = a.id " +
            "WHERE a.owner_id = ? GROUP BY a.id",
            (rs, rowNum) -> Map.entry(rs.getObject("id", UUID.class), Money.round(rs.getBigDecimal("balance"))),
            ownerId
        ).stream().collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    Optional<Account> findRoot(UUID ownerId, AccountCategory category) {
        return jdbcTemplate.query(
            SELECT_ACCOUNT + "WHERE owner_id = ? AND category = ? AND root_account ORDER BY created_at LIMIT 1",
            accountRowMapper(), ownerId, category.name()).stream().findFirst();
    }

    private Optional<Account> findAnyOwner(UUID accountId) {
        return jdbcTemplate.query(SELECT_ACCOUNT + "WHERE id = ?", accountRowMapper(), accountId)
            .stream().findFirst();
    }

    private static String validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidHierarchyException("Account name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new InvalidHierarchyException("Account name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    static RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getObject("id", UUID.class),
            rs.getObject("owner_id", UUID.class),
            rs.getString("name"),
            AccountCategory.valueOf(rs.getString("category")),
            rs.getObject("parent_id", UUID.class),
            rs.getBoolean("root_account"),
            rs.getBigDecimal("target_amount"),
            rs.getBigDecimal("current_balance"),
            rs.getBoolean("is_active"),
            rs.getInt("sort_order"),
            rs.getString("description"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
