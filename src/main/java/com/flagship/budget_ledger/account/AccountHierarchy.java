package com.flagship.budget_ledger.account;

import com.flagship.budget_ledger.exception.InvalidHierarchyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory view of one owner's accounts used to validate structural changes.
 *
 * Pure: no database access. The service loads the owner's accounts, asks this class
 * whether a placement is legal, and only then writes. Chain walks stop at the first
 * revisited node, so a tree already corrupted by a cycle cannot loop forever.
 */
public final class AccountHierarchy {

    private final Map<UUID, Account> accounts;

    private AccountHierarchy(Map<UUID, Account> accounts) {
        this.accounts = accounts;
    }

    public static AccountHierarchy of(Collection<Account> accounts) {
        Map<UUID, Account> byId = new LinkedHashMap<>();
        for (Account account : accounts) {
            byId.put(account.getId(), account);
        }
        return new AccountHierarchy(byId);
    }

    public Optional<Account> get(UUID accountId) {
        return Optional.ofNullable(accounts.get(accountId));
    }

    public Collection<Account> all() {
        return accounts.values();
    }

    /**
     * Ancestors of the account, nearest first. Stops at a missing parent or a revisit.
     */
    public List<Account> ancestors(UUID accountId) {
        List<Account> chain = new ArrayList<>();
        Set<UUID> seen = new HashSet<>();
        seen.add(accountId);
        Account current = accounts.get(accountId);
        while (current != null && current.getParentId() != null && seen.add(current.getParentId())) {
            current = accounts.get(current.getParentId());
            if (current != null) {
                chain.add(current);
            }
        }
        return chain;
    }

    /**
     * Walks the chain from {@code proposedParentId} towards the root and reports whether
     * {@code accountId} appears on it.
     */
    public boolean wouldCreateCycle(UUID accountId, UUID proposedParentId) {
        if (proposedParentId == null) {
            return false;
        }
        Set<UUID> seen = new HashSet<>();
        UUID cursor = proposedParentId;
        while (cursor != null && seen.add(cursor)) {
            if (cursor.equals(accountId)) {
                return true;
            }
            Account node = accounts.get(cursor);
            cursor = node != null ? node.getParentId() : null;
        }
        return false;
    }

    /**
     * Category of the topmost reachable ancestor (the account itself when top-level).
     */
    public AccountCategory rootCategory(Account account) {
        List<Account> chain = ancestors(account.getId());
        return chain.isEmpty() ? account.getCategory() : chain.get(chain.size() - 1).getCategory();
    }

    public List<Account> children(UUID parentId) {
        List<Account> result = new ArrayList<>();
        for (Account account : accounts.values()) {
            if (parentId == null ? account.getParentId() == null : parentId.equals(account.getParentId())) {
                result.add(account);
            }
        }
        return result;
    }

    /**
     * The account followed by all of its descendants, breadth first.
     */
    public List<Account> subtree(UUID accountId) {
        List<Account> result = new ArrayList<>();
        Account root = accounts.get(accountId);
        if (root == null) {
            return result;
        }
        Set<UUID> seen = new HashSet<>();
        Deque<Account> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            Account next = queue.poll();
            if (!seen.add(next.getId())) {
                continue;
            }
            result.add(next);
            queue.addAll(children(next.getId()));
        }
        return result;
    }

    /**
     * Validates placing an account named {@code name} with {@code category} under
     * {@code parent} (top level when null).
     *
     * @param ownerId   owner performing the change
     * @param accountId the account being moved or renamed, null for a new account
     * @param parent    proposed parent as loaded from storage, possibly owned by someone else
     * @throws InvalidHierarchyException if the placement breaks the tree
     */
    public void validatePlacement(UUID ownerId, UUID accountId, String name,
                                  AccountCategory category, Account parent) {
        if (parent != null) {
            if (!ownerId.equals(parent.getOwnerId())) {
                throw new InvalidHierarchyException("Parent account " + parent.getId() + " belongs to another owner");
            }
            if (!parent.isActive()) {
                throw new InvalidHierarchyException("Parent account '" + parent.getName() + "' is inactive");
            }
            AccountCategory rootCategory = rootCategory(parent);
            if (category != rootCategory) {
                throw new InvalidHierarchyException(String.format(
                    "Account category %s does not match parent category %s", category, rootCategory));
            }
            if (accountId != null && wouldCreateCycle(accountId, parent.getId())) {
                throw new InvalidHierarchyException(
                    "Moving account " + accountId + " under " + parent.getId() + " would create a cycle");
            }
        }

        UUID parentId = parent != null ? parent.getId() : null;
        for (Account sibling : children(parentId)) {
            if (!sibling.getId().equals(accountId) && sibling.getName().equalsIgnoreCase(name)) {
                throw new InvalidHierarchyException("An account named '" + name + "' already exists at this level");
            }
        }
    }
}
