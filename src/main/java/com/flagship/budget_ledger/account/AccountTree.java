package com.flagship.budget_ledger.account;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read model of an owner's chart of accounts.
 *
 * Siblings are ordered by sortOrder, then name. Accounts whose parent is not part of
 * the snapshot (filtered out as inactive, or orphaned) are not reachable from the roots.
 */
@Value
public class AccountTree {
    UUID ownerId;
    List<Node> roots;

    @Value
    public static class Node {
        Account account;
        String path;
        int depth;
        List<Node> children;
    }

    static final Comparator<Account> SIBLING_ORDER = Comparator
        .comparingInt(Account::getSortOrder)
        .thenComparing(Account::getName, String.CASE_INSENSITIVE_ORDER);

    static final String PATH_SEPARATOR = " > ";

    public static AccountTree build(UUID ownerId, Collection<Account> accounts) {
        Map<UUID, List<Account>> byParent = new HashMap<>();
        List<Account> topLevel = new ArrayList<>();
        for (Account account : accounts) {
            if (account.getParentId() == null) {
                topLevel.add(account);
            } else {
                byParent.computeIfAbsent(account.getParentId(), key -> new ArrayList<>()).add(account);
            }
        }
        topLevel.sort(SIBLING_ORDER);

        List<Node> roots = new ArrayList<>();
        for (Account root : topLevel) {
            roots.add(buildNode(root, root.getName(), 0, byParent));
        }
        return new AccountTree(ownerId, List.copyOf(roots));
    }

    private static Node buildNode(Account account, String path, int depth, Map<UUID, List<Account>> byParent) {
        List<Account> children = new ArrayList<>(byParent.getOrDefault(account.getId(), List.of()));
        children.sort(SIBLING_ORDER);

        List<Node> childNodes = new ArrayList<>();
        for (Account child : children) {
            childNodes.add(buildNode(child, path + PATH_SEPARATOR + child.getName(), depth + 1, byParent));
        }
        return new Node(account, path, depth, List.copyOf(childNodes));
    }

    /**
     * Depth-first listing of every reachable node.
     */
    public List<Node> flatten() {
        List<Node> result = new ArrayList<>();
        for (Node root : roots) {
            collect(root, result);
        }
        return result;
    }

    public Optional<Node> find(UUID accountId) {
        return flatten().stream()
            .filter(node -> node.getAccount().getId().equals(accountId))
            .findFirst();
    }

    private static void collect(Node node, List<Node> into) {
        into.add(node);
        for (Node child : node.getChildren()) {
            collect(child, into);
        }
    }
}
