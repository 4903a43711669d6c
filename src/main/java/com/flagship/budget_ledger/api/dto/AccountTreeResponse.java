package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.account.AccountTree;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class AccountTreeResponse {

    @JsonProperty("owner_id")
    UUID ownerId;

    @JsonProperty("roots")
    List<NodeResponse> roots;

    @Value
    public static class NodeResponse {

        @JsonProperty("account")
        AccountResponse account;

        @JsonProperty("path")
        String path;

        @JsonProperty("depth")
        int depth;

        @JsonProperty("children")
        List<NodeResponse> children;

        static NodeResponse from(AccountTree.Node node) {
            return new NodeResponse(
                AccountResponse.from(node.getAccount()),
                node.getPath(),
                node.getDepth(),
                node.getChildren().stream().map(NodeResponse::from).toList());
        }
    }

    public static AccountTreeResponse from(AccountTree tree) {
        return new AccountTreeResponse(tree.getOwnerId(),
            tree.getRoots().stream().map(NodeResponse::from).toList());
    }
}
