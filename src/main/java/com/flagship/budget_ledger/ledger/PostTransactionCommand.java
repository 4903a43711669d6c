package com.flagship.budget_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class PostTransactionCommand {
    UUID accountId;
    UUID periodId;
    BigDecimal amount;
    TransactionKind kind;
    String description;
}
