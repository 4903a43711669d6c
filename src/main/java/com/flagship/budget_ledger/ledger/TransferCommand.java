package com.flagship.budget_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Moves a positive amount from source to destination. Kind defaults to TRANSFER.
 */
@Value
@Builder
public class TransferCommand {
    UUID sourceAccountId;
    UUID destinationAccountId;
    UUID periodId;
    BigDecimal amount;
    TransactionKind kind;
    String description;
}
