package com.flagship.budget_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.budget_ledger.ledger.Transfer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class TransferResponse {

    @JsonProperty("transfer_id")
    UUID transferId;

    @JsonProperty("source_account_id")
    UUID sourceAccountId;

    @JsonProperty("destination_account_id")
    UUID destinationAccountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("debit")
    TransactionResponse debit;

    @JsonProperty("credit")
    TransactionResponse credit;

    public static TransferResponse from(Transfer transfer) {
        return TransferResponse.builder()
            .transferId(transfer.getTransferId())
            .sourceAccountId(transfer.getSourceAccountId())
            .destinationAccountId(transfer.getDestinationAccountId())
            .amount(transfer.getAmount())
            .debit(TransactionResponse.from(transfer.getDebit()))
            .credit(TransactionResponse.from(transfer.getCredit()))
            .build();
    }
}
