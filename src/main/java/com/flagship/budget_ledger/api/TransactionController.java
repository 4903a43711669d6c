package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.api.dto.PostTransactionRequest;
import com.flagship.budget_ledger.api.dto.ReversalRequest;
import com.flagship.budget_ledger.api.dto.TransactionResponse;
import com.flagship.budget_ledger.api.dto.TransferRequest;
import com.flagship.budget_ledger.api.dto.TransferResponse;
import com.flagship.budget_ledger.exception.UnknownReferenceException;
import com.flagship.budget_ledger.ledger.LedgerService;
import com.flagship.budget_ledger.ledger.LedgerTransaction;
import com.flagship.budget_ledger.ledger.Transfer;
import com.flagship.budget_ledger.observability.CorrelationContext;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Ledger writes: single transactions, transfers and reversals.
 *
 * Posting endpoints require an Idempotency-Key header. A repeated key returns the
 * original result with 200 instead of posting again; the key row is committed in the
 * same transaction as the ledger rows.
 */
@RestController
@RequestMapping("/api/owners/{ownerId}")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String TRANSACTION_RESOURCE = "TRANSACTION";
    static final String TRANSFER_RESOURCE = "TRANSFER";

    private final LedgerService ledgerService;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    @PostMapping("/transactions")
    @Transactional
    public ResponseEntity<TransactionResponse> postTransaction(
            @PathVariable("ownerId") UUID ownerId,
            @Valid @RequestBody PostTransactionRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        long startTime = System.currentTimeMillis();
        CorrelationContext.bindOwner(ownerId);
        CorrelationContext.bindAccount(request.getAccountId());
        log.info("Received transaction request: idempotencyKey={}, amount={}, kind={}",
            idempotencyKey, request.getAmount(), request.getKind());

        IdempotentResult<LedgerTransaction> result = idempotencyService.executeOnce(
            ownerId, TRANSACTION_RESOURCE, idempotencyKey,
            () -> ledgerService.post(ownerId, request.toCommand()),
            LedgerTransaction::getId,
            id -> ledgerService.getTransaction(ownerId, id));

        metrics.recordCommandLatency("post_transaction", System.currentTimeMillis() - startTime);
        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(TransactionResponse.from(result.getValue()));
    }

    @PostMapping("/transfers")
    @Transactional
    public ResponseEntity<TransferResponse> postTransfer(
            @PathVariable("ownerId") UUID ownerId,
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        long startTime = System.currentTimeMillis();
        CorrelationContext.bindOwner(ownerId);
        CorrelationContext.bindAccount(request.getSourceAccountId());
        log.info("Received transfer request: idempotencyKey={}, amount={}, to={}",
            idempotencyKey, request.getAmount(), request.getDestinationAccountId());

        IdempotentResult<Transfer> result = idempotencyService.executeOnce(
            ownerId, TRANSFER_RESOURCE, idempotencyKey,
            () -> ledgerService.postTransfer(ownerId, request.toCommand()),
            Transfer::getTransferId,
            id -> ledgerService.findTransfer(ownerId, id)
                .orElseThrow(() -> UnknownReferenceException.of("Transfer", id)));

        metrics.recordCommandLatency("post_transfer", System.currentTimeMillis() - startTime);
        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(TransferResponse.from(result.getValue()));
    }

    /**
     * Reverses a transaction; for a transfer leg both legs are reversed. A second
     * reversal of the same transaction is rejected with 409.
     */
    @PostMapping("/transactions/{transactionId}/reversal")
    public ResponseEntity<List<TransactionResponse>> reverse(
            @PathVariable("ownerId") UUID ownerId,
            @PathVariable("transactionId") UUID transactionId,
            @RequestBody(required = false) ReversalRequest request) {

        CorrelationContext.bindOwner(ownerId);
        List<LedgerTransaction> reversals = ledgerService.reverse(ownerId, transactionId,
            request != null ? request.getDescription() : null);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(reversals.stream().map(TransactionResponse::from).toList());
    }

    @GetMapping("/transactions/{transactionId}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("ownerId") UUID ownerId,
                                                              @PathVariable("transactionId") UUID transactionId) {
        return ResponseEntity.ok(TransactionResponse.from(ledgerService.getTransaction(ownerId, transactionId)));
    }

    @GetMapping("/transfers/{transferId}")
    public ResponseEntity<TransferResponse> getTransfer(@PathVariable("ownerId") UUID ownerId,
                                                        @PathVariable("transferId") UUID transferId) {
        return ledgerService.findTransfer(ownerId, transferId)
            .map(transfer -> ResponseEntity.ok(TransferResponse.from(transfer)))
            .orElseThrow(() -> UnknownReferenceException.of("Transfer", transferId));
    }
}
