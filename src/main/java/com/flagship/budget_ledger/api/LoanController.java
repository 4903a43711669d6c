package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.api.dto.AccrueInterestRequest;
import com.flagship.budget_ledger.api.dto.DisburseLoanRequest;
import com.flagship.budget_ledger.api.dto.LoanAccrualResponse;
import com.flagship.budget_ledger.api.dto.LoanResponse;
import com.flagship.budget_ledger.api.dto.RepayLoanRequest;
import com.flagship.budget_ledger.api.dto.RepaymentResponse;
import com.flagship.budget_ledger.loan.LoanAccrual;
import com.flagship.budget_ledger.loan.LoanRepayment;
import com.flagship.budget_ledger.loan.LoanService;
import com.flagship.budget_ledger.loan.LoanStatus;
import com.flagship.budget_ledger.loan.RepayLoanCommand;
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
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/owners/{ownerId}/loans")
@RequiredArgsConstructor
@Slf4j
public class LoanController {

    static final String REPAYMENT_RESOURCE = "LOAN_REPAYMENT";

    private final LoanService loanService;
    private final IdempotencyService idempotencyService;
    private final LedgerMetrics metrics;

    @PostMapping
    public ResponseEntity<LoanResponse> disburse(@PathVariable("ownerId") UUID ownerId,
                                                 @Valid @RequestBody DisburseLoanRequest request) {
        CorrelationContext.bindOwner(ownerId);
        CorrelationContext.bindAccount(request.getLenderAccountId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(LoanResponse.from(loanService.disburse(ownerId, request.toCommand())));
    }

    @GetMapping
    public ResponseEntity<List<LoanResponse>> listLoans(@PathVariable("ownerId") UUID ownerId,
                                                        @RequestParam(name = "status", required = false) LoanStatus status) {
        return ResponseEntity.ok(loanService.listLoans(ownerId, status).stream()
            .map(LoanResponse::from)
            .toList());
    }

    @GetMapping("/{loanId}")
    public ResponseEntity<LoanResponse> getLoan(@PathVariable("ownerId") UUID ownerId,
                                                @PathVariable("loanId") UUID loanId) {
        return ResponseEntity.ok(LoanResponse.from(loanService.getLoan(ownerId, loanId)));
    }

    /**
     * Requires an Idempotency-Key header; a repeated key returns the first repayment.
     */
    @PostMapping("/{loanId}/repayments")
    @Transactional
    public ResponseEntity<RepaymentResponse> repay(@PathVariable("ownerId") UUID ownerId,
                                                   @PathVariable("loanId") UUID loanId,
                                                   @Valid @RequestBody RepayLoanRequest request,
                                                   @RequestHeader(TransactionController.IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.bindOwner(ownerId);
        log.info("Received loan repayment request: idempotencyKey={}, loanId={}, amount={}",
            idempotencyKey, loanId, request.getAmount());

        RepayLoanCommand command = RepayLoanCommand.builder()
            .loanId(loanId)
            .amount(request.getAmount())
            .periodId(request.getPeriodId())
            .build();

        IdempotentResult<LoanRepayment> result = idempotencyService.executeOnce(
            ownerId, REPAYMENT_RESOURCE, idempotencyKey,
            () -> loanService.repay(ownerId, command),
            LoanRepayment::getId,
            id -> loanService.getRepayment(ownerId, id));

        metrics.recordCommandLatency("repay_loan", System.currentTimeMillis() - startTime);
        return ResponseEntity.status(result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED)
            .body(RepaymentResponse.from(result.getValue()));
    }

    @GetMapping("/{loanId}/repayments")
    public ResponseEntity<List<RepaymentResponse>> listRepayments(@PathVariable("ownerId") UUID ownerId,
                                                                  @PathVariable("loanId") UUID loanId) {
        return ResponseEntity.ok(loanService.repayments(ownerId, loanId).stream()
            .map(RepaymentResponse::from)
            .toList());
    }

    @GetMapping("/{loanId}/accruals")
    public ResponseEntity<List<LoanAccrualResponse>> listAccruals(@PathVariable("ownerId") UUID ownerId,
                                                                  @PathVariable("loanId") UUID loanId) {
        return ResponseEntity.ok(loanService.accruals(ownerId, loanId).stream()
            .map(LoanAccrualResponse::from)
            .toList());
    }

    /**
     * Accrues one loan, or every active loan when no loan id is given. Loans already
     * accrued for the period, and paid loans, produce no entry.
     */
    @PostMapping("/accruals")
    public ResponseEntity<List<LoanAccrualResponse>> accrue(@PathVariable("ownerId") UUID ownerId,
                                                            @Valid @RequestBody AccrueInterestRequest request) {
        CorrelationContext.bindOwner(ownerId);
        List<LoanAccrual> accruals = request.getLoanId() != null
            ? loanService.accrue(ownerId, request.getLoanId(), request.getPeriodId()).stream().toList()
            : loanService.accrueAll(ownerId, request.getPeriodId());
        return ResponseEntity.ok(accruals.stream().map(LoanAccrualResponse::from).toList());
    }
}
