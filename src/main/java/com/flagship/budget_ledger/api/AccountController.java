package com.flagship.budget_ledger.api;

import com.flagship.budget_ledger.account.Account;
import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.account.DeleteOutcome;
import com.flagship.budget_ledger.api.dto.AccountResponse;
import com.flagship.budget_ledger.api.dto.AccountTreeResponse;
import com.flagship.budget_ledger.api.dto.BalanceResponse;
import com.flagship.budget_ledger.api.dto.CreateAccountRequest;
import com.flagship.budget_ledger.api.dto.DeleteAccountResponse;
import com.flagship.budget_ledger.api.dto.LoanResponse;
import com.flagship.budget_ledger.api.dto.RenameRequest;
import com.flagship.budget_ledger.api.dto.ReparentRequest;
import com.flagship.budget_ledger.api.dto.TransactionResponse;
import com.flagship.budget_ledger.ledger.LedgerService;
import com.flagship.budget_ledger.ledger.LedgerTransaction;
import com.flagship.budget_ledger.loan.LoanService;
import com.flagship.budget_ledger.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Chart of accounts: creation, hierarchy changes, balances and history.
 */
@RestController
@RequestMapping("/api/owners/{ownerId}/accounts")
@RequiredArgsConstructor
@Slf4j
public class AccountController {

    private static final int MAX_HISTORY_LIMIT = 1000;

    private final AccountService accountService;
    private final LedgerService ledgerService;
    private final LoanService loanService;

    @PostMapping
    public ResponseEntity<AccountResponse> createAccount(@PathVariable("ownerId") UUID ownerId,
                                                         @Valid @RequestBody CreateAccountRequest request) {
        CorrelationContext.bindOwner(ownerId);
        Account account = accountService.createAccount(ownerId, request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(account));
    }

    /**
     * Creates the missing default roots. Safe to call repeatedly.
     */
    @PostMapping("/defaults")
    public ResponseEntity<List<AccountResponse>> setupDefaultAccounts(@PathVariable("ownerId") UUID ownerId) {
        CorrelationContext.bindOwner(ownerId);
        List<Account> roots = accountService.setupDefaultAccounts(ownerId);
        return ResponseEntity.ok(roots.stream().map(AccountResponse::from).toList());
    }

    @GetMapping
    public ResponseEntity<List<AccountResponse>> listAccounts(
            @PathVariable("ownerId") UUID ownerId,
            @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(accountService.listAccounts(ownerId, includeInactive).stream()
            .map(AccountResponse::from)
            .toList());
    }

    @GetMapping("/tree")
    public ResponseEntity<AccountTreeResponse> getTree(
            @PathVariable("ownerId") UUID ownerId,
            @RequestParam(name = "include_inactive", defaultValue = "false") boolean includeInactive) {
        return ResponseEntity.ok(AccountTreeResponse.from(accountService.tree(ownerId, includeInactive)));
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountResponse> getAccount(@PathVariable("ownerId") UUID ownerId,
                                                      @PathVariable("accountId") UUID accountId) {
        return ResponseEntity.ok(AccountResponse.from(accountService.require(ownerId, accountId)));
    }

    @PutMapping("/{accountId}/parent")
    public ResponseEntity<AccountResponse> reparent(@PathVariable("ownerId") UUID ownerId,
                                                    @PathVariable("accountId") UUID accountId,
                                                    @RequestBody ReparentRequest request) {
        bind(ownerId, accountId);
        return ResponseEntity.ok(AccountResponse.from(accountService.reparent(ownerId, accountId, request.getParentId())));
    }

    @PutMapping("/{accountId}/name")
    public ResponseEntity<AccountResponse> rename(@PathVariable("ownerId") UUID ownerId,
                                                  @PathVariable("accountId") UUID accountId,
                                                  @Valid @RequestBody RenameRequest request) {
        bind(ownerId, accountId);
        return ResponseEntity.ok(AccountResponse.from(accountService.rename(ownerId, accountId, request.getName())));
    }

    /**
     * Deactivates the account and its whole subtree.
     */
    @PostMapping("/{accountId}/deactivation")
    public ResponseEntity<AccountResponse> deactivate(@PathVariable("ownerId") UUID ownerId,
                                                      @PathVariable("accountId") UUID accountId) {
        bind(ownerId, accountId);
        accountService.deactivate(ownerId, accountId);
        return ResponseEntity.ok(AccountResponse.from(accountService.require(ownerId, accountId)));
    }

    @PostMapping("/{accountId}/activation")
    public ResponseEntity<AccountResponse> activate(@PathVariable("ownerId") UUID ownerId,
                                                    @PathVariable("accountId") UUID accountId) {
        bind(ownerId, accountId);
        return ResponseEntity.ok(AccountResponse.from(accountService.activate(ownerId, accountId)));
    }

    @DeleteMapping("/{accountId}")
    public ResponseEntity<DeleteAccountResponse> deleteAccount(@PathVariable("ownerId") UUID ownerId,
                                                               @PathVariable("accountId") UUID accountId) {
        bind(ownerId, accountId);
        DeleteOutcome outcome = accountService.deleteAccount(ownerId, accountId);
        return ResponseEntity.ok(new DeleteAccountResponse(accountId, outcome));
    }

    @GetMapping("/{accountId}/balance")
    public ResponseEntity<BalanceResponse> getBalance(
            @PathVariable("ownerId") UUID ownerId,
            @PathVariable("accountId") UUID accountId,
            @RequestParam(name = "as_of_period_id", required = false) UUID asOfPeriodId) {
        BalanceResponse response = BalanceResponse.builder()
            .accountId(accountId)
            .asOfPeriodId(asOfPeriodId)
            .balance(accountService.balance(ownerId, accountId, asOfPeriodId))
            .cachedBalance(accountService.cachedBalance(ownerId, accountId))
            .subtreeBalance(accountService.subtreeBalance(ownerId, accountId))
            .build();
        return ResponseEntity.ok(response);
    }

    /**
     * Newest first. The limit caps how far the lazy history is read.
     */
    @GetMapping("/{accountId}/history")
    public ResponseEntity<List<TransactionResponse>> getHistory(
            @PathVariable("ownerId") UUID ownerId,
            @PathVariable("accountId") UUID accountId,
            @RequestParam(name = "from_period_id", required = false) UUID fromPeriodId,
            @RequestParam(name = "to_period_id", required = false) UUID toPeriodId,
            @RequestParam(name = "limit", defaultValue = "100") int limit) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new IllegalArgumentException("Limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        List<TransactionResponse> page = new ArrayList<>();
        for (LedgerTransaction transaction : ledgerService.history(ownerId, accountId, fromPeriodId, toPeriodId)) {
            page.add(TransactionResponse.from(transaction));
            if (page.size() == limit) {
                break;
            }
        }
        return ResponseEntity.ok(page);
    }

    @GetMapping("/{accountId}/loans")
    public ResponseEntity<List<LoanResponse>> getLoans(@PathVariable("ownerId") UUID ownerId,
                                                       @PathVariable("accountId") UUID accountId) {
        return ResponseEntity.ok(loanService.loansForAccount(ownerId, accountId).stream()
            .map(LoanResponse::from)
            .toList());
    }

    private static void bind(UUID ownerId, UUID accountId) {
        CorrelationContext.bindOwner(ownerId);
        CorrelationContext.bindAccount(accountId);
    }
}
