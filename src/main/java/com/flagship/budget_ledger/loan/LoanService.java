package com.flagship.budget_ledger.loan;

import com.flagship.budget_ledger.account.AccountService;
import com.flagship.budget_ledger.common.Money;
import com.flagship.budget_ledger.common.OwnerLock;
import com.flagship.budget_ledger.config.LedgerProperties;
import com.flagship.budget_ledger.config.LedgerProperties.InterestBookkeeping;
import com.flagship.budget_ledger.event.LoanDisbursedEvent;
import com.flagship.budget_ledger.event.LoanInterestAccruedEvent;
import com.flagship.budget_ledger.event.LoanPaidOffEvent;
import com.flagship.budget_ledger.exception.InvalidAmountException;
import com.flagship.budget_ledger.exception.OverpaymentException;
import com.flagship.budget_ledger.exception.SameAccountException;
import com.flagship.budget_ledger.exception.UnknownReferenceException;
import com.flagship.budget_ledger.ledger.LedgerService;
import com.flagship.budget_ledger.ledger.LedgerTransaction;
import com.flagship.budget_ledger.ledger.PostTransactionCommand;
import com.flagship.budget_ledger.ledger.TransactionKind;
import com.flagship.budget_ledger.ledger.Transfer;
import com.flagship.budget_ledger.ledger.TransferCommand;
import com.flagship.budget_ledger.observability.LedgerMetrics;
import com.flagship.budget_ledger.outbox.OutboxService;
import com.flagship.budget_ledger.period.PeriodService;
import com.flagship.budget_ledger.period.WeeklyPeriod;
import com.flagship.budget_ledger.settings.OwnerSettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Loans between accounts of one owner.
 *
 * Every money movement goes through the ledger: disbursement and repayment are
 * transfers, accrued interest is optionally a single credit on the lender. The loan row
 * and its ledger entries are written in the same transaction under the owner lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LoanService {

    private final LoanRepository loanRepository;
    private final LoanAccrualRepository accrualRepository;
    private final LoanRepaymentRepository repaymentRepository;
    private final LedgerService ledgerService;
    private final AccountService accountService;
    private final PeriodService periodService;
    private final OwnerSettingsService settingsService;
    private final OwnerLock ownerLock;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final LedgerProperties properties;

    /**
     * Moves the principal from lender to borrower and opens the loan.
     *
     * @throws InvalidAmountException if the principal is not positive or the rate is outside [0, 1]
     * @throws SameAccountException if lender and borrower are the same account
     * @throws com.flagship.budget_ledger.exception.UnknownAccountException if either account is missing, foreign or inactive
     */
    @Transactional
    public Loan disburse(UUID ownerId, DisburseLoanCommand command) {
        BigDecimal principal = Money.positive(command.getPrincipal(), "Loan principal");
        if (command.getLenderAccountId() != null && command.getLenderAccountId().equals(command.getBorrowerAccountId())) {
            throw new SameAccountException("Lender and borrower must be different accounts");
        }
        BigDecimal rate = command.getInterestRate() != null
            ? command.getInterestRate()
            : settingsService.settingsFor(ownerId).getDefaultInterestRate();
        OwnerSettingsService.validateRate(rate);

        ownerLock.acquire(ownerId);
        accountService.requireActive(ownerId, command.getLenderAccountId());
        accountService.requireActive(ownerId, command.getBorrowerAccountId());

        UUID loanId = UUID.randomUUID();
        Transfer transfer = ledgerService.postTransfer(ownerId, TransferCommand.builder()
            .sourceAccountId(command.getLenderAccountId())
            .destinationAccountId(command.getBorrowerAccountId())
            .periodId(command.getPeriodId())
            .amount(principal)
            .kind(TransactionKind.LOAN_DISBURSEMENT)
            .description(command.getDescription() != null ? command.getDescription() : "Loan disbursement " + loanId)
            .build());

        Loan loan = Loan.disburse(loanId, ownerId, command.getLenderAccountId(), command.getBorrowerAccountId(),
            principal, rate, transfer.getTransferId());
        loanRepository.saveAndFlush(LoanEntity.fromDomain(loan));

        outboxService.append(LoanDisbursedEvent.from(loan));
        metrics.recordLoanEvent("disbursed");

        log.info("Loan disbursed: ownerId={}, loanId={}, lender={}, borrower={}, principal={}, rate={}",
            ownerId, loanId, loan.getLenderAccountId(), loan.getBorrowerAccountId(), principal, rate);
        return loan;
    }

    /**
     * Charges one period's interest.
     *
     * @return the accrual, or empty when the loan is PAID or the period was already accrued
     */
    @Transactional
    public Optional<LoanAccrual> accrue(UUID ownerId, UUID loanId, UUID periodId) {
        ownerLock.acquire(ownerId);
        LoanEntity entity = requireEntity(ownerId, loanId);
        WeeklyPeriod period = periodService.getPeriod(ownerId, periodId);
        return accrue(entity, period);
    }

    /**
     * Accrues interest on every active loan of the owner for the period. Loans already
     * accrued for it are left alone.
     */
    @Transactional
    public List<LoanAccrual> accrueAll(UUID ownerId, UUID periodId) {
        ownerLock.acquire(ownerId);
        WeeklyPeriod period = periodService.getPeriod(ownerId, periodId);

        List<LoanAccrual> accruals = new ArrayList<>();
        for (LoanEntity entity : loanRepository.findByOwnerIdAndStatusOrderByCreatedAtAsc(ownerId, LoanStatus.ACTIVE)) {
            accrue(entity, period).ifPresent(accruals::add);
        }
        log.info("Interest accrued for period: ownerId={}, periodId={}, loans={}", ownerId, periodId, accruals.size());
        return accruals;
    }

    /**
     * Moves money from borrower back to lender and reduces the outstanding balance.
     *
     * @throws InvalidAmountException if the amount is not positive
     * @throws OverpaymentException if the loan is PAID or the amount exceeds the outstanding balance
     */
    @Transactional
    public LoanRepayment repay(UUID ownerId, RepayLoanCommand command) {
        BigDecimal amount = Money.positive(command.getAmount(), "Repayment amount");

        ownerLock.acquire(ownerId);
        LoanEntity entity = requireEntity(ownerId, command.getLoanId());
        Loan loan = entity.toDomain();
        Loan repaid = loan.repay(amount);
        WeeklyPeriod period = periodService.getPeriod(ownerId, command.getPeriodId());

        Transfer transfer = ledgerService.postTransfer(ownerId, TransferCommand.builder()
            .sourceAccountId(loan.getBorrowerAccountId())
            .destinationAccountId(loan.getLenderAccountId())
            .periodId(period.getId())
            .amount(amount)
            .kind(TransactionKind.LOAN_REPAYMENT)
            .description("Loan repayment " + loan.getId())
            .build());

        entity.updateFromDomain(repaid);
        LoanRepayment repayment = repaymentRepository.save(LoanRepaymentEntity.fromDomain(new LoanRepayment(
            UUID.randomUUID(), loan.getId(), period.getId(), amount, repaid.getOutstanding(),
            transfer.getTransferId(), Instant.now()))).toDomain();

        metrics.recordLoanEvent("repaid");
        if (repaid.isPaid()) {
            outboxService.append(LoanPaidOffEvent.from(repaid));
            metrics.recordLoanEvent("paid_off");
        }

        log.info("Loan repayment: ownerId={}, loanId={}, amount={}, outstanding={}, status={}",
            ownerId, loan.getId(), amount, repaid.getOutstanding(), repaid.getStatus());
        return repayment;
    }

    @Transactional(readOnly = true)
    public Loan getLoan(UUID ownerId, UUID loanId) {
        return requireEntity(ownerId, loanId).toDomain();
    }

    /**
     * @param status optional filter; all loans when null
     */
    @Transactional(readOnly = true)
    public List<Loan> listLoans(UUID ownerId, LoanStatus status) {
        List<LoanEntity> entities = status == null
            ? loanRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId)
            : loanRepository.findByOwnerIdAndStatusOrderByCreatedAtAsc(ownerId, status);
        return entities.stream().map(LoanEntity::toDomain).toList();
    }

    /**
     * Loans where the account is lender or borrower.
     */
    @Transactional(readOnly = true)
    public List<Loan> loansForAccount(UUID ownerId, UUID accountId) {
        accountService.require(ownerId, accountId);
        return loanRepository.findByOwnerIdAndAccount(ownerId, accountId).stream()
            .map(LoanEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<LoanRepayment> repayments(UUID ownerId, UUID loanId) {
        requireEntity(ownerId, loanId);
        return repaymentRepository.findByLoanIdOrderByCreatedAtAsc(loanId).stream()
            .map(LoanRepaymentEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public LoanRepayment getRepayment(UUID ownerId, UUID repaymentId) {
        LoanRepayment repayment = repaymentRepository.findById(repaymentId)
            .map(LoanRepaymentEntity::toDomain)
            .orElseThrow(() -> UnknownReferenceException.of("Loan repayment", repaymentId));
        requireEntity(ownerId, repayment.getLoanId());
        return repayment;
    }

    @Transactional(readOnly = true)
    public List<LoanAccrual> accruals(UUID ownerId, UUID loanId) {
        requireEntity(ownerId, loanId);
        return accrualRepository.findByLoanIdOrderByCreatedAtAsc(loanId).stream()
            .map(LoanAccrualEntity::toDomain)
            .toList();
    }

    private Optional<LoanAccrual> accrue(LoanEntity entity, WeeklyPeriod period) {
        Loan loan = entity.toDomain();
        if (loan.isPaid()) {
            log.debug("Skipping accrual on paid loan: loanId={}, periodId={}", loan.getId(), period.getId());
            return Optional.empty();
        }
        if (accrualRepository.existsByLoanIdAndPeriodId(loan.getId(), period.getId())) {
            log.debug("Period already accrued: loanId={}, periodId={}", loan.getId(), period.getId());
            return Optional.empty();
        }

        BigDecimal interest = loan.interestDue();
        Loan accrued = loan.accrue(interest);

        UUID transactionId = null;
        if (interest.signum() > 0 && properties.getLoans().getInterestBookkeeping() == InterestBookkeeping.CREDIT_LENDER) {
            LedgerTransaction credit = ledgerService.post(loan.getOwnerId(), PostTransactionCommand.builder()
                .accountId(loan.getLenderAccountId())
                .periodId(period.getId())
                .amount(interest)
                .kind(TransactionKind.INTEREST_ACCRUAL)
                .description("Interest on loan " + loan.getId())
                .build());
            transactionId = credit.getId();
        }

        entity.updateFromDomain(accrued);
        LoanAccrual accrual = accrualRepository.save(LoanAccrualEntity.fromDomain(new LoanAccrual(
            UUID.randomUUID(), loan.getId(), period.getId(), interest, transactionId, Instant.now()))).toDomain();

        outboxService.append(LoanInterestAccruedEvent.from(accrued, accrual));
        metrics.recordLoanEvent("interest_accrued");

        log.info("Loan interest accrued: ownerId={}, loanId={}, periodId={}, interest={}, outstanding={}",
            loan.getOwnerId(), loan.getId(), period.getId(), interest, accrued.getOutstanding());
        return Optional.of(accrual);
    }

    private LoanEntity requireEntity(UUID ownerId, UUID loanId) {
        return loanRepository.findByIdAndOwnerId(loanId, ownerId)
            .orElseThrow(() -> UnknownReferenceException.of("Loan", loanId));
    }
}
