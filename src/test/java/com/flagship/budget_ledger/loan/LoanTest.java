package com.flagship.budget_ledger.loan;

import com.flagship.budget_ledger.exception.OverpaymentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loan state machine tests. No database.
 */
class LoanTest {

    private static Loan newLoan(String principal, String rate) {
        return Loan.disburse(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(),
            new BigDecimal(principal), new BigDecimal(rate), UUID.randomUUID());
    }

    @Test
    @DisplayName("New loan is ACTIVE with outstanding equal to principal")
    void disburseStartsActive() {
        Loan loan = newLoan("1000.00", "0.02");

        assertEquals(LoanStatus.ACTIVE, loan.getStatus());
        assertEquals(new BigDecimal("1000.00"), loan.getOutstanding());
        assertEquals(0, loan.getTotalInterest().signum());
        assertNull(loan.getPaidAt());
    }

    @Test
    @DisplayName("1000 at 2% accrues 20 and grows to 1020")
    void accrueAddsInterest() {
        Loan loan = newLoan("1000.00", "0.02");

        BigDecimal interest = loan.interestDue();
        Loan accrued = loan.accrue(interest);

        assertEquals(new BigDecimal("20.00"), interest);
        assertEquals(new BigDecimal("1020.00"), accrued.getOutstanding());
        assertEquals(new BigDecimal("20.00"), accrued.getTotalInterest());
    }

    @Test
    @DisplayName("Interest is rounded half-even to cents")
    void interestRoundsHalfEven() {
        // 0.25 * 0.1 = 0.025 -> 0.02
        assertEquals(new BigDecimal("0.02"), newLoan("0.25", "0.1").interestDue());
        // 0.35 * 0.1 = 0.035 -> 0.04
        assertEquals(new BigDecimal("0.04"), newLoan("0.35", "0.1").interestDue());
    }

    @Test
    @DisplayName("Repaying the full outstanding balance moves the loan to PAID")
    void fullRepaymentPaysOff() {
        Loan loan = newLoan("1000.00", "0.02").accrue(new BigDecimal("20.00"));

        Loan partly = loan.repay(new BigDecimal("500.00"));
        assertEquals(LoanStatus.ACTIVE, partly.getStatus());
        assertEquals(new BigDecimal("520.00"), partly.getOutstanding());

        Loan paid = partly.repay(new BigDecimal("520.00"));
        assertEquals(LoanStatus.PAID, paid.getStatus());
        assertEquals(0, paid.getOutstanding().signum());
        assertNotNull(paid.getPaidAt());
    }

    @Test
    @DisplayName("Repaying more than outstanding, or repaying a paid loan, is an overpayment")
    void overpaymentRejected() {
        Loan loan = newLoan("100.00", "0.02");

        assertThrows(OverpaymentException.class, () -> loan.repay(new BigDecimal("100.01")));

        Loan paid = loan.repay(new BigDecimal("100.00"));
        assertThrows(OverpaymentException.class, () -> paid.repay(new BigDecimal("0.01")));
    }

    @Test
    @DisplayName("A paid loan cannot accrue")
    void paidLoanCannotAccrue() {
        Loan paid = newLoan("10.00", "0.02").repay(new BigDecimal("10.00"));

        assertThrows(IllegalStateException.class, () -> paid.accrue(BigDecimal.ONE));
    }

    @Test
    @DisplayName("Zero rate accrues nothing")
    void zeroRate() {
        Loan loan = newLoan("500.00", "0");

        assertEquals(0, loan.interestDue().signum());
        assertEquals(new BigDecimal("500.00"), loan.accrue(loan.interestDue()).getOutstanding());
    }
}
