package com.flagship.budget_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.Duration;

/**
 * Engine settings bound from the {@code ledger.*} namespace.
 */
@ConfigurationProperties(prefix = "ledger")
@Getter
@Setter
public class LedgerProperties {

    private Loans loans = new Loans();
    private Periods periods = new Periods();
    private History history = new History();
    private Idempotency idempotency = new Idempotency();

    /**
     * How accrued loan interest is reflected in the ledger.
     */
    public enum InterestBookkeeping {
        /** Credit the lender account with the interest; no cash account is debited. */
        CREDIT_LENDER,
        /** Only the loan's outstanding balance grows. */
        OUTSTANDING_ONLY
    }

    @Getter
    @Setter
    public static class Loans {
        private InterestBookkeeping interestBookkeeping = InterestBookkeeping.CREDIT_LENDER;
    }

    @Getter
    @Setter
    public static class Periods {
        /** Used when an owner has no settings row of their own. */
        private DayOfWeek defaultWeekStart = DayOfWeek.MONDAY;
    }

    @Getter
    @Setter
    public static class History {
        private int pageSize = 100;
    }

    @Getter
    @Setter
    public static class Idempotency {
        private Duration ttl = Duration.ofDays(7);
    }
}
