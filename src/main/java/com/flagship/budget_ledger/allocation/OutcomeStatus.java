package com.flagship.budget_ledger.allocation;

/**
 * Result of one template within an allocation run.
 */
public enum OutcomeStatus {
    FUNDED,
    PARTIALLY_FUNDED,
    SKIPPED_BELOW_MINIMUM,
    SKIPPED_POOL_EXHAUSTED,
    SKIPPED_ALREADY_PROCESSED,
    SKIPPED_ZERO_AMOUNT,
    FAILED;

    public boolean isFunded() {
        return this == FUNDED || this == PARTIALLY_FUNDED;
    }

    public boolean isSkipped() {
        return switch (this) {
            case SKIPPED_BELOW_MINIMUM, SKIPPED_POOL_EXHAUSTED, SKIPPED_ALREADY_PROCESSED, SKIPPED_ZERO_AMOUNT -> true;
            case FUNDED, PARTIALLY_FUNDED, FAILED -> false;
        };
    }
}
