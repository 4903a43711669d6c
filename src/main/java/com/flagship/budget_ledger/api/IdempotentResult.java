package com.flagship.budget_ledger.api;

import lombok.Value;

/**
 * Result of an idempotent command and whether it came from an earlier request.
 */
@Value
public class IdempotentResult<T> {
    T value;
    boolean replayed;

    static <T> IdempotentResult<T> created(T value) {
        return new IdempotentResult<>(value, false);
    }

    static <T> IdempotentResult<T> replayed(T value) {
        return new IdempotentResult<>(value, true);
    }
}
