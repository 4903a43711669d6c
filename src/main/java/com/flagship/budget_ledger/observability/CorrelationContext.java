package com.flagship.budget_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC keys and helpers shared by the request filter and the controllers.
 *
 * correlationId comes from the X-Correlation-ID header or is generated per request;
 * ownerId and accountId are set by controllers once the path is resolved.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String OWNER_ID_MDC_KEY = "ownerId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private CorrelationContext() {
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void bindOwner(UUID ownerId) {
        MDC.put(OWNER_ID_MDC_KEY, ownerId.toString());
    }

    public static void bindAccount(UUID accountId) {
        if (accountId != null) {
            MDC.put(ACCOUNT_ID_MDC_KEY, accountId.toString());
        }
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(OWNER_ID_MDC_KEY);
        MDC.remove(ACCOUNT_ID_MDC_KEY);
    }
}
