package com.flagship.budget_ledger.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every endpoint.
 * {@code kind} is set for domain failures so clients can branch without parsing messages.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    ErrorKind kind;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
