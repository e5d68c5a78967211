package com.videoscout.suggestion.dto;

import java.util.List;

/**
 * Partial-success result of a bulk fetch: what was gathered, which inputs failed and why,
 * which inputs completed, and whether the loop stopped on quota exhaustion.
 */
public record BulkResult<T>(List<T> items,
                            List<Failure> failures,
                            List<String> completedInputs,
                            boolean quotaExhausted) {

    public BulkResult {
        items = List.copyOf(items);
        failures = List.copyOf(failures);
        completedInputs = List.copyOf(completedInputs);
    }

    public static <T> BulkResult<T> empty() {
        return new BulkResult<>(List.of(), List.of(), List.of(), false);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public record Failure(String input, ApiErrorType errorType, String message) {
    }
}
