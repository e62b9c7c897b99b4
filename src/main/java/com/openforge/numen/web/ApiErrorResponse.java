package com.openforge.numen.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body of every failed API call.
 *
 * @param error      short machine-readable kind, e.g. "not_found"
 * @param retryable  whether repeating the call (after backoff or reload) may succeed
 * @param violations contract validation failures, when there are any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(
        int status,
        String error,
        String message,
        boolean retryable,
        List<String> violations
) {

    public static ApiErrorResponse of(int status, String error, String message, boolean retryable) {
        return new ApiErrorResponse(status, error, message, retryable, null);
    }
}
