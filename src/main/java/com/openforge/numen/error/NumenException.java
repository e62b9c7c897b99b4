package com.openforge.numen.error;

/**
 * Root of the runtime's typed failures.
 *
 * {@code retryable} tells the caller whether the same call may succeed if
 * repeated (after backoff, or after reloading the contract for conflicts).
 */
public abstract class NumenException extends RuntimeException {

    private final boolean retryable;

    protected NumenException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    protected NumenException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
