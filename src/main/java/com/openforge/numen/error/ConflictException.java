package com.openforge.numen.error;

/**
 * A concurrent contract mutation won the compare-and-swap on {@code version}.
 * The caller must reload the contract and retry its update.
 */
public class ConflictException extends NumenException {

    public ConflictException(String message) {
        super(message, true);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
