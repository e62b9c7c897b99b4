package com.openforge.numen.error;

/**
 * A store write failed. Fatal for thread turns, swallowed for memory writes.
 */
public class PersistenceException extends NumenException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
