package com.openforge.numen.error;

/**
 * An embedding or completion provider call failed.
 */
public class ProviderException extends NumenException {

    public ProviderException(String message) {
        super(message, true);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
