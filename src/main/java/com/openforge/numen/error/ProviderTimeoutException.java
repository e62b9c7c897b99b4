package com.openforge.numen.error;

public class ProviderTimeoutException extends ProviderException {

    public ProviderTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
