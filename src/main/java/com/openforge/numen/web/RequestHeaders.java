package com.openforge.numen.web;

/**
 * Identity headers set by the gateway in front of the runtime.
 */
public final class RequestHeaders {

    public static final String TENANT = "X-Tenant-Id";
    public static final String USER   = "X-User-Id";

    private RequestHeaders() {}
}
