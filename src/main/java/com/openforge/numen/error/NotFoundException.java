package com.openforge.numen.error;

public class NotFoundException extends NumenException {

    public NotFoundException(String message) {
        super(message, false);
    }

    public static NotFoundException agent(String agentId, String tenantId) {
        return new NotFoundException("Agent %s not found for tenant %s".formatted(agentId, tenantId));
    }

    public static NotFoundException thread(String threadId) {
        return new NotFoundException("Thread not found: " + threadId);
    }
}
