package com.openforge.numen.contract;

/**
 * Listing filter; null fields match everything.
 */
public record ContractFilter(AgentStatus status, AgentType type, String tag, int limit, int offset) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    public ContractFilter {
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        offset = Math.max(offset, 0);
        tag = tag == null || tag.isBlank() ? null : tag.trim();
    }

    public static ContractFilter all() {
        return new ContractFilter(null, null, null, DEFAULT_LIMIT, 0);
    }
}
