package com.openforge.numen.memory;

import java.util.regex.Pattern;

/**
 * Isolation key of a memory entry.
 *
 *   {tenant}:{agent}                 agent-level memory
 *   {tenant}:{agent}:thread:{thread} thread-scoped memory
 *   {tenant}:{agent}:user:{user}     user-scoped memory
 *
 * Always derived from ids through the factories below; a raw string from a
 * caller is never accepted. Components are restricted to a safe alphabet so
 * that a component can neither contain the ':' separator nor break out of a
 * store's filter expression.
 */
public final class MemoryNamespace {

    private static final Pattern COMPONENT = Pattern.compile("[A-Za-z0-9._@-]{1,128}");

    private final String value;
    private final String tenantId;
    private final String agentId;

    private MemoryNamespace(String value, String tenantId, String agentId) {
        this.value = value;
        this.tenantId = tenantId;
        this.agentId = agentId;
    }

    public static MemoryNamespace agent(String tenantId, String agentId) {
        return new MemoryNamespace(
                check("tenant_id", tenantId) + ":" + check("agent_id", agentId), tenantId, agentId);
    }

    public static MemoryNamespace thread(String tenantId, String agentId, String threadId) {
        return agent(tenantId, agentId).child("thread", check("thread_id", threadId));
    }

    public static MemoryNamespace user(String tenantId, String agentId, String userId) {
        return agent(tenantId, agentId).child("user", check("user_id", userId));
    }

    public String value() {
        return value;
    }

    public String tenantId() {
        return tenantId;
    }

    public String agentId() {
        return agentId;
    }

    /** Prefix shared by every descendant namespace: "{value}:". */
    public String descendantPrefix() {
        return value + ":";
    }

    /** True for this namespace itself and for any namespace below it. */
    public boolean covers(String namespace) {
        return value.equals(namespace) || (namespace != null && namespace.startsWith(descendantPrefix()));
    }

    private MemoryNamespace child(String kind, String id) {
        return new MemoryNamespace(value + ":" + kind + ":" + id, tenantId, agentId);
    }

    private static String check(String field, String component) {
        if (component == null || !COMPONENT.matcher(component).matches()) {
            throw new IllegalArgumentException(
                    "%s must match %s, got '%s'".formatted(field, COMPONENT.pattern(), component));
        }
        return component;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MemoryNamespace other && other.value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
