package com.openforge.numen.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.openforge.numen.error.ContractValidationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Agent lifecycle. Contracts are never deleted, only moved to {@link #ARCHIVED}.
 */
public enum AgentStatus {
    ACTIVE,
    INACTIVE,
    ARCHIVED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentStatus fromWire(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(s -> s.wireName().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new ContractValidationException("Unknown agent status: " + value));
    }
}
