package com.openforge.numen.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.openforge.numen.error.ContractValidationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of agent kinds. {@link #VOICE} requires a voice configuration.
 */
public enum AgentType {
    CONVERSATIONAL,
    VOICE,
    WORKFLOW,
    AUTONOMOUS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentType fromWire(String value) {
        if (value == null) return null;
        return Arrays.stream(values())
                .filter(t -> t.wireName().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new ContractValidationException(
                        "type must be one of conversational, voice, workflow, autonomous; got '%s'"
                                .formatted(value)));
    }
}
