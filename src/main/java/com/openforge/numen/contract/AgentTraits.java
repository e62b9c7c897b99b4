package com.openforge.numen.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.openforge.numen.error.ContractValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Personality trait values keyed by {@link Trait}.
 *
 * Construction rejects unknown trait names and values outside [0,100].
 * Traits that were never supplied resolve to {@link Trait#defaultValue()}
 * until {@link #withDefaults(Map)} fixes them to the configured defaults.
 *
 * JSON shape is a flat object: {"confidence": 90, "empathy": 20}.
 */
public record AgentTraits(Map<Trait, Integer> values) {

    public AgentTraits {
        EnumMap<Trait, Integer> copy = new EnumMap<>(Trait.class);
        List<String> violations = new ArrayList<>();
        if (values != null) {
            values.forEach((trait, value) -> {
                if (trait == null) return;
                if (value == null) return;
                if (value < Trait.MIN || value > Trait.MAX) {
                    violations.add("traits.%s must be within [0,100], got %d".formatted(trait.key(), value));
                    return;
                }
                copy.put(trait, value);
            });
        }
        if (!violations.isEmpty()) throw new ContractValidationException(violations);
        values = Collections.unmodifiableMap(copy);
    }

    public static AgentTraits empty() {
        return new AgentTraits(Map.of());
    }

    /** Parses a key → value map such as the JSON payload or a patch. */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AgentTraits fromKeys(Map<String, Integer> raw) {
        return new AgentTraits(toTraitMap(raw));
    }

    public static AgentTraits of(Object... traitValuePairs) {
        if (traitValuePairs.length % 2 != 0) {
            throw new IllegalArgumentException("Expected trait/value pairs");
        }
        EnumMap<Trait, Integer> map = new EnumMap<>(Trait.class);
        for (int i = 0; i < traitValuePairs.length; i += 2) {
            map.put((Trait) traitValuePairs[i], (Integer) traitValuePairs[i + 1]);
        }
        return new AgentTraits(map);
    }

    /** Value for {@code trait}, falling back to its built-in default. */
    public int value(Trait trait) {
        Integer v = values.get(trait);
        return v != null ? v : trait.defaultValue();
    }

    public boolean isSet(Trait trait) {
        return values.containsKey(trait);
    }

    /** Fills every missing trait from {@code defaults} (by key), then from the built-in constant. */
    public AgentTraits withDefaults(Map<String, Integer> defaults) {
        EnumMap<Trait, Integer> resolved = new EnumMap<>(Trait.class);
        Map<Trait, Integer> configured = toTraitMap(defaults);
        for (Trait trait : Trait.values()) {
            Integer v = values.get(trait);
            if (v == null) v = configured.get(trait);
            if (v == null) v = trait.defaultValue();
            resolved.put(trait, v);
        }
        return new AgentTraits(resolved);
    }

    /** Overlays {@code patch} on top of these values. */
    public AgentTraits merge(Map<String, Integer> patch) {
        EnumMap<Trait, Integer> merged = new EnumMap<>(Trait.class);
        merged.putAll(values);
        merged.putAll(toTraitMap(patch));
        return new AgentTraits(merged);
    }

    /** Every trait in declaration order, missing ones resolved to built-in defaults. */
    public Map<Trait, Integer> resolved() {
        Map<Trait, Integer> out = new LinkedHashMap<>();
        for (Trait trait : Trait.values()) {
            out.put(trait, value(trait));
        }
        return out;
    }

    @JsonValue
    public Map<String, Integer> asKeyMap() {
        Map<String, Integer> out = new LinkedHashMap<>();
        values.forEach((trait, value) -> out.put(trait.key(), value));
        return out;
    }

    private static Map<Trait, Integer> toTraitMap(Map<String, Integer> raw) {
        EnumMap<Trait, Integer> map = new EnumMap<>(Trait.class);
        if (raw == null) return map;
        List<String> unknown = new ArrayList<>();
        raw.forEach((key, value) -> Trait.fromKey(key).ifPresentOrElse(
                trait -> map.put(trait, value),
                () -> unknown.add("traits.%s is not a known trait".formatted(key))));
        if (!unknown.isEmpty()) throw new ContractValidationException(unknown);
        return map;
    }
}
