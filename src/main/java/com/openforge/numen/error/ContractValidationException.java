package com.openforge.numen.error;

import java.util.List;

/**
 * A contract failed validation. Raised before anything is persisted.
 */
public class ContractValidationException extends NumenException {

    private final List<String> violations;

    public ContractValidationException(String message) {
        this(List.of(message));
    }

    public ContractValidationException(List<String> violations) {
        super("Invalid agent contract: " + String.join("; ", violations), false);
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }
}
