package com.openforge.numen.contract;

import java.util.List;

/**
 * Result types of {@link ContractValidator}.
 */
public final class ValidationReport {

    private ValidationReport() {}

    public record Check(String agentId, boolean valid, List<String> differences) {
        public Check {
            differences = List.copyOf(differences);
        }
    }

    public record Repair(String agentId, boolean repaired, RepairAction action, List<String> differences) {
        public Repair {
            differences = List.copyOf(differences);
        }
    }

    public record FailedAgent(String agentId, String name, String error) {}

    /**
     * {@code valid} counts agents consistent at the end of the run, repaired
     * ones included; {@code repaired} is the subset that needed a repair.
     */
    public record Summary(int total, int valid, int repaired, int failed, List<FailedAgent> failedAgents) {
        public Summary {
            failedAgents = List.copyOf(failedAgents);
        }
    }
}
