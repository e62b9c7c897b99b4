package com.openforge.numen.contract;

import java.time.LocalDateTime;

/**
 * One entry of an agent's version history: the contract as it was before
 * the change described by {@code changeSummary}.
 */
public record ContractSnapshot(
        String version,
        String changeSummary,
        String createdBy,
        LocalDateTime createdAt,
        AgentContract contract
) {}
