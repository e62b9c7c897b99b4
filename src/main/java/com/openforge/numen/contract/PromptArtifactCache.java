package com.openforge.numen.contract;

import java.util.Optional;

/**
 * Derived, per-agent copy of the contract and its rendered prompt.
 *
 * Only ever a cache: the contract store is authoritative and
 * {@link ContractValidator} is the one path that reconciles the two.
 */
public interface PromptArtifactCache {

    /** Empty when no artifact was ever written for the agent. */
    Optional<Artifact> read(String agentId);

    void write(String agentId, Artifact artifact);

    /**
     * @param contractJson  serialized contract, null when the file is missing
     * @param systemPrompt  rendered prompt, null when the file is missing
     */
    record Artifact(String contractJson, String systemPrompt) {}
}
