package com.openforge.numen.contract;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * A partial update. Null fields are left untouched; {@code identity} and
 * {@code configuration} merge field by field, {@code traits} overlays the
 * given keys, {@code voice} and {@code tags} replace wholesale.
 *
 * @param expectedVersion  compare-and-swap token: when set, the update is
 *                         rejected with a conflict unless it equals the
 *                         stored version
 */
@Builder(toBuilder = true)
public record ContractPatch(
        String name,
        List<String> tags,
        AgentStatus status,
        AgentIdentity identity,
        Map<String, Integer> traits,
        AgentConfiguration configuration,
        VoiceConfiguration voice,
        String expectedVersion,
        String changeSummary,
        String updatedBy
) {
}
