package com.openforge.numen.contract;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openforge.numen.error.ContractValidationException;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * The authoritative description of one agent.
 *
 * Instances are immutable; every change goes through
 * {@code ContractService.update}, which snapshots the prior state and bumps
 * {@link #version()}. {@link #validate()} is the single construction gate:
 * trait ranges are enforced by {@link AgentTraits} itself, everything else
 * here.
 */
@Builder(toBuilder = true)
public record AgentContract(
        String id,
        String tenantId,
        String ownerId,
        String name,
        AgentType type,
        String version,
        AgentStatus status,
        List<String> tags,
        AgentIdentity identity,
        AgentTraits traits,
        AgentConfiguration configuration,
        VoiceConfiguration voice,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public AgentContract {
        tags = tags == null ? List.of() : List.copyOf(tags);
        traits = traits == null ? AgentTraits.empty() : traits;
    }

    /**
     * @throws ContractValidationException listing every violation found
     */
    public AgentContract validate() {
        List<String> violations = new ArrayList<>();
        requireText(violations, "tenant_id", tenantId);
        requireText(violations, "owner_id", ownerId);
        requireText(violations, "name", name);
        if (type == null) violations.add("type is required");
        if (identity == null) {
            violations.add("identity is required");
        } else {
            violations.addAll(identity.violations());
        }
        if (configuration != null) violations.addAll(configuration.violations());
        if (type == AgentType.VOICE && voice == null) {
            violations.add("voice configuration is required for voice agents");
        }
        if (voice != null) violations.addAll(voice.violations());
        for (String tag : tags) {
            if (tag == null || tag.isBlank() || tag.contains(",")) {
                violations.add("tags must be non-blank and must not contain ','");
                break;
            }
        }
        if (!violations.isEmpty()) throw new ContractValidationException(violations);
        return this;
    }

    @JsonIgnore
    public boolean isArchived() {
        return status == AgentStatus.ARCHIVED;
    }

    public boolean usesMemory() {
        return configuration == null || configuration.usesMemory();
    }

    private static void requireText(List<String> violations, String field, String value) {
        if (value == null || value.isBlank()) violations.add(field + " is required");
    }
}
