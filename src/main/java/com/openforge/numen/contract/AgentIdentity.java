package com.openforge.numen.contract;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Who the agent is: purpose, character archetype, mission and manner.
 *
 * @param shortDescription  one-line purpose, required, at most 100 characters
 * @param fullDescription   detailed background; replaces the short one in prompts when present
 * @param characterRole     archetype the agent embodies
 * @param mission           primary objective
 * @param interactionStyle  communication approach
 */
@Builder(toBuilder = true)
public record AgentIdentity(
        String shortDescription,
        String fullDescription,
        String characterRole,
        String mission,
        String interactionStyle
) {

    public static final int SHORT_DESCRIPTION_MAX = 100;

    List<String> violations() {
        List<String> out = new ArrayList<>();
        if (shortDescription == null || shortDescription.isBlank()) {
            out.add("identity.short_description is required");
        } else if (shortDescription.length() > SHORT_DESCRIPTION_MAX) {
            out.add("identity.short_description must be at most %d characters".formatted(SHORT_DESCRIPTION_MAX));
        }
        return out;
    }

    /** Field-wise overlay: non-null fields of {@code patch} win. */
    public AgentIdentity merge(AgentIdentity patch) {
        if (patch == null) return this;
        return new AgentIdentity(
                patch.shortDescription != null ? patch.shortDescription : shortDescription,
                patch.fullDescription != null ? patch.fullDescription : fullDescription,
                patch.characterRole != null ? patch.characterRole : characterRole,
                patch.mission != null ? patch.mission : mission,
                patch.interactionStyle != null ? patch.interactionStyle : interactionStyle);
    }
}
