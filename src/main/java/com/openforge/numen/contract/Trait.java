package com.openforge.numen.contract;

import java.util.Arrays;
import java.util.Optional;

/**
 * The fixed set of personality dimensions, each an integer in [0,100].
 *
 * Declaration order is the rendering order of directives, so it must stay
 * stable: reordering constants changes every rendered prompt.
 */
public enum Trait {

    CONFIDENCE("confidence", 70, Section.BEHAVIORAL, "Certainty and authority in responses"),
    EMPATHY("empathy", 50, Section.BEHAVIORAL, "Emotional sensitivity and understanding"),
    CREATIVITY("creativity", 50, Section.BEHAVIORAL, "Creative vs structured responses"),
    DISCIPLINE("discipline", 50, Section.BEHAVIORAL, "Structured and consistent approach"),
    ASSERTIVENESS("assertiveness", 50, Section.COMMUNICATION, "Directive vs suggestive communication"),
    HUMOR("humor", 30, Section.COMMUNICATION, "Lighthearted vs serious tone"),
    FORMALITY("formality", 50, Section.COMMUNICATION, "Formal vs casual language"),
    VERBOSITY("verbosity", 50, Section.COMMUNICATION, "Concise vs detailed responses"),
    SUPPORTIVENESS("supportiveness", 50, Section.PRESENCE, "Nurturing and encouraging presence"),
    SPIRITUALITY("spirituality", 30, Section.PRESENCE, "Spiritual awareness and connection"),
    TECHNICALITY("technicality", 50, Section.GUARDRAILS, "Technical vs accessible language"),
    SAFETY("safety", 80, Section.GUARDRAILS, "Risk aversion and caution level");

    public static final int MIN = 0;
    public static final int MAX = 100;

    public enum Section {
        BEHAVIORAL("BEHAVIORAL DIRECTIVES"),
        COMMUNICATION("COMMUNICATION STYLE"),
        PRESENCE("PRESENCE & APPROACH"),
        GUARDRAILS("EXPERTISE & GUARDRAILS");

        private final String heading;

        Section(String heading) {
            this.heading = heading;
        }

        public String heading() {
            return heading;
        }
    }

    private final String key;
    private final int defaultValue;
    private final Section section;
    private final String description;

    Trait(String key, int defaultValue, Section section, String description) {
        this.key = key;
        this.defaultValue = defaultValue;
        this.section = section;
        this.description = description;
    }

    public String key() {
        return key;
    }

    public int defaultValue() {
        return defaultValue;
    }

    public Section section() {
        return section;
    }

    public String description() {
        return description;
    }

    /** "Supportiveness" for "supportiveness". */
    public String displayName() {
        return Character.toUpperCase(key.charAt(0)) + key.substring(1);
    }

    public static Optional<Trait> fromKey(String key) {
        if (key == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(t -> t.key.equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
