package com.openforge.numen.persona;

/**
 * Threshold bands a trait value falls into.
 *
 *   LOW        0 - 30
 *   MODERATE  31 - 60
 *   HIGH      61 - 85
 *   VERY_HIGH 86 - 100
 */
public enum TraitBand {
    LOW("Low"),
    MODERATE("Moderate"),
    HIGH("High"),
    VERY_HIGH("Very High");

    private final String label;

    TraitBand(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TraitBand of(int value) {
        if (value >= 86) return VERY_HIGH;
        if (value >= 61) return HIGH;
        if (value >= 31) return MODERATE;
        return LOW;
    }
}
