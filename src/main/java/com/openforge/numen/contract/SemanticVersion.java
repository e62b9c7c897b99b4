package com.openforge.numen.contract;

import com.openforge.numen.error.ContractValidationException;

/**
 * MAJOR.MINOR.PATCH. Contract mutations bump the patch component.
 */
public record SemanticVersion(int major, int minor, int patch) implements Comparable<SemanticVersion> {

    public static final SemanticVersion INITIAL = new SemanticVersion(1, 0, 0);

    public static SemanticVersion parse(String text) {
        if (text == null) throw new ContractValidationException("version is required");
        String[] parts = text.trim().split("\\.");
        if (parts.length != 3) {
            throw new ContractValidationException("version must be MAJOR.MINOR.PATCH, got '%s'".formatted(text));
        }
        try {
            return new SemanticVersion(
                    Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
        } catch (NumberFormatException e) {
            throw new ContractValidationException("version must be numeric, got '%s'".formatted(text));
        }
    }

    public SemanticVersion bumpPatch() {
        return new SemanticVersion(major, minor, patch + 1);
    }

    @Override
    public int compareTo(SemanticVersion other) {
        if (major != other.major) return Integer.compare(major, other.major);
        if (minor != other.minor) return Integer.compare(minor, other.minor);
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
