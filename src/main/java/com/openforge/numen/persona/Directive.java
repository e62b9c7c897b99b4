package com.openforge.numen.persona;

import com.openforge.numen.contract.Trait;

import java.util.List;

/**
 * The behavioral instruction one trait value maps to.
 */
public record Directive(Trait trait, int value, TraitBand band, List<String> instructions) {

    public Directive {
        instructions = List.copyOf(instructions);
    }

    /** "**Confidence (Very High):**" followed by one "- " line per instruction. */
    public String render() {
        StringBuilder sb = new StringBuilder()
                .append("**").append(trait.displayName())
                .append(" (").append(band.label()).append("):**");
        for (String line : instructions) {
            sb.append('\n').append("- ").append(line);
        }
        return sb.toString();
    }
}
