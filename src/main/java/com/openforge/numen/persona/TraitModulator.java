package com.openforge.numen.persona;

import com.openforge.numen.contract.AgentContract;
import com.openforge.numen.contract.AgentIdentity;
import com.openforge.numen.contract.AgentTraits;
import com.openforge.numen.contract.Trait;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;
import java.util.stream.Collectors;

/**
 * Turns a contract's trait values into behavioral directives and the system
 * prompt handed to the completion provider.
 *
 * Pure: no I/O, no clock, no mutable state. Iteration follows
 * {@link Trait} declaration order, so the same contract always renders the
 * same bytes and the result can be cached as a derived artifact.
 */
@Component
public class TraitModulator {

    static final int DOMINANT_ABOVE = 70;
    static final int SUBDUED_BELOW  = 40;

    private static final List<String> CORE_DIRECTIVES = List.of(
            "Embody the character role in every interaction",
            "Align all responses with your mission",
            "Follow the behavioral directives above precisely",
            "Your personality is defined by the trait directives, not by generic assistant behavior");

    public RenderedPrompt render(AgentContract contract) {
        Map<Trait, Integer> values = contract.traits().resolved();
        List<Directive> directives = directives(values);

        StringBuilder sb = new StringBuilder();
        appendIdentity(sb, contract);

        sb.append("PERSONALITY TRAITS (Quantified):\n");
        values.forEach((trait, value) ->
                sb.append("- ").append(trait.displayName()).append(": ").append(value).append("/100\n"));
        sb.append('\n').append(traitSummary(values)).append("\n\n");

        Trait.Section current = null;
        for (Directive directive : directives) {
            Trait.Section section = directive.trait().section();
            if (section != current) {
                if (current != null) sb.append('\n');
                sb.append("## ").append(section.heading()).append("\n\n");
                current = section;
            }
            sb.append(directive.render()).append('\n');
        }

        sb.append("\nINTERACTION GUIDELINES:\n");
        sb.append("- Greeting: ").append(greetingStyle(contract.traits())).append('\n');
        sb.append("- Questions: ").append(questionStyle(contract.traits())).append('\n');
        sb.append("- Challenges: ").append(challengeStyle(contract.traits())).append('\n');
        sb.append("- Celebrations: ").append(celebrationStyle(contract.traits())).append('\n');

        sb.append("\nCORE DIRECTIVES:\n");
        CORE_DIRECTIVES.forEach(line -> sb.append("- ").append(line).append('\n'));

        return new RenderedPrompt(sb.toString(), directives);
    }

    public List<Directive> directives(Map<Trait, Integer> values) {
        List<Directive> out = new ArrayList<>(values.size());
        for (Trait trait : Trait.values()) {
            Integer value = values.get(trait);
            if (value == null) continue;
            TraitBand band = TraitBand.of(value);
            out.add(new Directive(trait, value, band, DirectiveTable.instructions(trait, band)));
        }
        return out;
    }

    String traitSummary(Map<Trait, Integer> values) {
        String dominant = namesWhere(values, v -> v > DOMINANT_ABOVE);
        String subdued  = namesWhere(values, v -> v < SUBDUED_BELOW);
        List<String> lines = new ArrayList<>(2);
        if (!dominant.isEmpty()) lines.add("**Dominant Traits:** " + dominant);
        if (!subdued.isEmpty())  lines.add("**Subdued Traits:** " + subdued);
        return lines.isEmpty() ? "**Balanced Trait Profile**" : String.join("\n", lines);
    }

    // ── Identity header ──────────────────────────────────────────────────────

    private static void appendIdentity(StringBuilder sb, AgentContract contract) {
        sb.append("You are ").append(contract.name()).append(".\n\n");
        AgentIdentity identity = contract.identity();
        if (identity == null) return;

        String description = identity.fullDescription() != null && !identity.fullDescription().isBlank()
                ? identity.fullDescription()
                : identity.shortDescription();
        if (description != null) sb.append(description).append("\n\n");

        boolean any = appendField(sb, "CHARACTER ROLE", identity.characterRole());
        any |= appendField(sb, "MISSION", identity.mission());
        any |= appendField(sb, "INTERACTION STYLE", identity.interactionStyle());
        if (any) sb.append('\n');
    }

    private static boolean appendField(StringBuilder sb, String label, String value) {
        if (value == null || value.isBlank()) return false;
        sb.append(label).append(": ").append(value).append('\n');
        return true;
    }

    // ── Interaction guidelines ───────────────────────────────────────────────

    private static String greetingStyle(AgentTraits t) {
        String base;
        if (t.value(Trait.FORMALITY) >= 70) {
            base = "Greet with professional warmth and a proper introduction";
        } else if (t.value(Trait.FORMALITY) < 40) {
            base = "Greet casually and warmly, like a friend";
        } else {
            base = "Greet with balanced warmth and professionalism";
        }
        if (t.value(Trait.EMPATHY) >= 70) {
            base += ". Acknowledge their presence and emotional state right away.";
        }
        return base;
    }

    private static String questionStyle(AgentTraits t) {
        if (t.value(Trait.CONFIDENCE) >= 70 && t.value(Trait.ASSERTIVENESS) >= 60) {
            return "Answer questions with authority and clear direction";
        }
        if (t.value(Trait.EMPATHY) >= 70) {
            return "Explore the emotional context behind questions before answering";
        }
        return "Provide balanced, thoughtful responses that invite collaboration";
    }

    private static String challengeStyle(AgentTraits t) {
        if (t.value(Trait.DISCIPLINE) >= 70) return "Challenge firmly with clear accountability";
        if (t.value(Trait.SUPPORTIVENESS) >= 70) return "Challenge gently while maintaining encouragement";
        return "Challenge with balanced directness";
    }

    private static String celebrationStyle(AgentTraits t) {
        if (t.value(Trait.SUPPORTIVENESS) >= 70 && t.value(Trait.EMPATHY) >= 60) {
            return "Celebrate enthusiastically with genuine joy and validation";
        }
        if (t.value(Trait.FORMALITY) >= 70) return "Acknowledge accomplishments with professional recognition";
        return "Acknowledge progress with measured appreciation";
    }

    private static String namesWhere(Map<Trait, Integer> values, IntPredicate test) {
        return values.entrySet().stream()
                .filter(e -> test.test(e.getValue()))
                .map(e -> e.getKey().displayName())
                .collect(Collectors.joining(", "));
    }
}
