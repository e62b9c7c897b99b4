package com.openforge.numen.persona;

import com.openforge.numen.contract.AgentContract;
import com.openforge.numen.contract.AgentTraits;
import com.openforge.numen.contract.TestContracts;
import com.openforge.numen.contract.Trait;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TraitModulatorTest {

    private final TraitModulator modulator = new TraitModulator();

    @Test
    @DisplayName("identical contracts render byte-identical prompts")
    void renderIsDeterministic() {
        AgentContract contract = TestContracts.withTraits(
                AgentTraits.of(Trait.CONFIDENCE, 90, Trait.EMPATHY, 20, Trait.HUMOR, 75));

        String first = modulator.render(contract).systemPrompt();
        String second = modulator.render(TestContracts.withTraits(
                AgentTraits.of(Trait.HUMOR, 75, Trait.EMPATHY, 20, Trait.CONFIDENCE, 90))).systemPrompt();

        assertThat(second).isEqualTo(first);
    }

    @Nested
    @DisplayName("directive selection")
    class Directives {

        @Test
        @DisplayName("high confidence, low empathy: assertive and task-focused")
        void assertiveProfile() {
            String prompt = modulator.render(TestContracts.withTraits(
                    AgentTraits.of(Trait.CONFIDENCE, 90, Trait.EMPATHY, 20))).systemPrompt();

            assertThat(prompt)
                    .contains("**Confidence (Very High):**")
                    .contains("Speak with absolute certainty and unwavering conviction")
                    .contains("**Empathy (Low):**")
                    .contains("Stay task-focused with minimal emotional processing")
                    .doesNotContain("Deeply validate and mirror emotions");
        }

        @Test
        @DisplayName("low confidence, high empathy: the inverse directives")
        void validatingProfile() {
            String prompt = modulator.render(TestContracts.withTraits(
                    AgentTraits.of(Trait.CONFIDENCE, 10, Trait.EMPATHY, 90))).systemPrompt();

            assertThat(prompt)
                    .contains("**Confidence (Low):**")
                    .contains("Present options tentatively")
                    .contains("**Empathy (Very High):**")
                    .contains("Deeply validate and mirror emotions before any guidance")
                    .doesNotContain("Speak with absolute certainty");
        }

        @Test
        void everyTraitGetsOneDirectiveInDeclarationOrder() {
            Map<Trait, Integer> values = new EnumMap<>(Trait.class);
            for (Trait t : Trait.values()) values.put(t, 50);

            var directives = modulator.directives(values);

            assertThat(directives).hasSize(Trait.values().length);
            assertThat(directives).extracting(Directive::trait).containsExactly(Trait.values());
            assertThat(directives).allSatisfy(d -> {
                assertThat(d.band()).isEqualTo(TraitBand.MODERATE);
                assertThat(d.instructions()).isNotEmpty();
            });
        }
    }

    @ParameterizedTest
    @CsvSource({"0,LOW", "30,LOW", "31,MODERATE", "60,MODERATE", "61,HIGH", "85,HIGH", "86,VERY_HIGH", "100,VERY_HIGH"})
    void bandBoundaries(int value, TraitBand expected) {
        assertThat(TraitBand.of(value)).isEqualTo(expected);
    }

    @Nested
    class Layout {

        @Test
        void listsQuantifiedTraitsWithDefaultsFilledIn() {
            String prompt = modulator.render(TestContracts.withTraits(AgentTraits.empty())).systemPrompt();

            assertThat(prompt)
                    .startsWith("You are Sage.\n\nA calm mentor\n\n")
                    .contains("CHARACTER ROLE: Mentor")
                    .contains("PERSONALITY TRAITS (Quantified):")
                    .contains("- Confidence: 70/100")
                    .contains("- Safety: 80/100")
                    .contains("INTERACTION GUIDELINES:")
                    .contains("CORE DIRECTIVES:");
            assertThat(prompt.indexOf("## BEHAVIORAL DIRECTIVES"))
                    .isLessThan(prompt.indexOf("## COMMUNICATION STYLE"));
            assertThat(prompt.indexOf("## PRESENCE & APPROACH"))
                    .isLessThan(prompt.indexOf("## EXPERTISE & GUARDRAILS"));
        }

        @Test
        void summarizesDominantAndSubduedTraits() {
            Map<Trait, Integer> values = new EnumMap<>(Trait.class);
            for (Trait t : Trait.values()) values.put(t, 50);
            assertThat(modulator.traitSummary(values)).isEqualTo("**Balanced Trait Profile**");

            values.put(Trait.CONFIDENCE, 71);
            values.put(Trait.HUMOR, 39);
            assertThat(modulator.traitSummary(values))
                    .isEqualTo("**Dominant Traits:** Confidence\n**Subdued Traits:** Humor");
        }

        @Test
        void thresholdsAreExclusive() {
            Map<Trait, Integer> values = new EnumMap<>(Trait.class);
            for (Trait t : Trait.values()) values.put(t, 50);
            values.put(Trait.CONFIDENCE, 70);
            values.put(Trait.HUMOR, 40);

            assertThat(modulator.traitSummary(values)).isEqualTo("**Balanced Trait Profile**");
        }
    }
}
