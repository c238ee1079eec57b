package org.propositions.proofs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.propositions.syntax.Formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertAll;
import static org.junit.jupiter.api.Assertions.assertEquals;

class InferenceRuleTest {

    @Test
    @DisplayName("Costruzione da liste immutabili")
    void testConstruction_WithImmutableList() {
        InferenceRule rule = new InferenceRule(List.of(Formula.parse("p"), Formula.parse("(p->q)")), Formula.parse("q"));

        assertAll(
                () -> assertThat(rule.getAssumptions()).containsExactly(Formula.parse("p"), Formula.parse("(p->q)")),
                () -> assertEquals(Formula.parse("q"), rule.getConclusion()),
                () -> assertThat(rule.variables()).containsExactly("p", "q"),
                () -> assertEquals("[p, (p->q)] ==> q", rule.toString())
        );
    }

    @Test
    @DisplayName("Le assunzioni vengono copiate")
    void testConstruction_ShouldCopyAssumptions() {
        List<Formula> assumptions = new ArrayList<>(List.of(Formula.parse("r")));
        InferenceRule rule = new InferenceRule(assumptions, Formula.parse("r"));
        assumptions.add(Formula.parse("s"));

        assertThat(rule.getAssumptions()).containsExactly(Formula.parse("r"));
        assertEquals(new InferenceRule(List.of(Formula.parse("r")), Formula.parse("r")), rule);
    }

    @Test
    @DisplayName("Assunzioni o conclusione null vengono rifiutate")
    void testConstruction_WithNull_ShouldFail() {
        assertThatThrownBy(() -> new InferenceRule(Arrays.asList(Formula.parse("p"), null), Formula.parse("p")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InferenceRule(null, Formula.parse("p")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InferenceRule(List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
