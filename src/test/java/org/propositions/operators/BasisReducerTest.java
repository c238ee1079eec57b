package org.propositions.operators;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.propositions.semantics.Model;
import org.propositions.semantics.Semantics;
import org.propositions.syntax.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BasisReducerTest {

    private static final List<String> SAMPLES = List.of(
            "p", "T", "F", "~T", "(T&F)", "~~p",
            "(p&q)", "(p|q)", "(p->q)", "(p+q)", "(p<->q)", "(p-&q)", "(p-|q)",
            "~(p&q76)", "((p->q)->(~q->~p))", "((p+q)<->(r-&~s))",
            "(((p1-|T)->~(q|F))+(r<->(p1&~r)))",
            "(~(x->(y-|z))&((x+F)|(T<->~y)))"
    );

    /**
     * Confronta le tabelle di verità sull'unione delle variabili delle due formule.
     */
    private static void assertSameTruthTable(Formula original, Formula reduced) {
        Set<String> union = new TreeSet<>(original.variables());
        union.addAll(reduced.variables());
        List<String> variables = new ArrayList<>(union);

        for (Model model : Semantics.allModels(variables)) {
            assertEquals(Semantics.evaluate(original, model), Semantics.evaluate(reduced, model),
                    original + " e " + reduced + " differiscono nel modello " + model);
        }
    }

    @ParameterizedTest
    @EnumSource(OperatorBasis.class)
    @DisplayName("Ogni riduzione preserva la tabella di verità e resta nella base")
    void testReduction_ShouldPreserveTruthTableAndBasis(OperatorBasis basis) {
        for (String text : SAMPLES) {
            Formula original = Formula.parse(text);
            Formula reduced = basis.reduce(original);

            assertSameTruthTable(original, reduced);
            assertTrue(basis.contains(reduced), () -> "Operatori di " + reduced + " fuori da " + basis);
        }
    }

    @ParameterizedTest
    @EnumSource(OperatorBasis.class)
    @DisplayName("Le riduzioni non introducono variabili se la formula ne contiene")
    void testReduction_ShouldKeepVariables(OperatorBasis basis) {
        for (String text : SAMPLES) {
            Formula original = Formula.parse(text);
            if (!original.variables().isEmpty()) {
                assertThat(basis.reduce(original).variables())
                        .containsExactlyInAnyOrderElementsOf(original.variables());
            }
        }
    }

    @Test
    @DisplayName("Appartenenza alla base secondo gli operatori e le costanti usate")
    void testContains() {
        assertThat(OperatorBasis.IMPLIES_FALSE.getSymbols()).containsExactlyInAnyOrder("->", "F");
        assertTrue(OperatorBasis.NAND.contains(Formula.parse("(p-&q)")));
        assertTrue(OperatorBasis.NAND.contains(Formula.parse("x")));
        assertFalse(OperatorBasis.NAND.contains(Formula.parse("~p")));
        assertTrue(OperatorBasis.IMPLIES_FALSE.contains(Formula.parse("(p->F)")));
        assertFalse(OperatorBasis.IMPLIES_FALSE.contains(Formula.parse("(p->T)")));
    }

    @Nested
    @DisplayName("Identità specifiche")
    class IdentityTests {

        @Test
        void testToNotAndOr() {
            assertEquals("(~p|q)", BasisReducer.toNotAndOr(Formula.parse("(p->q)")).toString());
            assertEquals("((p&~q)|(~p&q))", BasisReducer.toNotAndOr(Formula.parse("(p+q)")).toString());
            assertEquals("~(x|y)", BasisReducer.toNotAndOr(Formula.parse("(x-|y)")).toString());
        }

        @Test
        @DisplayName("Le costanti usano la prima variabile della formula come testimone")
        void testToNotAndOr_ConstantWitness() {
            assertEquals("(s&(s|~s))", BasisReducer.toNotAndOr(Formula.parse("(s&T)")).toString());
            assertEquals("(s&(~r|(r|~r)))", BasisReducer.toNotAndOr(Formula.parse("(s&(r->T))")).toString());
            assertEquals("(p&~p)", BasisReducer.toNotAndOr(Formula.parse("F")).toString());
        }

        @Test
        void testToNotAnd() {
            assertEquals("~(~p&~q)", BasisReducer.toNotAnd(Formula.parse("(p|q)")).toString());
        }

        @Test
        void testToNand() {
            assertEquals("(p-&p)", BasisReducer.toNand(Formula.parse("~p")).toString());
            assertEquals("((p-&q)-&(p-&q))", BasisReducer.toNand(Formula.parse("(p&q)")).toString());
        }

        @Test
        void testToNor() {
            assertEquals("(p-|p)", BasisReducer.toNor(Formula.parse("~p")).toString());
            assertEquals("((p-|q)-|(p-|q))", BasisReducer.toNor(Formula.parse("(p|q)")).toString());
        }

        @Test
        void testToImpliesNot() {
            assertEquals("~(p->~q)", BasisReducer.toImpliesNot(Formula.parse("(p&q)")).toString());
            assertEquals("(~p->q)", BasisReducer.toImpliesNot(Formula.parse("(p|q)")).toString());
            assertEquals("(q->q)", BasisReducer.toImpliesNot(Formula.parse("(q|T)")).getSecond().toString());
        }

        @Test
        @DisplayName("In {->,F} le costanti non richiedono variabili")
        void testToImpliesFalse() {
            assertEquals("(p->F)", BasisReducer.toImpliesFalse(Formula.parse("~p")).toString());
            assertEquals("F", BasisReducer.toImpliesFalse(Formula.parse("F")).toString());
            assertEquals("(F->F)", BasisReducer.toImpliesFalse(Formula.parse("T")).toString());
            assertEquals("((p->(q->F))->F)", BasisReducer.toImpliesFalse(Formula.parse("(p&q)")).toString());
        }

        @Test
        @DisplayName("La formula originale non viene modificata")
        void testReduction_ShouldNotMutateInput() {
            Formula original = Formula.parse("((p+q)<->T)");
            BasisReducer.toNand(original);
            assertEquals("((p+q)<->T)", original.toString());
        }
    }

    @Test
    @DisplayName("Flag della linea di comando")
    void testOperatorBasisFromFlag() {
        assertEquals(OperatorBasis.NAND, OperatorBasis.fromFlag("nand"));
        assertEquals(OperatorBasis.IMPLIES_FALSE, OperatorBasis.fromFlag("if"));
        assertEquals("{->,~}", OperatorBasis.IMPLIES_NOT.toString());
        assertThatThrownBy(() -> OperatorBasis.fromFlag("xor")).isInstanceOf(IllegalArgumentException.class);
    }
}
