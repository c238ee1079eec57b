package org.propositions.syntax;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FormulaParserTest {

    @Nested
    @DisplayName("Notazione standard")
    class StandardNotationTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "p", "x12", "T", "F", "~p", "~~q1", "(p&q)", "(p|q)", "(p->q)", "(p+q)",
                "(p<->q)", "(p-&q)", "(p-|q)", "~(p&q76)", "((p1<->~F)-|(~r->(s+T)))"
        })
        @DisplayName("Formule valide vengono riconosciute e ristampate identiche")
        void testParse_ValidFormula_ShouldRoundTrip(String text) {
            assertTrue(Formula.isFormula(text));
            assertEquals(text, Formula.parse(text).toString());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "", "a", "p q", "(p)", "(p&q", "p&q", "(p&q))", "((p&q)", "(p<-q)", "(p-q)",
                "~", "(~&q)", "pq", "(p&&q)", "T1", "(p & q)"
        })
        @DisplayName("Formule non valide vengono rifiutate")
        void testIsFormula_InvalidText_ShouldBeRejected(String text) {
            assertFalse(Formula.isFormula(text));
        }

        @Test
        @DisplayName("Le variabili consumano tutte le cifre successive")
        void testParse_VariableConsumesDigitRun() {
            Formula formula = Formula.parse("(x12&~y345)");
            assertThat(formula.variables()).containsExactlyInAnyOrder("x12", "y345");
        }

        @Test
        @DisplayName("<-> viene riconosciuto prima di ->")
        void testParse_IffBeforeImplies() {
            Formula formula = Formula.parse("(p<->q)");
            assertEquals("<->", formula.getRoot());
            assertEquals("p", formula.getFirst().getRoot());
        }

        @Test
        @DisplayName("Il fallimento riporta una diagnostica leggibile")
        void testParseStandard_Failure_ShouldCarryDiagnostic() {
            ParseResult result = FormulaParser.parseStandard("(p&q");

            assertFalse(result.isSuccess());
            assertThat(result.getErrorMessage()).isNotBlank();
            assertThatThrownBy(result::getFormula).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("parse su input non valido viola la precondizione")
        void testParse_InvalidText_ShouldThrow() {
            assertThatThrownBy(() -> Formula.parse("(p&q"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("(p&q");
        }
    }

    @Nested
    @DisplayName("Notazione polacca")
    class PolishNotationTests {

        @Test
        @DisplayName("Serializzazione prefissa")
        void testToPolish() {
            assertEquals("~&pq76", Formula.parse("~(p&q76)").toPolish());
            assertEquals("->|x~yT", Formula.parse("((x|~y)->T)").toPolish());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "p", "~(p&q76)", "((x|~y)->T)", "(~(p1->q)&(r|~~F))", "((p&q)->(q&p))"
        })
        @DisplayName("Le formule su ~ & | -> e costanti tornano identiche")
        void testParsePolish_ShouldRoundTrip(String text) {
            Formula formula = Formula.parse(text);
            assertEquals(formula, Formula.parsePolish(formula.toPolish()));
        }

        @Test
        @DisplayName("Le variabili con cifre vengono lette per intero")
        void testParsePolish_VariableDigits() {
            Formula formula = Formula.parsePolish("&p12q3");
            assertEquals("(p12&q3)", formula.toString());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "&p", "->p", "pq", "~", "+pq", "<->pq", "(p)", "&pqr", "a"})
        @DisplayName("Operandi mancanti, simboli estranei e caratteri residui vengono rifiutati")
        void testParsePolish_InvalidText_ShouldBeRejected(String text) {
            assertFalse(FormulaParser.parsePolish(text).isSuccess());
            assertThatThrownBy(() -> Formula.parsePolish(text)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
