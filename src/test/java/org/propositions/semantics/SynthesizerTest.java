package org.propositions.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.propositions.syntax.Formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SynthesizerTest {

    private static final List<String> PQ = List.of("p", "q");

    @Test
    @DisplayName("DNF con la tabella di verità richiesta")
    void testSynthesize_ReferenceTable() {
        List<Boolean> values = List.of(true, true, true, false);
        Formula formula = Synthesizer.synthesize(PQ, values);

        assertEquals(values, Semantics.truthValues(formula, Semantics.allModels(PQ)));
        assertEquals("(((~p&~q)|(~p&q))|(p&~q))", formula.toString());
    }

    @Test
    @DisplayName("CNF con la tabella di verità richiesta")
    void testSynthesizeCnf_ReferenceTable() {
        List<Boolean> values = List.of(true, true, true, false);
        Formula formula = Synthesizer.synthesizeCnf(PQ, values);

        assertEquals(values, Semantics.truthValues(formula, Semantics.allModels(PQ)));
        assertEquals("(~p|~q)", formula.toString());
    }

    @Test
    @DisplayName("Tutte le tabelle su tre variabili vengono riprodotte")
    void testSynthesize_AllTablesOverThreeVariables() {
        List<String> variables = List.of("p", "q", "r");
        List<Model> models = Semantics.allModels(variables);

        for (int table = 0; table < 256; table++) {
            List<Boolean> values = new ArrayList<>();
            for (int row = 0; row < 8; row++) {
                values.add(((table >> row) & 1) == 1);
            }

            assertEquals(values, Semantics.truthValues(Synthesizer.synthesize(variables, values), models),
                    "DNF per la tabella " + table);
            assertEquals(values, Semantics.truthValues(Synthesizer.synthesizeCnf(variables, values), models),
                    "CNF per la tabella " + table);
        }
    }

    @Test
    @DisplayName("Nessuna riga vera o nessuna riga falsa producono formule fisse")
    void testSynthesize_DegenerateTables() {
        List<Boolean> allFalse = List.of(false, false, false, false);
        List<Boolean> allTrue = List.of(true, true, true, true);

        assertEquals("(p&~p)", Synthesizer.synthesize(PQ, allFalse).toString());
        assertEquals("(p|~p)", Synthesizer.synthesizeCnf(PQ, allTrue).toString());
    }

    @Test
    @DisplayName("Clausola per un singolo modello")
    void testSynthesizeForModel() {
        Model model = Semantics.allModels(List.of("q", "p")).get(2);

        assertEquals("(q&~p)", Synthesizer.synthesizeForModel(model).toString());
        assertEquals("(~q|p)", Synthesizer.synthesizeForAllExceptModel(model).toString());
    }

    @Test
    @DisplayName("Liste immutabili di valori vengono accettate da entrambe le forme")
    void testSynthesize_WithImmutableValueList() {
        List<Boolean> values = List.of(true, true, true, false);

        assertEquals(values, Semantics.truthValues(Synthesizer.synthesize(PQ, values), Semantics.allModels(PQ)));
        assertEquals(values, Semantics.truthValues(Synthesizer.synthesizeCnf(PQ, values), Semantics.allModels(PQ)));
    }

    @Test
    @DisplayName("Parametri non validi violano la precondizione")
    void testSynthesize_InvalidInput_ShouldFail() {
        assertThatThrownBy(() -> Synthesizer.synthesize(List.of(), List.of(true)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Synthesizer.synthesizeCnf(PQ, List.of(true, false)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("4");
        assertThatThrownBy(() -> Synthesizer.synthesize(PQ, Arrays.asList(true, null, false, true)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(Synthesizer.synthesize(List.of("x1"), List.of(false, true)).toString()).isEqualTo("x1");
    }
}
