package org.propositions.semantics;

import org.propositions.syntax.Formula;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * SINTESI DA TABELLA DI VERITÀ - Costruzione di formule in DNF e CNF
 *
 * Dati una lista di variabili e i valori di verità desiderati, allineati uno a
 * uno con i modelli prodotti da {@link Semantics#allModels(List)}, costruisce
 * una formula con esattamente quella tabella di verità.
 *
 * FORME PRODOTTE:
 * - DNF: disgiunzione di congiunzioni, una per ogni riga vera
 * - CNF: congiunzione di disgiunzioni, una per ogni riga falsa
 *
 * Letterali e clausole sono annidati a sinistra nell'ordine della lista di
 * variabili e dei modelli.
 */
public final class Synthesizer {

    private static final Logger LOGGER = Logger.getLogger(Synthesizer.class.getName());

    private Synthesizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region SINTESI DNF

    /**
     * Sintetizza una formula in DNF con la tabella di verità specificata.
     *
     * @param variables lista non vuota di variabili
     * @param values valori di verità nell'ordine di {@code allModels(variables)}
     * @return formula in DNF; (v&amp;~v) sulla prima variabile se nessun valore è vero
     * @throws IllegalArgumentException se le variabili sono vuote o il numero di valori è errato
     */
    public static Formula synthesize(List<String> variables, List<Boolean> values) {
        List<Model> models = alignedModels(variables, values);

        List<Formula> clauses = new ArrayList<>();
        for (int row = 0; row < models.size(); row++) {
            if (values.get(row)) {
                clauses.add(synthesizeForModel(models.get(row)));
            }
        }

        if (clauses.isEmpty()) {
            Formula v = new Formula(variables.get(0));
            return new Formula(Formula.AND, v, new Formula(Formula.NOT, v));
        }

        Formula result = joinLeft(Formula.OR, clauses);
        LOGGER.fine("Sintesi DNF su " + variables + ": " + result);
        return result;
    }

    /**
     * Sintetizza la congiunzione di letterali vera esattamente nel modello dato
     * (tra i modelli sulle stesse variabili).
     *
     * @param model modello su un insieme non vuoto di variabili
     * @return congiunzione dei letterali, nell'ordine delle variabili del modello
     */
    public static Formula synthesizeForModel(Model model) {
        List<Formula> literals = new ArrayList<>();
        for (String variable : nonEmptyVariables(model)) {
            Formula atom = new Formula(variable);
            literals.add(model.valueOf(variable) ? atom : new Formula(Formula.NOT, atom));
        }
        return joinLeft(Formula.AND, literals);
    }

    //endregion

    //region SINTESI CNF

    /**
     * Sintetizza una formula in CNF con la tabella di verità specificata.
     *
     * @param variables lista non vuota di variabili
     * @param values valori di verità nell'ordine di {@code allModels(variables)}
     * @return formula in CNF; (v|~v) sulla prima variabile se nessun valore è falso
     * @throws IllegalArgumentException se le variabili sono vuote o il numero di valori è errato
     */
    public static Formula synthesizeCnf(List<String> variables, List<Boolean> values) {
        List<Model> models = alignedModels(variables, values);

        List<Formula> clauses = new ArrayList<>();
        for (int row = 0; row < models.size(); row++) {
            if (!values.get(row)) {
                clauses.add(synthesizeForAllExceptModel(models.get(row)));
            }
        }

        if (clauses.isEmpty()) {
            Formula v = new Formula(variables.get(0));
            return new Formula(Formula.OR, v, new Formula(Formula.NOT, v));
        }

        Formula result = joinLeft(Formula.AND, clauses);
        LOGGER.fine("Sintesi CNF su " + variables + ": " + result);
        return result;
    }

    /**
     * Sintetizza la disgiunzione di letterali falsa esattamente nel modello dato
     * (tra i modelli sulle stesse variabili).
     *
     * @param model modello su un insieme non vuoto di variabili
     * @return disgiunzione dei letterali, nell'ordine delle variabili del modello
     */
    public static Formula synthesizeForAllExceptModel(Model model) {
        List<Formula> literals = new ArrayList<>();
        for (String variable : nonEmptyVariables(model)) {
            Formula atom = new Formula(variable);
            literals.add(model.valueOf(variable) ? new Formula(Formula.NOT, atom) : atom);
        }
        return joinLeft(Formula.OR, literals);
    }

    //endregion

    //region UTILITY

    private static List<Model> alignedModels(List<String> variables, List<Boolean> values) {
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("La sintesi richiede almeno una variabile");
        }
        if (values == null || values.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("I valori di verità non possono essere null");
        }

        List<Model> models = Semantics.allModels(variables);
        if (models.size() != values.size()) {
            throw new IllegalArgumentException("Attesi " + models.size() + " valori di verità per "
                    + variables + ", ricevuti " + values.size());
        }
        return models;
    }

    private static Iterable<String> nonEmptyVariables(Model model) {
        if (model.variables().isEmpty()) {
            throw new IllegalArgumentException("Il modello deve definire almeno una variabile");
        }
        return model.variables();
    }

    /**
     * Unisce gli operandi con l'operatore dato annidando a sinistra:
     * [a, b, c] diventa ((a op b) op c).
     */
    private static Formula joinLeft(String operator, List<Formula> operands) {
        Iterator<Formula> iterator = operands.iterator();
        Formula result = iterator.next();
        while (iterator.hasNext()) {
            result = new Formula(operator, result, iterator.next());
        }
        return result;
    }

    //endregion
}
