package org.propositions.semantics;

import org.propositions.proofs.InferenceRule;
import org.propositions.syntax.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * SEMANTICA PROPOSIZIONALE - Valutazione, modelli e classificazione delle formule
 *
 * Calcola il valore di verità di una formula in un modello, enumera tutti i
 * modelli su un insieme di variabili e, per enumerazione esaustiva della tabella
 * di verità, decide tautologia, contraddizione, soddisfacibilità e correttezza
 * delle regole di inferenza.
 *
 * ORDINE DEI MODELLI (contratto esterno):
 * le variabili che compaiono prima nella lista variano più lentamente, con
 * falso prima di vero, come un contatore binario.
 */
public final class Semantics {

    private static final Logger LOGGER = Logger.getLogger(Semantics.class.getName());

    /** Limite per l'enumerazione: 2^30 modelli sono già ben oltre l'uso pratico */
    public static final int MAX_ENUMERATED_VARIABLES = 30;

    private Semantics() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region VALUTAZIONE

    /**
     * Calcola il valore di verità della formula nel modello.
     *
     * @param formula formula da valutare
     * @param model modello definito (almeno) sulle variabili della formula
     * @return valore di verità della formula nel modello
     * @throws IllegalArgumentException se il modello non copre le variabili della formula
     */
    public static boolean evaluate(Formula formula, Model model) {
        if (!model.variables().containsAll(formula.variables())) {
            throw new IllegalArgumentException("Il modello " + model
                    + " non definisce tutte le variabili di " + formula);
        }
        return evaluateNode(formula, model);
    }

    private static boolean evaluateNode(Formula formula, Model model) {
        String root = formula.getRoot();

        return switch (formula.getKind()) {
            case CONSTANT -> Formula.TRUE.equals(root);
            case VARIABLE -> model.valueOf(root);
            case UNARY -> !evaluateNode(formula.getFirst(), model);
            case BINARY -> {
                boolean left = evaluateNode(formula.getFirst(), model);
                boolean right = evaluateNode(formula.getSecond(), model);
                yield applyBinary(root, left, right);
            }
        };
    }

    private static boolean applyBinary(String operator, boolean left, boolean right) {
        return switch (operator) {
            case Formula.AND -> left && right;
            case Formula.OR -> left || right;
            case Formula.IMPLIES -> !left || right;
            case Formula.XOR -> left != right;
            case Formula.IFF -> left == right;
            case Formula.NAND -> !(left && right);
            case Formula.NOR -> !(left || right);
            default -> throw new IllegalArgumentException("Operatore binario sconosciuto: " + operator);
        };
    }

    //endregion

    //region ENUMERAZIONE MODELLI E TABELLE DI VERITÀ

    /**
     * Calcola tutti i modelli possibili sulle variabili date, in ordine
     * lessicografico secondo l'ordine della lista (falso prima di vero).
     *
     * ESEMPIO:
     * [p, q] produce {p=F,q=F}, {p=F,q=T}, {p=T,q=F}, {p=T,q=T}
     *
     * @param variables nomi di variabile, nell'ordine desiderato
     * @return lista non modificabile dei 2^n modelli
     * @throws IllegalArgumentException se un nome non è una variabile
     */
    public static List<Model> allModels(List<String> variables) {
        for (String variable : variables) {
            if (!Formula.isVariable(variable)) {
                throw new IllegalArgumentException("Non è un nome di variabile: " + variable);
            }
        }
        if (variables.size() > MAX_ENUMERATED_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili da enumerare: " + variables.size());
        }

        int count = variables.size();
        int total = 1 << count;
        List<Model> models = new ArrayList<>(total);

        for (int row = 0; row < total; row++) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (int i = 0; i < count; i++) {
                // La prima variabile corrisponde al bit più significativo
                assignment.put(variables.get(i), ((row >> (count - 1 - i)) & 1) == 1);
            }
            models.add(Model.of(assignment));
        }

        LOGGER.finest("Enumerati " + total + " modelli su " + variables);
        return Collections.unmodifiableList(models);
    }

    /**
     * Valuta la formula in ciascuno dei modelli dati, nello stesso ordine.
     */
    public static List<Boolean> truthValues(Formula formula, Iterable<Model> models) {
        List<Boolean> values = new ArrayList<>();
        for (Model model : models) {
            values.add(evaluate(formula, model));
        }
        return values;
    }

    /**
     * Produce la tabella di verità della formula, con le colonne delle
     * variabili ordinate alfabeticamente.
     *
     * FORMATO OUTPUT:
     * <pre>
     * | p | q76 | ~(p&amp;q76) |
     * |---|-----|----------|
     * | F | F   | T        |
     * </pre>
     *
     * @param formula formula di cui calcolare la tabella
     * @return tabella come testo, una riga per linea
     */
    public static String truthTable(Formula formula) {
        List<String> sortedVariables = sortedVariables(formula);
        List<String> columns = new ArrayList<>(sortedVariables);
        columns.add(formula.toString());

        StringBuilder table = new StringBuilder();
        table.append("| ").append(String.join(" | ", columns)).append(" |\n");

        List<String> separators = new ArrayList<>();
        for (String column : columns) {
            separators.add("-".repeat(column.length()));
        }
        table.append("|-").append(String.join("-|-", separators)).append("-|\n");

        for (Model model : allModels(sortedVariables)) {
            List<String> cells = new ArrayList<>();
            for (String variable : sortedVariables) {
                cells.add(padCell(model.valueOf(variable), variable.length()));
            }
            cells.add(padCell(evaluate(formula, model), formula.toString().length()));
            table.append("| ").append(String.join(" | ", cells)).append(" |\n");
        }

        return table.toString();
    }

    private static String padCell(boolean value, int width) {
        String cell = value ? Formula.TRUE : Formula.FALSE;
        return cell + " ".repeat(width - cell.length());
    }

    private static List<String> sortedVariables(Formula formula) {
        List<String> variables = new ArrayList<>(formula.variables());
        Collections.sort(variables);
        return variables;
    }

    //endregion

    //region CLASSIFICAZIONE

    /**
     * @return true se la formula è vera in ogni modello sulle sue variabili
     */
    public static boolean isTautology(Formula formula) {
        for (Model model : allModels(sortedVariables(formula))) {
            if (!evaluate(formula, model)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true se la formula è falsa in ogni modello sulle sue variabili
     */
    public static boolean isContradiction(Formula formula) {
        return !isSatisfiable(formula);
    }

    /**
     * @return true se esiste almeno un modello in cui la formula è vera
     */
    public static boolean isSatisfiable(Formula formula) {
        for (Model model : allModels(sortedVariables(formula))) {
            if (evaluate(formula, model)) {
                return true;
            }
        }
        return false;
    }

    //endregion

    //region REGOLE DI INFERENZA

    /**
     * Verifica se la regola vale nel modello: la regola è violata solo quando
     * tutte le assunzioni sono vere e la conclusione è falsa.
     *
     * @param rule regola di inferenza
     * @param model modello definito sulle variabili della regola
     * @return true se la regola vale nel modello
     * @throws IllegalArgumentException se il modello non copre tutte le variabili della regola
     */
    public static boolean evaluateInference(InferenceRule rule, Model model) {
        if (!model.variables().containsAll(rule.variables())) {
            throw new IllegalArgumentException("Il modello " + model
                    + " non definisce tutte le variabili della regola " + rule);
        }
        for (Formula assumption : rule.getAssumptions()) {
            if (!evaluate(assumption, model)) {
                return true;
            }
        }
        return evaluate(rule.getConclusion(), model);
    }

    /**
     * Verifica se la regola è corretta, cioè se vale in ogni modello
     * sull'unione delle variabili di assunzioni e conclusione.
     */
    public static boolean isSoundInference(InferenceRule rule) {
        List<String> variables = new ArrayList<>(rule.variables());
        Collections.sort(variables);

        for (Model model : allModels(variables)) {
            if (!evaluateInference(rule, model)) {
                LOGGER.fine("Regola " + rule + " violata nel modello " + model);
                return false;
            }
        }
        return true;
    }

    //endregion
}
