package org.propositions.operators;

import org.propositions.syntax.Formula;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * RIDUZIONE DI BASE - Riscrittura di formule su insiemi ristretti di operatori
 *
 * Ogni riduzione è una riscrittura totale che preserva la tabella di verità ed
 * elimina tutti gli operatori esterni alla base di arrivo. È definita da una
 * tabella di identità su p e q: la formula viene ridotta dal basso verso l'alto
 * e ogni nodo viene sostituito dall'identità del suo operatore, istanziata
 * sugli operandi già ridotti.
 *
 * BASI SUPPORTATE:
 * - {~, &, |}    toNotAndOr
 * - {~, &}       toNotAnd      (a partire da {~, &, |})
 * - {-&}         toNand        (a partire da {~, &})
 * - {-|}         toNor         (a partire da {~, &, |})
 * - {->, ~}      toImpliesNot
 * - {->, F}      toImpliesFalse (identità di {->, ~} con ~ riscritta come ->F)
 *
 * Le costanti T e F, quando escluse dalla base, vengono espresse tramite una
 * variabile testimone: la prima variabile della formula in ordine alfabetico,
 * oppure p se la formula non ne contiene.
 */
public final class BasisReducer {

    private static final Logger LOGGER = Logger.getLogger(BasisReducer.class.getName());

    /** Variabile testimone per formule prive di variabili */
    private static final String DEFAULT_WITNESS = "p";

    //region TABELLE DI IDENTITÀ

    private static final Map<String, Formula> NOT_AND_OR_IDENTITIES = Map.of(
            Formula.TRUE, Formula.parse("(p|~p)"),
            Formula.FALSE, Formula.parse("(p&~p)"),
            Formula.IMPLIES, Formula.parse("(~p|q)"),
            Formula.XOR, Formula.parse("((p&~q)|(~p&q))"),
            Formula.IFF, Formula.parse("((p&q)|(~p&~q))"),
            Formula.NAND, Formula.parse("~(p&q)"),
            Formula.NOR, Formula.parse("~(p|q)"));

    private static final Map<String, Formula> NOT_AND_IDENTITIES = Map.of(
            Formula.OR, Formula.parse("~(~p&~q)"));

    private static final Map<String, Formula> NAND_IDENTITIES = Map.of(
            Formula.NOT, Formula.parse("(p-&p)"),
            Formula.AND, Formula.parse("((p-&q)-&(p-&q))"));

    private static final Map<String, Formula> NOR_IDENTITIES = Map.of(
            Formula.NOT, Formula.parse("(p-|p)"),
            Formula.OR, Formula.parse("((p-|q)-|(p-|q))"),
            Formula.AND, Formula.parse("((p-|p)-|(q-|q))"));

    private static final Map<String, Formula> IMPLIES_NOT_IDENTITIES = Map.of(
            Formula.TRUE, Formula.parse("(p->p)"),
            Formula.FALSE, Formula.parse("~(p->p)"),
            Formula.AND, Formula.parse("~(p->~q)"),
            Formula.OR, Formula.parse("(~p->q)"),
            Formula.IFF, Formula.parse("~((p->q)->~(q->p))"),
            Formula.XOR, Formula.parse("((p->q)->~(q->p))"),
            Formula.NAND, Formula.parse("(p->~q)"),
            Formula.NOR, Formula.parse("~(~p->q)"));

    private static final Map<String, Formula> IMPLIES_FALSE_IDENTITIES = buildImpliesFalseIdentities();

    /**
     * Deriva le identità per {->, F} da quelle per {->, ~}: ogni negazione
     * diventa un'implicazione verso F. Le costanti non richiedono testimone.
     */
    private static Map<String, Formula> buildImpliesFalseIdentities() {
        Map<String, Formula> negationAsImplication = Map.of(Formula.NOT, Formula.parse("(p->F)"));

        Map<String, Formula> identities = new HashMap<>();
        for (Map.Entry<String, Formula> entry : IMPLIES_NOT_IDENTITIES.entrySet()) {
            identities.put(entry.getKey(), entry.getValue().substituteOperators(negationAsImplication));
        }
        identities.put(Formula.NOT, Formula.parse("(p->F)"));
        identities.put(Formula.TRUE, Formula.parse("(F->F)"));
        identities.remove(Formula.FALSE); // F appartiene alla base
        return Map.copyOf(identities);
    }

    //endregion

    private BasisReducer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region INTERFACCIA PUBBLICA

    /**
     * Converte la formula in una equivalente che usa solo ~, &amp; e |.
     */
    public static Formula toNotAndOr(Formula formula) {
        return reduce(formula, NOT_AND_OR_IDENTITIES, "{~,&,|}");
    }

    /**
     * Converte la formula in una equivalente che usa solo ~ e &amp;.
     */
    public static Formula toNotAnd(Formula formula) {
        return reduce(toNotAndOr(formula), NOT_AND_IDENTITIES, "{~,&}");
    }

    /**
     * Converte la formula in una equivalente che usa solo -&amp;.
     */
    public static Formula toNand(Formula formula) {
        return reduce(toNotAnd(formula), NAND_IDENTITIES, "{-&}");
    }

    /**
     * Converte la formula in una equivalente che usa solo -|.
     */
    public static Formula toNor(Formula formula) {
        return reduce(toNotAndOr(formula), NOR_IDENTITIES, "{-|}");
    }

    /**
     * Converte la formula in una equivalente che usa solo -&gt; e ~.
     */
    public static Formula toImpliesNot(Formula formula) {
        return reduce(formula, IMPLIES_NOT_IDENTITIES, "{->,~}");
    }

    /**
     * Converte la formula in una equivalente che usa solo -&gt; e la costante F.
     */
    public static Formula toImpliesFalse(Formula formula) {
        return reduce(formula, IMPLIES_FALSE_IDENTITIES, "{->,F}");
    }

    //endregion

    //region RIDUZIONE BOTTOM-UP

    private static Formula reduce(Formula formula, Map<String, Formula> identities, String basis) {
        Formula witness = new Formula(chooseWitness(formula));
        Formula result = reduceNode(formula, identities, witness);
        LOGGER.fine("Riduzione " + basis + ": " + formula + " -> " + result);
        return result;
    }

    /**
     * Riduce i figli e poi applica l'identità dell'operatore radice, se presente.
     * Gli operatori senza identità sono già nella base e vengono ricostruiti
     * sui figli ridotti.
     */
    private static Formula reduceNode(Formula formula, Map<String, Formula> identities, Formula witness) {
        Formula identity = identities.get(formula.getRoot());

        return switch (formula.getKind()) {
            case VARIABLE -> formula;

            case CONSTANT -> identity != null
                    ? Formula.instantiate(identity, witness, null)
                    : formula;

            case UNARY -> {
                Formula operand = reduceNode(formula.getFirst(), identities, witness);
                yield identity != null
                        ? Formula.instantiate(identity, operand, null)
                        : new Formula(formula.getRoot(), operand);
            }

            case BINARY -> {
                Formula left = reduceNode(formula.getFirst(), identities, witness);
                Formula right = reduceNode(formula.getSecond(), identities, witness);
                yield identity != null
                        ? Formula.instantiate(identity, left, right)
                        : new Formula(formula.getRoot(), left, right);
            }
        };
    }

    private static String chooseWitness(Formula formula) {
        if (formula.variables().isEmpty()) {
            return DEFAULT_WITNESS;
        }
        return new TreeSet<>(formula.variables()).first();
    }

    //endregion
}
