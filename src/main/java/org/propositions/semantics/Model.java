package org.propositions.semantics;

import org.propositions.syntax.Formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * MODELLO - Assegnamento immutabile di valori di verità a variabili
 *
 * Usato sia come ambiente di valutazione sia come riga di una tabella di verità.
 * Preserva l'ordine di inserimento delle variabili (rilevante per la sintesi
 * delle clausole e per la stampa) ma l'uguaglianza dipende solo dal contenuto.
 *
 * INVARIANTE: ogni chiave è un nome di variabile valido.
 */
public final class Model {

    private static final Model EMPTY = new Model(new LinkedHashMap<>());

    private final Map<String, Boolean> assignment;

    private Model(LinkedHashMap<String, Boolean> assignment) {
        this.assignment = Collections.unmodifiableMap(assignment);
    }

    /**
     * Costruisce un modello dalla mappa data, copiandola.
     *
     * @param assignment mappa variabile → valore di verità
     * @return modello equivalente alla mappa
     * @throws IllegalArgumentException se una chiave non è una variabile o un valore è null
     */
    public static Model of(Map<String, Boolean> assignment) {
        if (assignment == null) {
            throw new IllegalArgumentException("Assegnamento non può essere null");
        }
        if (!isModel(assignment)) {
            throw new IllegalArgumentException("Non è un modello: " + assignment);
        }
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Valore null per la variabile " + entry.getKey());
            }
        }
        return new Model(new LinkedHashMap<>(assignment));
    }

    public static Model empty() {
        return EMPTY;
    }

    /**
     * Verifica che tutte le chiavi della mappa siano nomi di variabile.
     */
    public static boolean isModel(Map<String, Boolean> assignment) {
        for (String key : assignment.keySet()) {
            if (!Formula.isVariable(key)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return variabili su cui il modello è definito, in ordine di inserimento
     */
    public Set<String> variables() {
        return assignment.keySet();
    }

    /**
     * @param variable nome di variabile
     * @return valore assegnato
     * @throws IllegalArgumentException se il modello non definisce la variabile
     */
    public boolean valueOf(String variable) {
        Boolean value = assignment.get(variable);
        if (value == null) {
            throw new IllegalArgumentException("Variabile non definita nel modello: " + variable);
        }
        return value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Model)) return false;
        return assignment.equals(((Model) obj).assignment);
    }

    @Override
    public int hashCode() {
        return assignment.hashCode();
    }

    @Override
    public String toString() {
        return assignment.toString();
    }
}
