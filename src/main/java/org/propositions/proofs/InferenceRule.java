package org.propositions.proofs;

import org.propositions.syntax.Formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Regola di inferenza: sequenza ordinata di assunzioni e una conclusione.
 * Immutabile; la validazione strutturale delle regole non è compito di questa classe.
 */
public final class InferenceRule {

    private final List<Formula> assumptions;
    private final Formula conclusion;

    /**
     * @param assumptions assunzioni in ordine (non null, può essere vuota)
     * @param conclusion conclusione (non null)
     * @throws IllegalArgumentException se uno dei parametri è null
     */
    public InferenceRule(List<Formula> assumptions, Formula conclusion) {
        if (assumptions == null || assumptions.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Le assunzioni non possono essere null");
        }
        if (conclusion == null) {
            throw new IllegalArgumentException("La conclusione non può essere null");
        }
        this.assumptions = List.copyOf(assumptions);
        this.conclusion = conclusion;
    }

    public List<Formula> getAssumptions() {
        return assumptions;
    }

    public Formula getConclusion() {
        return conclusion;
    }

    /**
     * @return tutte le variabili di assunzioni e conclusione
     */
    public Set<String> variables() {
        Set<String> variables = new LinkedHashSet<>();
        for (Formula assumption : assumptions) {
            variables.addAll(assumption.variables());
        }
        variables.addAll(conclusion.variables());
        return Collections.unmodifiableSet(variables);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InferenceRule)) return false;
        InferenceRule other = (InferenceRule) obj;
        return assumptions.equals(other.assumptions) && conclusion.equals(other.conclusion);
    }

    @Override
    public int hashCode() {
        return 31 * assumptions.hashCode() + conclusion.hashCode();
    }

    @Override
    public String toString() {
        return assumptions.stream().map(Formula::toString).collect(Collectors.joining(", ", "[", "]"))
                + " ==> " + conclusion;
    }
}
