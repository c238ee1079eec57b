package org.propositions.operators;

import org.propositions.syntax.Formula;

import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Basi di operatori raggiungibili tramite {@link BasisReducer}, con il flag
 * usato dalla linea di comando e la riduzione corrispondente.
 */
public enum OperatorBasis {

    NOT_AND_OR("nao", Set.of(Formula.NOT, Formula.AND, Formula.OR), BasisReducer::toNotAndOr),
    NOT_AND("na", Set.of(Formula.NOT, Formula.AND), BasisReducer::toNotAnd),
    NAND("nand", Set.of(Formula.NAND), BasisReducer::toNand),
    NOR("nor", Set.of(Formula.NOR), BasisReducer::toNor),
    IMPLIES_NOT("in", Set.of(Formula.IMPLIES, Formula.NOT), BasisReducer::toImpliesNot),
    IMPLIES_FALSE("if", Set.of(Formula.IMPLIES, Formula.FALSE), BasisReducer::toImpliesFalse);

    private final String flag;
    private final Set<String> symbols;
    private final UnaryOperator<Formula> reducer;

    OperatorBasis(String flag, Set<String> symbols, UnaryOperator<Formula> reducer) {
        this.flag = flag;
        this.symbols = symbols;
        this.reducer = reducer;
    }

    public String getFlag() {
        return flag;
    }

    /**
     * @return operatori e costanti ammessi nella base
     */
    public Set<String> getSymbols() {
        return symbols;
    }

    public Formula reduce(Formula formula) {
        return reducer.apply(formula);
    }

    /**
     * @return true se la formula usa solo simboli della base
     */
    public boolean contains(Formula formula) {
        return symbols.containsAll(formula.operators());
    }

    /**
     * @param flag flag da linea di comando (nao, na, nand, nor, in, if)
     * @return base corrispondente
     * @throws IllegalArgumentException se il flag non è riconosciuto
     */
    public static OperatorBasis fromFlag(String flag) {
        for (OperatorBasis basis : values()) {
            if (basis.flag.equals(flag)) {
                return basis;
            }
        }
        throw new IllegalArgumentException("Base di operatori sconosciuta: " + flag + ". Supportate: "
                + Arrays.stream(values()).map(OperatorBasis::getFlag).collect(Collectors.joining(", ")));
    }

    @Override
    public String toString() {
        return "{" + String.join(",", new TreeSet<>(symbols)) + "}";
    }
}
