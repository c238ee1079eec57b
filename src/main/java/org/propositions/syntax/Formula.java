package org.propositions.syntax;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Rappresenta una formula della logica proposizionale come albero binario
 * immutabile, composto da variabili, costanti e operatori applicati ai loro
 * operandi. I sottoalberi possono essere condivisi liberamente tra più formule
 * poiché nessuna operazione modifica un nodo esistente.
 *
 * VARIANTI DEL NODO (determinate dal simbolo radice):
 * - Variabile: p..z seguita da cifre decimali opzionali (p, q76, x12)
 * - Costante: T (vero) o F (falso)
 * - Unario: ~ con un solo operando (first)
 * - Binario: & | -> + <-> -& -| con due operandi (first, second)
 *
 * INVARIANTI MANTENUTE:
 * - L'arità del nodo è verificata in costruzione rispetto al simbolo radice
 * - Uguaglianza e ordinamento sono quelli della rappresentazione standard
 * - Rappresentazione testuale, variabili e operatori sono calcolati una sola volta
 */
public final class Formula implements Comparable<Formula> {

    private static final Logger LOGGER = Logger.getLogger(Formula.class.getName());

    //region SIMBOLI DEL LINGUAGGIO

    public static final String TRUE = "T";
    public static final String FALSE = "F";
    public static final String NOT = "~";
    public static final String AND = "&";
    public static final String OR = "|";
    public static final String IMPLIES = "->";
    public static final String XOR = "+";
    public static final String IFF = "<->";
    public static final String NAND = "-&";
    public static final String NOR = "-|";

    /** Operatori binari ammessi nella notazione standard */
    private static final Set<String> BINARY_OPERATORS =
            Set.of(AND, OR, IMPLIES, XOR, IFF, NAND, NOR);

    /** Variabili libere ammesse nei modelli di sostituzione operatori */
    private static final Set<String> TEMPLATE_VARIABLES = Set.of("p", "q");

    //endregion

    //region STRUTTURA DATI

    /**
     * Tipi di nodo dell'albero, derivati dal simbolo radice.
     */
    public enum Kind {
        VARIABLE,   // Foglia: p, q76, ...
        CONSTANT,   // Foglia: T, F
        UNARY,      // Negazione: ~A
        BINARY      // Operatore binario: (A op B)
    }

    /** Simbolo alla radice: variabile, costante o operatore */
    private final String root;

    /** Primo operando (solo per nodi unari e binari) */
    private final Formula first;

    /** Secondo operando (solo per nodi binari) */
    private final Formula second;

    /** Tipo del nodo, fissato in costruzione */
    private final Kind kind;

    // Cache delle proprietà derivate: l'albero non cambia mai, il ricalcolo è idempotente
    private String cachedString;
    private Set<String> cachedVariables;
    private Set<String> cachedOperators;

    //endregion

    //region COSTRUTTORI E VALIDAZIONE ARITÀ

    /**
     * Costruisce una foglia (variabile o costante).
     *
     * @param root nome della variabile o costante
     * @throws IllegalArgumentException se il simbolo richiede operandi o non è valido
     */
    public Formula(String root) {
        this(root, null, null);
    }

    /**
     * Costruisce un nodo unario.
     *
     * @param root operatore unario
     * @param first operando (non null)
     * @throws IllegalArgumentException se il simbolo non è unario o l'operando manca
     */
    public Formula(String root, Formula first) {
        this(root, first, null);
    }

    /**
     * Costruisce un nodo con simbolo radice e operandi, verificando che l'arità
     * corrisponda al simbolo.
     *
     * @param root simbolo alla radice
     * @param first primo operando, se richiesto dal simbolo
     * @param second secondo operando, se richiesto dal simbolo
     * @throws IllegalArgumentException se simbolo e operandi non sono coerenti
     */
    public Formula(String root, Formula first, Formula second) {
        if (root == null || root.isEmpty()) {
            throw new IllegalArgumentException("Simbolo radice non può essere null o vuoto");
        }

        if (isVariable(root) || isConstant(root)) {
            if (first != null || second != null) {
                throw new IllegalArgumentException("La foglia '" + root + "' non può avere operandi");
            }
            this.kind = isVariable(root) ? Kind.VARIABLE : Kind.CONSTANT;
        } else if (isUnary(root)) {
            if (first == null || second != null) {
                throw new IllegalArgumentException("L'operatore unario '" + root + "' richiede esattamente un operando");
            }
            this.kind = Kind.UNARY;
        } else if (isBinary(root)) {
            if (first == null || second == null) {
                throw new IllegalArgumentException("L'operatore binario '" + root + "' richiede esattamente due operandi");
            }
            this.kind = Kind.BINARY;
        } else {
            throw new IllegalArgumentException("Simbolo radice non riconosciuto: " + root);
        }

        this.root = root;
        this.first = first;
        this.second = second;
    }

    //endregion

    //region RICONOSCIMENTO SIMBOLI

    /**
     * Verifica se la stringa è un nome di variabile: lettera tra p e z seguita
     * da zero o più cifre decimali.
     */
    public static boolean isVariable(String string) {
        if (string == null || string.isEmpty()) {
            return false;
        }
        char head = string.charAt(0);
        if (head < 'p' || head > 'z') {
            return false;
        }
        for (int i = 1; i < string.length(); i++) {
            char c = string.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    public static boolean isConstant(String string) {
        return TRUE.equals(string) || FALSE.equals(string);
    }

    public static boolean isUnary(String string) {
        return NOT.equals(string);
    }

    public static boolean isBinary(String string) {
        return string != null && BINARY_OPERATORS.contains(string);
    }

    //endregion

    //region ACCESSORI

    public String getRoot() {
        return root;
    }

    /**
     * @return primo operando, oppure null per le foglie
     */
    public Formula getFirst() {
        return first;
    }

    /**
     * @return secondo operando, oppure null per foglie e nodi unari
     */
    public Formula getSecond() {
        return second;
    }

    public Kind getKind() {
        return kind;
    }

    //endregion

    //region PROPRIETÀ DERIVATE

    /**
     * Raccoglie tutti i nomi di variabile presenti nella formula.
     * Le costanti T e F non sono variabili e vengono escluse.
     *
     * @return insieme non modificabile dei nomi di variabile
     */
    public Set<String> variables() {
        if (cachedVariables == null) {
            Set<String> collected = new LinkedHashSet<>();
            collectVariables(collected);
            cachedVariables = Collections.unmodifiableSet(collected);
        }
        return cachedVariables;
    }

    private void collectVariables(Set<String> variables) {
        switch (kind) {
            case VARIABLE -> variables.add(root);
            case CONSTANT -> { /* nessuna variabile */ }
            case UNARY -> first.collectVariables(variables);
            case BINARY -> {
                first.collectVariables(variables);
                second.collectVariables(variables);
            }
        }
    }

    /**
     * Raccoglie tutti gli operatori presenti nella formula, incluse le costanti
     * T e F, esclusi i nomi di variabile.
     *
     * @return insieme non modificabile dei simboli
     */
    public Set<String> operators() {
        if (cachedOperators == null) {
            Set<String> collected = new LinkedHashSet<>();
            collectOperators(collected);
            cachedOperators = Collections.unmodifiableSet(collected);
        }
        return cachedOperators;
    }

    private void collectOperators(Set<String> operators) {
        switch (kind) {
            case VARIABLE -> { /* le variabili non sono operatori */ }
            case CONSTANT -> operators.add(root);
            case UNARY -> {
                operators.add(root);
                first.collectOperators(operators);
            }
            case BINARY -> {
                operators.add(root);
                first.collectOperators(operators);
                second.collectOperators(operators);
            }
        }
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE E PARSING

    /**
     * Rappresentazione standard completamente parentesizzata.
     *
     * FORMATO OUTPUT:
     * - Foglie: il simbolo stesso (p, q76, T)
     * - Negazioni: ~ seguito dall'operando (~p, ~(p&q))
     * - Binari: (primo operatore secondo), senza spazi
     */
    @Override
    public String toString() {
        if (cachedString == null) {
            cachedString = switch (kind) {
                case VARIABLE, CONSTANT -> root;
                case UNARY -> root + first;
                case BINARY -> "(" + first + root + second + ")";
            };
        }
        return cachedString;
    }

    /**
     * Rappresentazione in notazione polacca (prefissa): il simbolo radice
     * seguito dalle rappresentazioni polacche degli operandi.
     */
    public String toPolish() {
        return switch (kind) {
            case VARIABLE, CONSTANT -> root;
            case UNARY -> root + first.toPolish();
            case BINARY -> root + first.toPolish() + second.toPolish();
        };
    }

    /**
     * Verifica se la stringa è una rappresentazione standard valida di una formula.
     */
    public static boolean isFormula(String string) {
        return FormulaParser.parseStandard(string).isSuccess();
    }

    /**
     * Converte una rappresentazione standard valida nella formula corrispondente.
     *
     * @param string rappresentazione standard, già verificata con {@link #isFormula}
     * @return formula la cui rappresentazione standard è la stringa data
     * @throws IllegalArgumentException se la stringa non è una formula valida
     */
    public static Formula parse(String string) {
        ParseResult result = FormulaParser.parseStandard(string);
        if (!result.isSuccess()) {
            throw new IllegalArgumentException("Formula non valida '" + string + "': " + result.getErrorMessage());
        }
        return result.getFormula();
    }

    /**
     * Converte una rappresentazione in notazione polacca nella formula corrispondente.
     *
     * @param string rappresentazione polacca
     * @return formula la cui rappresentazione polacca è la stringa data
     * @throws IllegalArgumentException se la stringa non è una formula polacca valida
     */
    public static Formula parsePolish(String string) {
        ParseResult result = FormulaParser.parsePolish(string);
        if (!result.isSuccess()) {
            throw new IllegalArgumentException("Formula polacca non valida '" + string + "': " + result.getErrorMessage());
        }
        return result.getFormula();
    }

    //endregion

    //region SOSTITUZIONI

    /**
     * Sostituisce ogni variabile che compare come chiave nella mappa con la
     * formula associata. Le occorrenze introdotte dalla sostituzione non vengono
     * sostituite a loro volta.
     *
     * ESEMPIO:
     * ((p->p)|r) con {p: (q&r), r: p} diventa (((q&r)->(q&r))|p)
     *
     * @param substitutionMap mappa da nome di variabile a formula
     * @return nuova formula con le sostituzioni applicate
     * @throws IllegalArgumentException se una chiave non è un nome di variabile
     */
    public Formula substituteVariables(Map<String, Formula> substitutionMap) {
        Objects.requireNonNull(substitutionMap, "Mappa di sostituzione non può essere null");
        for (Map.Entry<String, Formula> entry : substitutionMap.entrySet()) {
            if (!isVariable(entry.getKey())) {
                throw new IllegalArgumentException("Chiave di sostituzione non è una variabile: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Formula sostitutiva null per la variabile " + entry.getKey());
            }
        }
        return applyVariableSubstitution(substitutionMap);
    }

    private Formula applyVariableSubstitution(Map<String, Formula> substitutionMap) {
        return switch (kind) {
            case VARIABLE -> substitutionMap.getOrDefault(root, this);
            case CONSTANT -> this;
            case UNARY -> new Formula(root, first.applyVariableSubstitution(substitutionMap));
            case BINARY -> new Formula(root,
                    first.applyVariableSubstitution(substitutionMap),
                    second.applyVariableSubstitution(substitutionMap));
        };
    }

    /**
     * Sostituisce ogni costante o operatore che compare come chiave nella mappa
     * con il modello associato, applicato agli operandi già sostituiti: la
     * variabile p del modello indica il primo operando e q il secondo.
     *
     * ESEMPIO:
     * ((x&y)&~z) con {&: ~(~p|~q)} diventa ~(~~(~x|~y)|~~z)
     *
     * @param substitutionMap mappa da simbolo a formula modello su p e q
     * @return nuova formula con le sostituzioni applicate
     * @throws IllegalArgumentException se una chiave non è un operatore o una costante,
     *                                  o se un modello usa variabili diverse da p e q
     */
    public Formula substituteOperators(Map<String, Formula> substitutionMap) {
        Objects.requireNonNull(substitutionMap, "Mappa di sostituzione non può essere null");
        for (Map.Entry<String, Formula> entry : substitutionMap.entrySet()) {
            String operator = entry.getKey();
            if (!isConstant(operator) && !isUnary(operator) && !isBinary(operator)) {
                throw new IllegalArgumentException("Chiave di sostituzione non è un operatore: " + operator);
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Modello null per l'operatore " + operator);
            }
            if (!TEMPLATE_VARIABLES.containsAll(entry.getValue().variables())) {
                throw new IllegalArgumentException("Il modello per '" + operator
                        + "' può usare solo le variabili p e q: " + entry.getValue());
            }
            if (!isBinary(operator) && entry.getValue().variables().contains("q")) {
                throw new IllegalArgumentException("Il modello per '" + operator
                        + "' ha al più un operando e può usare solo la variabile p: " + entry.getValue());
            }
        }

        Formula result = applyOperatorSubstitution(substitutionMap);
        LOGGER.finest("Sostituzione operatori " + substitutionMap.keySet() + ": " + this + " -> " + result);
        return result;
    }

    private Formula applyOperatorSubstitution(Map<String, Formula> substitutionMap) {
        Formula template = substitutionMap.get(root);

        return switch (kind) {
            case VARIABLE -> this;

            case CONSTANT -> template != null ? template : this;

            case UNARY -> {
                Formula operand = first.applyOperatorSubstitution(substitutionMap);
                yield template != null
                        ? instantiate(template, operand, null)
                        : new Formula(root, operand);
            }

            case BINARY -> {
                Formula left = first.applyOperatorSubstitution(substitutionMap);
                Formula right = second.applyOperatorSubstitution(substitutionMap);
                yield template != null
                        ? instantiate(template, left, right)
                        : new Formula(root, left, right);
            }
        };
    }

    /**
     * Istanzia un modello su p e q legando p al primo operando e q al secondo.
     *
     * @param template formula modello sulle variabili p e q
     * @param p formula da legare a p (ignorata se null)
     * @param q formula da legare a q (ignorata se null)
     * @return il modello con le variabili legate sostituite
     */
    public static Formula instantiate(Formula template, Formula p, Formula q) {
        Map<String, Formula> bindings = new HashMap<>();
        if (p != null) {
            bindings.put("p", p);
        }
        if (q != null) {
            bindings.put("q", q);
        }
        return template.substituteVariables(bindings);
    }

    //endregion

    //region UGUAGLIANZA E ORDINAMENTO

    /**
     * Due formule sono uguali se e solo se hanno la stessa rappresentazione standard.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Formula)) return false;
        return toString().equals(obj.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    @Override
    public int compareTo(Formula other) {
        return toString().compareTo(other.toString());
    }

    //endregion
}
