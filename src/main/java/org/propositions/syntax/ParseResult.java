package org.propositions.syntax;

/**
 * RISULTATO DI PARSING - Esito immutabile della lettura di una formula
 *
 * Contiene la formula riconosciuta oppure una diagnostica leggibile che
 * descrive il primo costrutto atteso e non trovato. Le due alternative sono
 * mutuamente esclusive; la costruzione avviene solo tramite factory method.
 */
public final class ParseResult {

    /** Formula riconosciuta, null in caso di fallimento */
    private final Formula formula;

    /** Messaggio diagnostico, null in caso di successo */
    private final String errorMessage;

    private ParseResult(Formula formula, String errorMessage) {
        this.formula = formula;
        this.errorMessage = errorMessage;
    }

    /**
     * @param formula formula riconosciuta (non null)
     * @return risultato di successo
     */
    public static ParseResult success(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Un parsing riuscito richiede una formula");
        }
        return new ParseResult(formula, null);
    }

    /**
     * @param errorMessage diagnostica leggibile (non null, non vuota)
     * @return risultato di fallimento
     */
    public static ParseResult failure(String errorMessage) {
        if (errorMessage == null || errorMessage.isBlank()) {
            throw new IllegalArgumentException("Un parsing fallito richiede un messaggio diagnostico");
        }
        return new ParseResult(null, errorMessage);
    }

    public boolean isSuccess() {
        return formula != null;
    }

    /**
     * @return formula riconosciuta
     * @throws IllegalStateException se il parsing è fallito
     */
    public Formula getFormula() {
        if (formula == null) {
            throw new IllegalStateException("Nessuna formula disponibile: " + errorMessage);
        }
        return formula;
    }

    /**
     * @return diagnostica del fallimento, null se il parsing è riuscito
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return isSuccess() ? "OK[" + formula + "]" : "ERRORE[" + errorMessage + "]";
    }
}
