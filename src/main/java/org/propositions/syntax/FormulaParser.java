package org.propositions.syntax;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.tree.ParseTree;
import org.propositions.syntax.parser.PolishFormulaLexer;
import org.propositions.syntax.parser.PolishFormulaParser;
import org.propositions.syntax.parser.StandardFormulaLexer;
import org.propositions.syntax.parser.StandardFormulaParser;

import java.util.logging.Logger;

/**
 * PARSER FORMULE - Pipeline ANTLR per le due notazioni testuali
 *
 * PIPELINE:
 * 1. Lexing dell'input (token più lungo possibile: x12, <->)
 * 2. Parsing ricorsivo discendente secondo la grammatica della notazione
 * 3. Se si è verificato almeno un errore: fallimento con la prima diagnostica
 * 4. Altrimenti: costruzione della formula tramite visitor
 *
 * NOTAZIONI SUPPORTATE:
 * - Standard: completamente parentesizzata, tutti gli operatori e le costanti
 * - Polacca: prefissa, solo ~ & | -> e le costanti T, F
 *
 * L'albero prodotto da un input errato non viene mai visitato, quindi non
 * esistono formule parziali.
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Legge una formula in notazione standard.
     *
     * @param text rappresentazione standard
     * @return formula riconosciuta oppure diagnostica del primo errore
     */
    public static ParseResult parseStandard(String text) {
        if (text == null || text.isEmpty()) {
            return ParseResult.failure("stringa vuota");
        }

        FormulaErrorListener errors = new FormulaErrorListener();

        StandardFormulaLexer lexer = new StandardFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        StandardFormulaParser parser = new StandardFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        ParseTree tree = parser.formula();
        if (errors.hasErrors()) {
            LOGGER.fine("Formula standard rifiutata '" + text + "': " + errors.getFirstError());
            return ParseResult.failure(errors.getFirstError());
        }

        return ParseResult.success(new StandardFormulaBuilder().visit(tree));
    }

    /**
     * Legge una formula in notazione polacca.
     *
     * @param text rappresentazione polacca
     * @return formula riconosciuta oppure diagnostica del primo errore
     */
    public static ParseResult parsePolish(String text) {
        if (text == null || text.isEmpty()) {
            return ParseResult.failure("stringa vuota");
        }

        FormulaErrorListener errors = new FormulaErrorListener();

        PolishFormulaLexer lexer = new PolishFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);

        PolishFormulaParser parser = new PolishFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        ParseTree tree = parser.formula();
        if (errors.hasErrors()) {
            LOGGER.fine("Formula polacca rifiutata '" + text + "': " + errors.getFirstError());
            return ParseResult.failure(errors.getFirstError());
        }

        return ParseResult.success(new PolishFormulaBuilder().visit(tree));
    }
}
