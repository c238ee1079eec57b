package org.propositions.syntax;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Raccoglie gli errori di lexer e parser ANTLR conservando solo il primo:
 * il primo errore è definitivo, i successivi sono conseguenze del recupero.
 */
class FormulaErrorListener extends BaseErrorListener {

    private String firstError;

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        if (firstError == null) {
            firstError = "posizione " + charPositionInLine + ": " + msg;
        }
    }

    boolean hasErrors() {
        return firstError != null;
    }

    String getFirstError() {
        return firstError;
    }
}
