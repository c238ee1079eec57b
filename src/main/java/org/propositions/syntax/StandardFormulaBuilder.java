package org.propositions.syntax;

import org.propositions.syntax.parser.StandardFormulaBaseVisitor;
import org.propositions.syntax.parser.StandardFormulaParser.BinaryContext;
import org.propositions.syntax.parser.StandardFormulaParser.ConstantContext;
import org.propositions.syntax.parser.StandardFormulaParser.FormulaContext;
import org.propositions.syntax.parser.StandardFormulaParser.NegationContext;
import org.propositions.syntax.parser.StandardFormulaParser.VariableContext;

import java.util.logging.Logger;

/**
 * COSTRUTTORE DA NOTAZIONE STANDARD - Dall'albero sintattico ANTLR a {@link Formula}
 *
 * Visitor sull'albero prodotto dalla grammatica StandardFormula. Ogni metodo
 * gestisce un'alternativa della grammatica e costruisce il nodo corrispondente
 * a partire dagli operandi già convertiti (conversione bottom-up).
 *
 * Va usato solo su alberi privi di errori sintattici: il controllo spetta a
 * {@link FormulaParser}.
 */
class StandardFormulaBuilder extends StandardFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(StandardFormulaBuilder.class.getName());

    /**
     * Punto di ingresso: la formula completa seguita da fine input.
     */
    @Override
    public Formula visitFormula(FormulaContext ctx) {
        Formula formula = visit(ctx.expression());
        LOGGER.finest("Formula standard costruita: " + formula);
        return formula;
    }

    @Override
    public Formula visitVariable(VariableContext ctx) {
        return new Formula(ctx.VARIABLE().getText());
    }

    @Override
    public Formula visitConstant(ConstantContext ctx) {
        return new Formula(ctx.CONSTANT().getText());
    }

    @Override
    public Formula visitNegation(NegationContext ctx) {
        return new Formula(Formula.NOT, visit(ctx.expression()));
    }

    /**
     * Gestisce (A op B): il lexer ha già riconosciuto l'operatore più lungo
     * possibile (ad esempio <-> prima di ->).
     */
    @Override
    public Formula visitBinary(BinaryContext ctx) {
        Formula left = visit(ctx.expression(0));
        Formula right = visit(ctx.expression(1));
        return new Formula(ctx.BINARY_OP().getText(), left, right);
    }
}
