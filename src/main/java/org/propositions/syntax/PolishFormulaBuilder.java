package org.propositions.syntax;

import org.propositions.syntax.parser.PolishFormulaBaseVisitor;
import org.propositions.syntax.parser.PolishFormulaParser.BinaryContext;
import org.propositions.syntax.parser.PolishFormulaParser.ConstantContext;
import org.propositions.syntax.parser.PolishFormulaParser.FormulaContext;
import org.propositions.syntax.parser.PolishFormulaParser.NegationContext;
import org.propositions.syntax.parser.PolishFormulaParser.VariableContext;

/**
 * Visitor sull'albero della grammatica PolishFormula (notazione prefissa).
 * Gli operandi di ogni operatore sono delimitati solo dalla grammatica.
 */
class PolishFormulaBuilder extends PolishFormulaBaseVisitor<Formula> {

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.expression());
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

    @Override
    public Formula visitBinary(BinaryContext ctx) {
        return new Formula(ctx.BINARY_OP().getText(), visit(ctx.expression(0)), visit(ctx.expression(1)));
    }
}
