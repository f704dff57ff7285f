package org.ctl.validation;

import org.ctl.parser.CTLFormulaBaseVisitor;
import org.ctl.parser.CTLFormulaParser.AndContext;
import org.ctl.parser.CTLFormulaParser.ComparisonContext;
import org.ctl.parser.CTLFormulaParser.FalseContext;
import org.ctl.parser.CTLFormulaParser.FormulaContext;
import org.ctl.parser.CTLFormulaParser.IdContext;
import org.ctl.parser.CTLFormulaParser.NotContext;
import org.ctl.parser.CTLFormulaParser.OperandContext;
import org.ctl.parser.CTLFormulaParser.OrContext;
import org.ctl.parser.CTLFormulaParser.ParContext;
import org.ctl.parser.CTLFormulaParser.PathBinaryContext;
import org.ctl.parser.CTLFormulaParser.TemporalContext;
import org.ctl.parser.CTLFormulaParser.TrueContext;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Visitor sull'albero sintattico ANTLR che misura una formula.
 *
 * Ogni metodo visit restituisce il numero di nodi del sottoalbero visitato; atomi distinti,
 * operatori temporali e confronti vengono accumulati durante la visita. Le parentesi di
 * raggruppamento non contano come nodi.
 */
public class FormulaInfoCollector extends CTLFormulaBaseVisitor<Integer> {

    private final Set<String> atoms = new LinkedHashSet<>();
    private int temporalOperators;
    private int comparisons;

    /**
     * Misura l'intera formula.
     *
     * @param ctx radice prodotta dalla regola {@code formula}
     * @return misure raccolte
     */
    public FormulaInfo collect(FormulaContext ctx) {
        atoms.clear();
        temporalOperators = 0;
        comparisons = 0;

        int size = visit(ctx);
        return new FormulaInfo(size, temporalOperators, atoms, comparisons);
    }

    @Override
    public Integer visitFormula(FormulaContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Integer visitAnd(AndContext ctx) {
        int size = 1;
        for (var operand : ctx.expression()) {
            size += visit(operand);
        }
        return size;
    }

    @Override
    public Integer visitOr(OrContext ctx) {
        int size = 1;
        for (var operand : ctx.expression()) {
            size += visit(operand);
        }
        return size;
    }

    @Override
    public Integer visitNot(NotContext ctx) {
        return 1 + visit(ctx.expression());
    }

    @Override
    public Integer visitTemporal(TemporalContext ctx) {
        temporalOperators++;
        return 1 + visit(ctx.expression());
    }

    @Override
    public Integer visitPathBinary(PathBinaryContext ctx) {
        temporalOperators++;
        return 1 + visit(ctx.expression(0)) + visit(ctx.expression(1));
    }

    /**
     * Un confronto è un atomo: conta come un nodo, ma i suoi identificatori sono registrati.
     */
    @Override
    public Integer visitComparison(ComparisonContext ctx) {
        comparisons++;
        for (var term : ctx.term()) {
            for (OperandContext operand : term.operand()) {
                if (operand.identifier() != null) {
                    atoms.add(operand.identifier().getText());
                }
            }
        }
        return 1;
    }

    @Override
    public Integer visitPar(ParContext ctx) {
        return visit(ctx.expression());
    }

    @Override
    public Integer visitTrue(TrueContext ctx) {
        return 1;
    }

    @Override
    public Integer visitFalse(FalseContext ctx) {
        return 1;
    }

    @Override
    public Integer visitId(IdContext ctx) {
        atoms.add(ctx.identifier().getText());
        return 1;
    }
}
