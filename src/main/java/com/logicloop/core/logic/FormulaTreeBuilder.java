package com.logicloop.core.logic;

import com.logicloop.core.logic.grammar.FolBaseVisitor;
import com.logicloop.core.logic.grammar.FolLexer;
import com.logicloop.core.logic.grammar.FolParser;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a Formula from a Fol parse tree.
 *
 * Operand-count checks for the function-style connectives and the rejection
 * of function terms happen here, so their messages name the construct
 * instead of the token ANTLR happened to stop at.
 */
final class FormulaTreeBuilder extends FolBaseVisitor<Formula> {

    @Override
    public Formula visitFormula(FolParser.FormulaContext ctx) {
        return visit(ctx.iff());
    }

    @Override
    public Formula visitIff(FolParser.IffContext ctx) {
        List<FolParser.ImplicationContext> parts = ctx.implication();
        Formula result = visit(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            result = Formula.iff(result, visit(parts.get(i)));
        }
        return result;
    }

    @Override
    public Formula visitImplication(FolParser.ImplicationContext ctx) {
        List<FolParser.DisjunctionContext> parts = ctx.disjunction();
        Formula result = visit(parts.get(parts.size() - 1));
        for (int i = parts.size() - 2; i >= 0; i--) {
            result = Formula.implies(visit(parts.get(i)), result);
        }
        return result;
    }

    @Override
    public Formula visitDisjunction(FolParser.DisjunctionContext ctx) {
        // children: operand (op operand)*
        Formula left = visit(ctx.getChild(0));
        for (int i = 1; i + 1 < ctx.getChildCount(); i += 2) {
            Token op = ((TerminalNode) ctx.getChild(i)).getSymbol();
            Formula right = visit(ctx.getChild(i + 1));
            if (op.getType() == FolLexer.XOR) {
                left = Formula.xor(left, right);
            } else {
                left = left.getKind() == Formula.Kind.OR
                        ? Formula.or(append(left.getOperands(), right))
                        : Formula.or(left, right);
            }
        }
        return left;
    }

    @Override
    public Formula visitConjunction(FolParser.ConjunctionContext ctx) {
        List<FolParser.UnaryContext> parts = ctx.unary();
        Formula left = visit(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            Formula right = visit(parts.get(i));
            left = left.getKind() == Formula.Kind.AND
                    ? Formula.and(append(left.getOperands(), right))
                    : Formula.and(left, right);
        }
        return left;
    }

    // ── Unary ────────────────────────────────────────────────────────────────

    @Override
    public Formula visitNegation(FolParser.NegationContext ctx) {
        return Formula.not(visit(ctx.unary()));
    }

    @Override
    public Formula visitWideQuantified(FolParser.WideQuantifiedContext ctx) {
        return quantify(ctx.quantifier(), names(ctx.variables().IDENT()), visit(ctx.iff()));
    }

    @Override
    public Formula visitNarrowQuantified(FolParser.NarrowQuantifiedContext ctx) {
        return quantify(ctx.quantifier(), names(ctx.variables().IDENT()), visit(ctx.unary()));
    }

    @Override
    public Formula visitPlain(FolParser.PlainContext ctx) {
        return visit(ctx.primary());
    }

    private static Formula quantify(FolParser.QuantifierContext quantifier, List<String> variables, Formula body) {
        boolean existential = quantifier.EXISTS_SYM() != null || quantifier.EXISTS_WORD() != null;
        return existential ? Formula.exists(variables, body) : Formula.forAll(variables, body);
    }

    // ── Primary ──────────────────────────────────────────────────────────────

    @Override
    public Formula visitParenthesized(FolParser.ParenthesizedContext ctx) {
        return visit(ctx.iff());
    }

    @Override
    public Formula visitConnective(FolParser.ConnectiveContext ctx) {
        Token head = ctx.head;
        List<Formula> args = new ArrayList<>();
        for (FolParser.IffContext arg : ctx.iff()) {
            args.add(visit(arg));
        }

        switch (head.getType()) {
            case FolLexer.AND_FN:
                requireAtLeast(head, args, 1);
                return Formula.and(args);
            case FolLexer.OR_FN:
                requireAtLeast(head, args, 1);
                return Formula.or(args);
            case FolLexer.NOT_FN:
                requireExactly(head, args, 1);
                return Formula.not(args.get(0));
            case FolLexer.IMPLIES_FN:
                requireExactly(head, args, 2);
                return Formula.implies(args.get(0), args.get(1));
            case FolLexer.IFF_FN:
                requireExactly(head, args, 2);
                return Formula.iff(args.get(0), args.get(1));
            default:
                requireExactly(head, args, 2);
                return Formula.xor(args.get(0), args.get(1));
        }
    }

    @Override
    public Formula visitQuantifierCall(FolParser.QuantifierCallContext ctx) {
        List<String> variables = names(ctx.boundVariables().IDENT());
        Formula body = visit(ctx.iff());
        return ctx.head.getType() == FolLexer.EXISTS_FN
                ? Formula.exists(variables, body)
                : Formula.forAll(variables, body);
    }

    @Override
    public Formula visitTruth(FolParser.TruthContext ctx) {
        return Formula.truth();
    }

    @Override
    public Formula visitFalsity(FolParser.FalsityContext ctx) {
        return Formula.falsity();
    }

    @Override
    public Formula visitEquality(FolParser.EqualityContext ctx) {
        Formula eq = Formula.equalsTerm(ctx.left.getText(), ctx.right.getText());
        return ctx.op.getType() == FolLexer.NEQ ? Formula.not(eq) : eq;
    }

    @Override
    public Formula visitAtom(FolParser.AtomContext ctx) {
        List<String> terms = new ArrayList<>();
        for (FolParser.TermContext term : ctx.term()) {
            if (term instanceof FolParser.FunctionTermContext) {
                Token name = ((FolParser.FunctionTermContext) term).IDENT().getSymbol();
                throw new FormulaSyntaxException(
                        "Function terms are not supported: '" + name.getText() + "('", name.getStartIndex());
            }
            terms.add(term.getText());
        }
        return Formula.atom(ctx.IDENT().getText(), terms);
    }

    @Override
    public Formula visitProposition(FolParser.PropositionContext ctx) {
        return Formula.proposition(ctx.IDENT().getText());
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static List<String> names(List<TerminalNode> identifiers) {
        List<String> out = new ArrayList<>(identifiers.size());
        for (TerminalNode id : identifiers) out.add(id.getText());
        return out;
    }

    private static List<Formula> append(List<Formula> operands, Formula next) {
        List<Formula> out = new ArrayList<>(operands);
        out.add(next);
        return out;
    }

    private static void requireExactly(Token head, List<Formula> args, int count) {
        if (args.size() != count) {
            throw new FormulaSyntaxException(
                    head.getText() + " expects " + count + " argument(s), got " + args.size(), head.getStartIndex());
        }
    }

    private static void requireAtLeast(Token head, List<Formula> args, int count) {
        if (args.size() < count) {
            throw new FormulaSyntaxException(
                    head.getText() + " expects at least " + count + " argument(s)", head.getStartIndex());
        }
    }
}
