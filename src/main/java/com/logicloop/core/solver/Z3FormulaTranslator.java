package com.logicloop.core.solver;

import com.logicloop.core.logic.Formula;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import com.microsoft.z3.UninterpretedSort;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Z3FormulaTranslator: Formula → Z3 BoolExpr over one uninterpreted sort.
 *
 * Constants become 0-ary terms of sort Entity, predicates become Bool-valued
 * function declarations over Entity. Quantified variables are fresh
 * constants abstracted by mkForall / mkExists; an inner binder shadows an
 * outer one or a constant of the same name.
 *
 * One instance per Context; declarations are shared by every formula the
 * instance translates, so premises and conclusion speak about the same
 * predicates and individuals.
 */
final class Z3FormulaTranslator {

    private final Context                           ctx;
    private final UninterpretedSort                 entity;
    private final Map<String, FuncDecl<BoolSort>>   predicates = new HashMap<>();
    private final Map<String, Expr<UninterpretedSort>> constants = new HashMap<>();

    Z3FormulaTranslator(Context ctx) {
        this.ctx    = ctx;
        this.entity = ctx.mkUninterpretedSort("Entity");
    }

    BoolExpr translate(Formula formula) {
        return translate(formula, Map.of());
    }

    private BoolExpr translate(Formula f, Map<String, Expr<UninterpretedSort>> scope) {
        switch (f.getKind()) {
            case TRUE:
                return ctx.mkTrue();
            case FALSE:
                return ctx.mkFalse();
            case ATOM:
                return atom(f, scope);
            case EQUALS:
                return ctx.mkEq(term(f.getTerms().get(0), scope), term(f.getTerms().get(1), scope));
            case NOT:
                return ctx.mkNot(translate(f.operand(0), scope));
            case AND:
                return ctx.mkAnd(operands(f, scope));
            case OR:
                return ctx.mkOr(operands(f, scope));
            case IMPLIES:
                return ctx.mkImplies(translate(f.operand(0), scope), translate(f.operand(1), scope));
            case IFF:
                return ctx.mkIff(translate(f.operand(0), scope), translate(f.operand(1), scope));
            case XOR:
                return ctx.mkXor(translate(f.operand(0), scope), translate(f.operand(1), scope));
            case FORALL:
            case EXISTS:
                return quantifier(f, scope);
            default:
                throw new IllegalArgumentException("Unsupported formula kind " + f.getKind());
        }
    }

    private BoolExpr atom(Formula f, Map<String, Expr<UninterpretedSort>> scope) {
        List<String> terms = f.getTerms();
        FuncDecl<BoolSort> decl = predicates.computeIfAbsent(f.getName(), name -> {
            Sort[] domain = new Sort[terms.size()];
            for (int i = 0; i < domain.length; i++) domain[i] = entity;
            return ctx.mkFuncDecl(name, domain, ctx.mkBoolSort());
        });

        Expr<?>[] args = new Expr<?>[terms.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = term(terms.get(i), scope);
        }
        return (BoolExpr) decl.apply(args);
    }

    private Expr<UninterpretedSort> term(String name, Map<String, Expr<UninterpretedSort>> scope) {
        Expr<UninterpretedSort> bound = scope.get(name);
        if (bound != null) return bound;
        return constants.computeIfAbsent(name, n -> ctx.mkConst(n, entity));
    }

    private BoolExpr quantifier(Formula f, Map<String, Expr<UninterpretedSort>> scope) {
        Map<String, Expr<UninterpretedSort>> inner = new HashMap<>(scope);
        List<Expr<UninterpretedSort>> bound = new ArrayList<>();
        for (String variable : f.getVariables()) {
            Expr<UninterpretedSort> fresh = ctx.mkFreshConst(variable, entity);
            inner.put(variable, fresh);
            bound.add(fresh);
        }

        Expr<?>[] boundArray = bound.toArray(new Expr<?>[0]);
        BoolExpr body = translate(f.operand(0), inner);
        return f.getKind() == Formula.Kind.FORALL
                ? ctx.mkForall(boundArray, body, 1, null, null, null, null)
                : ctx.mkExists(boundArray, body, 1, null, null, null, null);
    }

    private BoolExpr[] operands(Formula f, Map<String, Expr<UninterpretedSort>> scope) {
        List<Formula> ops = f.getOperands();
        BoolExpr[] out = new BoolExpr[ops.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = translate(ops.get(i), scope);
        }
        return out;
    }
}
