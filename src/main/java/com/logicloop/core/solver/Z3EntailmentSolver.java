package com.logicloop.core.solver;

import com.logicloop.core.logic.Formula;
import com.logicloop.core.logic.FormulaParser;
import com.logicloop.core.logic.FormulaSyntaxException;
import com.logicloop.core.logic.PredicateSignature;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Z3EntailmentSolver: the Z3 backend.
 *
 * Pipeline per query:
 *   1. Parse premises + conclusion (syntax failure → Error with position)
 *   2. Reject predicates used with two different arities
 *   3. Translate to Z3 over one uninterpreted sort, then check twice:
 *        premises ∧ ¬conclusion UNSAT → Proved
 *        premises ∧  conclusion UNSAT → Disproved
 *        otherwise                    → Unknown
 *
 * Each check runs with Z3's own "timeout" parameter set to the budget that
 * is left, so a hard query stops inside Z3 instead of pinning a worker. Z3
 * giving up on the clock yields Unknown with timeout=true; giving up for any
 * other reason (typically incomplete quantifier instantiation) is plain Unknown.
 *
 * A fresh Context per call: Z3 contexts are not shared between threads.
 */
@Component
public class Z3EntailmentSolver implements EntailmentSolver {

    private static final Logger log = LoggerFactory.getLogger(Z3EntailmentSolver.class);

    private static final int MAX_QUOTED_CHARS = 80;

    @Override
    public SolverBackend backend() {
        return SolverBackend.Z3;
    }

    @Override
    public SolverResult solve(List<String> premises, String conclusion, Duration timeout) {

        long deadline = System.nanoTime() + timeout.toNanos();

        // ── Parse ────────────────────────────────────────────────────────────
        List<Formula> parsedPremises = new ArrayList<>();
        for (int i = 0; i < premises.size(); i++) {
            try {
                parsedPremises.add(FormulaParser.parse(premises.get(i)));
            } catch (FormulaSyntaxException e) {
                return SolverResult.error("Syntax error in premise " + (i + 1)
                        + " '" + abbreviate(premises.get(i)) + "': " + e.getMessage());
            }
        }

        Formula goal;
        try {
            goal = FormulaParser.parse(conclusion);
        } catch (FormulaSyntaxException e) {
            return SolverResult.error("Syntax error in conclusion '" + abbreviate(conclusion) + "': " + e.getMessage());
        }

        List<Formula> all = new ArrayList<>(parsedPremises);
        all.add(goal);

        String arityProblem = findArityMismatch(all);
        if (arityProblem != null) {
            return SolverResult.error(arityProblem);
        }

        // ── Solve ────────────────────────────────────────────────────────────
        try (Context ctx = new Context()) {
            Z3FormulaTranslator translator = new Z3FormulaTranslator(ctx);
            List<BoolExpr> assumptions = new ArrayList<>();
            for (Formula p : parsedPremises) assumptions.add(translator.translate(p));
            BoolExpr target = translator.translate(goal);

            Outcome counterModel = check(ctx, assumptions, ctx.mkNot(target), deadline, timeout);
            if (counterModel.status == Status.UNSATISFIABLE) {
                return SolverResult.proved();
            }

            Outcome model = check(ctx, assumptions, target, deadline, timeout);
            if (model.status == Status.UNSATISFIABLE) {
                return SolverResult.disproved();
            }

            if (counterModel.ranOutOfTime() || model.ranOutOfTime()) {
                log.debug("[Z3] gave up on the clock after {} ms", timeout.toMillis());
                return SolverResult.timedOut();
            }
            return SolverResult.unknown();

        } catch (Z3Exception e) {
            log.warn("[Z3] {}", e.getMessage());
            return SolverResult.error("Z3 exception: " + e.getMessage());
        }
    }

    private static Outcome check(Context ctx, List<BoolExpr> assumptions, BoolExpr extra,
                                 long deadline, Duration timeout) {
        long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
        if (remainingMs <= 0) {
            throw new SolverTimeoutException("timeout exceeded after " + timeout.toMillis() + "ms");
        }

        Solver solver = ctx.mkSolver();
        Params params = ctx.mkParams();
        params.add("timeout", (int) Math.min(remainingMs, Integer.MAX_VALUE));
        solver.setParameters(params);

        solver.add(assumptions.toArray(new BoolExpr[0]));
        solver.add(extra);

        Status status = solver.check();
        String reason = status == Status.UNKNOWN ? solver.getReasonUnknown() : null;
        log.debug("[Z3] assertions={} → {}{}", solver.getNumAssertions(), status,
                reason != null ? " (" + reason + ")" : "");
        return new Outcome(status, reason);
    }

    private static String abbreviate(String formula) {
        return formula.length() <= MAX_QUOTED_CHARS ? formula : formula.substring(0, MAX_QUOTED_CHARS) + "...";
    }

    private static String findArityMismatch(List<Formula> formulas) {
        Map<String, Integer> arities = new HashMap<>();
        for (Formula f : formulas) {
            for (PredicateSignature sig : f.predicates()) {
                Integer seen = arities.putIfAbsent(sig.getName(), sig.getArity());
                if (seen != null && seen != sig.getArity()) {
                    return "Arity mismatch: predicate '" + sig.getName() + "' used with "
                            + seen + " and " + sig.getArity() + " arguments";
                }
            }
        }
        return null;
    }

    private static final class Outcome {

        final Status status;
        final String reasonUnknown;

        Outcome(Status status, String reasonUnknown) {
            this.status        = status;
            this.reasonUnknown = reasonUnknown;
        }

        boolean ranOutOfTime() {
            if (status != Status.UNKNOWN || reasonUnknown == null) return false;
            String reason = reasonUnknown.toLowerCase(Locale.ROOT);
            return reason.contains("timeout") || reason.contains("canceled");
        }
    }
}
