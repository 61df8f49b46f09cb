package com.logicloop.core.logic;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Formula: immutable first-order formula tree.
 *
 * Node kinds:
 *   TRUE / FALSE           : constants
 *   ATOM                   : Pred(t1, ..., tn); n == 0 is a bare proposition
 *   EQUALS                 : t1 = t2
 *   NOT                    : one operand
 *   AND / OR               : one or more operands
 *   IMPLIES / IFF / XOR    : exactly two operands
 *   FORALL / EXISTS        : bound variables + one operand (the body)
 *
 * Terms are plain identifiers. An identifier is a variable when an enclosing
 * quantifier binds it and a constant otherwise.
 *
 * Construct via the static factories; FormulaParser is the usual entry point.
 * Z3FormulaTranslator resolves identifiers against the enclosing binders.
 */
public final class Formula {

    public enum Kind {
        TRUE, FALSE, ATOM, EQUALS, NOT, AND, OR, IMPLIES, IFF, XOR, FORALL, EXISTS
    }

    private static final Formula TRUE_CONSTANT  = new Formula(Kind.TRUE, null, List.of(), List.of(), List.of());
    private static final Formula FALSE_CONSTANT = new Formula(Kind.FALSE, null, List.of(), List.of(), List.of());

    private final Kind          kind;
    private final String        name;       // predicate name (ATOM only)
    private final List<String>  terms;      // ATOM arguments, or the two EQUALS sides
    private final List<String>  variables;  // FORALL / EXISTS only
    private final List<Formula> operands;

    private Formula(Kind kind, String name, List<String> terms,
                    List<String> variables, List<Formula> operands) {
        this.kind      = kind;
        this.name      = name;
        this.terms     = List.copyOf(terms);
        this.variables = List.copyOf(variables);
        this.operands  = List.copyOf(operands);
    }

    // =========================================================================
    // Factories
    // =========================================================================

    public static Formula truth()   { return TRUE_CONSTANT; }
    public static Formula falsity() { return FALSE_CONSTANT; }

    public static Formula atom(String name, List<String> terms) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Predicate name must not be blank");
        }
        return new Formula(Kind.ATOM, name, terms, List.of(), List.of());
    }

    public static Formula proposition(String name) {
        return atom(name, List.of());
    }

    public static Formula equalsTerm(String left, String right) {
        return new Formula(Kind.EQUALS, null, List.of(left, right), List.of(), List.of());
    }

    public static Formula not(Formula operand) {
        return new Formula(Kind.NOT, null, List.of(), List.of(), List.of(operand));
    }

    public static Formula and(List<Formula> operands) {
        requireOperands(Kind.AND, operands);
        return operands.size() == 1 ? operands.get(0)
                : new Formula(Kind.AND, null, List.of(), List.of(), operands);
    }

    public static Formula or(List<Formula> operands) {
        requireOperands(Kind.OR, operands);
        return operands.size() == 1 ? operands.get(0)
                : new Formula(Kind.OR, null, List.of(), List.of(), operands);
    }

    public static Formula and(Formula... operands) { return and(List.of(operands)); }
    public static Formula or(Formula... operands)  { return or(List.of(operands)); }

    public static Formula implies(Formula antecedent, Formula consequent) {
        return new Formula(Kind.IMPLIES, null, List.of(), List.of(), List.of(antecedent, consequent));
    }

    public static Formula iff(Formula left, Formula right) {
        return new Formula(Kind.IFF, null, List.of(), List.of(), List.of(left, right));
    }

    public static Formula xor(Formula left, Formula right) {
        return new Formula(Kind.XOR, null, List.of(), List.of(), List.of(left, right));
    }

    public static Formula forAll(List<String> variables, Formula body) {
        requireVariables(variables);
        return new Formula(Kind.FORALL, null, List.of(), variables, List.of(body));
    }

    public static Formula exists(List<String> variables, Formula body) {
        requireVariables(variables);
        return new Formula(Kind.EXISTS, null, List.of(), variables, List.of(body));
    }

    private static void requireOperands(Kind kind, List<Formula> operands) {
        if (operands == null || operands.isEmpty()) {
            throw new IllegalArgumentException(kind + " requires at least one operand");
        }
    }

    private static void requireVariables(List<String> variables) {
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("Quantifier requires at least one variable");
        }
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public Kind          getKind()      { return kind; }
    public String        getName()      { return name; }
    public List<String>  getTerms()     { return terms; }
    public List<String>  getVariables() { return variables; }
    public List<Formula> getOperands()  { return operands; }

    public Formula operand(int index) {
        return operands.get(index);
    }

    // =========================================================================
    // Structural queries
    // =========================================================================

    /** Predicate signatures used anywhere in this formula, in first-use order. */
    public Set<PredicateSignature> predicates() {
        Set<PredicateSignature> out = new LinkedHashSet<>();
        collectPredicates(out);
        return out;
    }

    private void collectPredicates(Set<PredicateSignature> out) {
        if (kind == Kind.ATOM) {
            out.add(new PredicateSignature(name, terms.size()));
        }
        for (Formula op : operands) op.collectPredicates(out);
    }

    // =========================================================================
    // Display: function-style rendering, re-parseable by FormulaParser
    // =========================================================================

    @Override
    public String toString() {
        return switch (kind) {
            case TRUE    -> "True";
            case FALSE   -> "False";
            case ATOM    -> terms.isEmpty() ? name : name + "(" + String.join(", ", terms) + ")";
            case EQUALS  -> terms.get(0) + " = " + terms.get(1);
            case NOT     -> "Not(" + operands.get(0) + ")";
            case AND     -> "And(" + joinOperands() + ")";
            case OR      -> "Or(" + joinOperands() + ")";
            case IMPLIES -> "Implies(" + joinOperands() + ")";
            case IFF     -> "Iff(" + joinOperands() + ")";
            case XOR     -> "Xor(" + joinOperands() + ")";
            case FORALL  -> "ForAll([" + String.join(", ", variables) + "], " + operands.get(0) + ")";
            case EXISTS  -> "Exists([" + String.join(", ", variables) + "], " + operands.get(0) + ")";
        };
    }

    private String joinOperands() {
        return operands.stream().map(Formula::toString).collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula)) return false;
        Formula other = (Formula) o;
        return kind == other.kind
                && Objects.equals(name, other.name)
                && terms.equals(other.terms)
                && variables.equals(other.variables)
                && operands.equals(other.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, terms, variables, operands);
    }
}
