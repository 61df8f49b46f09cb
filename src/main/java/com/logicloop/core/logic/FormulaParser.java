package com.logicloop.core.logic;

import com.logicloop.core.logic.grammar.FolLexer;
import com.logicloop.core.logic.grammar.FolParser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * FormulaParser: parses one formula string into a Formula tree.
 *
 * The surface syntax lives in Fol.g4 (src/main/antlr4); this class wires the
 * generated lexer and parser together and hands the parse tree to
 * FormulaTreeBuilder.
 *
 *   Function style:  And(a, b, ...)  Or(...)  Not(a)  Implies(a, b)
 *                    Iff(a, b) / Equivalent(a, b)  Xor(a, b)
 *                    ForAll(x, body)  ForAll([x, y], body)  Exists(...)
 *
 *   Symbolic style:  ¬ ~ !     ∧ & &&     ∨ | ||     ⊕ ^
 *                    → -> =>   ↔ <-> <=>  ∀x  ∃x  all x  forall x  exists x
 *
 *   Atoms:           Pred(t1, ..., tn), bare proposition P, t1 = t2, t1 != t2
 *
 * Formulas nesting deeper than MAX_DEPTH are rejected before parsing, so an
 * adversarial payload cannot exhaust the stack of the parser, the tree builder
 * or the Z3 translation.
 *
 * Every failure is a FormulaSyntaxException carrying the character offset.
 */
public final class FormulaParser {

    public static final int MAX_DEPTH = 256;

    private FormulaParser() {
    }

    public static Formula parse(String text) {
        if (text == null || text.isBlank()) {
            throw new FormulaSyntaxException("Empty formula", 0);
        }

        FolLexer lexer = new FolLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(FormulaErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        checkDepth(tokens.getTokens());

        FolParser parser = new FolParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(FormulaErrorListener.INSTANCE);

        return new FormulaTreeBuilder().visit(parser.formula());
    }

    /** True when the text parses; never throws. */
    public static boolean isParseable(String text) {
        try {
            parse(text);
            return true;
        } catch (FormulaSyntaxException e) {
            return false;
        }
    }

    /*
     * Upper bound on the recursion the parse will need, computed on the flat
     * token list. Per parenthesis level we track prefix operators (¬ and
     * narrow quantifiers, which stop stacking at the next ∧, ∨ or comma) and
     * chain operators (→, ↔, ⊕ and wide quantifiers, which nest until the
     * level closes).
     */
    private static void checkDepth(List<Token> tokens) {
        Deque<int[]> enclosing = new ArrayDeque<>();
        int outer = 0;
        int prefix = 0;
        int chain = 0;
        boolean inVariables = false;

        for (Token token : tokens) {
            int type = token.getType();
            if (inVariables && type != FolLexer.IDENT && type != FolLexer.COMMA
                    && type != FolLexer.DOT && type != FolLexer.COLON) {
                inVariables = false;
            }

            switch (type) {
                case FolLexer.NOT -> prefix++;
                case FolLexer.FORALL_SYM, FolLexer.EXISTS_SYM,
                     FolLexer.ALL_WORD, FolLexer.FORALL_WORD, FolLexer.EXISTS_WORD -> {
                    prefix++;
                    inVariables = true;
                }
                case FolLexer.DOT, FolLexer.COLON -> {
                    if (inVariables && prefix > 0) {
                        prefix--;
                        chain++;
                    }
                    inVariables = false;
                }
                case FolLexer.IMPLIES, FolLexer.IFF, FolLexer.XOR -> {
                    chain++;
                    prefix = 0;
                }
                case FolLexer.AND, FolLexer.OR -> prefix = 0;
                case FolLexer.COMMA -> {
                    if (!inVariables) prefix = 0;
                }
                case FolLexer.LPAREN -> {
                    enclosing.push(new int[] {prefix, chain});
                    outer += prefix + chain + 1;
                    prefix = 0;
                    chain  = 0;
                }
                case FolLexer.RPAREN -> {
                    if (!enclosing.isEmpty()) {
                        int[] level = enclosing.pop();
                        outer -= level[0] + level[1] + 1;
                        prefix = level[0];
                        chain  = level[1];
                    }
                }
                default -> { }
            }

            if (outer + prefix + chain > MAX_DEPTH) {
                throw new FormulaSyntaxException(
                        "Formula nesting exceeds " + MAX_DEPTH + " levels", token.getStartIndex());
            }
        }
    }
}
