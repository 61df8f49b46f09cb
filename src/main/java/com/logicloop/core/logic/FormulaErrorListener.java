package com.logicloop.core.logic;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;

/**
 * Turns the first lexer or parser complaint into a FormulaSyntaxException.
 * ANTLR's default recovery is never attempted: one bad token rejects the formula.
 */
final class FormulaErrorListener extends BaseErrorListener {

    static final FormulaErrorListener INSTANCE = new FormulaErrorListener();

    private FormulaErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {

        if (e instanceof LexerNoViableAltException) {
            LexerNoViableAltException lexerError = (LexerNoViableAltException) e;
            int start = lexerError.getStartIndex();
            String character = lexerError.getInputStream().getText(Interval.of(start, start));
            throw new FormulaSyntaxException("Unexpected character '" + character + "'", start);
        }

        if (offendingSymbol instanceof Token) {
            Token token = (Token) offendingSymbol;
            if (token.getType() == Token.EOF) {
                throw new FormulaSyntaxException(
                        "Unexpected end of formula (dangling operator?)", token.getStartIndex());
            }
            throw new FormulaSyntaxException("Unexpected token '" + token.getText() + "'", token.getStartIndex());
        }

        throw new FormulaSyntaxException(msg, charPositionInLine);
    }
}
