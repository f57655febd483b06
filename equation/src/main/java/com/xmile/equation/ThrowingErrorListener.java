package com.xmile.equation;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Stops the equation lexer at the first error. The thrown {@link ParseCancellationException} wraps an
 * {@link EquationParseException} positioned at the text the lexer could not match; one listener serves
 * one equation.
 */
final class ThrowingErrorListener extends BaseErrorListener {
    private final String text;

    ThrowingErrorListener(String text) {
        this.text = text;
    }

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        int offset = recognizer instanceof Lexer lexer ? offsetOf(lexer._tokenStartCharIndex) : 0;
        EquationParseException failure =
                new EquationParseException(
                        "Failed to tokenize equation at line " + line + ":" + (charPositionInLine + 1)
                                + ": " + msg,
                        text.substring(offset),
                        offset,
                        e);
        throw new ParseCancellationException(failure);
    }

    // ANTLR counts code points.
    private int offsetOf(int codePointIndex) {
        if (codePointIndex <= 0) {
            return 0;
        }
        if (codePointIndex >= text.codePointCount(0, text.length())) {
            return text.length();
        }
        return text.offsetByCodePoints(0, codePointIndex);
    }
}
