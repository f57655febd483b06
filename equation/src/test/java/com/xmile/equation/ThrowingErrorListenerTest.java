package com.xmile.equation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.xmile.equation.grammar.EquationLexer;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.junit.jupiter.api.Test;

class ThrowingErrorListenerTest {

    @Test
    void positionsFailureAtTheUnmatchedText() {
        String text = "\uD83D\uDE00 + #";
        EquationLexer lexer = new EquationLexer(CharStreams.fromString(text));
        lexer._tokenStartCharIndex = 4;
        ThrowingErrorListener listener = new ThrowingErrorListener(text);

        ParseCancellationException thrown =
                assertThrows(
                        ParseCancellationException.class,
                        () -> listener.syntaxError(lexer, null, 1, 4, "token recognition error", null));

        EquationParseException failure =
                assertInstanceOf(EquationParseException.class, thrown.getCause());
        assertEquals(5, failure.getOffset());
        assertEquals("#", failure.getRemainingInput());
        assertTrue(failure.getMessage().contains("line 1:5: token recognition error"));
    }

    @Test
    void fallsBackToStartWithoutLexer() {
        ThrowingErrorListener listener = new ThrowingErrorListener("a b");

        ParseCancellationException thrown =
                assertThrows(
                        ParseCancellationException.class,
                        () -> listener.syntaxError(null, null, 1, 0, "bad", null));

        EquationParseException failure =
                assertInstanceOf(EquationParseException.class, thrown.getCause());
        assertEquals(0, failure.getOffset());
        assertEquals("a b", failure.getRemainingInput());
    }
}
