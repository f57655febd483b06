package com.xmile.equation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DebugFlagsTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty("xmile.debugTokens");
        DebugFlags.drainCapturedTokens();
    }

    @Test
    void capturesTokenDumpWhenEnabled() throws Exception {
        System.setProperty("xmile.debugTokens", "true");

        new ExpressionParser().parseExpression("a + 1");

        List<String> captured = DebugFlags.drainCapturedTokens();
        assertEquals(4, captured.size());
        assertTrue(captured.get(0).startsWith("IDENTIFIER"), captured.get(0));
        assertTrue(captured.get(2).endsWith("-> 1"), captured.get(2));
        assertTrue(DebugFlags.drainCapturedTokens().isEmpty());
    }

    @Test
    void capturesNothingWhenPropertyIsFalse() throws Exception {
        System.setProperty("xmile.debugTokens", "false");

        new ExpressionParser().parseExpression("a + 1");

        assertTrue(DebugFlags.drainCapturedTokens().isEmpty());
    }
}
