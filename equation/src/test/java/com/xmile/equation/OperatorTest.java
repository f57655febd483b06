package com.xmile.equation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class OperatorTest {

    @Test
    void declaresTwentyOneKinds() {
        assertEquals(21, Operator.values().length);
    }

    @Test
    void binaryOperatorsOrderFromTightestToLoosest() {
        List<Operator> binary = Operator.binaryOperators();

        assertEquals(Operator.EXPONENT, binary.get(0));
        assertEquals(Operator.OR, binary.get(binary.size() - 1));
        assertTrue(Operator.MULTIPLY.bindsTighterThan(Operator.ADD));
        assertTrue(Operator.AND.bindsTighterThan(Operator.OR));
        assertEquals(0, Operator.BY_PRECEDENCE.compare(Operator.LESS, Operator.GREATER_EQUAL));
    }

    @Test
    void symbolsMatchEquationSyntax() {
        assertEquals("<>", Operator.NOT_EQUAL.getSymbol());
        assertEquals("MOD", Operator.MOD.getSymbol());
        assertEquals("[", Operator.SUBSCRIPT_OPEN.getSymbol());
    }

    @Test
    void floorModTakesTheSignOfTheDivisor() {
        assertEquals(2.0, Operator.floorMod(-7, 3));
        assertEquals(-2.0, Operator.floorMod(7, -3));
        assertEquals(1.0, Operator.floorMod(7, 3));
        assertEquals(-1.0, Operator.floorMod(-7, -3));
    }
}
