package com.xmile.equation;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Operator and delimiter kinds of the equation language. A lower rank binds tighter; the ordering of
 * operators is derived from the rank alone.
 */
public enum Operator {
    SUBSCRIPT_OPEN(0, "["),
    SUBSCRIPT_CLOSE(0, "]"),
    PAREN_OPEN(1, "("),
    PAREN_CLOSE(1, ")"),
    EXPONENT(2, "^"),
    UNARY_PLUS(3, "+"),
    UNARY_MINUS(3, "-"),
    NOT(3, "NOT"),
    MULTIPLY(4, "*"),
    DIVIDE(4, "/"),
    MOD(4, "MOD"),
    ADD(5, "+"),
    SUBTRACT(5, "-"),
    LESS(6, "<"),
    LESS_EQUAL(6, "<="),
    GREATER(6, ">"),
    GREATER_EQUAL(6, ">="),
    EQUAL(7, "="),
    NOT_EQUAL(7, "<>"),
    AND(8, "AND"),
    OR(9, "OR");

    public static final Comparator<Operator> BY_PRECEDENCE =
            Comparator.comparingInt(Operator::getRank);

    private final int rank;
    private final String symbol;

    Operator(int rank, String symbol) {
        this.rank = rank;
        this.symbol = symbol;
    }

    public int getRank() {
        return rank;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isUnary() {
        return rank == 3;
    }

    public boolean isBinary() {
        return rank >= 2 && rank != 3;
    }

    public boolean isRightAssociative() {
        return rank == 2 || rank == 3;
    }

    public boolean bindsTighterThan(Operator other) {
        return rank < other.rank;
    }

    /** Binary operators ordered from tightest to loosest binding. */
    public static List<Operator> binaryOperators() {
        return Arrays.stream(values()).filter(Operator::isBinary).sorted(BY_PRECEDENCE).toList();
    }

    /**
     * Floored modulus as defined for {@code MOD}: the result takes the sign of the divisor, so
     * {@code -7 MOD 3} is {@code 2} and {@code 7 MOD -3} is {@code -2}.
     */
    public static double floorMod(double dividend, double divisor) {
        return dividend - divisor * Math.floor(dividend / divisor);
    }
}
