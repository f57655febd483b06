package com.xmile.equation;

/**
 * Relaxations applied when validating an unquoted identifier. Units of measure may start with a digit
 * or a dollar sign and may reuse reserved names ({@code min} is a minute); equation references may
 * name built-in functions.
 */
public final class IdentifierOptions {

    private static final IdentifierOptions DEFAULTS = new IdentifierOptions(false, false, false);
    private static final IdentifierOptions UNITS_OF_MEASURE = new IdentifierOptions(true, true, true);
    private static final IdentifierOptions EXPRESSION = new IdentifierOptions(false, false, true);

    private final boolean allowDollar;
    private final boolean allowDigit;
    private final boolean allowReserved;

    public IdentifierOptions(boolean allowDollar, boolean allowDigit, boolean allowReserved) {
        this.allowDollar = allowDollar;
        this.allowDigit = allowDigit;
        this.allowReserved = allowReserved;
    }

    public static IdentifierOptions defaults() {
        return DEFAULTS;
    }

    public static IdentifierOptions unitsOfMeasure() {
        return UNITS_OF_MEASURE;
    }

    public static IdentifierOptions expression() {
        return EXPRESSION;
    }

    public boolean isAllowDollar() {
        return allowDollar;
    }

    public boolean isAllowDigit() {
        return allowDigit;
    }

    public boolean isAllowReserved() {
        return allowReserved;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof IdentifierOptions other)) {
            return false;
        }
        return allowDollar == other.allowDollar
                && allowDigit == other.allowDigit
                && allowReserved == other.allowReserved;
    }

    @Override
    public int hashCode() {
        return (allowDollar ? 4 : 0) | (allowDigit ? 2 : 0) | (allowReserved ? 1 : 0);
    }

    @Override
    public String toString() {
        return "IdentifierOptions[allowDollar="
                + allowDollar
                + ", allowDigit="
                + allowDigit
                + ", allowReserved="
                + allowReserved
                + "]";
    }
}
