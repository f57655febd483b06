package com.xmile.equation;

/**
 * Raised when equation text does not parse. Carries the input that was left unconsumed at the point
 * of failure so callers can report a position inside the enclosing document.
 */
public final class EquationParseException extends Exception {

    private static final int EXCERPT_LENGTH = 40;

    private final String remainingInput;
    private final int offset;

    public EquationParseException(String message, String remainingInput, int offset) {
        super(describe(message, remainingInput));
        this.remainingInput = remainingInput;
        this.offset = offset;
    }

    public EquationParseException(
            String message, String remainingInput, int offset, Throwable cause) {
        super(describe(message, remainingInput), cause);
        this.remainingInput = remainingInput;
        this.offset = offset;
    }

    public String getRemainingInput() {
        return remainingInput;
    }

    /** Character offset of the remaining input within the parsed text. */
    public int getOffset() {
        return offset;
    }

    private static String describe(String message, String remaining) {
        if (remaining == null || remaining.isEmpty()) {
            return message + " at end of input";
        }
        String excerpt =
                remaining.length() > EXCERPT_LENGTH
                        ? remaining.substring(0, EXCERPT_LENGTH) + "..."
                        : remaining;
        return message + " near '" + excerpt + "'";
    }
}
