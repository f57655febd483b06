package com.xmile.equation;

/** Raised when text cannot be used as an XMILE identifier. */
public final class IdentifierException extends Exception {

    public enum Kind {
        EMPTY,
        INVALID_FIRST_CHARACTER,
        INVALID_LAST_CHARACTER,
        INVALID_CHARACTER,
        RESERVED,
        INVALID_QUALIFIED_NAME
    }

    private final Kind kind;
    private final String input;

    public IdentifierException(Kind kind, String input, String message) {
        super(message);
        this.kind = kind;
        this.input = input;
    }

    public Kind getKind() {
        return kind;
    }

    public String getInput() {
        return input;
    }
}
