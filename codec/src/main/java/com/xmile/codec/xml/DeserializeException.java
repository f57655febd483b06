package com.xmile.codec.xml;

import java.util.Objects;

/** A document that cannot be mapped onto the schema. */
public final class DeserializeException extends Exception {

    public enum Kind {
        XML,
        IO,
        CUSTOM,
        UNEXPECTED_EOF,
        UNEXPECTED_ELEMENT,
        MISSING_FIELD
    }

    private final Kind kind;
    private final String expected;
    private final String found;
    private final String field;

    private DeserializeException(
            Kind kind, String message, String expected, String found, String field, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.expected = expected;
        this.found = found;
        this.field = field;
    }

    public static DeserializeException custom(String message) {
        return new DeserializeException(Kind.CUSTOM, message, null, null, null, null);
    }

    public static DeserializeException custom(String message, Throwable cause) {
        return new DeserializeException(Kind.CUSTOM, message, null, null, null, cause);
    }

    public static DeserializeException missingField(String field) {
        return new DeserializeException(
                Kind.MISSING_FIELD, "Missing required field: " + field, null, null, field, null);
    }

    public static DeserializeException unexpectedElement(String expected, String found) {
        return new DeserializeException(
                Kind.UNEXPECTED_ELEMENT,
                "Unexpected element: expected " + expected + ", found " + found,
                expected,
                found,
                null,
                null);
    }

    public static DeserializeException unexpectedEof() {
        return unexpectedEof(null);
    }

    public static DeserializeException unexpectedEof(Throwable cause) {
        return new DeserializeException(
                Kind.UNEXPECTED_EOF, "Unexpected end of document", null, null, null, cause);
    }

    public static DeserializeException xml(String message, Throwable cause) {
        return new DeserializeException(Kind.XML, message, null, null, null, cause);
    }

    public static DeserializeException io(String message, Throwable cause) {
        return new DeserializeException(Kind.IO, message, null, null, null, cause);
    }

    public Kind getKind() {
        return kind;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    /** Name of the missing field for {@link Kind#MISSING_FIELD}. */
    public String getField() {
        return field;
    }
}
