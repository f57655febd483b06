package com.xmile.codec.schema;

import java.util.Objects;

/** A {@code <doc>} body, kept as plain text or as an HTML fragment. */
public sealed interface Documentation {

    String text();

    /** Classifies raw doc text: markup on both sides makes it HTML. */
    static Documentation of(String text) {
        String trimmed = text.strip();
        if (trimmed.contains("<") && trimmed.contains(">")) {
            return new Html(text);
        }
        return new PlainText(text);
    }

    record PlainText(String text) implements Documentation {

        public PlainText {
            Objects.requireNonNull(text, "text");
        }
    }

    record Html(String text) implements Documentation {

        public Html {
            Objects.requireNonNull(text, "text");
        }
    }
}
