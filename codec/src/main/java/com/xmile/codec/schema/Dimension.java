package com.xmile.codec.schema;

import java.util.List;
import java.util.Objects;

/** A named array dimension, given either by size or by an explicit element list. */
public record Dimension(String name, Integer size, List<String> elements) {

    public Dimension {
        Objects.requireNonNull(name, "name");
        elements = elements == null ? List.of() : List.copyOf(elements);
    }
}
