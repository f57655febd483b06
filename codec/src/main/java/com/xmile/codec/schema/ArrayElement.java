package com.xmile.codec.schema;

import java.util.Objects;

/** Per-element equation of an arrayed variable, addressed by its comma-separated subscript. */
public record ArrayElement(String subscript, Equation equation) {

    public ArrayElement {
        Objects.requireNonNull(subscript, "subscript");
    }
}
