package com.xmile.codec.schema;

import java.util.Objects;

/** A {@code <connect to from>} wiring between a module port and a variable. */
public record ModuleConnection(String to, String from) {

    public ModuleConnection {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(from, "from");
    }
}
