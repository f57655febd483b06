package com.xmile.codec.schema;

import java.util.List;
import java.util.Objects;

public record UnitDefinition(String name, String equation, List<String> aliases, Boolean disabled) {

    public UnitDefinition {
        Objects.requireNonNull(name, "name");
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }
}
