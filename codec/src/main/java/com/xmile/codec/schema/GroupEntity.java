package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.Objects;

public record GroupEntity(Identifier name, boolean run) {

    public GroupEntity {
        Objects.requireNonNull(name, "name");
    }
}
