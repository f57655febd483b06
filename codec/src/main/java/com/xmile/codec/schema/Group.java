package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.List;
import java.util.Objects;

public record Group(Identifier name, Documentation documentation, List<GroupEntity> entities)
        implements Variable {

    public Group {
        Objects.requireNonNull(name, "name");
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    @Override
    public String elementName() {
        return "group";
    }
}
