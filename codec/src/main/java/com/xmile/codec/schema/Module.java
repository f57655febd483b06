package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.List;
import java.util.Objects;

/** Instance of another model, wired to this one through its connections. */
public record Module(
        Identifier name,
        String resource,
        List<ModuleConnection> connections,
        Documentation documentation)
        implements Variable {

    public Module {
        Objects.requireNonNull(name, "name");
        connections = connections == null ? List.of() : List.copyOf(connections);
    }

    @Override
    public String elementName() {
        return "module";
    }
}
