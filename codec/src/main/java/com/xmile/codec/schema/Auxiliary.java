package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.Objects;

public record Auxiliary(Identifier name, EquationFields fields) implements Variable {

    public Auxiliary {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fields, "fields");
    }

    @Override
    public Documentation documentation() {
        return fields.documentation();
    }

    @Override
    public String elementName() {
        return "aux";
    }

    public Auxiliary withFields(EquationFields newFields) {
        return new Auxiliary(name, newFields);
    }
}
