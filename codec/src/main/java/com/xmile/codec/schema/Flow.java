package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.Objects;

/** A flow; {@code transit} is null unless the flow overflows a queue or leaks from a conveyor. */
public record Flow(
        Identifier name,
        EquationFields fields,
        Double multiplier,
        NonNegative nonNegative,
        TransitOptions transit)
        implements Variable {

    public Flow {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fields, "fields");
    }

    public Flow(Identifier name, EquationFields fields, Double multiplier, NonNegative nonNegative) {
        this(name, fields, multiplier, nonNegative, null);
    }

    @Override
    public Documentation documentation() {
        return fields.documentation();
    }

    @Override
    public String elementName() {
        return "flow";
    }

    public Flow withFields(EquationFields newFields) {
        return new Flow(name, newFields, multiplier, nonNegative, transit);
    }
}
