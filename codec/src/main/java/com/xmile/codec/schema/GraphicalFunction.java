package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.Objects;

/**
 * A lookup table. Standalone ones sit in the variable list with a name; one embedded in a stock, flow
 * or auxiliary has none and maps that variable's equation result.
 */
public record GraphicalFunction(
        Identifier name,
        GraphicalFunctionType type,
        Equation equation,
        GraphicalFunctionData data,
        Documentation documentation,
        String units)
        implements Variable {

    public GraphicalFunction {
        Objects.requireNonNull(data, "data");
    }

    @Override
    public String elementName() {
        return "gf";
    }

    public GraphicalFunction withEquation(Equation newEquation) {
        return new GraphicalFunction(name, type, newEquation, data, documentation, units);
    }
}
