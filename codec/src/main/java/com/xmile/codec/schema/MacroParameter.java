package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import com.xmile.equation.ast.Expression;
import java.util.Objects;

/** A macro {@code <parm>}; the default value is optional. */
public record MacroParameter(Identifier name, Expression defaultValue) {

    public MacroParameter {
        Objects.requireNonNull(name, "name");
    }
}
