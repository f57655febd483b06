package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.List;
import java.util.Objects;

/**
 * A stock. A plain stock has neither {@code conveyor} nor {@code queue}; a conveyor stock carries its
 * {@link Conveyor} settings and a queue stock sets {@code queue}. The two are exclusive.
 */
public record Stock(
        Identifier name,
        EquationFields fields,
        List<Identifier> inflows,
        List<Identifier> outflows,
        NonNegative nonNegative,
        Conveyor conveyor,
        boolean queue)
        implements Variable {

    public Stock {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fields, "fields");
        inflows = inflows == null ? List.of() : List.copyOf(inflows);
        outflows = outflows == null ? List.of() : List.copyOf(outflows);
        if (conveyor != null && queue) {
            throw new IllegalArgumentException(
                    "Stock '" + name + "' cannot be both a conveyor and a queue");
        }
    }

    public Stock(
            Identifier name,
            EquationFields fields,
            List<Identifier> inflows,
            List<Identifier> outflows,
            NonNegative nonNegative) {
        this(name, fields, inflows, outflows, nonNegative, null, false);
    }

    @Override
    public Documentation documentation() {
        return fields.documentation();
    }

    @Override
    public String elementName() {
        return "stock";
    }

    public boolean isConveyor() {
        return conveyor != null;
    }

    public Stock withFields(EquationFields newFields) {
        return new Stock(name, newFields, inflows, outflows, nonNegative, conveyor, queue);
    }

    public Stock withConveyor(Conveyor newConveyor) {
        return new Stock(name, fields, inflows, outflows, nonNegative, newConveyor, queue);
    }
}
