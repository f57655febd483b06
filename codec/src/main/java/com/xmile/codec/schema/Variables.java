package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.ArrayList;
import java.util.List;

/** The ordered contents of a {@code <variables>} block. */
public record Variables(List<Variable> all) {

    public Variables {
        all = List.copyOf(all);
    }

    public static Variables empty() {
        return new Variables(List.of());
    }

    public static Variables of(Variable... variables) {
        return new Variables(List.of(variables));
    }

    public <T extends Variable> List<T> ofType(Class<T> type) {
        List<T> matches = new ArrayList<>();
        for (Variable variable : all) {
            if (type.isInstance(variable)) {
                matches.add(type.cast(variable));
            }
        }
        return matches;
    }

    /** First variable with the given name, or null. */
    public Variable find(Identifier name) {
        for (Variable variable : all) {
            if (name.equals(variable.name())) {
                return variable;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return all.isEmpty();
    }

    public int size() {
        return all.size();
    }
}
