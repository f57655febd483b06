package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Diagram symbol of a stock, flow, auxiliary or module. Only flows carry pipe points. */
public record VariableObject(
        Kind kind,
        Integer uid,
        Identifier name,
        Double x,
        Double y,
        Double width,
        Double height,
        String labelSide,
        List<Point> points)
        implements ViewObject {

    public enum Kind {
        STOCK,
        FLOW,
        AUX,
        MODULE;

        public String xmlName() {
            return name().toLowerCase(Locale.ROOT);
        }

        public String displayName() {
            return switch (this) {
                case STOCK -> "Stock";
                case FLOW -> "Flow";
                case AUX -> "Aux";
                case MODULE -> "Module";
            };
        }
    }

    public VariableObject {
        Objects.requireNonNull(kind, "kind");
        points = points == null ? List.of() : List.copyOf(points);
    }
}
