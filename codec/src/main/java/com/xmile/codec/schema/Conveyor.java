package com.xmile.codec.schema;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Transit settings of a conveyor stock. The length is required; the other equations and the
 * behavior flags are optional and null when absent.
 */
public record Conveyor(
        Equation length,
        Equation capacity,
        Equation inflowLimit,
        Equation sample,
        Equation arrest,
        Boolean discrete,
        Boolean batchIntegrity,
        Boolean oneAtATime,
        Boolean exponentialLeak) {

    public Conveyor {
        Objects.requireNonNull(length, "length");
    }

    public static Conveyor of(Equation length) {
        return new Conveyor(length, null, null, null, null, null, null, null, null);
    }

    /** Applies the mapper to every equation that is present. */
    public Conveyor mapEquations(UnaryOperator<Equation> mapper) {
        return new Conveyor(
                mapper.apply(length),
                capacity == null ? null : mapper.apply(capacity),
                inflowLimit == null ? null : mapper.apply(inflowLimit),
                sample == null ? null : mapper.apply(sample),
                arrest == null ? null : mapper.apply(arrest),
                discrete,
                batchIntegrity,
                oneAtATime,
                exponentialLeak);
    }
}
