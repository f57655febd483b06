package com.xmile.equation.semantic;

import com.xmile.equation.Identifier;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Names declared in a model that a call-shaped expression may refer to instead of a function. */
public final class SymbolTable {

    private final Set<Identifier> graphicalFunctions;
    private final Set<Identifier> models;
    private final Set<Identifier> arrays;

    public SymbolTable(
            Set<Identifier> graphicalFunctions, Set<Identifier> models, Set<Identifier> arrays) {
        this.graphicalFunctions =
                Set.copyOf(Objects.requireNonNull(graphicalFunctions, "graphicalFunctions"));
        this.models = Set.copyOf(Objects.requireNonNull(models, "models"));
        this.arrays = Set.copyOf(Objects.requireNonNull(arrays, "arrays"));
    }

    public static SymbolTable empty() {
        return new SymbolTable(Set.of(), Set.of(), Set.of());
    }

    public boolean isGraphicalFunction(Identifier name) {
        return graphicalFunctions.contains(name);
    }

    public boolean isModel(Identifier name) {
        return models.contains(name);
    }

    public boolean isArray(Identifier name) {
        return arrays.contains(name);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Set<Identifier> graphicalFunctions = new LinkedHashSet<>();
        private final Set<Identifier> models = new LinkedHashSet<>();
        private final Set<Identifier> arrays = new LinkedHashSet<>();

        private Builder() {}

        public Builder graphicalFunction(Identifier name) {
            graphicalFunctions.add(Objects.requireNonNull(name, "name"));
            return this;
        }

        public Builder model(Identifier name) {
            models.add(Objects.requireNonNull(name, "name"));
            return this;
        }

        public Builder array(Identifier name) {
            arrays.add(Objects.requireNonNull(name, "name"));
            return this;
        }

        public SymbolTable build() {
            return new SymbolTable(graphicalFunctions, models, arrays);
        }
    }
}
