package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.List;
import java.util.Objects;

/**
 * A user-defined function. Equality covers the definition only: the {@link MacroView} diagram is not
 * part of {@link #equals(Object)} or {@link #hashCode()}, so two macros that differ only in layout
 * compare equal.
 */
public final class Macro {

    private final Identifier name;
    private final String namespace;
    private final List<MacroParameter> parameters;
    private final Equation equation;
    private final String format;
    private final Documentation documentation;
    private final SimSpecs simSpecs;
    private final Variables variables;
    private final MacroView view;

    public Macro(
            Identifier name,
            String namespace,
            List<MacroParameter> parameters,
            Equation equation,
            String format,
            Documentation documentation,
            SimSpecs simSpecs,
            Variables variables,
            MacroView view) {
        this.name = Objects.requireNonNull(name, "name");
        this.namespace = namespace;
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.equation = Objects.requireNonNull(equation, "equation");
        this.format = format;
        this.documentation = documentation;
        this.simSpecs = simSpecs;
        this.variables = variables;
        this.view = view;
    }

    public Identifier getName() {
        return name;
    }

    public String getNamespace() {
        return namespace;
    }

    public List<MacroParameter> getParameters() {
        return parameters;
    }

    public Equation getEquation() {
        return equation;
    }

    public String getFormat() {
        return format;
    }

    public Documentation getDocumentation() {
        return documentation;
    }

    public SimSpecs getSimSpecs() {
        return simSpecs;
    }

    public Variables getVariables() {
        return variables;
    }

    public MacroView getView() {
        return view;
    }

    public Macro withEquation(Equation newEquation) {
        return new Macro(
                name, namespace, parameters, newEquation, format, documentation, simSpecs, variables,
                view);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Macro other)) {
            return false;
        }
        return name.equals(other.name)
                && Objects.equals(namespace, other.namespace)
                && parameters.equals(other.parameters)
                && equation.equals(other.equation)
                && Objects.equals(format, other.format)
                && Objects.equals(documentation, other.documentation)
                && Objects.equals(simSpecs, other.simSpecs)
                && Objects.equals(variables, other.variables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                name, namespace, parameters, equation, format, documentation, simSpecs, variables);
    }

    @Override
    public String toString() {
        return "Macro(" + name + ", " + parameters + ")";
    }
}
