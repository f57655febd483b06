package com.xmile.codec.schema;

import java.util.Objects;

/** One {@code <model>}; fields may be replaced by application code between decode and encode. */
public final class Model {

    private String name;
    private String resource;
    private SimSpecs simSpecs;
    private Behavior behavior;
    private Variables variables;
    private Views views;

    public Model(Variables variables) {
        this.variables = Objects.requireNonNull(variables, "variables");
    }

    public Model(String name, Variables variables) {
        this(variables);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getResource() {
        return resource;
    }

    public void setResource(String resource) {
        this.resource = resource;
    }

    public SimSpecs getSimSpecs() {
        return simSpecs;
    }

    public void setSimSpecs(SimSpecs simSpecs) {
        this.simSpecs = simSpecs;
    }

    public Behavior getBehavior() {
        return behavior;
    }

    public void setBehavior(Behavior behavior) {
        this.behavior = behavior;
    }

    public Variables getVariables() {
        return variables;
    }

    public void setVariables(Variables variables) {
        this.variables = Objects.requireNonNull(variables, "variables");
    }

    public Views getViews() {
        return views;
    }

    public void setViews(Views views) {
        this.views = views;
    }

    /** A model without a name attribute is the root model of its file. */
    public boolean isRoot() {
        return name == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Model other)) {
            return false;
        }
        return Objects.equals(name, other.name)
                && Objects.equals(resource, other.resource)
                && Objects.equals(simSpecs, other.simSpecs)
                && Objects.equals(behavior, other.behavior)
                && variables.equals(other.variables)
                && Objects.equals(views, other.views);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, resource, simSpecs, behavior, variables, views);
    }

    @Override
    public String toString() {
        return "Model(" + (name == null ? "<root>" : name) + ", " + variables.size() + " variables)";
    }
}
