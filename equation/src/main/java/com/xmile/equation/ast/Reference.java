package com.xmile.equation.ast;

import com.xmile.equation.Identifier;
import java.util.List;
import java.util.Objects;

/** A variable reference, or an array element reference when indices are present. */
public final class Reference extends Expression {

    private final Identifier identifier;
    private final List<Expression> indices;

    public Reference(Identifier identifier) {
        this(identifier, List.of());
    }

    public Reference(Identifier identifier, List<Expression> indices) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.indices = List.copyOf(indices);
    }

    public Identifier getIdentifier() {
        return identifier;
    }

    public List<Expression> getIndices() {
        return indices;
    }

    public boolean isSubscripted() {
        return !indices.isEmpty();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitReference(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Reference other)) {
            return false;
        }
        return identifier.equals(other.identifier) && indices.equals(other.indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, indices);
    }

    @Override
    public String toString() {
        return indices.isEmpty()
                ? "Reference(" + identifier + ")"
                : "Reference(" + identifier + ", " + indices + ")";
    }
}
