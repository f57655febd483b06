package com.xmile.equation.ast;

import java.util.Objects;

/** Grouping written by the author. Kept so the equation text renders back the way it was typed. */
public final class Parentheses extends Expression {

    private final Expression inner;

    public Parentheses(Expression inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    public Expression getInner() {
        return inner;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitParentheses(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Parentheses other)) {
            return false;
        }
        return inner.equals(other.inner);
    }

    @Override
    public int hashCode() {
        return 31 * inner.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "Parentheses(" + inner + ")";
    }
}
