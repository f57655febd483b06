package com.xmile.equation.ast;

import java.util.Objects;

public final class IfElse extends Expression {

    private final Expression condition;
    private final Expression thenBranch;
    private final Expression elseBranch;

    public IfElse(Expression condition, Expression thenBranch, Expression elseBranch) {
        this.condition = Objects.requireNonNull(condition, "condition");
        this.thenBranch = Objects.requireNonNull(thenBranch, "thenBranch");
        this.elseBranch = Objects.requireNonNull(elseBranch, "elseBranch");
    }

    public Expression getCondition() {
        return condition;
    }

    public Expression getThenBranch() {
        return thenBranch;
    }

    public Expression getElseBranch() {
        return elseBranch;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIfElse(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof IfElse other)) {
            return false;
        }
        return condition.equals(other.condition)
                && thenBranch.equals(other.thenBranch)
                && elseBranch.equals(other.elseBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, thenBranch, elseBranch);
    }

    @Override
    public String toString() {
        return "IfElse(" + condition + ", " + thenBranch + ", " + elseBranch + ")";
    }
}
