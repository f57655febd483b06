package com.xmile.equation.ast;

import com.xmile.equation.Operator;
import java.util.Objects;

public final class BinaryExpression extends Expression {

    private final Operator operator;
    private final Expression left;
    private final Expression right;

    public BinaryExpression(Operator operator, Expression left, Expression right) {
        this.operator = Objects.requireNonNull(operator, "operator");
        if (!operator.isBinary()) {
            throw new IllegalArgumentException("Not a binary operator: " + operator);
        }
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getLeft() {
        return left;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof BinaryExpression other)) {
            return false;
        }
        return operator == other.operator && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, left, right);
    }

    @Override
    public String toString() {
        return operator + "(" + left + ", " + right + ")";
    }
}
