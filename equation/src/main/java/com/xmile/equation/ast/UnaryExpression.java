package com.xmile.equation.ast;

import com.xmile.equation.Operator;
import java.util.Objects;

public final class UnaryExpression extends Expression {

    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator");
        if (!operator.isUnary()) {
            throw new IllegalArgumentException("Not a unary operator: " + operator);
        }
        this.operand = Objects.requireNonNull(operand, "operand");
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getOperand() {
        return operand;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof UnaryExpression other)) {
            return false;
        }
        return operator == other.operator && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return operator + "(" + operand + ")";
    }
}
