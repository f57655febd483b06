package com.xmile.equation.ast;

import java.util.List;
import java.util.Objects;

public final class FunctionCall extends Expression {

    private final CallTarget target;
    private final List<Expression> arguments;

    public FunctionCall(CallTarget target, List<Expression> arguments) {
        this.target = Objects.requireNonNull(target, "target");
        this.arguments = List.copyOf(arguments);
    }

    public CallTarget getTarget() {
        return target;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FunctionCall other)) {
            return false;
        }
        return target.equals(other.target) && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, arguments);
    }

    @Override
    public String toString() {
        return "Call(" + target + ", " + arguments + ")";
    }
}
