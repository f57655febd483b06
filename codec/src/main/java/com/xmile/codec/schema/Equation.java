package com.xmile.codec.schema;

import com.xmile.equation.ExpressionRenderer;
import com.xmile.equation.ast.Expression;
import java.util.List;
import java.util.Objects;

/**
 * Contents of an {@code <eqn>} element: the parsed expression list plus the text it was read from.
 * Two equations are equal when their expressions are; the source text is kept for diagnostics only.
 */
public final class Equation {

    private final String sourceText;
    private final List<Expression> expressions;

    public Equation(String sourceText, List<Expression> expressions) {
        this.sourceText = Objects.requireNonNull(sourceText, "sourceText");
        this.expressions = List.copyOf(expressions);
    }

    /** Builds an equation from expressions assembled in code. */
    public static Equation of(List<Expression> expressions) {
        return new Equation(ExpressionRenderer.renderList(expressions), expressions);
    }

    public static Equation of(Expression expression) {
        return of(List.of(expression));
    }

    public String getSourceText() {
        return sourceText;
    }

    public List<Expression> getExpressions() {
        return expressions;
    }

    public boolean isEmpty() {
        return expressions.isEmpty();
    }

    public Equation withExpressions(List<Expression> newExpressions) {
        return new Equation(sourceText, newExpressions);
    }

    /** Canonical text written back into the document. */
    public String render() {
        return ExpressionRenderer.renderList(expressions);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Equation other)) {
            return false;
        }
        return expressions.equals(other.expressions);
    }

    @Override
    public int hashCode() {
        return expressions.hashCode();
    }

    @Override
    public String toString() {
        return "Equation(" + sourceText + ")";
    }
}
