package com.xmile.equation.ast;

import java.util.Objects;

/** A {@code //} comment. It occupies its own slot in an equation's expression list. */
public final class InlineComment extends Expression {

    private final String text;

    public InlineComment(String text) {
        this.text = Objects.requireNonNull(text, "text").strip();
    }

    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitComment(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof InlineComment other)) {
            return false;
        }
        return text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "Comment(" + text + ")";
    }
}
