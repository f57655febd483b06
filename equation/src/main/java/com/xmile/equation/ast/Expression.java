package com.xmile.equation.ast;

/** A node of a parsed equation. */
public sealed abstract class Expression
        permits NumberLiteral,
                Reference,
                Parentheses,
                UnaryExpression,
                BinaryExpression,
                FunctionCall,
                IfElse,
                InlineComment {

    public abstract <R> R accept(ExpressionVisitor<R> visitor);
}
