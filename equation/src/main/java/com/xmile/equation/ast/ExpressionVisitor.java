package com.xmile.equation.ast;

public interface ExpressionVisitor<R> {

    R visitNumber(NumberLiteral number);

    R visitReference(Reference reference);

    R visitParentheses(Parentheses parentheses);

    R visitUnary(UnaryExpression unary);

    R visitBinary(BinaryExpression binary);

    R visitFunctionCall(FunctionCall call);

    R visitIfElse(IfElse ifElse);

    R visitComment(InlineComment comment);
}
