package com.xmile.equation.semantic;

import com.xmile.equation.ast.BinaryExpression;
import com.xmile.equation.ast.CallTarget;
import com.xmile.equation.ast.Expression;
import com.xmile.equation.ast.ExpressionVisitor;
import com.xmile.equation.ast.FunctionCall;
import com.xmile.equation.ast.IfElse;
import com.xmile.equation.ast.InlineComment;
import com.xmile.equation.ast.NumberLiteral;
import com.xmile.equation.ast.Parentheses;
import com.xmile.equation.ast.Reference;
import com.xmile.equation.ast.UnaryExpression;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Settles the target of every {@code name(...)} expression against the declared symbols. A name
 * declared as a graphical function wins over a module, which wins over an array; anything else stays
 * a function call. Trees are immutable, so resolution returns a rewritten copy.
 */
public final class CallTargetResolver {

    private final SymbolTable symbols;
    private final ExpressionVisitor<Expression> rewriter = new Rewriter();

    public CallTargetResolver(SymbolTable symbols) {
        this.symbols = Objects.requireNonNull(symbols, "symbols");
    }

    public Expression resolve(Expression expression) {
        return expression.accept(rewriter);
    }

    public List<Expression> resolveAll(List<Expression> expressions) {
        List<Expression> resolved = new ArrayList<>(expressions.size());
        for (Expression expression : expressions) {
            resolved.add(resolve(expression));
        }
        return List.copyOf(resolved);
    }

    CallTarget.Kind kindOf(CallTarget target) {
        if (symbols.isGraphicalFunction(target.getName())) {
            return CallTarget.Kind.GRAPHICAL_FUNCTION;
        }
        if (symbols.isModel(target.getName())) {
            return CallTarget.Kind.MODEL;
        }
        if (symbols.isArray(target.getName())) {
            return CallTarget.Kind.ARRAY;
        }
        return CallTarget.Kind.FUNCTION;
    }

    private final class Rewriter implements ExpressionVisitor<Expression> {

        @Override
        public Expression visitNumber(NumberLiteral number) {
            return number;
        }

        @Override
        public Expression visitReference(Reference reference) {
            if (!reference.isSubscripted()) {
                return reference;
            }
            return new Reference(reference.getIdentifier(), resolveAll(reference.getIndices()));
        }

        @Override
        public Expression visitParentheses(Parentheses parentheses) {
            return new Parentheses(resolve(parentheses.getInner()));
        }

        @Override
        public Expression visitUnary(UnaryExpression unary) {
            return new UnaryExpression(unary.getOperator(), resolve(unary.getOperand()));
        }

        @Override
        public Expression visitBinary(BinaryExpression binary) {
            return new BinaryExpression(
                    binary.getOperator(), resolve(binary.getLeft()), resolve(binary.getRight()));
        }

        @Override
        public Expression visitFunctionCall(FunctionCall call) {
            CallTarget target = call.getTarget().withKind(kindOf(call.getTarget()));
            return new FunctionCall(target, resolveAll(call.getArguments()));
        }

        @Override
        public Expression visitIfElse(IfElse ifElse) {
            return new IfElse(
                    resolve(ifElse.getCondition()),
                    resolve(ifElse.getThenBranch()),
                    resolve(ifElse.getElseBranch()));
        }

        @Override
        public Expression visitComment(InlineComment comment) {
            return comment;
        }
    }
}
