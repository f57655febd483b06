package com.xmile.equation;

import com.xmile.equation.ast.BinaryExpression;
import com.xmile.equation.ast.Expression;
import com.xmile.equation.ast.ExpressionVisitor;
import com.xmile.equation.ast.FunctionCall;
import com.xmile.equation.ast.IfElse;
import com.xmile.equation.ast.InlineComment;
import com.xmile.equation.ast.NumberLiteral;
import com.xmile.equation.ast.Parentheses;
import com.xmile.equation.ast.Reference;
import com.xmile.equation.ast.UnaryExpression;
import java.util.List;

/**
 * Turns an expression tree back into equation text that {@link ExpressionParser} reads as the same
 * tree. Parsed trees already carry their {@link Parentheses}; for trees assembled in code the renderer
 * adds the grouping the operator ranks require.
 */
public final class ExpressionRenderer {

    private static final int LOOSEST = 10;

    private ExpressionRenderer() {}

    public static String render(Expression expression) {
        StringBuilder out = new StringBuilder();
        expression.accept(new Writer(out));
        return out.toString();
    }

    /** Joins list elements with {@code ; }; a comment ends its line. */
    public static String renderList(List<Expression> expressions) {
        StringBuilder out = new StringBuilder();
        Writer writer = new Writer(out);
        Expression previous = null;
        for (Expression expression : expressions) {
            if (previous instanceof InlineComment) {
                out.append('\n');
            } else if (previous != null) {
                out.append(expression instanceof InlineComment ? " " : "; ");
            }
            expression.accept(writer);
            previous = expression;
        }
        return out.toString();
    }

    private static int rank(Expression expression) {
        if (expression instanceof BinaryExpression binary) {
            return binary.getOperator().getRank();
        }
        if (expression instanceof UnaryExpression) {
            return Operator.NOT.getRank();
        }
        if (expression instanceof IfElse) {
            return LOOSEST;
        }
        if (expression instanceof NumberLiteral number
                && DecimalText.format(number.getValue()).startsWith("-")) {
            // Reads back as a prefix minus.
            return Operator.UNARY_MINUS.getRank();
        }
        return 0;
    }

    // True when the text of the expression ends in an else-branch that would swallow what follows.
    private static boolean endsOpen(Expression expression) {
        if (expression instanceof IfElse) {
            return true;
        }
        if (expression instanceof BinaryExpression binary) {
            return endsOpen(binary.getRight());
        }
        if (expression instanceof UnaryExpression unary) {
            return endsOpen(unary.getOperand());
        }
        return false;
    }

    private static final class Writer implements ExpressionVisitor<Void> {
        private final StringBuilder out;

        Writer(StringBuilder out) {
            this.out = out;
        }

        @Override
        public Void visitNumber(NumberLiteral number) {
            out.append(DecimalText.format(number.getValue()));
            return null;
        }

        @Override
        public Void visitReference(Reference reference) {
            out.append(reference.getIdentifier().toExpressionText());
            if (reference.isSubscripted()) {
                out.append('[');
                writeAll(reference.getIndices());
                out.append(']');
            }
            return null;
        }

        @Override
        public Void visitParentheses(Parentheses parentheses) {
            out.append('(');
            parentheses.getInner().accept(this);
            out.append(')');
            return null;
        }

        @Override
        public Void visitUnary(UnaryExpression unary) {
            Operator operator = unary.getOperator();
            out.append(operator.getSymbol());
            if (operator == Operator.NOT || unary.getOperand() instanceof UnaryExpression) {
                out.append(' ');
            }
            Expression operand = unary.getOperand();
            boolean group = !(operand instanceof IfElse) && rank(operand) > operator.getRank();
            writeOperand(operand, group);
            return null;
        }

        @Override
        public Void visitBinary(BinaryExpression binary) {
            Operator operator = binary.getOperator();
            int parentRank = operator.getRank();
            Expression left = binary.getLeft();
            boolean groupLeft =
                    rank(left) > parentRank
                            || (operator.isRightAssociative() && rank(left) == parentRank)
                            || endsOpen(left);
            writeOperand(left, groupLeft);

            out.append(' ').append(operator.getSymbol()).append(' ');

            Expression right = binary.getRight();
            boolean groupRight;
            if (right instanceof IfElse) {
                groupRight = false;
            } else if (operator == Operator.EXPONENT && right instanceof UnaryExpression) {
                groupRight = false;
            } else {
                groupRight =
                        rank(right) > parentRank
                                || (!operator.isRightAssociative() && rank(right) == parentRank);
            }
            writeOperand(right, groupRight);
            return null;
        }

        @Override
        public Void visitFunctionCall(FunctionCall call) {
            out.append(call.getTarget().getName().toExpressionText()).append('(');
            writeAll(call.getArguments());
            out.append(')');
            return null;
        }

        @Override
        public Void visitIfElse(IfElse ifElse) {
            out.append("IF ");
            ifElse.getCondition().accept(this);
            out.append(" THEN ");
            ifElse.getThenBranch().accept(this);
            out.append(" ELSE ");
            ifElse.getElseBranch().accept(this);
            return null;
        }

        @Override
        public Void visitComment(InlineComment comment) {
            out.append("// ").append(comment.getText());
            return null;
        }

        private void writeOperand(Expression operand, boolean group) {
            if (group) {
                out.append('(');
            }
            operand.accept(this);
            if (group) {
                out.append(')');
            }
        }

        private void writeAll(List<Expression> expressions) {
            for (int i = 0; i < expressions.size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                expressions.get(i).accept(this);
            }
        }
    }
}
