package com.xmile.equation;

import com.xmile.equation.ast.BinaryExpression;
import com.xmile.equation.ast.CallTarget;
import com.xmile.equation.ast.Expression;
import com.xmile.equation.ast.FunctionCall;
import com.xmile.equation.ast.IfElse;
import com.xmile.equation.ast.InlineComment;
import com.xmile.equation.ast.NumberLiteral;
import com.xmile.equation.ast.Parentheses;
import com.xmile.equation.ast.Reference;
import com.xmile.equation.ast.UnaryExpression;
import com.xmile.equation.grammar.EquationLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Parses XMILE equation text. Tokens come from the generated {@link EquationLexer}; the grammar itself
 * is a hand-written precedence climber with one method per binding level, tightest first:
 * subscript/call, grouping, {@code ^}, unary, multiplicative, additive, relational, equality,
 * {@code AND}, {@code OR}.
 *
 * <p>Instances are stateless; each call works on its own token buffer.
 */
public final class ExpressionParser {

    private static final Map<Integer, Operator> MULTIPLICATIVE =
            Map.of(
                    EquationLexer.STAR, Operator.MULTIPLY,
                    EquationLexer.SLASH, Operator.DIVIDE,
                    EquationLexer.MOD, Operator.MOD);
    private static final Map<Integer, Operator> ADDITIVE =
            Map.of(EquationLexer.PLUS, Operator.ADD, EquationLexer.MINUS, Operator.SUBTRACT);
    private static final Map<Integer, Operator> RELATIONAL =
            Map.of(
                    EquationLexer.LESS, Operator.LESS,
                    EquationLexer.LESS_EQUAL, Operator.LESS_EQUAL,
                    EquationLexer.GREATER, Operator.GREATER,
                    EquationLexer.GREATER_EQUAL, Operator.GREATER_EQUAL);
    private static final Map<Integer, Operator> EQUALITY =
            Map.of(EquationLexer.EQUAL, Operator.EQUAL, EquationLexer.NOT_EQUAL, Operator.NOT_EQUAL);
    private static final Map<Integer, Operator> CONJUNCTION =
            Map.of(EquationLexer.AND, Operator.AND);
    private static final Map<Integer, Operator> DISJUNCTION = Map.of(EquationLexer.OR, Operator.OR);
    private static final Map<Integer, Operator> PREFIX =
            Map.of(
                    EquationLexer.PLUS, Operator.UNARY_PLUS,
                    EquationLexer.MINUS, Operator.UNARY_MINUS,
                    EquationLexer.NOT, Operator.NOT);

    /**
     * Parses a full equation field: expressions separated by {@code ;} or line breaks, with
     * {@code //} comments kept as their own elements. Blank text yields an empty list.
     */
    public List<Expression> parseExpressionList(String text) throws EquationParseException {
        Objects.requireNonNull(text, "text");
        String trimmed = text.stripTrailing();
        if (trimmed.isBlank()) {
            return List.of();
        }
        return new Session(trimmed).expressionList();
    }

    /** Parses text holding exactly one expression, such as a macro parameter default. */
    public Expression parseExpression(String text) throws EquationParseException {
        Objects.requireNonNull(text, "text");
        String trimmed = text.stripTrailing();
        if (trimmed.isBlank()) {
            throw new EquationParseException("Expected an expression", "", 0);
        }
        return new Session(trimmed).singleExpression();
    }

    private static List<Token> tokenize(String text) throws EquationParseException {
        EquationLexer lexer = new EquationLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ThrowingErrorListener(text));
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        try {
            tokens.fill();
        } catch (ParseCancellationException e) {
            if (e.getCause() instanceof EquationParseException failure) {
                throw failure;
            }
            throw new EquationParseException(
                    "Failed to tokenize equation: " + e.getMessage(), text, 0, e);
        }
        if (DebugFlags.isTokenDebugEnabled()) {
            DebugFlags.logTokens(tokens, lexer);
        }
        return tokens.getTokens();
    }

    @FunctionalInterface
    private interface OperandParser {
        Expression parse() throws EquationParseException;
    }

    /** Cursor over the token buffer of one parse call. */
    private static final class Session {
        private final String text;
        private final List<Token> tokens;
        private int position;
        // Line breaks only separate expressions outside of brackets and if/then/else.
        private int nesting;
        private int elementStart;

        Session(String text) throws EquationParseException {
            this.text = text;
            this.tokens = tokenize(text);
        }

        List<Expression> expressionList() throws EquationParseException {
            List<Expression> expressions = new ArrayList<>();
            skipSeparators();
            while (peekType() != Token.EOF) {
                elementStart = position;
                expressions.add(disjunction());
                int next = peekType();
                if (next == EquationLexer.SEMICOLON || next == EquationLexer.NEWLINE) {
                    skipSeparators();
                } else if (next != EquationLexer.COMMENT && next != Token.EOF) {
                    throw error("Unexpected trailing input", peek());
                }
            }
            return expressions;
        }

        Expression singleExpression() throws EquationParseException {
            skipNewlines();
            elementStart = -1;
            Expression expression = disjunction();
            skipSeparators();
            if (peekType() != Token.EOF) {
                throw error("Unexpected trailing input", peek());
            }
            return expression;
        }

        private Expression disjunction() throws EquationParseException {
            return leftFold(this::conjunction, DISJUNCTION);
        }

        private Expression conjunction() throws EquationParseException {
            return leftFold(this::equality, CONJUNCTION);
        }

        private Expression equality() throws EquationParseException {
            return leftFold(this::relational, EQUALITY);
        }

        private Expression relational() throws EquationParseException {
            return leftFold(this::additive, RELATIONAL);
        }

        private Expression additive() throws EquationParseException {
            return leftFold(this::multiplicative, ADDITIVE);
        }

        private Expression multiplicative() throws EquationParseException {
            return leftFold(this::unary, MULTIPLICATIVE);
        }

        private Expression leftFold(OperandParser operand, Map<Integer, Operator> operators)
                throws EquationParseException {
            Expression left = operand.parse();
            while (true) {
                Operator operator = operators.get(peekType());
                if (operator == null) {
                    return left;
                }
                next();
                left = new BinaryExpression(operator, left, operand.parse());
            }
        }

        private Expression unary() throws EquationParseException {
            skipNewlines();
            Operator operator = PREFIX.get(peekType());
            if (operator != null) {
                next();
                return new UnaryExpression(operator, unary());
            }
            return exponent();
        }

        private Expression exponent() throws EquationParseException {
            Expression base = primary();
            if (peekType() == EquationLexer.CARET) {
                next();
                // Recursing through unary keeps ^ right-associative and admits 2 ^ -1.
                return new BinaryExpression(Operator.EXPONENT, base, unary());
            }
            return base;
        }

        private Expression primary() throws EquationParseException {
            Token token = peek();
            switch (token.getType()) {
                case EquationLexer.NUMBER:
                    next();
                    return number(token);
                case EquationLexer.COMMENT:
                    if (position != elementStart) {
                        throw error("Comment where an operand is expected", token);
                    }
                    next();
                    return new InlineComment(token.getText().substring(2));
                case EquationLexer.IF:
                    return ifElse();
                case EquationLexer.IDENTIFIER:
                case EquationLexer.QUOTED_IDENTIFIER:
                    return referenceOrCall();
                case EquationLexer.LPAREN:
                    next();
                    nesting++;
                    Expression inner = disjunction();
                    close(EquationLexer.RPAREN, "Unterminated parenthesis", token);
                    return new Parentheses(inner);
                case Token.EOF:
                    throw error("Unexpected end of input where an operand is expected", token);
                default:
                    throw error(
                            "Unexpected token '" + token.getText() + "' where an operand is expected",
                            token);
            }
        }

        private Expression number(Token token) throws EquationParseException {
            double value;
            try {
                value = Double.parseDouble(token.getText());
            } catch (NumberFormatException e) {
                throw new EquationParseException(
                        "Malformed numeric literal '" + token.getText() + "'",
                        remainingFrom(token),
                        offsetOf(token),
                        e);
            }
            // Overflowing literals would render as INF, which reads back as a name.
            if (Double.isInfinite(value)) {
                throw new EquationParseException(
                        "Malformed numeric literal '" + token.getText() + "'",
                        remainingFrom(token),
                        offsetOf(token));
            }
            return new NumberLiteral(value);
        }

        private Expression ifElse() throws EquationParseException {
            Token keyword = next();
            nesting++;
            Expression condition = disjunction();
            expect(EquationLexer.THEN, "Expected THEN", keyword);
            Expression thenBranch = disjunction();
            expect(EquationLexer.ELSE, "Expected ELSE", keyword);
            nesting--;
            Expression elseBranch = disjunction();
            return new IfElse(condition, thenBranch, elseBranch);
        }

        private Expression referenceOrCall() throws EquationParseException {
            Token nameToken = next();
            Identifier identifier = identifier(nameToken);
            int following = peekType();
            if (following == EquationLexer.LBRACKET) {
                Token open = next();
                nesting++;
                List<Expression> indices = commaSeparated(EquationLexer.RBRACKET);
                if (indices.isEmpty()) {
                    throw error("Subscript needs at least one index", peek());
                }
                close(EquationLexer.RBRACKET, "Unterminated subscript", open);
                return new Reference(identifier, indices);
            }
            if (following == EquationLexer.LPAREN) {
                Token open = next();
                nesting++;
                List<Expression> arguments = commaSeparated(EquationLexer.RPAREN);
                close(EquationLexer.RPAREN, "Unterminated argument list", open);
                return new FunctionCall(CallTarget.function(identifier), arguments);
            }
            return new Reference(identifier);
        }

        private List<Expression> commaSeparated(int closingType) throws EquationParseException {
            List<Expression> items = new ArrayList<>();
            if (peekType() == closingType) {
                return items;
            }
            items.add(disjunction());
            while (peekType() == EquationLexer.COMMA) {
                next();
                items.add(disjunction());
            }
            return items;
        }

        private Identifier identifier(Token token) throws EquationParseException {
            try {
                return Identifier.parse(token.getText(), IdentifierOptions.expression());
            } catch (IdentifierException e) {
                throw new EquationParseException(
                        e.getMessage(), remainingFrom(token), offsetOf(token), e);
            }
        }

        private void close(int type, String unterminatedMessage, Token opening)
                throws EquationParseException {
            Token token = peek();
            if (token.getType() == Token.EOF) {
                throw error(unterminatedMessage, opening);
            }
            if (token.getType() != type) {
                throw error(
                        "Expected '" + EquationLexer.VOCABULARY.getLiteralName(type).replace("'", "")
                                + "' but found '" + token.getText() + "'",
                        token);
            }
            next();
            nesting--;
        }

        private void expect(int type, String message, Token context) throws EquationParseException {
            Token token = peek();
            if (token.getType() != type) {
                throw error(message, token.getType() == Token.EOF ? context : token);
            }
            next();
        }

        private Token peek() {
            int index = position;
            if (nesting > 0) {
                while (tokens.get(index).getType() == EquationLexer.NEWLINE) {
                    index++;
                }
            }
            return tokens.get(index);
        }

        private int peekType() {
            return peek().getType();
        }

        private Token next() {
            if (nesting > 0) {
                skipNewlines();
            }
            Token token = tokens.get(position);
            if (token.getType() != Token.EOF) {
                position++;
            }
            return token;
        }

        private void skipNewlines() {
            while (tokens.get(position).getType() == EquationLexer.NEWLINE) {
                position++;
            }
        }

        private void skipSeparators() {
            int type = tokens.get(position).getType();
            while (type == EquationLexer.NEWLINE || type == EquationLexer.SEMICOLON) {
                position++;
                type = tokens.get(position).getType();
            }
        }

        private EquationParseException error(String message, Token token) {
            return new EquationParseException(message, remainingFrom(token), offsetOf(token));
        }

        private String remainingFrom(Token token) {
            int offset = offsetOf(token);
            return offset >= text.length() ? "" : text.substring(offset);
        }

        // ANTLR indexes code points; convert back to a String offset.
        private int offsetOf(Token token) {
            if (token.getType() == Token.EOF || token.getStartIndex() < 0) {
                return text.length();
            }
            int codePoints = text.codePointCount(0, text.length());
            if (token.getStartIndex() >= codePoints) {
                return text.length();
            }
            return text.offsetByCodePoints(0, token.getStartIndex());
        }
    }
}
