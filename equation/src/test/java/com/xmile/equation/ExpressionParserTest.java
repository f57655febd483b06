package com.xmile.equation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

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
import java.util.List;
import org.junit.jupiter.api.Test;

class ExpressionParserTest {

    private final ExpressionParser parser = new ExpressionParser();

    @Test
    void multiplicationBindsTighterThanAddition() throws Exception {
        BinaryExpression add = assertInstanceOf(BinaryExpression.class, parser.parseExpression("2 + 3 * 4"));

        assertEquals(Operator.ADD, add.getOperator());
        assertEquals(new NumberLiteral(2), add.getLeft());
        BinaryExpression multiply = assertInstanceOf(BinaryExpression.class, add.getRight());
        assertEquals(Operator.MULTIPLY, multiply.getOperator());
    }

    @Test
    void exponentIsRightAssociative() throws Exception {
        Expression parsed = parser.parseExpression("2 ^ 3 ^ 4");

        Expression expected =
                new BinaryExpression(
                        Operator.EXPONENT,
                        new NumberLiteral(2),
                        new BinaryExpression(
                                Operator.EXPONENT, new NumberLiteral(3), new NumberLiteral(4)));
        assertEquals(expected, parsed);
    }

    @Test
    void subtractionFoldsLeft() throws Exception {
        Expression parsed = parser.parseExpression("10 - 4 - 3");

        Expression expected =
                new BinaryExpression(
                        Operator.SUBTRACT,
                        new BinaryExpression(
                                Operator.SUBTRACT, new NumberLiteral(10), new NumberLiteral(4)),
                        new NumberLiteral(3));
        assertEquals(expected, parsed);
    }

    @Test
    void keepsExplicitParentheses() throws Exception {
        BinaryExpression multiply =
                assertInstanceOf(BinaryExpression.class, parser.parseExpression("(2 + 3) * 4"));

        assertEquals(Operator.MULTIPLY, multiply.getOperator());
        Parentheses group = assertInstanceOf(Parentheses.class, multiply.getLeft());
        assertInstanceOf(BinaryExpression.class, group.getInner());
    }

    @Test
    void keepsRedundantParentheses() throws Exception {
        Expression parsed = parser.parseExpression("((x))");

        Parentheses outer = assertInstanceOf(Parentheses.class, parsed);
        assertInstanceOf(Parentheses.class, outer.getInner());
    }

    @Test
    void unaryMinusAppliesToThePower() throws Exception {
        UnaryExpression negation =
                assertInstanceOf(UnaryExpression.class, parser.parseExpression("-2 ^ 2"));

        assertEquals(Operator.UNARY_MINUS, negation.getOperator());
        assertInstanceOf(BinaryExpression.class, negation.getOperand());
    }

    @Test
    void exponentAcceptsSignedPower() throws Exception {
        BinaryExpression power = assertInstanceOf(BinaryExpression.class, parser.parseExpression("2 ^ -1"));

        assertEquals(new UnaryExpression(Operator.UNARY_MINUS, new NumberLiteral(1)), power.getRight());
    }

    @Test
    void logicalOperatorsAreCaseInsensitive() throws Exception {
        BinaryExpression or =
                assertInstanceOf(BinaryExpression.class, parser.parseExpression("a and not b Or c"));

        assertEquals(Operator.OR, or.getOperator());
        BinaryExpression and = assertInstanceOf(BinaryExpression.class, or.getLeft());
        assertEquals(Operator.AND, and.getOperator());
        assertInstanceOf(UnaryExpression.class, and.getRight());
    }

    @Test
    void comparisonOperatorsAreNotConfused() throws Exception {
        assertEquals(Operator.LESS_EQUAL, binary("a <= b").getOperator());
        assertEquals(Operator.GREATER_EQUAL, binary("a >= b").getOperator());
        assertEquals(Operator.NOT_EQUAL, binary("a <> b").getOperator());
        assertEquals(Operator.LESS, binary("a < b").getOperator());
        assertEquals(Operator.EQUAL, binary("a = b").getOperator());
    }

    @Test
    void relationalBindsTighterThanEquality() throws Exception {
        BinaryExpression equal = binary("a < b = c > d");

        assertEquals(Operator.EQUAL, equal.getOperator());
        assertEquals(Operator.LESS, ((BinaryExpression) equal.getLeft()).getOperator());
        assertEquals(Operator.GREATER, ((BinaryExpression) equal.getRight()).getOperator());
    }

    @Test
    void modIsMultiplicative() throws Exception {
        BinaryExpression add = binary("a + b mod c");

        assertEquals(Operator.ADD, add.getOperator());
        assertEquals(Operator.MOD, ((BinaryExpression) add.getRight()).getOperator());
    }

    @Test
    void parsesFunctionCallsWithDefaultTarget() throws Exception {
        FunctionCall call = assertInstanceOf(FunctionCall.class, parser.parseExpression("MAX(a, b + 1)"));

        assertEquals(CallTarget.Kind.FUNCTION, call.getTarget().getKind());
        assertEquals(Identifier.parse("max", IdentifierOptions.expression()), call.getTarget().getName());
        assertEquals(2, call.getArguments().size());
    }

    @Test
    void parsesCallWithoutArguments() throws Exception {
        FunctionCall call = assertInstanceOf(FunctionCall.class, parser.parseExpression("TIME()"));

        assertTrue(call.getArguments().isEmpty());
    }

    @Test
    void parsesSubscripts() throws Exception {
        Reference reference = assertInstanceOf(Reference.class, parser.parseExpression("pop[1, region]"));

        assertEquals(2, reference.getIndices().size());
        assertEquals(new NumberLiteral(1), reference.getIndices().get(0));
    }

    @Test
    void bareIdentifierHasNoIndices() throws Exception {
        Reference reference = assertInstanceOf(Reference.class, parser.parseExpression("Room_Temperature"));

        assertTrue(reference.getIndices().isEmpty());
        assertEquals("Room Temperature", reference.getIdentifier().getNormalized());
    }

    @Test
    void quotedIdentifierIsOneReference() throws Exception {
        BinaryExpression divide =
                binary("(\"Teacup Temperature\"-\"Room Temperature\")/\"Characteristic Time\"");

        assertEquals(Operator.DIVIDE, divide.getOperator());
        Parentheses group = assertInstanceOf(Parentheses.class, divide.getLeft());
        BinaryExpression subtract = assertInstanceOf(BinaryExpression.class, group.getInner());
        Reference teacup = assertInstanceOf(Reference.class, subtract.getLeft());
        assertEquals("Teacup Temperature", teacup.getIdentifier().getNormalized());
        assertEquals(Identifier.parse("Characteristic_Time"), ((Reference) divide.getRight()).getIdentifier());
    }

    @Test
    void parsesIfThenElseAcrossLines() throws Exception {
        List<Expression> parsed = parser.parseExpressionList("IF stock > 0\nTHEN outflow\nELSE 0");

        assertEquals(1, parsed.size());
        IfElse ifElse = assertInstanceOf(IfElse.class, parsed.get(0));
        assertEquals(new NumberLiteral(0), ifElse.getElseBranch());
    }

    @Test
    void ifKeywordsAreCaseInsensitive() throws Exception {
        assertInstanceOf(IfElse.class, parser.parseExpression("if a then b else c"));
    }

    @Test
    void splitsListOnSemicolonsAndNewlines() throws Exception {
        List<Expression> parsed = parser.parseExpressionList("a + 1; b\n\n c * 2;");

        assertEquals(3, parsed.size());
        assertInstanceOf(Reference.class, parsed.get(1));
    }

    @Test
    void newlinesInsideGroupingAreWhitespace() throws Exception {
        List<Expression> parsed = parser.parseExpressionList("MIN(a,\n b) * (c\n + d)");

        assertEquals(1, parsed.size());
    }

    @Test
    void newlineAfterOperatorContinuesExpression() throws Exception {
        List<Expression> parsed = parser.parseExpressionList("a +\n b");

        assertEquals(1, parsed.size());
        assertEquals(Operator.ADD, ((BinaryExpression) parsed.get(0)).getOperator());
    }

    @Test
    void commentsBecomeListElements() throws Exception {
        List<Expression> parsed = parser.parseExpressionList("growth * 2 // doubling time\nother");

        assertEquals(3, parsed.size());
        assertEquals(new InlineComment("doubling time"), parsed.get(1));
        assertInstanceOf(Reference.class, parsed.get(2));
    }

    @Test
    void leadingCommentIsAnElement() throws Exception {
        List<Expression> parsed = parser.parseExpressionList("// note\n42");

        assertEquals(List.of(new InlineComment("note"), new NumberLiteral(42)), parsed);
    }

    @Test
    void blankFieldIsAnEmptyList() throws Exception {
        assertTrue(parser.parseExpressionList("").isEmpty());
        assertTrue(parser.parseExpressionList("  \n\t ").isEmpty());
    }

    @Test
    void parsesNumberForms() throws Exception {
        assertEquals(new NumberLiteral(0.5), parser.parseExpression(".5"));
        assertEquals(new NumberLiteral(1.5e3), parser.parseExpression("1.5E3"));
        assertEquals(new NumberLiteral(7), parser.parseExpression("7."));
    }

    @Test
    void reportsUnterminatedParenthesis() {
        EquationParseException error =
                assertThrows(EquationParseException.class, () -> parser.parseExpression("(2 + 3"));

        assertTrue(error.getMessage().contains("Unterminated parenthesis"));
        assertEquals("(2 + 3", error.getRemainingInput());
        assertEquals(0, error.getOffset());
    }

    @Test
    void reportsUnterminatedSubscript() {
        EquationParseException error =
                assertThrows(EquationParseException.class, () -> parser.parseExpression("x + a[1"));

        assertEquals("[1", error.getRemainingInput());
        assertEquals(5, error.getOffset());
    }

    @Test
    void rejectsLiteralOutsideDoubleRange() {
        EquationParseException error =
                assertThrows(EquationParseException.class, () -> parser.parseExpression("2 * 1e400"));

        assertTrue(error.getMessage().contains("Malformed numeric literal '1e400'"));
        assertEquals("1e400", error.getRemainingInput());
        assertEquals(4, error.getOffset());
    }

    @Test
    void reportsMissingOperand() {
        EquationParseException error =
                assertThrows(EquationParseException.class, () -> parser.parseExpression("2 * * 3"));

        assertEquals("* 3", error.getRemainingInput());
    }

    @Test
    void reportsTrailingInput() {
        EquationParseException error =
                assertThrows(EquationParseException.class, () -> parser.parseExpressionList("a b"));

        assertTrue(error.getMessage().startsWith("Unexpected trailing input"));
        assertEquals("b", error.getRemainingInput());
    }

    @Test
    void reportsMalformedNumber() {
        EquationParseException error =
                assertThrows(EquationParseException.class, () -> parser.parseExpressionList("1.2.3"));

        assertEquals(".3", error.getRemainingInput());
    }

    @Test
    void reportsUnknownCharacters() {
        assertThrows(EquationParseException.class, () -> parser.parseExpression("a # b"));
        assertThrows(EquationParseException.class, () -> parser.parseExpression("\"unterminated"));
    }

    @Test
    void rejectsCommentInOperandPosition() {
        assertThrows(EquationParseException.class, () -> parser.parseExpressionList("a + // nothing"));
    }

    @Test
    void reportsEmptyExpression() {
        assertThrows(EquationParseException.class, () -> parser.parseExpression("  "));
    }

    private BinaryExpression binary(String text) throws EquationParseException {
        return assertInstanceOf(BinaryExpression.class, parser.parseExpression(text));
    }
}
