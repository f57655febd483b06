package com.xmile.equation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.xmile.equation.ast.BinaryExpression;
import com.xmile.equation.ast.Expression;
import com.xmile.equation.ast.IfElse;
import com.xmile.equation.ast.NumberLiteral;
import com.xmile.equation.ast.Reference;
import com.xmile.equation.ast.UnaryExpression;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExpressionRendererTest {

    private final ExpressionParser parser = new ExpressionParser();

    @Test
    void reproducesExplicitParentheses() throws Exception {
        assertEquals("(2 + 3) * 4", ExpressionRenderer.render(parser.parseExpression("(2+3)*4")));
        assertEquals("((x))", ExpressionRenderer.render(parser.parseExpression("((x))")));
    }

    @Test
    void doesNotInventParenthesesForParsedText() throws Exception {
        assertEquals("2 + 3 * 4", ExpressionRenderer.render(parser.parseExpression("2 + 3 * 4")));
        assertEquals("2 ^ 3 ^ 4", ExpressionRenderer.render(parser.parseExpression("2^3^4")));
        assertEquals("-2 ^ 2", ExpressionRenderer.render(parser.parseExpression("-2^2")));
        assertEquals("2 ^ -1", ExpressionRenderer.render(parser.parseExpression("2^-1")));
        assertEquals(
                "1 + IF a THEN b ELSE c * 2",
                ExpressionRenderer.render(parser.parseExpression("1 + if a then b else c * 2")));
    }

    @Test
    void quotesIdentifiersWithSpaces() throws Exception {
        Expression parsed = parser.parseExpression("\"Teacup Temperature\" - Room_Temperature");

        assertEquals(
                "\"Teacup Temperature\" - \"Room Temperature\"", ExpressionRenderer.render(parsed));
    }

    @Test
    void quotesNamesTheLexerCannotReadBare() throws Exception {
        for (String text : List.of("\"$x\" + 1", "\"\uD83D\uDE00\" + 1", "a$b * 2")) {
            Expression parsed = parser.parseExpression(text);
            String rendered = ExpressionRenderer.render(parsed);

            assertEquals(parsed, parser.parseExpression(rendered), rendered);
        }
        assertEquals("\"$x\" + 1", ExpressionRenderer.render(parser.parseExpression("\"$x\" + 1")));
        assertEquals(
                "\"\uD83D\uDE00\" + 1",
                ExpressionRenderer.render(parser.parseExpression("\"\uD83D\uDE00\" + 1")));
        assertEquals("a$b * 2", ExpressionRenderer.render(parser.parseExpression("a$b * 2")));
    }

    @Test
    void rendersKeywordsInUpperCase() throws Exception {
        assertEquals(
                "NOT a AND b OR c MOD 2 = 1",
                ExpressionRenderer.render(parser.parseExpression("not a and b or c mod 2 = 1")));
    }

    @Test
    void rendersCallsAndSubscripts() throws Exception {
        assertEquals(
                "MAX(pop[1, region], 0)",
                ExpressionRenderer.render(parser.parseExpression("MAX( pop[1,region] ,0 )")));
        assertEquals("TIME()", ExpressionRenderer.render(parser.parseExpression("TIME ( )")));
    }

    @Test
    void rendersIntegralNumbersWithoutFraction() throws Exception {
        assertEquals("180", ExpressionRenderer.render(parser.parseExpression("180.0")));
        assertEquals("0.125", ExpressionRenderer.render(parser.parseExpression("0.125")));
    }

    @Test
    void addsGroupingForTreesBuiltInCode() {
        Expression sum = new BinaryExpression(Operator.ADD, new NumberLiteral(2), new NumberLiteral(3));
        Expression product = new BinaryExpression(Operator.MULTIPLY, sum, new NumberLiteral(4));
        assertEquals("(2 + 3) * 4", ExpressionRenderer.render(product));

        Expression difference =
                new BinaryExpression(
                        Operator.SUBTRACT,
                        new NumberLiteral(10),
                        new BinaryExpression(Operator.SUBTRACT, new NumberLiteral(4), new NumberLiteral(3)));
        assertEquals("10 - (4 - 3)", ExpressionRenderer.render(difference));

        Expression power =
                new BinaryExpression(
                        Operator.EXPONENT,
                        new BinaryExpression(Operator.EXPONENT, new NumberLiteral(2), new NumberLiteral(3)),
                        new NumberLiteral(4));
        assertEquals("(2 ^ 3) ^ 4", ExpressionRenderer.render(power));

        Expression negatedSum = new UnaryExpression(Operator.UNARY_MINUS, sum);
        assertEquals("-(2 + 3)", ExpressionRenderer.render(negatedSum));
    }

    @Test
    void groupsConditionalThatWouldSwallowTheRest() throws Exception {
        Expression conditional =
                new IfElse(
                        new Reference(Identifier.parse("a")),
                        new NumberLiteral(1),
                        new NumberLiteral(2));
        Expression sum = new BinaryExpression(Operator.ADD, conditional, new NumberLiteral(3));

        String text = ExpressionRenderer.render(sum);

        assertEquals("(IF a THEN 1 ELSE 2) + 3", text);
    }

    @Test
    void rendersListsWithCommentsOnTheirOwnLine() throws Exception {
        List<Expression> parsed = parser.parseExpressionList("a+1;b // note\nc");

        String text = ExpressionRenderer.renderList(parsed);

        assertEquals("a + 1; b // note\nc", text);
        assertEquals(parsed, parser.parseExpressionList(text));
    }

    @Test
    void renderedTextParsesToTheSameTree() throws Exception {
        String[] samples = {
            "(\"Teacup Temperature\"-\"Room Temperature\")/\"Characteristic Time\"",
            "IF TIME > 5 THEN STEP(10, 3) ELSE -pulse(1, 2, 3) ^ 2",
            "a[i, j + 1] * isee.\"Unit Cost\" <> 0 OR NOT flag",
            "2 ^ -x ^ 2 mod 3",
        };
        for (String sample : samples) {
            Expression parsed = parser.parseExpression(sample);
            assertEquals(parsed, parser.parseExpression(ExpressionRenderer.render(parsed)), sample);
        }
    }
}
