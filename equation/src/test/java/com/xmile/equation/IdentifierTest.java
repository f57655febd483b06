package com.xmile.equation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.xmile.equation.IdentifierException.Kind;
import java.util.List;
import org.junit.jupiter.api.Test;

class IdentifierTest {

    @Test
    void underscoresNormalizeToSpaces() throws IdentifierException {
        Identifier id = Identifier.parse("Cash_Balance");

        assertEquals("Cash Balance", id.getNormalized());
        assertEquals("Cash Balance", id.toString());
        assertEquals(Identifier.parse("Cash Balance"), id);
    }

    @Test
    void equalityIgnoresCaseAndQuoting() throws IdentifierException {
        Identifier bare = Identifier.parse("cash_balance");
        Identifier quoted = Identifier.parse("\"Cash Balance\"");

        assertEquals(bare, quoted);
        assertEquals(bare.hashCode(), quoted.hashCode());
        assertTrue(quoted.isQuoted());
        assertEquals("Cash Balance", quoted.getNormalized());
    }

    @Test
    void collapsesWhitespaceAndControlCharacters() throws IdentifierException {
        Identifier id = Identifier.parse("\"revenue\\ngap\"");
        assertEquals("revenue gap", id.getNormalized());

        Identifier spaced = Identifier.parse("Heat__Loss   to Room");
        assertEquals("Heat Loss to Room", spaced.getNormalized());
    }

    @Test
    void rejectsEmptyText() {
        IdentifierException error = assertThrows(IdentifierException.class, () -> Identifier.parse("   "));
        assertEquals(Kind.EMPTY, error.getKind());

        IdentifierException quoted = assertThrows(IdentifierException.class, () -> Identifier.parse("\"\""));
        assertEquals(Kind.EMPTY, quoted.getKind());
    }

    @Test
    void leadingDigitNeedsOption() throws IdentifierException {
        IdentifierException error =
                assertThrows(IdentifierException.class, () -> Identifier.parse("2nd_stage"));
        assertEquals(Kind.INVALID_FIRST_CHARACTER, error.getKind());

        Identifier unit = Identifier.parse("2nd_stage", IdentifierOptions.unitsOfMeasure());
        assertEquals("2nd stage", unit.getNormalized());
    }

    @Test
    void dollarSignNeedsOption() throws IdentifierException {
        assertThrows(IdentifierException.class, () -> Identifier.parse("$"));
        assertEquals("$", Identifier.parse("$", IdentifierOptions.unitsOfMeasure()).getNormalized());
    }

    @Test
    void underscoreMayNotStartOrEndAName() {
        assertEquals(
                Kind.INVALID_FIRST_CHARACTER,
                assertThrows(IdentifierException.class, () -> Identifier.parse("_stock")).getKind());
        assertEquals(
                Kind.INVALID_LAST_CHARACTER,
                assertThrows(IdentifierException.class, () -> Identifier.parse("stock_")).getKind());
    }

    @Test
    void rejectsPunctuationOutsideQuotes() throws IdentifierException {
        IdentifierException error =
                assertThrows(IdentifierException.class, () -> Identifier.parse("rate%"));
        assertEquals(Kind.INVALID_CHARACTER, error.getKind());

        assertEquals("rate%", Identifier.parse("\"rate%\"").getNormalized());
    }

    @Test
    void reservedWordsAreCaseInsensitive() throws IdentifierException {
        assertEquals(
                Kind.RESERVED,
                assertThrows(IdentifierException.class, () -> Identifier.parse("MAX")).getKind());
        assertEquals(
                Kind.RESERVED,
                assertThrows(IdentifierException.class, () -> Identifier.parse("If_Then_Else"))
                        .getKind());
        assertEquals("max", Identifier.parse("max", IdentifierOptions.expression()).getNormalized());
        assertTrue(Identifier.isReserved("Delay1"));
        assertFalse(Identifier.isReserved("Revenue"));
    }

    @Test
    void unsupportedEscapeIsInvalid() {
        IdentifierException error =
                assertThrows(IdentifierException.class, () -> Identifier.parse("\"a\\tb\""));
        assertEquals(Kind.INVALID_CHARACTER, error.getKind());
    }

    @Test
    void parsesQualifiedNames() throws IdentifierException {
        Identifier id = Identifier.parse("isee.Cash_Flow");

        assertTrue(id.isQualified());
        assertEquals(List.of(Namespace.fromPart("isee")), id.getNamespacePath());
        assertTrue(id.getNamespacePath().get(0).isVendor());
        assertEquals("Cash Flow", id.getNormalized());
        assertEquals("isee.Cash Flow", id.getQualifiedName());
        assertNotEquals(Identifier.parse("Cash_Flow"), id);
    }

    @Test
    void quotedNamePartMayFollowNamespace() throws IdentifierException {
        Identifier id = Identifier.parse("std.\"my.rate\"");

        assertEquals(List.of(Namespace.STD), id.getNamespacePath());
        assertEquals("my.rate", id.getNormalized());
    }

    @Test
    void rejectsBrokenQualifiedNames() {
        assertEquals(
                Kind.INVALID_QUALIFIED_NAME,
                assertThrows(IdentifierException.class, () -> Identifier.parse("std.")).getKind());
        assertEquals(
                Kind.INVALID_QUALIFIED_NAME,
                assertThrows(IdentifierException.class, () -> Identifier.parse(".rate")).getKind());
    }

    @Test
    void expressionTextQuotesOnlyWhenNeeded() throws IdentifierException {
        assertEquals("Revenue", Identifier.parse("Revenue").toExpressionText());
        assertEquals(
                "\"Teacup Temperature\"", Identifier.parse("Teacup_Temperature").toExpressionText());
        assertEquals("\"say \\\"hi\\\"\"", Identifier.parse("\"say \\\"hi\\\"\"").toExpressionText());
        assertEquals("\"if\"", Identifier.parse("\"if\"").toExpressionText());
        assertEquals("isee.\"Cash Flow\"", Identifier.parse("isee.Cash_Flow").toExpressionText());
        assertEquals("\"$x\"", Identifier.parse("\"$x\"").toExpressionText());
        assertEquals("\"\uD83D\uDE00\"", Identifier.parse("\"\uD83D\uDE00\"").toExpressionText());
    }
}
