package com.xmile.codec.schema;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import com.xmile.equation.Identifier;
import com.xmile.equation.ast.NumberLiteral;
import com.xmile.equation.ast.Reference;
import java.util.List;
import org.junit.jupiter.api.Test;

final class MacroTest {

    @Test
    void layoutDoesNotAffectEquality() throws Exception {
        Macro plain = macro(null);
        Macro drawn =
                macro(
                        new MacroView(
                                View.of(
                                        List.of(
                                                new AliasObject(
                                                        1, null, null, Identifier.parse("x"))))));

        assertEquals(plain, drawn);
        assertEquals(plain.hashCode(), drawn.hashCode());
    }

    @Test
    void definitionAffectsEquality() throws Exception {
        Macro macro = macro(null);

        assertNotEquals(macro, macro.withEquation(Equation.of(new NumberLiteral(2))));
    }

    @Test
    void withEquationKeepsEverythingElse() throws Exception {
        Macro macro = macro(null);
        Equation replacement = Equation.of(new NumberLiteral(3));

        Macro changed = macro.withEquation(replacement);

        assertEquals(replacement, changed.getEquation());
        assertEquals(macro.getParameters(), changed.getParameters());
        assertEquals("user", changed.getNamespace());
    }

    private static Macro macro(MacroView view) throws Exception {
        Identifier rate = Identifier.parse("rate");
        return new Macro(
                Identifier.parse("SCALE_UP"),
                "user",
                List.of(new MacroParameter(rate, null)),
                Equation.of(new Reference(rate)),
                null,
                null,
                null,
                null,
                view);
    }
}
