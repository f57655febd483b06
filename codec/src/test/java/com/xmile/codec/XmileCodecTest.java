package com.xmile.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.xmile.codec.schema.Auxiliary;
import com.xmile.codec.schema.Flow;
import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.Stock;
import com.xmile.codec.schema.XmileDocument;
import com.xmile.codec.testing.TestResources;
import com.xmile.codec.validation.ValidationResult;
import com.xmile.codec.xml.DecoderOptions;
import com.xmile.equation.Identifier;
import com.xmile.equation.ast.BinaryExpression;
import com.xmile.equation.ast.CallTarget;
import com.xmile.equation.ast.Expression;
import com.xmile.equation.ast.FunctionCall;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

final class XmileCodecTest {

    private final XmileCodec codec = new XmileCodec(DecoderOptions.lenient());

    @Test
    void decodeResolvesCallTargetsAgainstModelSymbols() throws Exception {
        XmileDocument document = codec.decode(TestResources.read("models/full-featured.xmile"));
        Model model = document.getRootModel();

        Auxiliary rate = (Auxiliary) model.getVariables().find(Identifier.parse("Attrition Rate"));
        FunctionCall lookup =
                assertInstanceOf(FunctionCall.class, rate.fields().equation().getExpressions().get(0));
        assertEquals(CallTarget.Kind.GRAPHICAL_FUNCTION, lookup.getTarget().getKind());

        Flow hiring = (Flow) model.getVariables().find(Identifier.parse("Hiring"));
        BinaryExpression divide =
                assertInstanceOf(
                        BinaryExpression.class, hiring.fields().equation().getExpressions().get(0));
        FunctionCall max = assertInstanceOf(FunctionCall.class, divide.getLeft());
        assertEquals(CallTarget.Kind.FUNCTION, max.getTarget().getKind());
    }

    @Test
    void resolvedDocumentsSurviveRoundTrip() throws Exception {
        XmileDocument original = codec.decode(TestResources.read("models/full-featured.xmile"));

        assertEquals(original, codec.decode(codec.encode(original)));
    }

    @Test
    void resolvesConveyorEquations() throws Exception {
        String xml =
                String.join(
                        "\n",
                        "<xmile>",
                        "  <header><vendor>v</vendor><product version=\"1\">p</product></header>",
                        "  <model>",
                        "    <variables>",
                        "      <stock name=\"belt\"><eqn>0</eqn>",
                        "        <conveyor><len>transit(TIME)</len><capacity>MAX(1, 2)</capacity></conveyor>",
                        "      </stock>",
                        "      <gf name=\"transit\"><xscale min=\"0\" max=\"1\"/><ypts>1,2</ypts></gf>",
                        "    </variables>",
                        "  </model>",
                        "</xmile>");

        XmileDocument document = codec.decode(xml);
        Stock belt = (Stock) document.getRootModel().getVariables().find(Identifier.parse("belt"));

        FunctionCall length =
                assertInstanceOf(
                        FunctionCall.class, belt.conveyor().length().getExpressions().get(0));
        assertEquals(CallTarget.Kind.GRAPHICAL_FUNCTION, length.getTarget().getKind());
        FunctionCall capacity =
                assertInstanceOf(
                        FunctionCall.class, belt.conveyor().capacity().getExpressions().get(0));
        assertEquals(CallTarget.Kind.FUNCTION, capacity.getTarget().getKind());
        assertEquals(document, codec.decode(codec.encode(document)));
    }

    @Test
    void validDocumentPassesValidation() throws Exception {
        XmileDocument document = codec.decode(TestResources.read("models/teacup.xmile"));

        assertInstanceOf(ValidationResult.Valid.class, codec.validate(document));
    }

    @Test
    void invalidDocumentThrowsValidationError() throws Exception {
        String xml =
                String.join(
                        "\n",
                        "<xmile>",
                        "  <header><vendor>v</vendor><product version=\"1\">p</product></header>",
                        "  <model>",
                        "    <variables>",
                        "      <aux name=\"x\"><eqn>1</eqn></aux>",
                        "      <aux name=\"X\"><eqn>2</eqn></aux>",
                        "      <stock name=\"s\"><eqn>0</eqn><inflow>x</inflow></stock>",
                        "    </variables>",
                        "  </model>",
                        "</xmile>");
        XmileDocument document = codec.decode(xml);

        XmileException error = assertThrows(XmileException.class, () -> codec.validate(document));

        assertEquals(XmileException.Kind.VALIDATION, error.getKind());
        assertEquals(1, error.getErrors().size());
        assertEquals(1, error.getWarnings().size());
        assertEquals("Validation failed with 1 error(s)", error.getDetail());
    }

    @Test
    void decodeAllReportsEveryFailure() throws Exception {
        Path good = TestResources.extract("models/teacup.xmile");
        Path missing = Path.of("missing-one.xmile");
        Path alsoMissing = Path.of("missing-two.xmile");

        assertEquals(1, codec.decodeAll(List.of(good)).size());
        XmileException error =
                assertThrows(
                        XmileException.class,
                        () -> codec.decodeAll(List.of(missing, good, alsoMissing)));

        assertEquals(XmileException.Kind.MULTIPLE, error.getKind());
        assertEquals(2, error.getCauses().size());
        assertEquals("missing-two.xmile", error.getCauses().get(1).getContext().filePath());
    }

    @Test
    void arrayedVariablesBecomeArrayCalls() throws Exception {
        String xml =
                String.join(
                        "\n",
                        "<xmile>",
                        "  <header><vendor>v</vendor><product version=\"1\">p</product></header>",
                        "  <model>",
                        "    <variables>",
                        "      <aux name=\"pop\">",
                        "        <dimensions><dim name=\"Region\"/></dimensions>",
                        "        <element subscript=\"North\"><eqn>1</eqn></element>",
                        "      </aux>",
                        "      <aux name=\"total\"><eqn>pop(1) + SUM(pop(2))</eqn></aux>",
                        "    </variables>",
                        "  </model>",
                        "</xmile>");

        Model model = codec.decode(xml).getRootModel();
        Auxiliary total = (Auxiliary) model.getVariables().find(Identifier.parse("total"));
        Expression sum = total.fields().equation().getExpressions().get(0);
        BinaryExpression add = assertInstanceOf(BinaryExpression.class, sum);

        FunctionCall first = assertInstanceOf(FunctionCall.class, add.getLeft());
        assertEquals(CallTarget.Kind.ARRAY, first.getTarget().getKind());
        FunctionCall outer = assertInstanceOf(FunctionCall.class, add.getRight());
        assertEquals(CallTarget.Kind.FUNCTION, outer.getTarget().getKind());
        FunctionCall inner = assertInstanceOf(FunctionCall.class, outer.getArguments().get(0));
        assertEquals(CallTarget.Kind.ARRAY, inner.getTarget().getKind());
    }
}
