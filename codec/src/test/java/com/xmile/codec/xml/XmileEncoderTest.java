package com.xmile.codec.xml;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.xmile.codec.XmileException;
import com.xmile.codec.schema.Auxiliary;
import com.xmile.codec.schema.Behavior;
import com.xmile.codec.schema.Data;
import com.xmile.codec.schema.DataExport;
import com.xmile.codec.schema.Equation;
import com.xmile.codec.schema.EquationFields;
import com.xmile.codec.schema.Header;
import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.NonNegative;
import com.xmile.codec.schema.Product;
import com.xmile.codec.schema.SimSpecs;
import com.xmile.codec.schema.Stock;
import com.xmile.codec.schema.Variables;
import com.xmile.codec.schema.XmileDocument;
import com.xmile.codec.testing.TestResources;
import com.xmile.equation.ExpressionParser;
import com.xmile.equation.Identifier;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

final class XmileEncoderTest {

    private final XmileDecoder decoder = new XmileDecoder(DecoderOptions.lenient());
    private final XmileEncoder encoder = new XmileEncoder();
    private final ExpressionParser parser = new ExpressionParser();

    @Test
    void teacupSurvivesRoundTrip() throws Exception {
        XmileDocument original = decoder.decode(TestResources.read("models/teacup.xmile"));

        String encoded = encoder.encode(original);

        assertEquals(original, decoder.decode(encoded));
    }

    @Test
    void fullFeaturedDocumentSurvivesRoundTrip() throws Exception {
        XmileDocument original = decoder.decode(TestResources.read("models/full-featured.xmile"));

        XmileDocument reread = decoder.decode(encoder.encode(original));

        assertEquals(original, reread);
        assertEquals(original.getMacros().get(0).getView(), reread.getMacros().get(0).getView());
    }

    @Test
    void conveyorsQueuesAndLeaksSurviveRoundTrip() throws Exception {
        XmileDocument original = decoder.decode(TestResources.read("models/conveyor.xmile"));

        String xml = encoder.encode(original);

        assertEquals(original, decoder.decode(xml));
        assertTrue(xml.contains("<queue/>"), xml);
        assertTrue(xml.contains("<conveyor discrete=\"true\" batch_integrity=\"false\">"), xml);
        assertTrue(xml.contains("<len><![CDATA[\"Training Time\"]]></len>"), xml);
        assertTrue(xml.contains("<overflow/>"), xml);
        assertTrue(xml.contains("<leak_integers/>"), xml);
        assertTrue(xml.contains("<leak_start>0.25</leak_start>"), xml);
        assertFalse(xml.contains("<arrest>"), xml);
    }

    @Test
    void encodingIsIdempotent() throws Exception {
        XmileDocument original = decoder.decode(TestResources.read("models/full-featured.xmile"));

        String first = encoder.encode(original);
        String second = encoder.encode(decoder.decode(first));

        assertEquals(first, second);
    }

    @Test
    void reproducesTriStateShapes() throws Exception {
        XmileDocument document = programmaticDocument();
        document.getRootModel()
                .setVariables(
                        new Variables(
                                List.of(
                                        stock("absent", null),
                                        stock("implicit", NonNegative.IMPLICIT),
                                        stock("explicit", NonNegative.FALSE))));

        String xml = encoder.encode(document);

        assertTrue(xml.contains("<non_negative/>"), xml);
        assertTrue(xml.contains("<non_negative>false</non_negative>"), xml);
        assertFalse(xml.contains("<non_negative>true</non_negative>"), xml);
        List<Stock> stocks = decoder.decode(xml).getRootModel().getVariables().ofType(Stock.class);
        assertNull(stocks.get(0).nonNegative());
        assertEquals(NonNegative.IMPLICIT, stocks.get(1).nonNegative());
        assertEquals(NonNegative.FALSE, stocks.get(2).nonNegative());
    }

    @Test
    void writesProgrammaticDocument() throws Exception {
        XmileDocument document = programmaticDocument();

        String xml = encoder.encode(document);

        assertTrue(xml.startsWith("<?xml"), xml);
        assertTrue(xml.contains("xmlns=\"" + XmileDocument.XMILE_NAMESPACE + "\""), xml);
        assertTrue(xml.contains("version=\"1.0\""), xml);
        assertTrue(xml.contains("<start>0</start>"), xml);
        assertTrue(xml.contains("<stop>100</stop>"), xml);
        assertTrue(xml.contains("<dt>0.25</dt>"), xml);
        assertTrue(xml.contains("<aux name=\"Growth Rate\">"), xml);
        assertTrue(xml.contains("<eqn><![CDATA[(births - deaths) * 2]]></eqn>"), xml);
        assertTrue(xml.contains("<behavior/>"), xml);
        assertTrue(xml.contains("<export resource=\"out.csv\"/>"), xml);
        assertEquals(document, decoder.decode(xml));
    }

    @Test
    void alwaysWritesEmptyVariables() throws Exception {
        XmileDocument document = programmaticDocument();
        document.getModels().add(new Model("Empty", Variables.empty()));

        String xml = encoder.encode(document);

        assertTrue(xml.contains("<model name=\"Empty\">\n        <variables/>\n    </model>"), xml);
    }

    @Test
    void writesUtf8ToStream() throws Exception {
        XmileDocument document =
                new XmileDocument(Header.of("Vendör", new Product("Prodüct", "1", null)));
        document.getModels().add(new Model(Variables.empty()));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        encoder.encode(document, out);

        String xml = out.toString(StandardCharsets.UTF_8);
        assertTrue(xml.contains("<vendor>Vendör</vendor>"), xml);
        assertEquals(document, decoder.decode(xml));
    }

    @Test
    void quotesNamesThatWouldNotReadBack() throws Exception {
        XmileDocument document = programmaticDocument();
        Identifier dotted = Identifier.parse("\"a.b\"");
        document.getRootModel()
                .setVariables(Variables.of(new Auxiliary(dotted, EquationFields.of(equation("1")))));

        String xml = encoder.encode(document);

        assertTrue(xml.contains("<aux name=\"&quot;a.b&quot;\">"), xml);
        assertEquals(dotted, decoder.decode(xml).getRootModel().getVariables().all().get(0).name());
    }

    @Test
    void rejectsVariableWithoutAnyEquation() throws Exception {
        XmileDocument document = programmaticDocument();
        document.getRootModel()
                .setVariables(
                        Variables.of(
                                new Auxiliary(Identifier.parse("orphan"), EquationFields.of(null))));

        XmileException error = assertThrows(XmileException.class, () -> encoder.encode(document));

        assertEquals(XmileException.Kind.SERIALIZE, error.getKind());
        assertEquals(
                "Variable 'orphan' has neither an equation nor element equations",
                error.getDetail());
    }

    private XmileDocument programmaticDocument() throws Exception {
        XmileDocument document = new XmileDocument(Header.of("Acme", new Product("Builder", "3.0", null)));
        document.setSimSpecs(SimSpecs.of(0, 100, 0.25));
        document.setData(
                new Data(
                        List.of(),
                        List.of(new DataExport(null, null, null, null, "out.csv", null, null, null))));
        Model model =
                new Model(
                        Variables.of(
                                new Auxiliary(
                                        Identifier.parse("Growth Rate"),
                                        EquationFields.of(equation("(births - deaths) * 2")))));
        model.setBehavior(Behavior.empty());
        document.getModels().add(model);
        return document;
    }

    private Stock stock(String name, NonNegative flag) throws Exception {
        return new Stock(Identifier.parse(name), EquationFields.of(equation("10")), List.of(), List.of(), flag);
    }

    private Equation equation(String text) throws Exception {
        return Equation.of(parser.parseExpressionList(text));
    }
}
