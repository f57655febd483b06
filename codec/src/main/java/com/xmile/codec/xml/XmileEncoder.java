package com.xmile.codec.xml;

import com.ctc.wstx.stax.WstxOutputFactory;
import com.xmile.codec.ErrorContext;
import com.xmile.codec.XmileException;
import com.xmile.codec.schema.AliasObject;
import com.xmile.codec.schema.ArrayElement;
import com.xmile.codec.schema.Auxiliary;
import com.xmile.codec.schema.Behavior;
import com.xmile.codec.schema.ConnectorObject;
import com.xmile.codec.schema.Conveyor;
import com.xmile.codec.schema.Contact;
import com.xmile.codec.schema.Data;
import com.xmile.codec.schema.DataExport;
import com.xmile.codec.schema.DataImport;
import com.xmile.codec.schema.DeviceRange;
import com.xmile.codec.schema.DeviceScale;
import com.xmile.codec.schema.Dimension;
import com.xmile.codec.schema.Dimensions;
import com.xmile.codec.schema.Documentation;
import com.xmile.codec.schema.EntityBehavior;
import com.xmile.codec.schema.Equation;
import com.xmile.codec.schema.EquationFields;
import com.xmile.codec.schema.EventPoster;
import com.xmile.codec.schema.ExportTarget;
import com.xmile.codec.schema.Flow;
import com.xmile.codec.schema.FormatOptions;
import com.xmile.codec.schema.GraphicalFunction;
import com.xmile.codec.schema.GraphicalFunctionData;
import com.xmile.codec.schema.GraphicalFunctionScale;
import com.xmile.codec.schema.Group;
import com.xmile.codec.schema.GroupEntity;
import com.xmile.codec.schema.GroupObject;
import com.xmile.codec.schema.Header;
import com.xmile.codec.schema.HeaderOptions;
import com.xmile.codec.schema.Macro;
import com.xmile.codec.schema.MacroParameter;
import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.ModelUnits;
import com.xmile.codec.schema.Module;
import com.xmile.codec.schema.ModuleConnection;
import com.xmile.codec.schema.NonNegative;
import com.xmile.codec.schema.Point;
import com.xmile.codec.schema.Pointer;
import com.xmile.codec.schema.PosterEvent;
import com.xmile.codec.schema.SimSpecs;
import com.xmile.codec.schema.Stock;
import com.xmile.codec.schema.Threshold;
import com.xmile.codec.schema.TransitOptions;
import com.xmile.codec.schema.UnitDefinition;
import com.xmile.codec.schema.Variable;
import com.xmile.codec.schema.VariableObject;
import com.xmile.codec.schema.Variables;
import com.xmile.codec.schema.View;
import com.xmile.codec.schema.ViewObject;
import com.xmile.codec.schema.Views;
import com.xmile.codec.schema.XmileDocument;
import com.xmile.equation.DecimalText;
import com.xmile.equation.ExpressionRenderer;
import com.xmile.equation.Identifier;
import com.xmile.equation.IdentifierException;
import com.xmile.equation.IdentifierOptions;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.xml.stream.XMLStreamException;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamWriter2;

/**
 * Writes an {@link XmileDocument} as indented XMILE. Equations are re-rendered from their syntax
 * trees and written as CDATA. Tri-state flags keep their recorded shape: an implicit flag becomes a
 * self-closing element, an explicit one a {@code true}/{@code false} text element.
 */
public final class XmileEncoder {

    private static final Logger LOGGER = Logger.getLogger(XmileEncoder.class.getName());

    private static final String INDENT = "    ";

    private final XMLOutputFactory2 factory;

    public XmileEncoder() {
        this.factory = new WstxOutputFactory();
        factory.setProperty(XMLOutputFactory2.P_AUTOMATIC_EMPTY_ELEMENTS, Boolean.TRUE);
    }

    public String encode(XmileDocument document) throws XmileException {
        StringWriter out = new StringWriter();
        XMLStreamWriter2 writer;
        try {
            writer = (XMLStreamWriter2) factory.createXMLStreamWriter(out);
        } catch (XMLStreamException e) {
            throw new XmileException(
                    XmileException.Kind.XML, "Cannot open XML writer: " + e.getMessage(), null, e);
        }
        write(document, writer);
        return out.toString();
    }

    /** Writes UTF-8 bytes; the stream is flushed but not closed. */
    public void encode(XmileDocument document, OutputStream out) throws XmileException {
        XMLStreamWriter2 writer;
        try {
            writer =
                    (XMLStreamWriter2)
                            factory.createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
        } catch (XMLStreamException e) {
            throw new XmileException(
                    XmileException.Kind.XML, "Cannot open XML writer: " + e.getMessage(), null, e);
        }
        write(document, writer);
    }

    /** Writes to a character sink that the caller owns. */
    public void encode(XmileDocument document, Writer out) throws XmileException {
        XMLStreamWriter2 writer;
        try {
            writer = (XMLStreamWriter2) factory.createXMLStreamWriter(out);
        } catch (XMLStreamException e) {
            throw new XmileException(
                    XmileException.Kind.XML, "Cannot open XML writer: " + e.getMessage(), null, e);
        }
        write(document, writer);
    }

    private void write(XmileDocument document, XMLStreamWriter2 writer) throws XmileException {
        Output output = new Output(writer);
        try {
            output.document(document);
            writer.flush();
        } catch (SerializeException e) {
            throw new XmileException(
                    XmileException.Kind.SERIALIZE,
                    e.getMessage(),
                    ErrorContext.stage(output.stage()),
                    e);
        } catch (XMLStreamException e) {
            throw new XmileException(
                    XmileException.Kind.XML,
                    "Failed to write XML: " + e.getMessage(),
                    ErrorContext.stage(output.stage()),
                    e);
        } finally {
            try {
                writer.close();
            } catch (XMLStreamException e) {
                LOGGER.log(Level.FINE, "Failed to close XML writer", e);
            }
        }
    }

    /** Element writer that tracks nesting for indentation. */
    private static final class Output {
        private final XMLStreamWriter2 writer;
        // One entry per open element: whether it has child elements so far.
        private final Deque<Boolean> open = new ArrayDeque<>();
        private final Deque<String> names = new ArrayDeque<>();

        Output(XMLStreamWriter2 writer) {
            this.writer = writer;
        }

        String stage() {
            return names.isEmpty() ? null : "<" + names.peek() + ">";
        }

        // ---- low-level helpers --------------------------------------------------------------

        private void newline() throws XMLStreamException {
            if (open.isEmpty()) {
                return;
            }
            open.pop();
            open.push(Boolean.TRUE);
            writer.writeCharacters("\n" + INDENT.repeat(open.size()));
        }

        private void start(String name) throws XMLStreamException {
            newline();
            writer.writeStartElement(name);
            open.push(Boolean.FALSE);
            names.push(name);
        }

        private void end() throws XMLStreamException {
            boolean hasChildren = open.pop();
            names.pop();
            if (hasChildren) {
                writer.writeCharacters("\n" + INDENT.repeat(open.size()));
            }
            writer.writeEndElement();
        }

        /** Self-closing element; attributes may follow until the next element call. */
        private void empty(String name) throws XMLStreamException {
            newline();
            writer.writeEmptyElement(name);
        }

        private void attr(String name, String value) throws XMLStreamException {
            if (value != null) {
                writer.writeAttribute(name, value);
            }
        }

        private void attr(String name, Double value) throws XMLStreamException {
            if (value != null) {
                writer.writeAttribute(name, DecimalText.format(value));
            }
        }

        private void attr(String name, Integer value) throws XMLStreamException {
            if (value != null) {
                writer.writeAttribute(name, value.toString());
            }
        }

        private void attr(String name, Boolean value) throws XMLStreamException {
            if (value != null) {
                writer.writeAttribute(name, value.toString());
            }
        }

        private void textElement(String name, String text) throws XMLStreamException {
            if (text == null) {
                return;
            }
            start(name);
            writer.writeCharacters(text);
            end();
        }

        private void numberElement(String name, Double value) throws XMLStreamException {
            if (value != null) {
                textElement(name, DecimalText.format(value));
            }
        }

        private void cdata(String text) throws XMLStreamException {
            if (text.contains("]]>")) {
                writer.writeCharacters(text);
            } else {
                writer.writeCData(text);
            }
        }

        /** The plain qualified name, or the quoted form when the plain one would not read back. */
        private static String nameText(Identifier name) {
            String qualified = name.getQualifiedName();
            try {
                if (Identifier.parse(qualified, IdentifierOptions.expression()).equals(name)) {
                    return qualified;
                }
            } catch (IdentifierException e) {
                LOGGER.finest("Quoting name " + qualified + ": " + e.getMessage());
            }
            return name.toExpressionText();
        }

        private void nonNegative(NonNegative flag) throws XMLStreamException {
            if (flag == null) {
                return;
            }
            if (flag == NonNegative.IMPLICIT) {
                empty("non_negative");
            } else {
                textElement("non_negative", flag == NonNegative.TRUE ? "true" : "false");
            }
        }

        // ---- document -----------------------------------------------------------------------

        void document(XmileDocument document) throws XMLStreamException, SerializeException {
            writer.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
            writer.writeCharacters("\n");
            String xmlns =
                    document.getXmlns() == null
                            ? XmileDocument.XMILE_NAMESPACE
                            : document.getXmlns();
            writer.setDefaultNamespace(xmlns);
            start("xmile");
            writer.writeDefaultNamespace(xmlns);
            attr(
                    "version",
                    document.getVersion() == null
                            ? XmileDocument.DEFAULT_VERSION
                            : document.getVersion());
            header(document.getHeader());
            if (document.getSimSpecs() != null) {
                simSpecs(document.getSimSpecs());
            }
            if (document.getModelUnits() != null) {
                modelUnits(document.getModelUnits());
            }
            if (document.getDimensions() != null) {
                dimensions(document.getDimensions());
            }
            if (document.getBehavior() != null) {
                behavior(document.getBehavior());
            }
            if (document.getData() != null) {
                data(document.getData());
            }
            for (Model model : document.getModels()) {
                model(model);
            }
            for (Macro macro : document.getMacros()) {
                macro(macro);
            }
            end();
            writer.writeCharacters("\n");
            writer.writeEndDocument();
        }

        private void header(Header header) throws XMLStreamException {
            start("header");
            textElement("vendor", header.vendor());
            start("product");
            attr("version", header.product().version());
            attr("lang", header.product().lang());
            writer.writeCharacters(header.product().name());
            end();
            if (header.options() != null) {
                headerOptions(header.options());
            }
            textElement("name", header.name());
            textElement("version", header.version());
            textElement("caption", header.caption());
            textElement("image", header.image());
            textElement("author", header.author());
            textElement("affiliation", header.affiliation());
            textElement("client", header.client());
            textElement("copyright", header.copyright());
            if (header.contact() != null) {
                contact(header.contact());
            }
            textElement("created", header.created());
            textElement("modified", header.modified());
            textElement("uuid", header.uuid());
            if (!header.includes().isEmpty()) {
                start("includes");
                for (String resource : header.includes()) {
                    empty("include");
                    attr("resource", resource);
                }
                end();
            }
            end();
        }

        private void headerOptions(HeaderOptions options) throws XMLStreamException {
            start("options");
            attr("namespace", options.namespace());
            for (Map.Entry<String, Map<String, String>> feature : options.features().entrySet()) {
                empty(feature.getKey());
                for (Map.Entry<String, String> attribute : feature.getValue().entrySet()) {
                    attr(attribute.getKey(), attribute.getValue());
                }
            }
            end();
        }

        private void contact(Contact contact) throws XMLStreamException {
            start("contact");
            textElement("address", contact.address());
            textElement("phone", contact.phone());
            textElement("fax", contact.fax());
            textElement("email", contact.email());
            textElement("website", contact.website());
            end();
        }

        private void simSpecs(SimSpecs simSpecs) throws XMLStreamException {
            start("sim_specs");
            attr("method", simSpecs.method());
            attr("time_units", simSpecs.timeUnits());
            numberElement("start", simSpecs.start());
            numberElement("stop", simSpecs.stop());
            numberElement("dt", simSpecs.dt());
            numberElement("pause", simSpecs.pause());
            if (simSpecs.runBy() != null) {
                empty("run");
                attr("by", simSpecs.runBy());
            }
            end();
        }

        private void modelUnits(ModelUnits units) throws XMLStreamException {
            start("model_units");
            for (UnitDefinition unit : units.units()) {
                start("unit");
                attr("name", unit.name());
                attr("disabled", unit.disabled());
                textElement("eqn", unit.equation());
                for (String alias : unit.aliases()) {
                    textElement("alias", alias);
                }
                end();
            }
            end();
        }

        private void dimensions(Dimensions dimensions) throws XMLStreamException {
            start("dimensions");
            for (Dimension dimension : dimensions.dimensions()) {
                start("dim");
                attr("name", dimension.name());
                attr("size", dimension.size());
                for (String element : dimension.elements()) {
                    empty("elem");
                    attr("name", element);
                }
                end();
            }
            end();
        }

        private void behavior(Behavior behavior) throws XMLStreamException {
            start("behavior");
            nonNegative(behavior.nonNegative());
            for (EntityBehavior entity : behavior.entities()) {
                start(entity.entityType());
                nonNegative(entity.nonNegative());
                end();
            }
            end();
        }

        private void data(Data data) throws XMLStreamException {
            start("data");
            for (DataImport dataImport : data.imports()) {
                empty("import");
                attr("type", dataImport.type());
                attr("enabled", dataImport.enabled());
                attr("frequency", dataImport.frequency());
                attr("orientation", dataImport.orientation());
                attr("resource", dataImport.resource());
                attr("worksheet", dataImport.worksheet());
            }
            for (DataExport export : data.exports()) {
                dataExport(export);
            }
            end();
        }

        private void dataExport(DataExport export) throws XMLStreamException {
            if (export.target() == null) {
                empty("export");
            } else {
                start("export");
            }
            attr("type", export.type());
            attr("enabled", export.enabled());
            attr("frequency", export.frequency());
            attr("orientation", export.orientation());
            attr("resource", export.resource());
            attr("worksheet", export.worksheet());
            attr("interval", export.interval());
            if (export.target() == null) {
                return;
            }
            if (export.target() instanceof ExportTarget.Table table) {
                empty("table");
                attr("uid", table.uid());
                attr("use_settings", table.useSettings());
            } else {
                empty("all");
            }
            end();
        }

        // ---- models and variables -----------------------------------------------------------

        private void model(Model model) throws XMLStreamException, SerializeException {
            start("model");
            attr("name", model.getName());
            attr("resource", model.getResource());
            if (model.getSimSpecs() != null) {
                simSpecs(model.getSimSpecs());
            }
            if (model.getBehavior() != null) {
                behavior(model.getBehavior());
            }
            variables(model.getVariables());
            if (model.getViews() != null) {
                views(model.getViews());
            }
            end();
        }

        private void variables(Variables variables) throws XMLStreamException, SerializeException {
            if (variables.isEmpty()) {
                empty("variables");
                return;
            }
            start("variables");
            for (Variable variable : variables.all()) {
                if (variable instanceof Stock stock) {
                    stock(stock);
                } else if (variable instanceof Flow flow) {
                    flow(flow);
                } else if (variable instanceof Auxiliary aux) {
                    start("aux");
                    attr("name", nameText(aux.name()));
                    fields(aux.name(), aux.fields());
                    end();
                } else if (variable instanceof GraphicalFunction gf) {
                    graphicalFunction(gf);
                } else if (variable instanceof Module module) {
                    module(module);
                } else if (variable instanceof Group group) {
                    group(group);
                }
            }
            end();
        }

        private void stock(Stock stock) throws XMLStreamException, SerializeException {
            start("stock");
            attr("name", nameText(stock.name()));
            fields(stock.name(), stock.fields());
            for (Identifier inflow : stock.inflows()) {
                textElement("inflow", nameText(inflow));
            }
            for (Identifier outflow : stock.outflows()) {
                textElement("outflow", nameText(outflow));
            }
            nonNegative(stock.nonNegative());
            if (stock.conveyor() != null) {
                conveyor(stock.conveyor());
            } else if (stock.queue()) {
                empty("queue");
            }
            end();
        }

        private void conveyor(Conveyor conveyor) throws XMLStreamException {
            start("conveyor");
            attr("discrete", conveyor.discrete());
            attr("batch_integrity", conveyor.batchIntegrity());
            attr("one_at_a_time", conveyor.oneAtATime());
            attr("exponential_leak", conveyor.exponentialLeak());
            equation("len", conveyor.length());
            equation("capacity", conveyor.capacity());
            equation("in_limit", conveyor.inflowLimit());
            equation("sample", conveyor.sample());
            equation("arrest", conveyor.arrest());
            end();
        }

        private void flow(Flow flow) throws XMLStreamException, SerializeException {
            start("flow");
            attr("name", nameText(flow.name()));
            fields(flow.name(), flow.fields());
            numberElement("multiplier", flow.multiplier());
            nonNegative(flow.nonNegative());
            TransitOptions transit = flow.transit();
            if (transit != null) {
                if (transit.overflow()) {
                    empty("overflow");
                }
                if (transit.leak()) {
                    empty("leak");
                }
                if (transit.leakIntegers()) {
                    empty("leak_integers");
                }
                numberElement("leak_start", transit.leakStart());
                numberElement("leak_end", transit.leakEnd());
            }
            end();
        }

        /** Attributes and children shared by stocks, flows and auxiliaries. */
        private void fields(Identifier owner, EquationFields fields)
                throws XMLStreamException, SerializeException {
            if (fields.equation() == null && fields.elements().isEmpty()) {
                throw new SerializeException(
                        "Variable '" + owner.getQualifiedName()
                                + "' has neither an equation nor element equations");
            }
            if (fields.access() != null) {
                attr("access", fields.access().xmlName());
            }
            attr("autoexport", fields.autoexport());
            if (fields.equation() != null) {
                equation(fields.equation());
            }
            if (fields.mathml() != null) {
                start("mathml");
                cdata(fields.mathml());
                end();
            }
            documentation(fields.documentation());
            textElement("units", fields.units());
            if (fields.range() != null) {
                DeviceRange range = fields.range();
                empty("range");
                attr("min", range.min());
                attr("max", range.max());
            }
            if (fields.scale() != null) {
                DeviceScale scale = fields.scale();
                empty("scale");
                attr("min", scale.min());
                attr("max", scale.max());
                attr("auto", scale.auto());
                attr("group", scale.group());
            }
            if (fields.format() != null) {
                FormatOptions format = fields.format();
                empty("format");
                attr("precision", format.precision());
                attr("scale_by", format.scaleBy());
                if (format.displayAs() != null) {
                    attr("display_as", format.displayAs().xmlName());
                }
                attr("delimit_000s", format.delimit000s());
            }
            if (!fields.dimensions().isEmpty()) {
                start("dimensions");
                for (String dimension : fields.dimensions()) {
                    empty("dim");
                    attr("name", dimension);
                }
                end();
            }
            for (ArrayElement element : fields.elements()) {
                start("element");
                attr("subscript", element.subscript());
                if (element.equation() != null) {
                    equation(element.equation());
                }
                end();
            }
            if (fields.graphicalFunction() != null) {
                graphicalFunction(fields.graphicalFunction());
            }
            if (fields.eventPoster() != null) {
                eventPoster(fields.eventPoster());
            }
        }

        private void equation(Equation equation) throws XMLStreamException {
            equation("eqn", equation);
        }

        private void equation(String name, Equation equation) throws XMLStreamException {
            if (equation == null) {
                return;
            }
            start(name);
            cdata(equation.render());
            end();
        }

        private void documentation(Documentation documentation) throws XMLStreamException {
            if (documentation == null) {
                return;
            }
            start("doc");
            if (documentation instanceof Documentation.Html) {
                cdata(documentation.text());
            } else {
                writer.writeCharacters(documentation.text());
            }
            end();
        }

        private void eventPoster(EventPoster poster) throws XMLStreamException {
            start("event_poster");
            attr("min", poster.min());
            attr("max", poster.max());
            for (Threshold threshold : poster.thresholds()) {
                start("threshold");
                attr("value", threshold.value());
                attr("direction", threshold.direction());
                attr("repeat", threshold.repeat());
                attr("interval", threshold.interval());
                for (PosterEvent event : threshold.events()) {
                    if (event.text() == null) {
                        empty("event");
                        attr("sim_action", event.simAction());
                    } else {
                        start("event");
                        attr("sim_action", event.simAction());
                        writer.writeCharacters(event.text());
                        end();
                    }
                }
                end();
            }
            end();
        }

        private void graphicalFunction(GraphicalFunction gf) throws XMLStreamException {
            start("gf");
            if (gf.name() != null) {
                attr("name", nameText(gf.name()));
            }
            if (gf.type() != null) {
                attr("type", gf.type().xmlName());
            }
            if (gf.equation() != null) {
                equation(gf.equation());
            }
            GraphicalFunctionData data = gf.data();
            scale("xscale", data.xScale());
            scale("yscale", data.yScale());
            if (data instanceof GraphicalFunctionData.XYPairs pairs) {
                points("xpts", pairs.xValues(), pairs.xSeparator());
            }
            points("ypts", data.yValues(), data.ySeparator());
            documentation(gf.documentation());
            textElement("units", gf.units());
            end();
        }

        private void scale(String name, GraphicalFunctionScale scale) throws XMLStreamException {
            if (scale == null) {
                return;
            }
            empty(name);
            attr("min", scale.min());
            attr("max", scale.max());
        }

        private void points(String name, List<Double> values, String separator)
                throws XMLStreamException {
            String joiner =
                    separator == null || separator.isEmpty()
                            ? GraphicalFunctionData.DEFAULT_SEPARATOR
                            : separator;
            StringBuilder text = new StringBuilder();
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) {
                    text.append(joiner);
                }
                text.append(DecimalText.format(values.get(i)));
            }
            start(name);
            attr("sep", separator);
            writer.writeCharacters(text.toString());
            end();
        }

        private void module(Module module) throws XMLStreamException {
            start("module");
            attr("name", nameText(module.name()));
            attr("resource", module.resource());
            for (ModuleConnection connection : module.connections()) {
                empty("connect");
                attr("to", connection.to());
                attr("from", connection.from());
            }
            documentation(module.documentation());
            end();
        }

        private void group(Group group) throws XMLStreamException {
            start("group");
            attr("name", nameText(group.name()));
            documentation(group.documentation());
            for (GroupEntity entity : group.entities()) {
                empty("entity");
                attr("name", nameText(entity.name()));
                if (entity.run()) {
                    attr("run", Boolean.TRUE);
                }
            }
            end();
        }

        // ---- views --------------------------------------------------------------------------

        private void views(Views views) throws XMLStreamException {
            start("views");
            attr("visible_view", views.visibleView());
            for (View view : views.views()) {
                view(view);
            }
            end();
        }

        private void view(View view) throws XMLStreamException {
            start("view");
            attr("uid", view.uid());
            if (view.type() != null) {
                attr("type", view.type().xmlName());
            }
            attr("order", view.order());
            attr("width", view.width());
            attr("height", view.height());
            attr("zoom", view.zoom());
            attr("scroll_x", view.scrollX());
            attr("scroll_y", view.scrollY());
            attr("background", view.background());
            attr("page_width", view.pageWidth());
            attr("page_height", view.pageHeight());
            attr("page_sequence", view.pageSequence());
            attr("page_orientation", view.pageOrientation());
            attr("show_pages", view.showPages());
            attr("home_page", view.homePage());
            attr("home_view", view.homeView());
            for (ViewObject object : view.objects()) {
                if (object instanceof VariableObject symbol) {
                    variableObject(symbol);
                } else if (object instanceof AliasObject alias) {
                    aliasObject(alias);
                } else if (object instanceof ConnectorObject connector) {
                    connectorObject(connector);
                } else if (object instanceof GroupObject group) {
                    groupObject(group);
                }
            }
            end();
        }

        private void variableObject(VariableObject object) throws XMLStreamException {
            boolean hasPoints = !object.points().isEmpty();
            if (hasPoints) {
                start(object.kind().xmlName());
            } else {
                empty(object.kind().xmlName());
            }
            attr("uid", object.uid());
            if (object.name() != null) {
                attr("name", nameText(object.name()));
            }
            attr("x", object.x());
            attr("y", object.y());
            attr("width", object.width());
            attr("height", object.height());
            attr("label_side", object.labelSide());
            if (hasPoints) {
                start("pts");
                for (Point point : object.points()) {
                    empty("pt");
                    attr("x", point.x());
                    attr("y", point.y());
                }
                end();
                end();
            }
        }

        private void aliasObject(AliasObject alias) throws XMLStreamException {
            if (alias.of() == null) {
                empty("alias");
            } else {
                start("alias");
            }
            attr("uid", alias.uid());
            attr("x", alias.x());
            attr("y", alias.y());
            if (alias.of() != null) {
                textElement("of", nameText(alias.of()));
                end();
            }
        }

        private void connectorObject(ConnectorObject connector) throws XMLStreamException {
            start("connector");
            attr("uid", connector.uid());
            attr("x", connector.x());
            attr("y", connector.y());
            attr("angle", connector.angle());
            pointer("from", connector.from());
            pointer("to", connector.to());
            end();
        }

        private void pointer(String name, Pointer pointer) throws XMLStreamException {
            if (pointer == null) {
                return;
            }
            if (pointer instanceof Pointer.Named named) {
                textElement(name, nameText(named.name()));
            } else if (pointer instanceof Pointer.Alias alias) {
                start(name);
                empty("alias");
                attr("uid", alias.uid());
                end();
            }
        }

        private void groupObject(GroupObject group) throws XMLStreamException {
            empty("group");
            attr("uid", group.uid());
            if (group.name() != null) {
                attr("name", nameText(group.name()));
            }
            attr("x", group.x());
            attr("y", group.y());
            attr("width", group.width());
            attr("height", group.height());
        }

        // ---- macros -------------------------------------------------------------------------

        private void macro(Macro macro) throws XMLStreamException, SerializeException {
            start("macro");
            attr("name", nameText(macro.getName()));
            attr("namespace", macro.getNamespace());
            for (MacroParameter parameter : macro.getParameters()) {
                start("parm");
                if (parameter.defaultValue() != null) {
                    attr("default", ExpressionRenderer.render(parameter.defaultValue()));
                }
                writer.writeCharacters(nameText(parameter.name()));
                end();
            }
            equation(macro.getEquation());
            textElement("format", macro.getFormat());
            documentation(macro.getDocumentation());
            if (macro.getSimSpecs() != null) {
                simSpecs(macro.getSimSpecs());
            }
            if (macro.getVariables() != null) {
                variables(macro.getVariables());
            }
            if (macro.getView() != null) {
                view(macro.getView().view());
            }
            end();
        }
    }
}
