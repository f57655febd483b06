package com.xmile.codec.xml;

import static javax.xml.stream.XMLStreamConstants.CDATA;
import static javax.xml.stream.XMLStreamConstants.CHARACTERS;
import static javax.xml.stream.XMLStreamConstants.END_DOCUMENT;
import static javax.xml.stream.XMLStreamConstants.END_ELEMENT;
import static javax.xml.stream.XMLStreamConstants.SPACE;
import static javax.xml.stream.XMLStreamConstants.START_ELEMENT;

import com.ctc.wstx.exc.WstxEOFException;
import com.ctc.wstx.stax.WstxInputFactory;
import com.xmile.codec.ErrorContext;
import com.xmile.codec.XmileException;
import com.xmile.codec.schema.Access;
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
import com.xmile.codec.schema.DisplayAs;
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
import com.xmile.codec.schema.GraphicalFunctionType;
import com.xmile.codec.schema.Group;
import com.xmile.codec.schema.GroupEntity;
import com.xmile.codec.schema.GroupObject;
import com.xmile.codec.schema.Header;
import com.xmile.codec.schema.HeaderOptions;
import com.xmile.codec.schema.Macro;
import com.xmile.codec.schema.MacroParameter;
import com.xmile.codec.schema.MacroView;
import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.ModelUnits;
import com.xmile.codec.schema.Module;
import com.xmile.codec.schema.ModuleConnection;
import com.xmile.codec.schema.NonNegative;
import com.xmile.codec.schema.Point;
import com.xmile.codec.schema.Pointer;
import com.xmile.codec.schema.PosterEvent;
import com.xmile.codec.schema.Product;
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
import com.xmile.codec.schema.ViewType;
import com.xmile.codec.schema.Views;
import com.xmile.codec.schema.XmileDocument;
import com.xmile.equation.DecimalText;
import com.xmile.equation.EquationParseException;
import com.xmile.equation.ExpressionParser;
import com.xmile.equation.Identifier;
import com.xmile.equation.IdentifierException;
import com.xmile.equation.IdentifierOptions;
import com.xmile.equation.ast.Expression;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import org.codehaus.stax2.XMLInputFactory2;
import org.codehaus.stax2.XMLStreamReader2;

/**
 * Streaming reader for XMILE documents built on the Woodstox StAX2 cursor.
 *
 * <p>Each element has a reader that starts on its already-consumed start tag and returns on its end
 * tag; {@link Session#consume(String, ElementReader)} adds the other calling convention by reading
 * and checking the start tag first. Unknown elements are skipped as a whole unless the decoder is
 * strict. Equation text, including CDATA sections, is handed to {@link ExpressionParser}.
 *
 * <p>Instances are immutable and may be shared; every call owns its own stream reader.
 */
public final class XmileDecoder {

    private static final Logger LOGGER = Logger.getLogger(XmileDecoder.class.getName());

    // Diagram styling is never modelled, not even in strict mode.
    private static final Set<String> IGNORED_ELEMENTS = Set.of("style");

    private final DecoderOptions options;
    private final XMLInputFactory2 factory;
    private final ExpressionParser parser = new ExpressionParser();

    public XmileDecoder() {
        this(DecoderOptions.fromEnvironment());
    }

    public XmileDecoder(DecoderOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.factory = createFactory();
    }

    private static XMLInputFactory2 createFactory() {
        XMLInputFactory2 factory = new WstxInputFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, Boolean.TRUE);
        factory.setProperty(XMLInputFactory.IS_COALESCING, Boolean.FALSE);
        factory.setProperty(XMLInputFactory2.P_REPORT_CDATA, Boolean.TRUE);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
        return factory;
    }

    public DecoderOptions getOptions() {
        return options;
    }

    public XmileDocument decode(String xml) throws XmileException {
        return decode(new StringReader(xml));
    }

    public XmileDocument decode(Reader source) throws XmileException {
        XMLStreamReader2 reader;
        try {
            reader = (XMLStreamReader2) factory.createXMLStreamReader(source);
        } catch (XMLStreamException e) {
            throw toXmileException(translate(e), ErrorContext.none());
        }
        return decode(reader, null);
    }

    public XmileDocument decode(InputStream source) throws XmileException {
        return decode(source, null);
    }

    /** Reads a file; errors carry its path. */
    public XmileDocument decode(Path path) throws XmileException {
        try (InputStream in = Files.newInputStream(path)) {
            return decode(in, path.toString());
        } catch (IOException e) {
            throw new XmileException(
                    XmileException.Kind.IO,
                    "Failed to read " + path + ": " + e.getMessage(),
                    new ErrorContext(path.toString(), null, null, null),
                    e);
        }
    }

    private XmileDocument decode(InputStream source, String filePath) throws XmileException {
        XMLStreamReader2 reader;
        try {
            reader = (XMLStreamReader2) factory.createXMLStreamReader(source);
        } catch (XMLStreamException e) {
            throw toXmileException(translate(e), new ErrorContext(filePath, null, null, null));
        }
        return decode(reader, filePath);
    }

    private XmileDocument decode(XMLStreamReader2 reader, String filePath) throws XmileException {
        Session session = new Session(reader);
        try {
            return session.consume("xmile", session::document);
        } catch (DeserializeException e) {
            throw toXmileException(e, session.context(filePath));
        } catch (XMLStreamException e) {
            throw toXmileException(translate(e), session.context(filePath));
        } finally {
            // The caller owns the underlying stream.
            try {
                reader.close();
            } catch (XMLStreamException e) {
                LOGGER.log(Level.FINE, "Failed to close XML reader", e);
            }
        }
    }

    private static DeserializeException translate(XMLStreamException e) {
        if (e instanceof WstxEOFException) {
            return DeserializeException.unexpectedEof(e);
        }
        if (e.getNestedException() instanceof IOException) {
            return DeserializeException.io("I/O error: " + e.getMessage(), e);
        }
        return DeserializeException.xml("Malformed XML: " + e.getMessage(), e);
    }

    private static XmileException toXmileException(DeserializeException e, ErrorContext context) {
        XmileException.Kind kind =
                switch (e.getKind()) {
                    case IO -> XmileException.Kind.IO;
                    case XML -> XmileException.Kind.XML;
                    default -> XmileException.Kind.DESERIALIZE;
                };
        return new XmileException(kind, e.getMessage(), context, e);
    }

    @FunctionalInterface
    private interface ElementReader<T> {
        T read() throws XMLStreamException, DeserializeException;
    }

    /** Decoding state of one call. */
    private final class Session {
        private final XMLStreamReader2 reader;
        private String currentElement;

        Session(XMLStreamReader2 reader) {
            this.reader = reader;
        }

        ErrorContext context(String filePath) {
            Location location = reader.getLocation();
            Integer line = null;
            Integer column = null;
            if (location != null && location.getLineNumber() > 0) {
                line = location.getLineNumber();
                column = location.getColumnNumber() > 0 ? location.getColumnNumber() : null;
            }
            String stage = currentElement == null ? null : "<" + currentElement + ">";
            return new ErrorContext(filePath, line, column, stage);
        }

        // ---- cursor helpers -----------------------------------------------------------------

        /** Moves to the next start or end tag, ignoring text, comments and processing instructions. */
        private int nextTag() throws XMLStreamException, DeserializeException {
            while (true) {
                int event = reader.next();
                switch (event) {
                    case START_ELEMENT -> {
                        currentElement = reader.getLocalName();
                        return event;
                    }
                    case END_ELEMENT -> {
                        return event;
                    }
                    case END_DOCUMENT -> throw DeserializeException.unexpectedEof();
                    default -> {
                        // whitespace, comments, processing instructions
                    }
                }
            }
        }

        /** Reads the next start tag and checks that it is the expected element. */
        <T> T consume(String name, ElementReader<T> body)
                throws XMLStreamException, DeserializeException {
            int event = nextTag();
            if (event != START_ELEMENT) {
                throw DeserializeException.unexpectedElement(
                        "<" + name + ">", "</" + reader.getLocalName() + ">");
            }
            if (!name.equals(reader.getLocalName())) {
                throw DeserializeException.unexpectedElement(name, reader.getLocalName());
            }
            return body.read();
        }

        /** True when positioned on the next child's start tag, false on the parent's end tag. */
        private boolean nextChild() throws XMLStreamException, DeserializeException {
            return nextTag() == START_ELEMENT;
        }

        private void skipUnknown(String parent) throws XMLStreamException, DeserializeException {
            String name = reader.getLocalName();
            if (options.isStrict() && !IGNORED_ELEMENTS.contains(name)) {
                throw DeserializeException.unexpectedElement("a known child of <" + parent + ">", name);
            }
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Skipping unknown element <" + name + "> in <" + parent + ">");
            }
            skip();
        }

        /** Consumes the current element with all of its content. */
        private void skip() throws XMLStreamException, DeserializeException {
            int depth = 1;
            while (depth > 0) {
                switch (reader.next()) {
                    case START_ELEMENT -> depth++;
                    case END_ELEMENT -> depth--;
                    case END_DOCUMENT -> throw DeserializeException.unexpectedEof();
                    default -> {
                        // content of a skipped element
                    }
                }
            }
        }

        /** Concatenated text and CDATA content of the current element; nested elements are dropped. */
        private String text() throws XMLStreamException, DeserializeException {
            String element = reader.getLocalName();
            StringBuilder out = new StringBuilder();
            while (true) {
                switch (reader.next()) {
                    case CHARACTERS, CDATA, SPACE -> out.append(reader.getText());
                    case START_ELEMENT -> {
                        if (LOGGER.isLoggable(Level.FINE)) {
                            LOGGER.fine(
                                    "Dropping markup <" + reader.getLocalName() + "> inside <" + element
                                            + ">");
                        }
                        skip();
                    }
                    case END_ELEMENT -> {
                        return out.toString();
                    }
                    case END_DOCUMENT -> throw DeserializeException.unexpectedEof();
                    default -> {
                        // comments and processing instructions
                    }
                }
            }
        }

        private String simpleText() throws XMLStreamException, DeserializeException {
            return text().strip();
        }

        private double numberText() throws XMLStreamException, DeserializeException {
            String element = reader.getLocalName();
            return requiredNumber(text(), "<" + element + ">");
        }

        private String attr(String name) {
            return reader.getAttributeValue(null, name);
        }

        private String requiredAttr(String name, String field) throws DeserializeException {
            String value = attr(name);
            if (value == null) {
                throw DeserializeException.missingField(field);
            }
            return value;
        }

        private Double doubleAttr(String name) throws DeserializeException {
            String value = attr(name);
            return value == null ? null : requiredNumber(value, "attribute '" + name + "'");
        }

        private double requiredDoubleAttr(String name, String field) throws DeserializeException {
            return requiredNumber(requiredAttr(name, field), "attribute '" + name + "'");
        }

        private Integer intAttr(String name) throws DeserializeException {
            String value = attr(name);
            if (value == null) {
                return null;
            }
            try {
                return Integer.parseInt(value.strip());
            } catch (NumberFormatException e) {
                throw DeserializeException.custom(
                        "Invalid integer in attribute '" + name + "': '" + value + "'", e);
            }
        }

        private Boolean boolAttr(String name) throws DeserializeException {
            String value = attr(name);
            if (value == null) {
                return null;
            }
            return switch (value.strip()) {
                case "true" -> Boolean.TRUE;
                case "false" -> Boolean.FALSE;
                default -> throw DeserializeException.custom(
                        "Invalid boolean in attribute '" + name + "': '" + value + "'");
            };
        }

        private <T> T enumAttr(String name, Function<String, T> parse) throws DeserializeException {
            String value = attr(name);
            if (value == null) {
                return null;
            }
            try {
                return parse.apply(value.strip());
            } catch (IllegalArgumentException e) {
                throw DeserializeException.custom(e.getMessage(), e);
            }
        }

        private double requiredNumber(String text, String where) throws DeserializeException {
            Double value;
            try {
                value = DecimalText.parse(text);
            } catch (NumberFormatException e) {
                throw DeserializeException.custom(
                        "Invalid number in " + where + ": '" + text.strip() + "'", e);
            }
            if (value == null) {
                throw DeserializeException.custom("Missing number in " + where);
            }
            return value;
        }

        private Identifier identifier(String text, String where) throws DeserializeException {
            try {
                return Identifier.parse(text, IdentifierOptions.expression());
            } catch (IdentifierException e) {
                throw DeserializeException.custom(
                        "Invalid identifier in " + where + ": " + e.getMessage(), e);
            }
        }

        private Identifier nameAttr(String field) throws DeserializeException {
            return identifier(requiredAttr("name", field), "attribute 'name'");
        }

        private Identifier optionalNameAttr() throws DeserializeException {
            String value = attr("name");
            return value == null ? null : identifier(value, "attribute 'name'");
        }

        private Map<String, String> attributes() {
            Map<String, String> attributes = new LinkedHashMap<>();
            for (int i = 0; i < reader.getAttributeCount(); i++) {
                attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
            }
            return attributes;
        }

        // ---- document -----------------------------------------------------------------------

        XmileDocument document() throws XMLStreamException, DeserializeException {
            String version = attr("version");
            String xmlns = reader.getNamespaceURI();
            if (xmlns != null && xmlns.isEmpty()) {
                xmlns = null;
            }
            Header header = null;
            SimSpecs simSpecs = null;
            ModelUnits modelUnits = null;
            Dimensions dimensions = null;
            Behavior behavior = null;
            Data data = null;
            List<Model> models = new ArrayList<>();
            List<Macro> macros = new ArrayList<>();
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "header" -> header = header();
                    case "sim_specs" -> simSpecs = simSpecs(true);
                    case "model_units" -> modelUnits = modelUnits();
                    case "dimensions" -> dimensions = dimensions();
                    case "behavior" -> behavior = behavior();
                    case "data" -> data = data();
                    case "model" -> models.add(model());
                    case "macro" -> macros.add(macro());
                    default -> skipUnknown("xmile");
                }
                currentElement = "xmile";
            }
            if (header == null) {
                throw DeserializeException.missingField("header");
            }
            XmileDocument document = new XmileDocument(version, xmlns, header);
            document.setSimSpecs(simSpecs);
            document.setModelUnits(modelUnits);
            document.setDimensions(dimensions);
            document.setBehavior(behavior);
            document.setData(data);
            document.getModels().addAll(models);
            document.getMacros().addAll(macros);
            return document;
        }

        private Header header() throws XMLStreamException, DeserializeException {
            String vendor = null;
            Product product = null;
            HeaderOptions headerOptions = null;
            String name = null;
            String version = null;
            String caption = null;
            String image = null;
            String author = null;
            String affiliation = null;
            String client = null;
            String copyright = null;
            Contact contact = null;
            String created = null;
            String modified = null;
            String uuid = null;
            List<String> includes = new ArrayList<>();
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "vendor" -> vendor = simpleText();
                    case "product" -> product = product();
                    case "options" -> headerOptions = headerOptions();
                    case "name" -> name = simpleText();
                    case "version" -> version = simpleText();
                    case "caption" -> caption = simpleText();
                    case "image" -> image = simpleText();
                    case "author" -> author = simpleText();
                    case "affiliation" -> affiliation = simpleText();
                    case "client" -> client = simpleText();
                    case "copyright" -> copyright = simpleText();
                    case "contact" -> contact = contact();
                    case "created" -> created = simpleText();
                    case "modified" -> modified = simpleText();
                    case "uuid" -> uuid = simpleText();
                    case "includes" -> includes.addAll(includes());
                    default -> skipUnknown("header");
                }
            }
            if (vendor == null) {
                throw DeserializeException.missingField("vendor");
            }
            if (product == null) {
                throw DeserializeException.missingField("product");
            }
            return new Header(
                    vendor, product, headerOptions, name, version, caption, image, author,
                    affiliation, client, copyright, contact, created, modified, uuid, includes);
        }

        private Product product() throws XMLStreamException, DeserializeException {
            String version = requiredAttr("version", "product@version");
            String lang = attr("lang");
            return new Product(simpleText(), version, lang);
        }

        private HeaderOptions headerOptions() throws XMLStreamException, DeserializeException {
            String namespace = attr("namespace");
            Map<String, Map<String, String>> features = new LinkedHashMap<>();
            while (nextChild()) {
                features.put(reader.getLocalName(), attributes());
                skip();
            }
            return new HeaderOptions(namespace, features);
        }

        private Contact contact() throws XMLStreamException, DeserializeException {
            String address = null;
            String phone = null;
            String fax = null;
            String email = null;
            String website = null;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "address" -> address = simpleText();
                    case "phone" -> phone = simpleText();
                    case "fax" -> fax = simpleText();
                    case "email" -> email = simpleText();
                    case "website" -> website = simpleText();
                    default -> skipUnknown("contact");
                }
            }
            return new Contact(address, phone, fax, email, website);
        }

        private List<String> includes() throws XMLStreamException, DeserializeException {
            List<String> resources = new ArrayList<>();
            while (nextChild()) {
                if ("include".equals(reader.getLocalName())) {
                    resources.add(requiredAttr("resource", "include.resource"));
                    skip();
                } else {
                    skipUnknown("includes");
                }
            }
            return resources;
        }

        /** Start and stop are only required outside macros. */
        private SimSpecs simSpecs(boolean requireBounds)
                throws XMLStreamException, DeserializeException {
            String method = attr("method");
            String timeUnits = attr("time_units");
            Double start = null;
            Double stop = null;
            Double dt = null;
            Double pause = null;
            String runBy = null;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "start" -> start = numberText();
                    case "stop" -> stop = numberText();
                    case "dt" -> dt = numberText();
                    case "pause" -> pause = numberText();
                    case "run" -> {
                        runBy = attr("by");
                        skip();
                    }
                    default -> skipUnknown("sim_specs");
                }
            }
            if (requireBounds && start == null) {
                throw DeserializeException.missingField("start");
            }
            if (requireBounds && stop == null) {
                throw DeserializeException.missingField("stop");
            }
            return new SimSpecs(start, stop, dt, method, timeUnits, pause, runBy);
        }

        private ModelUnits modelUnits() throws XMLStreamException, DeserializeException {
            List<UnitDefinition> units = new ArrayList<>();
            while (nextChild()) {
                if ("unit".equals(reader.getLocalName())) {
                    units.add(unit());
                } else {
                    skipUnknown("model_units");
                }
            }
            return new ModelUnits(units);
        }

        private UnitDefinition unit() throws XMLStreamException, DeserializeException {
            String name = requiredAttr("name", "unit.name");
            Boolean disabled = boolAttr("disabled");
            String equation = null;
            List<String> aliases = new ArrayList<>();
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "eqn" -> equation = simpleText();
                    case "alias" -> aliases.add(simpleText());
                    default -> skipUnknown("unit");
                }
            }
            return new UnitDefinition(name, equation, aliases, disabled);
        }

        private Dimensions dimensions() throws XMLStreamException, DeserializeException {
            List<Dimension> dimensions = new ArrayList<>();
            while (nextChild()) {
                if ("dim".equals(reader.getLocalName())) {
                    dimensions.add(dimension());
                } else {
                    skipUnknown("dimensions");
                }
            }
            return new Dimensions(dimensions);
        }

        private Dimension dimension() throws XMLStreamException, DeserializeException {
            String name = requiredAttr("name", "dim.name");
            Integer size = intAttr("size");
            List<String> elements = new ArrayList<>();
            while (nextChild()) {
                if ("elem".equals(reader.getLocalName())) {
                    elements.add(requiredAttr("name", "elem.name"));
                    skip();
                } else {
                    skipUnknown("dim");
                }
            }
            return new Dimension(name, size, elements);
        }

        private Behavior behavior() throws XMLStreamException, DeserializeException {
            NonNegative global = null;
            List<EntityBehavior> entities = new ArrayList<>();
            while (nextChild()) {
                String name = reader.getLocalName();
                switch (name) {
                    case "non_negative" -> global = nonNegative();
                    case "stock", "flow", "aux", "gf" -> entities.add(entityBehavior(name));
                    default -> skipUnknown("behavior");
                }
            }
            return new Behavior(global, entities);
        }

        private EntityBehavior entityBehavior(String entityType)
                throws XMLStreamException, DeserializeException {
            NonNegative flag = null;
            while (nextChild()) {
                if ("non_negative".equals(reader.getLocalName())) {
                    flag = nonNegative();
                } else {
                    skipUnknown(entityType);
                }
            }
            return new EntityBehavior(entityType, flag);
        }

        /** Self-closing or blank means implicit true; otherwise the text must be a boolean. */
        private NonNegative nonNegative() throws XMLStreamException, DeserializeException {
            boolean empty = reader.isEmptyElement();
            String text = text();
            if (empty || text.isBlank()) {
                return NonNegative.IMPLICIT;
            }
            return switch (text.strip()) {
                case "true" -> NonNegative.TRUE;
                case "false" -> NonNegative.FALSE;
                default -> throw DeserializeException.custom(
                        "Invalid non_negative value: '" + text.strip() + "'");
            };
        }

        private Data data() throws XMLStreamException, DeserializeException {
            List<DataImport> imports = new ArrayList<>();
            List<DataExport> exports = new ArrayList<>();
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "import" -> imports.add(dataImport());
                    case "export" -> exports.add(dataExport());
                    default -> skipUnknown("data");
                }
            }
            return new Data(imports, exports);
        }

        private DataImport dataImport() throws XMLStreamException, DeserializeException {
            DataImport result =
                    new DataImport(
                            attr("type"),
                            boolAttr("enabled"),
                            attr("frequency"),
                            attr("orientation"),
                            attr("resource"),
                            attr("worksheet"));
            while (nextChild()) {
                skipUnknown("import");
            }
            return result;
        }

        /** The target is either absent (self-closing export) or one {@code all}/{@code table} child. */
        private DataExport dataExport() throws XMLStreamException, DeserializeException {
            String type = attr("type");
            Boolean enabled = boolAttr("enabled");
            String frequency = attr("frequency");
            String orientation = attr("orientation");
            String resource = attr("resource");
            String worksheet = attr("worksheet");
            String interval = attr("interval");
            ExportTarget target = null;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "all" -> {
                        target = new ExportTarget.All();
                        skip();
                    }
                    case "table" -> {
                        target =
                                new ExportTarget.Table(
                                        requiredAttr("uid", "table.uid"), boolAttr("use_settings"));
                        skip();
                    }
                    default -> skipUnknown("export");
                }
            }
            return new DataExport(
                    type, enabled, frequency, orientation, resource, worksheet, interval, target);
        }

        // ---- models and variables -----------------------------------------------------------

        private Model model() throws XMLStreamException, DeserializeException {
            String name = attr("name");
            String resource = attr("resource");
            SimSpecs simSpecs = null;
            Behavior behavior = null;
            Variables variables = null;
            Views views = null;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "sim_specs" -> simSpecs = simSpecs(true);
                    case "behavior" -> behavior = behavior();
                    case "variables" -> variables = variables();
                    case "views" -> views = views();
                    default -> skipUnknown("model");
                }
                currentElement = "model";
            }
            if (variables == null) {
                throw DeserializeException.missingField("variables");
            }
            Model model = new Model(name, variables);
            model.setResource(resource);
            model.setSimSpecs(simSpecs);
            model.setBehavior(behavior);
            model.setViews(views);
            return model;
        }

        private Variables variables() throws XMLStreamException, DeserializeException {
            List<Variable> variables = new ArrayList<>();
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "stock" -> variables.add(stock());
                    case "flow" -> variables.add(flow());
                    case "aux" -> variables.add(auxiliary());
                    case "gf" -> variables.add(graphicalFunction(false));
                    case "module" -> variables.add(module());
                    case "group" -> variables.add(group());
                    default -> skipUnknown("variables");
                }
                currentElement = "variables";
            }
            return new Variables(variables);
        }

        private Stock stock() throws XMLStreamException, DeserializeException {
            Identifier name = nameAttr("name");
            FieldsBuilder fields = new FieldsBuilder();
            List<Identifier> inflows = new ArrayList<>();
            List<Identifier> outflows = new ArrayList<>();
            NonNegative nonNegative = null;
            Conveyor conveyor = null;
            boolean queue = false;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "inflow" -> inflows.add(identifier(simpleText(), "<inflow>"));
                    case "outflow" -> outflows.add(identifier(simpleText(), "<outflow>"));
                    case "non_negative" -> nonNegative = nonNegative();
                    case "conveyor" -> conveyor = conveyor();
                    case "queue" -> {
                        queue = true;
                        skip();
                    }
                    default -> fields.child("stock");
                }
            }
            if (conveyor != null && queue) {
                LOGGER.fine(
                        "Stock '" + name + "' declares both conveyor and queue; keeping the conveyor");
                queue = false;
            }
            return new Stock(name, fields.build(), inflows, outflows, nonNegative, conveyor, queue);
        }

        private Conveyor conveyor() throws XMLStreamException, DeserializeException {
            Boolean discrete = boolAttr("discrete");
            Boolean batchIntegrity = boolAttr("batch_integrity");
            Boolean oneAtATime = boolAttr("one_at_a_time");
            Boolean exponentialLeak = boolAttr("exponential_leak");
            Equation length = null;
            Equation capacity = null;
            Equation inflowLimit = null;
            Equation sample = null;
            Equation arrest = null;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "len" -> length = equation();
                    case "capacity" -> capacity = equation();
                    case "in_limit" -> inflowLimit = equation();
                    case "sample" -> sample = equation();
                    case "arrest" -> arrest = equation();
                    default -> skipUnknown("conveyor");
                }
            }
            if (length == null) {
                throw DeserializeException.missingField("len");
            }
            return new Conveyor(
                    length, capacity, inflowLimit, sample, arrest, discrete, batchIntegrity,
                    oneAtATime, exponentialLeak);
        }

        private Flow flow() throws XMLStreamException, DeserializeException {
            Identifier name = nameAttr("name");
            FieldsBuilder fields = new FieldsBuilder();
            Double multiplier = null;
            NonNegative nonNegative = null;
            boolean overflow = false;
            boolean leak = false;
            boolean leakIntegers = false;
            Double leakStart = null;
            Double leakEnd = null;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "multiplier" -> multiplier = numberText();
                    case "non_negative" -> nonNegative = nonNegative();
                    case "overflow" -> overflow = presenceFlag();
                    case "leak" -> leak = presenceFlag();
                    case "leak_integers" -> leakIntegers = presenceFlag();
                    case "leak_start" -> leakStart = numberText();
                    case "leak_end" -> leakEnd = numberText();
                    default -> fields.child("flow");
                }
            }
            TransitOptions transit =
                    TransitOptions.of(overflow, leak, leakIntegers, leakStart, leakEnd);
            return new Flow(name, fields.build(), multiplier, nonNegative, transit);
        }

        /** An element that is true by presence, unless its text says {@code false}. */
        private boolean presenceFlag() throws XMLStreamException, DeserializeException {
            String element = reader.getLocalName();
            String text = text().strip();
            return switch (text) {
                case "", "true" -> true;
                case "false" -> false;
                default -> throw DeserializeException.custom(
                        "Invalid " + element + " value: '" + text + "'");
            };
        }

        private Auxiliary auxiliary() throws XMLStreamException, DeserializeException {
            Identifier name = nameAttr("name");
            FieldsBuilder fields = new FieldsBuilder();
            while (nextChild()) {
                fields.child("aux");
            }
            return new Auxiliary(name, fields.build());
        }

        private Equation equation() throws XMLStreamException, DeserializeException {
            String text = text();
            try {
                return new Equation(text, parser.parseExpressionList(text));
            } catch (EquationParseException e) {
                throw DeserializeException.custom("Invalid equation: " + e.getMessage(), e);
            }
        }

        private Documentation documentation() throws XMLStreamException, DeserializeException {
            return Documentation.of(text());
        }

        private DeviceRange range() throws XMLStreamException, DeserializeException {
            DeviceRange range =
                    new DeviceRange(
                            requiredDoubleAttr("min", "range.min"),
                            requiredDoubleAttr("max", "range.max"));
            skip();
            return range;
        }

        private DeviceScale scale() throws XMLStreamException, DeserializeException {
            Double min = doubleAttr("min");
            Double max = doubleAttr("max");
            Boolean auto = boolAttr("auto");
            Integer group = intAttr("group");
            if (auto == null && group == null) {
                if (min == null) {
                    throw DeserializeException.missingField("scale.min");
                }
                if (max == null) {
                    throw DeserializeException.missingField("scale.max");
                }
            }
            skip();
            return new DeviceScale(min, max, auto, group);
        }

        private FormatOptions format() throws XMLStreamException, DeserializeException {
            FormatOptions format =
                    new FormatOptions(
                            intAttr("precision"),
                            doubleAttr("scale_by"),
                            enumAttr("display_as", DisplayAs::fromXml),
                            boolAttr("delimit_000s"));
            skip();
            return format;
        }

        private List<String> dimensionRefs() throws XMLStreamException, DeserializeException {
            List<String> names = new ArrayList<>();
            while (nextChild()) {
                if ("dim".equals(reader.getLocalName())) {
                    names.add(requiredAttr("name", "dim.name"));
                    skip();
                } else {
                    skipUnknown("dimensions");
                }
            }
            return names;
        }

        private ArrayElement arrayElement() throws XMLStreamException, DeserializeException {
            String subscript = requiredAttr("subscript", "element.subscript");
            Equation equation = null;
            while (nextChild()) {
                if ("eqn".equals(reader.getLocalName())) {
                    equation = equation();
                } else {
                    skipUnknown("element");
                }
            }
            return new ArrayElement(subscript, equation);
        }

        private EventPoster eventPoster() throws XMLStreamException, DeserializeException {
            double min = requiredDoubleAttr("min", "event_poster.min");
            double max = requiredDoubleAttr("max", "event_poster.max");
            List<Threshold> thresholds = new ArrayList<>();
            while (nextChild()) {
                if ("threshold".equals(reader.getLocalName())) {
                    thresholds.add(threshold());
                } else {
                    skipUnknown("event_poster");
                }
            }
            return new EventPoster(min, max, thresholds);
        }

        private Threshold threshold() throws XMLStreamException, DeserializeException {
            double value = requiredDoubleAttr("value", "threshold.value");
            String direction = attr("direction");
            String repeat = attr("repeat");
            Double interval = doubleAttr("interval");
            List<PosterEvent> events = new ArrayList<>();
            while (nextChild()) {
                if ("event".equals(reader.getLocalName())) {
                    String simAction = attr("sim_action");
                    String text = simpleText();
                    events.add(new PosterEvent(simAction, text.isEmpty() ? null : text));
                } else {
                    skipUnknown("threshold");
                }
            }
            return new Threshold(value, direction, repeat, interval, events);
        }

        /** Embedded graphical functions have no name; standalone ones must. */
        private GraphicalFunction graphicalFunction(boolean embedded)
                throws XMLStreamException, DeserializeException {
            Identifier name = embedded ? optionalNameAttr() : nameAttr("name");
            GraphicalFunctionType type = enumAttr("type", GraphicalFunctionType::fromXml);
            Equation equation = null;
            GraphicalFunctionScale xScale = null;
            GraphicalFunctionScale yScale = null;
            Points xPoints = null;
            Points yPoints = null;
            Documentation documentation = null;
            String units = null;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "eqn" -> equation = equation();
                    case "xscale" -> xScale = graphicalFunctionScale("xscale");
                    case "yscale" -> yScale = graphicalFunctionScale("yscale");
                    case "xpts" -> xPoints = points();
                    case "ypts" -> yPoints = points();
                    case "doc" -> documentation = documentation();
                    case "units" -> units = simpleText();
                    default -> skipUnknown("gf");
                }
            }
            if (yPoints == null) {
                throw DeserializeException.missingField("ypts");
            }
            GraphicalFunctionData data;
            if (xPoints != null) {
                data =
                        new GraphicalFunctionData.XYPairs(
                                xScale, yScale, xPoints.values, xPoints.separator, yPoints.values,
                                yPoints.separator);
            } else {
                if (xScale == null) {
                    throw DeserializeException.missingField("xscale");
                }
                data =
                        new GraphicalFunctionData.UniformScale(
                                xScale, yScale, yPoints.values, yPoints.separator);
            }
            return new GraphicalFunction(name, type, equation, data, documentation, units);
        }

        private GraphicalFunctionScale graphicalFunctionScale(String element)
                throws XMLStreamException, DeserializeException {
            GraphicalFunctionScale scale =
                    new GraphicalFunctionScale(
                            requiredDoubleAttr("min", element + ".min"),
                            requiredDoubleAttr("max", element + ".max"));
            skip();
            return scale;
        }

        private Points points() throws XMLStreamException, DeserializeException {
            String element = reader.getLocalName();
            String separator = attr("sep");
            String text = text();
            String effective =
                    separator == null || separator.isEmpty()
                            ? GraphicalFunctionData.DEFAULT_SEPARATOR
                            : separator;
            List<Double> values = new ArrayList<>();
            for (String part : text.split(Pattern.quote(effective))) {
                if (!part.isBlank()) {
                    values.add(requiredNumber(part, "<" + element + ">"));
                }
            }
            return new Points(values, separator);
        }

        private Module module() throws XMLStreamException, DeserializeException {
            Identifier name = nameAttr("name");
            String resource = attr("resource");
            List<ModuleConnection> connections = new ArrayList<>();
            Documentation documentation = null;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "connect" -> {
                        connections.add(
                                new ModuleConnection(
                                        requiredAttr("to", "connect.to"),
                                        requiredAttr("from", "connect.from")));
                        skip();
                    }
                    case "doc" -> documentation = documentation();
                    default -> skipUnknown("module");
                }
            }
            return new Module(name, resource, connections, documentation);
        }

        private Group group() throws XMLStreamException, DeserializeException {
            Identifier name = nameAttr("name");
            Documentation documentation = null;
            List<GroupEntity> entities = new ArrayList<>();
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "doc" -> documentation = documentation();
                    case "entity" -> {
                        Identifier entity = nameAttr("entity.name");
                        Boolean run = boolAttr("run");
                        entities.add(new GroupEntity(entity, Boolean.TRUE.equals(run)));
                        skip();
                    }
                    default -> skipUnknown("group");
                }
            }
            return new Group(name, documentation, entities);
        }

        // ---- views --------------------------------------------------------------------------

        private Views views() throws XMLStreamException, DeserializeException {
            Integer visibleView = intAttr("visible_view");
            List<View> views = new ArrayList<>();
            while (nextChild()) {
                if ("view".equals(reader.getLocalName())) {
                    views.add(view());
                } else {
                    skipUnknown("views");
                }
            }
            return new Views(visibleView, views);
        }

        private View view() throws XMLStreamException, DeserializeException {
            Integer uid = intAttr("uid");
            ViewType type = enumAttr("type", ViewType::fromXml);
            Integer order = intAttr("order");
            Double width = doubleAttr("width");
            Double height = doubleAttr("height");
            Double zoom = doubleAttr("zoom");
            Double scrollX = doubleAttr("scroll_x");
            Double scrollY = doubleAttr("scroll_y");
            String background = attr("background");
            Double pageWidth = doubleAttr("page_width");
            Double pageHeight = doubleAttr("page_height");
            String pageSequence = attr("page_sequence");
            String pageOrientation = attr("page_orientation");
            Boolean showPages = boolAttr("show_pages");
            Integer homePage = intAttr("home_page");
            Boolean homeView = boolAttr("home_view");
            List<ViewObject> objects = new ArrayList<>();
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "stock" -> objects.add(variableObject(VariableObject.Kind.STOCK));
                    case "flow" -> objects.add(variableObject(VariableObject.Kind.FLOW));
                    case "aux" -> objects.add(variableObject(VariableObject.Kind.AUX));
                    case "module" -> objects.add(variableObject(VariableObject.Kind.MODULE));
                    case "alias" -> objects.add(aliasObject());
                    case "connector" -> objects.add(connectorObject());
                    case "group" -> objects.add(groupObject());
                    default -> skipUnknown("view");
                }
                currentElement = "view";
            }
            return new View(
                    uid, type, order, width, height, zoom, scrollX, scrollY, background, pageWidth,
                    pageHeight, pageSequence, pageOrientation, showPages, homePage, homeView,
                    objects);
        }

        private VariableObject variableObject(VariableObject.Kind kind)
                throws XMLStreamException, DeserializeException {
            Integer uid = intAttr("uid");
            Identifier name = optionalNameAttr();
            Double x = doubleAttr("x");
            Double y = doubleAttr("y");
            Double width = doubleAttr("width");
            Double height = doubleAttr("height");
            String labelSide = attr("label_side");
            List<Point> points = new ArrayList<>();
            while (nextChild()) {
                if ("pts".equals(reader.getLocalName())) {
                    points.addAll(pipePoints());
                } else {
                    skipUnknown(kind.xmlName());
                }
            }
            return new VariableObject(kind, uid, name, x, y, width, height, labelSide, points);
        }

        private List<Point> pipePoints() throws XMLStreamException, DeserializeException {
            List<Point> points = new ArrayList<>();
            while (nextChild()) {
                if ("pt".equals(reader.getLocalName())) {
                    points.add(
                            new Point(
                                    requiredDoubleAttr("x", "pt.x"),
                                    requiredDoubleAttr("y", "pt.y")));
                    skip();
                } else {
                    skipUnknown("pts");
                }
            }
            return points;
        }

        private AliasObject aliasObject() throws XMLStreamException, DeserializeException {
            Integer uid = intAttr("uid");
            Double x = doubleAttr("x");
            Double y = doubleAttr("y");
            Identifier of = null;
            while (nextChild()) {
                if ("of".equals(reader.getLocalName())) {
                    of = identifier(simpleText(), "<of>");
                } else {
                    skipUnknown("alias");
                }
            }
            return new AliasObject(uid, x, y, of);
        }

        private ConnectorObject connectorObject() throws XMLStreamException, DeserializeException {
            Integer uid = intAttr("uid");
            Double x = doubleAttr("x");
            Double y = doubleAttr("y");
            Double angle = doubleAttr("angle");
            Pointer from = null;
            Pointer to = null;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "from" -> from = pointer();
                    case "to" -> to = pointer();
                    default -> skipUnknown("connector");
                }
            }
            return new ConnectorObject(uid, x, y, angle, from, to);
        }

        /** A connector end: a variable name as text, or a nested {@code <alias uid>}. */
        private Pointer pointer() throws XMLStreamException, DeserializeException {
            String element = reader.getLocalName();
            Integer aliasUid = null;
            StringBuilder text = new StringBuilder();
            while (true) {
                switch (reader.next()) {
                    case CHARACTERS, CDATA, SPACE -> text.append(reader.getText());
                    case START_ELEMENT -> {
                        if ("alias".equals(reader.getLocalName())) {
                            aliasUid = intAttr("uid");
                            if (aliasUid == null) {
                                throw DeserializeException.missingField("alias.uid");
                            }
                            skip();
                        } else {
                            skipUnknown(element);
                        }
                    }
                    case END_ELEMENT -> {
                        if (aliasUid != null) {
                            return new Pointer.Alias(aliasUid);
                        }
                        return new Pointer.Named(
                                identifier(text.toString().strip(), "<" + element + ">"));
                    }
                    case END_DOCUMENT -> throw DeserializeException.unexpectedEof();
                    default -> {
                        // comments and processing instructions
                    }
                }
            }
        }

        private GroupObject groupObject() throws XMLStreamException, DeserializeException {
            GroupObject group =
                    new GroupObject(
                            intAttr("uid"),
                            optionalNameAttr(),
                            doubleAttr("x"),
                            doubleAttr("y"),
                            doubleAttr("width"),
                            doubleAttr("height"));
            while (nextChild()) {
                skipUnknown("group");
            }
            return group;
        }

        // ---- macros -------------------------------------------------------------------------

        private Macro macro() throws XMLStreamException, DeserializeException {
            Identifier name = nameAttr("name");
            String namespace = attr("namespace");
            List<MacroParameter> parameters = new ArrayList<>();
            Equation equation = null;
            String format = null;
            Documentation documentation = null;
            SimSpecs simSpecs = null;
            Variables variables = null;
            MacroView view = null;
            while (nextChild()) {
                switch (reader.getLocalName()) {
                    case "parm" -> parameters.add(parameter());
                    case "eqn" -> equation = equation();
                    case "format" -> format = simpleText();
                    case "doc" -> documentation = documentation();
                    case "sim_specs" -> simSpecs = simSpecs(false);
                    case "variables" -> variables = variables();
                    case "view" -> view = new MacroView(view());
                    default -> skipUnknown("macro");
                }
                currentElement = "macro";
            }
            if (equation == null) {
                throw DeserializeException.missingField("eqn");
            }
            return new Macro(
                    name, namespace, parameters, equation, format, documentation, simSpecs,
                    variables, view);
        }

        private MacroParameter parameter() throws XMLStreamException, DeserializeException {
            String defaultText = attr("default");
            Expression defaultValue = null;
            if (defaultText != null) {
                try {
                    defaultValue = parser.parseExpression(defaultText);
                } catch (EquationParseException e) {
                    throw DeserializeException.custom(
                            "Invalid default for macro parameter: " + e.getMessage(), e);
                }
            }
            String name = simpleText();
            if (name.isEmpty()) {
                throw DeserializeException.missingField("name");
            }
            return new MacroParameter(identifier(name, "<parm>"), defaultValue);
        }

        /** Accumulates the children shared by stocks, flows and auxiliaries. */
        private final class FieldsBuilder {
            private final Access access;
            private final Boolean autoexport;
            private Equation equation;
            private String mathml;
            private Documentation documentation;
            private String units;
            private DeviceRange range;
            private DeviceScale scale;
            private FormatOptions format;
            private List<String> dimensions = List.of();
            private final List<ArrayElement> elements = new ArrayList<>();
            private GraphicalFunction graphicalFunction;
            private EventPoster eventPoster;

            FieldsBuilder() throws DeserializeException {
                this.access = enumAttr("access", Access::fromXml);
                this.autoexport = boolAttr("autoexport");
            }

            void child(String parent) throws XMLStreamException, DeserializeException {
                switch (reader.getLocalName()) {
                    case "eqn" -> equation = equation();
                    case "mathml" -> mathml = text();
                    case "doc" -> documentation = documentation();
                    case "units" -> units = simpleText();
                    case "range" -> range = range();
                    case "scale" -> scale = scale();
                    case "format" -> format = format();
                    case "dimensions" -> dimensions = dimensionRefs();
                    case "element" -> elements.add(arrayElement());
                    case "gf" -> graphicalFunction = graphicalFunction(true);
                    case "event_poster" -> eventPoster = eventPoster();
                    default -> skipUnknown(parent);
                }
            }

            EquationFields build() throws DeserializeException {
                if (equation == null && elements.isEmpty()) {
                    throw DeserializeException.missingField("eqn");
                }
                return new EquationFields(
                        equation, mathml, documentation, units, range, scale, format, dimensions,
                        elements, graphicalFunction, eventPoster, access, autoexport);
            }
        }
    }

    private static final class Points {
        private final List<Double> values;
        private final String separator;

        Points(List<Double> values, String separator) {
            this.values = values;
            this.separator = separator;
        }
    }
}
