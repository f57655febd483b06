package com.xmile.codec;

import com.xmile.codec.schema.ArrayElement;
import com.xmile.codec.schema.Auxiliary;
import com.xmile.codec.schema.Equation;
import com.xmile.codec.schema.EquationFields;
import com.xmile.codec.schema.Flow;
import com.xmile.codec.schema.GraphicalFunction;
import com.xmile.codec.schema.Macro;
import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.Module;
import com.xmile.codec.schema.Stock;
import com.xmile.codec.schema.Variable;
import com.xmile.codec.schema.Variables;
import com.xmile.codec.schema.XmileDocument;
import com.xmile.codec.validation.ValidationResult;
import com.xmile.codec.validation.ValidationRunner;
import com.xmile.codec.xml.DecoderOptions;
import com.xmile.codec.xml.XmileDecoder;
import com.xmile.codec.xml.XmileEncoder;
import com.xmile.equation.semantic.CallTargetResolver;
import com.xmile.equation.semantic.SymbolTable;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point that ties decoding, call-target resolution, validation and encoding together.
 * Decoded documents come back with every function call classified against the variables of its
 * model.
 */
public final class XmileCodec {

    private static final Logger LOGGER = Logger.getLogger(XmileCodec.class.getName());

    private final XmileDecoder decoder;
    private final XmileEncoder encoder;
    private final ValidationRunner validator;

    public XmileCodec() {
        this(DecoderOptions.fromEnvironment());
    }

    public XmileCodec(DecoderOptions options) {
        this(new XmileDecoder(options), new XmileEncoder(), ValidationRunner.defaultRules());
    }

    public XmileCodec(XmileDecoder decoder, XmileEncoder encoder, ValidationRunner validator) {
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public XmileDocument decode(String xml) throws XmileException {
        return resolveCallTargets(decoder.decode(xml));
    }

    public XmileDocument decode(InputStream in) throws XmileException {
        return resolveCallTargets(decoder.decode(in));
    }

    public XmileDocument decode(Path path) throws XmileException {
        return resolveCallTargets(decoder.decode(path));
    }

    /**
     * Decodes every file, reporting all failures at once. A single failure is rethrown as is; two or
     * more become one {@link XmileException.Kind#MULTIPLE} exception.
     */
    public List<XmileDocument> decodeAll(List<Path> paths) throws XmileException {
        List<XmileDocument> documents = new ArrayList<>();
        ErrorCollection errors = new ErrorCollection();
        for (Path path : paths) {
            try {
                documents.add(decode(path));
            } catch (XmileException e) {
                LOGGER.fine("Failed to decode " + path + ": " + e.getMessage());
                errors.push(e);
            }
        }
        errors.throwIfAny();
        return documents;
    }

    public String encode(XmileDocument document) throws XmileException {
        return encoder.encode(document);
    }

    public void encode(XmileDocument document, OutputStream out) throws XmileException {
        encoder.encode(document, out);
    }

    /**
     * Runs the cross-reference rules over all models.
     *
     * @return {@link ValidationResult.Valid} or {@link ValidationResult.Warnings}
     * @throws XmileException of kind {@code VALIDATION} carrying all warnings and errors when any
     *     rule reports an error
     */
    public ValidationResult validate(XmileDocument document) throws XmileException {
        ValidationResult result = validator.run(document);
        if (!result.isValid()) {
            throw XmileException.validation(
                    "Validation failed with " + result.errors().size() + " error(s)",
                    result.warnings(),
                    result.errors());
        }
        return result;
    }

    /**
     * Rewrites the equations of the document so that calls naming a graphical function, module or
     * arrayed variable of the same model are classified as such. The document is updated in place
     * and returned.
     */
    public static XmileDocument resolveCallTargets(XmileDocument document) {
        for (Model model : document.getModels()) {
            CallTargetResolver resolver = new CallTargetResolver(symbolsOf(model.getVariables()));
            model.setVariables(resolve(model.getVariables(), resolver));
        }
        List<Macro> macros = document.getMacros();
        for (int i = 0; i < macros.size(); i++) {
            Macro macro = macros.get(i);
            Variables body = macro.getVariables() == null ? Variables.empty() : macro.getVariables();
            CallTargetResolver resolver = new CallTargetResolver(symbolsOf(body));
            macros.set(i, macro.withEquation(resolve(macro.getEquation(), resolver)));
        }
        return document;
    }

    static SymbolTable symbolsOf(Variables variables) {
        SymbolTable.Builder symbols = SymbolTable.builder();
        for (Variable variable : variables.all()) {
            if (variable instanceof GraphicalFunction && variable.name() != null) {
                symbols.graphicalFunction(variable.name());
            } else if (variable instanceof Module) {
                symbols.model(variable.name());
            } else {
                EquationFields fields = fieldsOf(variable);
                if (fields != null && fields.isArrayed()) {
                    symbols.array(variable.name());
                }
            }
        }
        return symbols.build();
    }

    private static Variables resolve(Variables variables, CallTargetResolver resolver) {
        List<Variable> resolved = new ArrayList<>(variables.size());
        for (Variable variable : variables.all()) {
            if (variable instanceof Stock stock) {
                resolved.add(resolve(stock, resolver));
            } else if (variable instanceof Flow flow) {
                resolved.add(flow.withFields(resolve(flow.fields(), resolver)));
            } else if (variable instanceof Auxiliary aux) {
                resolved.add(aux.withFields(resolve(aux.fields(), resolver)));
            } else if (variable instanceof GraphicalFunction gf) {
                resolved.add(resolve(gf, resolver));
            } else {
                resolved.add(variable);
            }
        }
        return new Variables(resolved);
    }

    private static Stock resolve(Stock stock, CallTargetResolver resolver) {
        Stock result = stock.withFields(resolve(stock.fields(), resolver));
        if (stock.conveyor() == null) {
            return result;
        }
        return result.withConveyor(
                stock.conveyor().mapEquations(equation -> resolve(equation, resolver)));
    }

    private static EquationFields resolve(EquationFields fields, CallTargetResolver resolver) {
        List<ArrayElement> elements = new ArrayList<>(fields.elements().size());
        for (ArrayElement element : fields.elements()) {
            elements.add(
                    new ArrayElement(element.subscript(), resolve(element.equation(), resolver)));
        }
        EquationFields result =
                fields.withEquation(resolve(fields.equation(), resolver)).withElements(elements);
        if (fields.graphicalFunction() == null) {
            return result;
        }
        return new EquationFields(
                result.equation(),
                result.mathml(),
                result.documentation(),
                result.units(),
                result.range(),
                result.scale(),
                result.format(),
                result.dimensions(),
                result.elements(),
                resolve(fields.graphicalFunction(), resolver),
                result.eventPoster(),
                result.access(),
                result.autoexport());
    }

    private static GraphicalFunction resolve(GraphicalFunction gf, CallTargetResolver resolver) {
        return gf.withEquation(resolve(gf.equation(), resolver));
    }

    private static Equation resolve(Equation equation, CallTargetResolver resolver) {
        if (equation == null) {
            return null;
        }
        return equation.withExpressions(resolver.resolveAll(equation.getExpressions()));
    }

    private static EquationFields fieldsOf(Variable variable) {
        if (variable instanceof Stock stock) {
            return stock.fields();
        }
        if (variable instanceof Flow flow) {
            return flow.fields();
        }
        if (variable instanceof Auxiliary aux) {
            return aux.fields();
        }
        return null;
    }
}
