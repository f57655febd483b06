package com.xmile.codec.validation;

import com.xmile.codec.schema.Macro;
import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.XmileDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes a list of validation rules and aggregates their diagnostics. Rules run independently; a
 * failing rule never stops the ones after it.
 */
public final class ValidationRunner {

    private static final Logger LOGGER = Logger.getLogger(ValidationRunner.class.getName());

    private final List<ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /**
     * Convenience factory that wires in the default rule set.
     */
    public static ValidationRunner defaultRules() {
        return new ValidationRunner(
                List.of(
                        new VariableNameUniquenessRule(),
                        new ViewReferenceRule(),
                        new ViewUidUniquenessRule(),
                        new GroupEntityRule(),
                        new StockFlowLinkRule(),
                        new GraphicalFunctionDataRule()));
    }

    /**
     * Run all configured rules against one model.
     *
     * @return All diagnostics produced by all rules, in rule order.
     */
    public List<ValidationMessage> run(Model model) {
        List<ValidationMessage> diagnostics = new ArrayList<>();
        for (ValidationRule rule : rules) {
            diagnostics.addAll(rule.validate(model));
        }
        return diagnostics;
    }

    /**
     * Run all rules against every model of the document, then against the variables of each macro
     * that declares its own. Dimension references are checked here too, against the dimensions the
     * document declares.
     */
    public ValidationResult run(XmileDocument document) {
        ValidationRule dimensions = new DimensionReferenceRule(document.getDimensions());
        List<ValidationMessage> diagnostics = new ArrayList<>();
        for (Model model : document.getModels()) {
            diagnostics.addAll(run(model));
            diagnostics.addAll(dimensions.validate(model));
        }
        for (Macro macro : document.getMacros()) {
            if (macro.getVariables() != null) {
                Model body = new Model(macro.getName().getQualifiedName(), macro.getVariables());
                diagnostics.addAll(run(body));
                diagnostics.addAll(dimensions.validate(body));
            }
        }
        ValidationResult result = ValidationResult.of(diagnostics);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(
                    "Validated " + document.getModels().size() + " model(s): "
                            + result.errors().size() + " error(s), "
                            + result.warnings().size() + " warning(s)");
        }
        return result;
    }
}
