package com.xmile.codec.validation;

import com.xmile.codec.schema.Auxiliary;
import com.xmile.codec.schema.Dimension;
import com.xmile.codec.schema.Dimensions;
import com.xmile.codec.schema.EquationFields;
import com.xmile.codec.schema.Flow;
import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.Stock;
import com.xmile.codec.schema.Variable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks that every {@code <dim name>} used by a variable is declared in the document's
 * {@code <dimensions>} block. Names compare case-insensitively.
 */
final class DimensionReferenceRule implements ValidationRule {

    private final Set<String> declared = new HashSet<>();

    DimensionReferenceRule(Dimensions dimensions) {
        if (dimensions != null) {
            for (Dimension dimension : dimensions.dimensions()) {
                declared.add(key(dimension.name()));
            }
        }
    }

    @Override
    public List<ValidationMessage> validate(Model model) {
        List<ValidationMessage> messages = new ArrayList<>();
        for (Variable variable : model.getVariables().all()) {
            EquationFields fields = fieldsOf(variable);
            if (fields == null) {
                continue;
            }
            for (String dimension : fields.dimensions()) {
                if (!declared.contains(key(dimension))) {
                    messages.add(
                            ValidationMessage.error(
                                    "Variable '" + variable.name().getQualifiedName()
                                            + "' references undefined dimension '" + dimension + "'",
                                    model.getName()));
                }
            }
        }
        return messages;
    }

    private static String key(String name) {
        return name.strip().toLowerCase(Locale.ROOT);
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
