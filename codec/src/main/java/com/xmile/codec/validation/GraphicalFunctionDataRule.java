package com.xmile.codec.validation;

import com.xmile.codec.schema.Auxiliary;
import com.xmile.codec.schema.EquationFields;
import com.xmile.codec.schema.Flow;
import com.xmile.codec.schema.GraphicalFunction;
import com.xmile.codec.schema.GraphicalFunctionData;
import com.xmile.codec.schema.GraphicalFunctionScale;
import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.Stock;
import com.xmile.codec.schema.Variable;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks the point data of standalone and embedded graphical functions: scales must not be
 * inverted, x and y lists must pair up, and x values should ascend.
 */
final class GraphicalFunctionDataRule implements ValidationRule {

    @Override
    public List<ValidationMessage> validate(Model model) {
        List<ValidationMessage> messages = new ArrayList<>();
        for (Variable variable : model.getVariables().all()) {
            if (variable instanceof GraphicalFunction gf) {
                String label =
                        gf.name() == null
                                ? "Graphical function"
                                : "Graphical function '" + gf.name().getQualifiedName() + "'";
                check(label, gf.data(), model.getName(), messages);
            } else {
                EquationFields fields = fieldsOf(variable);
                if (fields != null && fields.graphicalFunction() != null) {
                    String label =
                            "Graphical function of '" + variable.name().getQualifiedName() + "'";
                    check(label, fields.graphicalFunction().data(), model.getName(), messages);
                }
            }
        }
        return messages;
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

    private static void check(
            String label, GraphicalFunctionData data, String modelName, List<ValidationMessage> out) {
        checkScale(label, "xscale", data.xScale(), modelName, out);
        checkScale(label, "yscale", data.yScale(), modelName, out);
        if (!(data instanceof GraphicalFunctionData.XYPairs pairs)) {
            return;
        }
        List<Double> xs = pairs.xValues();
        if (xs.size() != pairs.yValues().size()) {
            out.add(
                    ValidationMessage.error(
                            label + " has " + xs.size() + " x values but "
                                    + pairs.yValues().size() + " y values",
                            modelName));
        }
        for (int i = 1; i < xs.size(); i++) {
            if (xs.get(i) < xs.get(i - 1)) {
                out.add(
                        ValidationMessage.warning(
                                label + " has x values that are not in ascending order",
                                modelName));
                return;
            }
        }
    }

    private static void checkScale(
            String label,
            String which,
            GraphicalFunctionScale scale,
            String modelName,
            List<ValidationMessage> out) {
        if (scale != null && scale.min() > scale.max()) {
            out.add(
                    ValidationMessage.error(
                            label + " has " + which + " min " + scale.min() + " greater than max "
                                    + scale.max(),
                            modelName));
        }
    }
}
