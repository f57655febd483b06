package com.xmile.codec.validation;

import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.Variable;
import com.xmile.equation.Identifier;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Variable names must be unique within a model; names compare case-insensitively. */
final class VariableNameUniquenessRule implements ValidationRule {

    @Override
    public List<ValidationMessage> validate(Model model) {
        List<Variable> variables = model.getVariables().all();
        Map<Identifier, List<Integer>> seen = new LinkedHashMap<>();
        for (int i = 0; i < variables.size(); i++) {
            Identifier name = variables.get(i).name();
            if (name != null) {
                seen.computeIfAbsent(name, key -> new ArrayList<>()).add(i);
            }
        }
        List<ValidationMessage> messages = new ArrayList<>();
        for (Map.Entry<Identifier, List<Integer>> entry : seen.entrySet()) {
            List<Integer> indices = entry.getValue();
            if (indices.size() > 1) {
                messages.add(
                        ValidationMessage.error(
                                "Duplicate variable name '" + entry.getKey().getQualifiedName()
                                        + "' found " + indices.size() + " times at indices: "
                                        + indices,
                                model.getName()));
            }
        }
        return messages;
    }
}
