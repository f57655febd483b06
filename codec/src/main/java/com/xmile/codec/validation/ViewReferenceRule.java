package com.xmile.codec.validation;

import com.xmile.codec.schema.AliasObject;
import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.VariableObject;
import com.xmile.codec.schema.Variables;
import com.xmile.codec.schema.View;
import com.xmile.codec.schema.ViewObject;
import java.util.ArrayList;
import java.util.List;

/**
 * Named diagram symbols must point at declared variables. Aliases are only warned about: a broken
 * alias leaves the model itself intact.
 */
final class ViewReferenceRule implements ValidationRule {

    @Override
    public List<ValidationMessage> validate(Model model) {
        List<ValidationMessage> messages = new ArrayList<>();
        if (model.getViews() == null) {
            return messages;
        }
        Variables variables = model.getVariables();
        for (View view : model.getViews().views()) {
            for (ViewObject object : view.objects()) {
                if (object instanceof VariableObject symbol) {
                    if (symbol.name() != null && variables.find(symbol.name()) == null) {
                        messages.add(
                                ValidationMessage.error(
                                        symbol.kind().displayName() + " object '"
                                                + symbol.name().getQualifiedName() + "'"
                                                + uidSuffix(symbol.uid())
                                                + " references a variable that does not exist",
                                        model.getName()));
                    }
                } else if (object instanceof AliasObject alias) {
                    checkAlias(alias, variables, model.getName(), messages);
                }
            }
        }
        return messages;
    }

    private static void checkAlias(
            AliasObject alias, Variables variables, String modelName, List<ValidationMessage> out) {
        if (alias.of() == null) {
            out.add(
                    ValidationMessage.warning(
                            "Alias object" + uidSuffix(alias.uid()) + " does not name its target",
                            modelName));
        } else if (variables.find(alias.of()) == null) {
            out.add(
                    ValidationMessage.warning(
                            "Alias object" + uidSuffix(alias.uid()) + " refers to '"
                                    + alias.of().getQualifiedName()
                                    + "', which does not exist",
                            modelName));
        }
    }

    private static String uidSuffix(Integer uid) {
        return uid == null ? "" : " (UID " + uid + ")";
    }
}
