package com.xmile.codec.validation;

import com.xmile.codec.schema.Flow;
import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.Stock;
import com.xmile.codec.schema.Variables;
import com.xmile.equation.Identifier;
import java.util.ArrayList;
import java.util.List;

/** Inflows and outflows of a stock should name flows declared in the same model. */
final class StockFlowLinkRule implements ValidationRule {

    @Override
    public List<ValidationMessage> validate(Model model) {
        Variables variables = model.getVariables();
        List<ValidationMessage> messages = new ArrayList<>();
        for (Stock stock : variables.ofType(Stock.class)) {
            check(stock, "inflow", stock.inflows(), variables, model.getName(), messages);
            check(stock, "outflow", stock.outflows(), variables, model.getName(), messages);
        }
        return messages;
    }

    private static void check(
            Stock stock,
            String role,
            List<Identifier> links,
            Variables variables,
            String modelName,
            List<ValidationMessage> out) {
        for (Identifier link : links) {
            if (!(variables.find(link) instanceof Flow)) {
                out.add(
                        ValidationMessage.warning(
                                "Stock '" + stock.name().getQualifiedName() + "' lists " + role
                                        + " '" + link.getQualifiedName()
                                        + "', which is not a declared flow",
                                modelName));
            }
        }
    }
}
