package com.xmile.codec.validation;

import com.xmile.codec.schema.Model;
import com.xmile.codec.schema.View;
import com.xmile.codec.schema.ViewObject;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Object UIDs must be unique within each view. Views are named by UID, else by position. */
final class ViewUidUniquenessRule implements ValidationRule {

    @Override
    public List<ValidationMessage> validate(Model model) {
        List<ValidationMessage> messages = new ArrayList<>();
        if (model.getViews() == null) {
            return messages;
        }
        List<View> views = model.getViews().views();
        for (int i = 0; i < views.size(); i++) {
            View view = views.get(i);
            Map<Integer, Integer> counts = new LinkedHashMap<>();
            for (ViewObject object : view.objects()) {
                if (object.uid() != null) {
                    counts.merge(object.uid(), 1, Integer::sum);
                }
            }
            String label = view.uid() != null ? view.uid().toString() : Integer.toString(i);
            for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
                if (entry.getValue() > 1) {
                    messages.add(
                            ValidationMessage.error(
                                    "UID " + entry.getKey() + " appears " + entry.getValue()
                                            + " times in view " + label,
                                    model.getName()));
                }
            }
        }
        return messages;
    }
}
