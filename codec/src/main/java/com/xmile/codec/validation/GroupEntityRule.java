package com.xmile.codec.validation;

import com.xmile.codec.schema.Group;
import com.xmile.codec.schema.GroupEntity;
import com.xmile.codec.schema.Model;
import java.util.ArrayList;
import java.util.List;

final class GroupEntityRule implements ValidationRule {

    @Override
    public List<ValidationMessage> validate(Model model) {
        List<ValidationMessage> messages = new ArrayList<>();
        for (Group group : model.getVariables().ofType(Group.class)) {
            for (GroupEntity entity : group.entities()) {
                if (model.getVariables().find(entity.name()) == null) {
                    messages.add(
                            ValidationMessage.error(
                                    "Group '" + group.name().getQualifiedName()
                                            + "' references undefined entity '"
                                            + entity.name().getQualifiedName() + "'",
                                    model.getName()));
                }
            }
        }
        return messages;
    }
}
