package com.xmile.codec.schema;

import java.util.List;

public record Behavior(NonNegative nonNegative, List<EntityBehavior> entities) {

    public Behavior {
        entities = entities == null ? List.of() : List.copyOf(entities);
    }

    public static Behavior empty() {
        return new Behavior(null, List.of());
    }

    /** The flag that applies to the given entity type, falling back to the global one. */
    public NonNegative nonNegativeFor(String entityType) {
        for (EntityBehavior entity : entities) {
            if (entity.entityType().equals(entityType) && entity.nonNegative() != null) {
                return entity.nonNegative();
            }
        }
        return nonNegative;
    }
}
