package com.xmile.codec.schema;

import java.util.Objects;

/** Behavior override for one entity type ({@code stock}, {@code flow}, {@code aux} or {@code gf}). */
public record EntityBehavior(String entityType, NonNegative nonNegative) {

    public EntityBehavior {
        Objects.requireNonNull(entityType, "entityType");
    }
}
