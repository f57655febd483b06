package com.xmile.codec.schema;

import java.util.List;

public record Dimensions(List<Dimension> dimensions) {

    public Dimensions {
        dimensions = List.copyOf(dimensions);
    }
}
