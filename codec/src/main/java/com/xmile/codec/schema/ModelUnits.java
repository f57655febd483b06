package com.xmile.codec.schema;

import java.util.List;

public record ModelUnits(List<UnitDefinition> units) {

    public ModelUnits {
        units = List.copyOf(units);
    }
}
