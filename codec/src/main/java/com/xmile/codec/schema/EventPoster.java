package com.xmile.codec.schema;

import java.util.List;

/** Event thresholds attached to a variable. */
public record EventPoster(double min, double max, List<Threshold> thresholds) {

    public EventPoster {
        thresholds = thresholds == null ? List.of() : List.copyOf(thresholds);
    }
}
