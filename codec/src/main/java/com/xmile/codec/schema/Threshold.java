package com.xmile.codec.schema;

import java.util.List;

public record Threshold(
        double value, String direction, String repeat, Double interval, List<PosterEvent> events) {

    public Threshold {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
