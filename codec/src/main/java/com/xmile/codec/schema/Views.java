package com.xmile.codec.schema;

import java.util.List;

public record Views(Integer visibleView, List<View> views) {

    public Views {
        views = views == null ? List.of() : List.copyOf(views);
    }
}
