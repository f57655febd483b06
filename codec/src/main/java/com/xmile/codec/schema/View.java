package com.xmile.codec.schema;

import java.util.List;

public record View(
        Integer uid,
        ViewType type,
        Integer order,
        Double width,
        Double height,
        Double zoom,
        Double scrollX,
        Double scrollY,
        String background,
        Double pageWidth,
        Double pageHeight,
        String pageSequence,
        String pageOrientation,
        Boolean showPages,
        Integer homePage,
        Boolean homeView,
        List<ViewObject> objects) {

    public View {
        objects = objects == null ? List.of() : List.copyOf(objects);
    }

    public static View of(List<ViewObject> objects) {
        return new View(
                null, null, null, null, null, null, null, null, null, null, null, null, null, null,
                null, null, objects);
    }
}
