package com.xmile.codec.schema;

import java.util.Locale;

/** How a graphical function treats inputs between and beyond its points. */
public enum GraphicalFunctionType {
    CONTINUOUS,
    EXTRAPOLATE,
    DISCRETE;

    public String xmlName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static GraphicalFunctionType fromXml(String text) {
        for (GraphicalFunctionType type : values()) {
            if (type.xmlName().equals(text)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid graphical function type: " + text);
    }
}
