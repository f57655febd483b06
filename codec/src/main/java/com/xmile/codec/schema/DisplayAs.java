package com.xmile.codec.schema;

import java.util.Locale;

public enum DisplayAs {
    NUMBER,
    CURRENCY,
    PERCENT;

    public String xmlName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DisplayAs fromXml(String text) {
        for (DisplayAs value : values()) {
            if (value.xmlName().equals(text)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Invalid display_as value: " + text);
    }
}
