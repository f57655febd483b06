package com.xmile.codec.schema;

import java.util.Locale;

public enum ViewType {
    STOCK_FLOW,
    INTERFACE,
    POPUP;

    public String xmlName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ViewType fromXml(String text) {
        for (ViewType type : values()) {
            if (type.xmlName().equals(text)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Invalid view type: " + text);
    }
}
