package com.xmile.codec.schema;

import java.util.Locale;

/** Value of the {@code access} attribute that exposes a variable as a module port. */
public enum Access {
    INPUT,
    OUTPUT;

    public String xmlName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Access fromXml(String text) {
        for (Access access : values()) {
            if (access.xmlName().equals(text)) {
                return access;
            }
        }
        throw new IllegalArgumentException("Invalid access value: " + text);
    }
}
