package com.xmile.codec.schema;

import java.util.Objects;

public record Product(String name, String version, String lang) {

    public Product {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
    }
}
