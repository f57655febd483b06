package com.xmile.codec.schema;

import java.util.List;
import java.util.Objects;

/** Document {@code <header>}; vendor and product are required, everything else may be null. */
public record Header(
        String vendor,
        Product product,
        HeaderOptions options,
        String name,
        String version,
        String caption,
        String image,
        String author,
        String affiliation,
        String client,
        String copyright,
        Contact contact,
        String created,
        String modified,
        String uuid,
        List<String> includes) {

    public Header {
        Objects.requireNonNull(vendor, "vendor");
        Objects.requireNonNull(product, "product");
        includes = includes == null ? List.of() : List.copyOf(includes);
    }

    public static Header of(String vendor, Product product) {
        return new Header(
                vendor, product, null, null, null, null, null, null, null, null, null, null, null,
                null, null, List.of());
    }
}
