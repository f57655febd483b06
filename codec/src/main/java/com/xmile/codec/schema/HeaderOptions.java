package com.xmile.codec.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Header {@code <options>}: the optional namespace attribute plus the feature declarations
 * ({@code uses_arrays}, {@code uses_conveyor}, ...) keyed by element name, each with its attributes,
 * in document order.
 */
public record HeaderOptions(String namespace, Map<String, Map<String, String>> features) {

    public HeaderOptions {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (features != null) {
            for (Map.Entry<String, Map<String, String>> entry : features.entrySet()) {
                Map<String, String> attributes = new LinkedHashMap<>(entry.getValue());
                copy.put(entry.getKey(), Collections.unmodifiableMap(attributes));
            }
        }
        features = Collections.unmodifiableMap(copy);
    }

    public boolean uses(String feature) {
        return features.containsKey(feature);
    }
}
