package com.xmile.codec.schema;

public record DataImport(
        String type,
        Boolean enabled,
        String frequency,
        String orientation,
        String resource,
        String worksheet) {}
