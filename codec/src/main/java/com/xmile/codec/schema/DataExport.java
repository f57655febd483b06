package com.xmile.codec.schema;

public record DataExport(
        String type,
        Boolean enabled,
        String frequency,
        String orientation,
        String resource,
        String worksheet,
        String interval,
        ExportTarget target) {}
