package com.xmile.codec.schema;

public record DeviceRange(double min, double max) {}
