package com.xmile.codec.schema;

public record GraphicalFunctionScale(double min, double max) {}
