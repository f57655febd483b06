package com.xmile.codec.schema;

public record Point(double x, double y) {}
