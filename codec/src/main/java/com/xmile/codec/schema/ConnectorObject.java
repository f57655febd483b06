package com.xmile.codec.schema;

public record ConnectorObject(
        Integer uid, Double x, Double y, Double angle, Pointer from, Pointer to)
        implements ViewObject {}
