package com.xmile.codec.schema;

import com.xmile.equation.Identifier;

public record GroupObject(
        Integer uid, Identifier name, Double x, Double y, Double width, Double height)
        implements ViewObject {}
