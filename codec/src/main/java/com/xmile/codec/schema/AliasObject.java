package com.xmile.codec.schema;

import com.xmile.equation.Identifier;

/** Shadow copy of another variable's symbol; {@code of} names the original. */
public record AliasObject(Integer uid, Double x, Double y, Identifier of) implements ViewObject {}
