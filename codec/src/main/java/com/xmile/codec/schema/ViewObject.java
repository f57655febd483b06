package com.xmile.codec.schema;

/** A diagram object placed on a view. */
public sealed interface ViewObject
        permits VariableObject, AliasObject, ConnectorObject, GroupObject {

    Integer uid();
}
