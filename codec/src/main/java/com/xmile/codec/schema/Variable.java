package com.xmile.codec.schema;

import com.xmile.equation.Identifier;

/** An entry of a model's {@code <variables>} block. */
public sealed interface Variable
        permits Stock, Flow, Auxiliary, GraphicalFunction, Module, Group {

    /** Name of the variable; null only for a graphical function embedded in another variable. */
    Identifier name();

    Documentation documentation();

    /** Element name used in the document. */
    String elementName();
}
