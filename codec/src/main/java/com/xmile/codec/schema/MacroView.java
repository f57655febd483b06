package com.xmile.codec.schema;

/** Holder for the optional diagram of a macro. */
public record MacroView(View view) {}
