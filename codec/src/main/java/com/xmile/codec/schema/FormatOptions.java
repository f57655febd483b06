package com.xmile.codec.schema;

public record FormatOptions(
        Integer precision, Double scaleBy, DisplayAs displayAs, Boolean delimit000s) {}
