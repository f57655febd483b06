package com.xmile.codec.schema;

public record PosterEvent(String simAction, String text) {}
