package com.xmile.equation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/** One component of a qualified identifier such as {@code isee.}{@code name}. */
public final class Namespace {

    public static final Namespace STD = new Namespace("std");
    public static final Namespace USER = new Namespace("user");

    private static final Set<String> VENDORS =
            Set.of(
                    "anylogic",
                    "forio",
                    "insightmaker",
                    "isee",
                    "powersim",
                    "simanticssd",
                    "simile",
                    "sysdea",
                    "vensim");

    private final String name;

    private Namespace(String name) {
        this.name = name;
    }

    /** Known namespace names are folded to lower case; anything else is kept verbatim. */
    public static Namespace fromPart(String part) {
        Objects.requireNonNull(part, "part");
        String folded = part.toLowerCase(Locale.ROOT);
        if (folded.equals(STD.name)) {
            return STD;
        }
        if (folded.equals(USER.name)) {
            return USER;
        }
        if (VENDORS.contains(folded)) {
            return new Namespace(folded);
        }
        return new Namespace(part);
    }

    public static List<Namespace> fromPath(String path) {
        List<Namespace> parts = new ArrayList<>();
        for (String part : path.split("\\.", -1)) {
            parts.add(fromPart(part));
        }
        return List.copyOf(parts);
    }

    public static String asPrefix(List<Namespace> path) {
        StringBuilder builder = new StringBuilder();
        for (Namespace namespace : path) {
            if (builder.length() > 0) {
                builder.append('.');
            }
            builder.append(namespace.name);
        }
        return builder.toString();
    }

    public String getName() {
        return name;
    }

    public boolean isVendor() {
        return VENDORS.contains(name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Namespace other)) {
            return false;
        }
        return name.equalsIgnoreCase(other.name);
    }

    @Override
    public int hashCode() {
        return name.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
