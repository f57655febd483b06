package com.xmile.equation.ast;

import com.xmile.equation.Identifier;
import java.util.Objects;

/**
 * What a call-shaped expression {@code name(args)} refers to. The parser cannot tell these apart and
 * always produces {@link Kind#FUNCTION}; {@code CallTargetResolver} settles the kind once the
 * declared graphical functions, modules and arrays are known.
 */
public final class CallTarget {

    public enum Kind {
        FUNCTION,
        GRAPHICAL_FUNCTION,
        MODEL,
        /** Array addressed by a flat, row-major index. */
        ARRAY
    }

    private final Kind kind;
    private final Identifier name;

    public CallTarget(Kind kind, Identifier name) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.name = Objects.requireNonNull(name, "name");
    }

    public static CallTarget function(Identifier name) {
        return new CallTarget(Kind.FUNCTION, name);
    }

    public Kind getKind() {
        return kind;
    }

    public Identifier getName() {
        return name;
    }

    public CallTarget withKind(Kind newKind) {
        return newKind == kind ? this : new CallTarget(newKind, name);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof CallTarget other)) {
            return false;
        }
        return kind == other.kind && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return kind + ":" + name;
    }
}
