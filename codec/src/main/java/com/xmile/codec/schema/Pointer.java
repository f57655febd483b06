package com.xmile.codec.schema;

import com.xmile.equation.Identifier;
import java.util.Objects;

/** End of a connector: a variable by name, or an alias by uid. */
public sealed interface Pointer {

    record Named(Identifier name) implements Pointer {

        public Named {
            Objects.requireNonNull(name, "name");
        }
    }

    record Alias(int uid) implements Pointer {}
}
