package com.xmile.codec.schema;

import java.util.Objects;

/** What a data export writes: every variable, or the contents of one table. */
public sealed interface ExportTarget {

    record All() implements ExportTarget {}

    record Table(String uid, Boolean useSettings) implements ExportTarget {

        public Table {
            Objects.requireNonNull(uid, "uid");
        }
    }
}
