package com.xmile.codec.schema;

/**
 * Recorded shape of a {@code <non_negative>} flag. A {@code null} reference means the element was
 * absent and the value is inherited from the enclosing behavior block.
 */
public enum NonNegative {
    /** Self-closing or blank element; true by presence alone. */
    IMPLICIT,
    TRUE,
    FALSE;

    public boolean isEnabled() {
        return this != FALSE;
    }

    /** Resolves an optional flag against the value inherited from the enclosing scope. */
    public static boolean effective(NonNegative flag, boolean inherited) {
        return flag == null ? inherited : flag.isEnabled();
    }
}
