package com.xmile.codec;

import java.util.ArrayList;
import java.util.List;

/** Gathers independent failures so they can be reported together. Not thread-safe. */
public final class ErrorCollection {

    private final List<XmileException> errors = new ArrayList<>();

    public void push(XmileException error) {
        errors.add(error);
    }

    public int size() {
        return errors.size();
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    public List<XmileException> getErrors() {
        return List.copyOf(errors);
    }

    /**
     * Converts the collection into one exception: null when empty, the single error itself, or a
     * {@link XmileException.Kind#MULTIPLE} wrapping all of them.
     */
    public XmileException toException() {
        if (errors.isEmpty()) {
            return null;
        }
        if (errors.size() == 1) {
            return errors.get(0);
        }
        return XmileException.multiple(errors);
    }

    /** Throws the collected errors, if any. */
    public void throwIfAny() throws XmileException {
        XmileException error = toException();
        if (error != null) {
            throw error;
        }
    }
}
