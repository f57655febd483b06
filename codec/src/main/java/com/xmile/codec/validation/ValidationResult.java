package com.xmile.codec.validation;

import java.util.ArrayList;
import java.util.List;

/** Outcome of validating a model or document. */
public sealed interface ValidationResult {

    List<ValidationMessage> warnings();

    List<ValidationMessage> errors();

    default boolean isValid() {
        return !(this instanceof Invalid);
    }

    /** Classifies messages: any error makes the result invalid, warnings alone do not. */
    static ValidationResult of(List<ValidationMessage> messages) {
        List<ValidationMessage> warnings = new ArrayList<>();
        List<ValidationMessage> errors = new ArrayList<>();
        for (ValidationMessage message : messages) {
            if (message.isError()) {
                errors.add(message);
            } else {
                warnings.add(message);
            }
        }
        if (!errors.isEmpty()) {
            return new Invalid(warnings, errors);
        }
        if (!warnings.isEmpty()) {
            return new Warnings(warnings);
        }
        return new Valid();
    }

    record Valid() implements ValidationResult {
        @Override
        public List<ValidationMessage> warnings() {
            return List.of();
        }

        @Override
        public List<ValidationMessage> errors() {
            return List.of();
        }
    }

    record Warnings(List<ValidationMessage> warnings) implements ValidationResult {
        public Warnings {
            warnings = List.copyOf(warnings);
        }

        @Override
        public List<ValidationMessage> errors() {
            return List.of();
        }
    }

    record Invalid(List<ValidationMessage> warnings, List<ValidationMessage> errors)
            implements ValidationResult {
        public Invalid {
            warnings = List.copyOf(warnings);
            errors = List.copyOf(errors);
        }
    }
}
