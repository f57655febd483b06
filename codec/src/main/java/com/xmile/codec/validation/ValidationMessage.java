package com.xmile.codec.validation;

import java.util.Objects;

/** A diagnostic produced by a {@link ValidationRule} for one model. */
public final class ValidationMessage {

    public enum Level {
        WARNING,
        ERROR
    }

    private final Level level;
    private final String message;
    private final String modelName;

    /**
     * @param modelName Name of the model the message is about; null for the root model.
     */
    public ValidationMessage(Level level, String message, String modelName) {
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
        this.modelName = modelName;
    }

    public static ValidationMessage error(String message, String modelName) {
        return new ValidationMessage(Level.ERROR, message, modelName);
    }

    public static ValidationMessage warning(String message, String modelName) {
        return new ValidationMessage(Level.WARNING, message, modelName);
    }

    public Level getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    public String getModelName() {
        return modelName;
    }

    public boolean isError() {
        return level == Level.ERROR;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ValidationMessage other)) {
            return false;
        }
        return level == other.level
                && message.equals(other.message)
                && Objects.equals(modelName, other.modelName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, message, modelName);
    }

    @Override
    public String toString() {
        String scope = modelName == null ? "" : "[" + modelName + "] ";
        return level + ": " + scope + message;
    }
}
