package io.github.rowbase.service;

/**
 * A message attached to an {@link ApiResult}.
 */
public class ApiMessage {

    public enum Level {
        ERROR,
        WARNING,
        INFO,
        DEBUG
    }

    private final Level level;
    private final String operation;
    private final String text;

    public ApiMessage(Level level, String operation, String text) {
        this.level = level;
        this.operation = operation;
        this.text = text;
    }

    public Level getLevel() {
        return level;
    }

    public String getOperation() {
        return operation;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return level + " (" + operation + "): " + text;
    }
}
