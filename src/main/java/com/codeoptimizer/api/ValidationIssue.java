package com.codeoptimizer.api;

/**
 * One finding of a validation stage.
 */
public class ValidationIssue {

    public enum Type {
        SYNTAX,
        RUNTIME,
        TEST,
        BEHAVIOR
    }

    public enum Level {
        CRITICAL,
        WARNING,
        INFO
    }

    private final Type type;
    private final Level level;
    private final String message;
    private final int line;

    public ValidationIssue(Type type, Level level, String message) {
        this(type, level, message, 0);
    }

    public ValidationIssue(Type type, Level level, String message, int line) {
        this.type = type;
        this.level = level;
        this.message = message;
        this.line = line;
    }

    public Type getType() { return type; }
    public Level getLevel() { return level; }
    public String getMessage() { return message; }
    public int getLine() { return line; }

    public boolean isCritical() {
        return level == Level.CRITICAL;
    }

    @Override
    public String toString() {
        return type + "/" + level + ": " + message + (line > 0 ? " (line " + line + ")" : "");
    }
}
