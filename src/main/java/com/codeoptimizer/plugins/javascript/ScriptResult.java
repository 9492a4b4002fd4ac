package com.codeoptimizer.plugins.javascript;

/**
 * Outcome of one sandboxed script execution: the completion value, or the message of the
 * exception the script threw.
 */
public class ScriptResult {
    private final boolean succeeded;
    private final String value;
    private final String error;

    private ScriptResult(boolean succeeded, String value, String error) {
        this.succeeded = succeeded;
        this.value = value;
        this.error = error;
    }

    public static ScriptResult success(String value) {
        return new ScriptResult(true, value, null);
    }

    public static ScriptResult failure(String error) {
        return new ScriptResult(false, null, error);
    }

    public boolean isSucceeded() { return succeeded; }
    public String getValue() { return value; }
    public String getError() { return error; }

    @Override
    public String toString() {
        return succeeded ? "ok: " + value : "error: " + error;
    }
}
