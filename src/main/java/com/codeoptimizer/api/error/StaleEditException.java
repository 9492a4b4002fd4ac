package com.codeoptimizer.api.error;

/**
 * The text at a transformation's range no longer matches the text it was generated from.
 */
public class StaleEditException extends OptimizerException {
    private final String transformationId;

    public StaleEditException(String transformationId, String expected, String actual) {
        super("Stale transformation " + transformationId + ": expected '" + _abbreviate(expected) +
                "' but found '" + _abbreviate(actual) + "'");
        this.transformationId = transformationId;
    }

    public String getTransformationId() {
        return transformationId;
    }

    private static String _abbreviate(String text) {
        if (text == null) {
            return "<out of range>";
        }
        String singleLine = text.replace("\n", "\\n");
        return singleLine.length() > 40 ? singleLine.substring(0, 37) + "..." : singleLine;
    }
}
