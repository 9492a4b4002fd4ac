package com.codeoptimizer.api.error;

/**
 * Wraps a failure raised inside a detector or strategy plugin.
 */
public class PluginException extends RuntimeException {
    private final String pluginName;

    public PluginException(String pluginName, Throwable cause) {
        super("Plugin '" + pluginName + "' failed: " + cause.getMessage(), cause);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
