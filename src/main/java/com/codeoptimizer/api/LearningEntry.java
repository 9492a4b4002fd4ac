package com.codeoptimizer.api;

import java.time.Instant;

/**
 * What happened to one transformation, appended to the learning log after a run.
 */
public class LearningEntry {
    private final String type;
    private final String description;
    private final boolean succeeded;
    private final String reason;
    private final Instant timestamp;

    public LearningEntry(String type, String description, boolean succeeded, String reason, Instant timestamp) {
        this.type = type;
        this.description = description;
        this.succeeded = succeeded;
        this.reason = reason;
        this.timestamp = timestamp;
    }

    public String getType() { return type; }
    public String getDescription() { return description; }
    public boolean isSucceeded() { return succeeded; }
    public String getReason() { return reason; }
    public Instant getTimestamp() { return timestamp; }
}
