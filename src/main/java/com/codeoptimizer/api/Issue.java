package com.codeoptimizer.api;

import java.util.Objects;

import com.codeoptimizer.api.error.Severity;

/**
 * A problem found by the issue detector. Read-only once built.
 */
public class Issue {
    private final String id;
    private final String code;
    private final IssueCategory category;
    private final Severity severity;
    private final String message;
    private final Location location;
    private final String codeSnippet;
    private final String suggestion;

    private Issue(Builder builder) {
        this.code = Objects.requireNonNull(builder.code, "code");
        this.category = Objects.requireNonNull(builder.category, "category");
        this.severity = Objects.requireNonNull(builder.severity, "severity");
        this.message = Objects.requireNonNull(builder.message, "message");
        this.location = Objects.requireNonNull(builder.location, "location");
        this.codeSnippet = builder.codeSnippet;
        this.suggestion = builder.suggestion;
        this.id = builder.id != null ? builder.id : _defaultId(location, code);
    }

    public String getId() { return id; }
    public String getCode() { return code; }
    public IssueCategory getCategory() { return category; }
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public Location getLocation() { return location; }
    public String getCodeSnippet() { return codeSnippet; }
    public String getSuggestion() { return suggestion; }

    /**
     * Copy of this issue with another severity.
     */
    public Issue withSeverity(Severity newSeverity) {
        return toBuilder().severity(newSeverity).build();
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .code(code)
                .category(category)
                .severity(severity)
                .message(message)
                .location(location)
                .codeSnippet(codeSnippet)
                .suggestion(suggestion);
    }

    @Override
    public String toString() {
        return severity.getId() + " " + category.getId() + " " + code + " at " + location + ": " + message;
    }

    private static String _defaultId(Location location, String code) {
        if (location == null) {
            return "<unknown>:" + code;
        }
        String file = location.getFile() != null ? location.getFile().toString() : "<unknown>";
        return file + ":" + location.getLine() + ":" + location.getColumn() + ":" + code;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String code;
        private IssueCategory category;
        private Severity severity;
        private String message;
        private Location location;
        private String codeSnippet;
        private String suggestion;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder category(IssueCategory category) {
            this.category = category;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder location(Location location) {
            this.location = location;
            return this;
        }

        public Builder codeSnippet(String codeSnippet) {
            this.codeSnippet = codeSnippet;
            return this;
        }

        public Builder suggestion(String suggestion) {
            this.suggestion = suggestion;
            return this;
        }

        public Issue build() {
            return new Issue(this);
        }
    }
}
