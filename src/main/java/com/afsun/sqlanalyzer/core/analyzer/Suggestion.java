package com.afsun.sqlanalyzer.core.analyzer;

import lombok.Data;

@Data
public class Suggestion {
    private final SuggestionType type;
    private final String description;
    private final Severity severity;

    public static Suggestion of(SuggestionType type, Severity severity, String description) {
        return new Suggestion(type, description, severity);
    }
}
