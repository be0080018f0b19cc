package com.team.idletask.analyzer;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category tag of an analyzer, used by downstream routing.
 */
public enum AnalyzerType {
    MAINTENANCE("maintenance", "maintenance"),
    DOCS("docs", "documentation"),
    REFACTORING("refactoring", "refactoring"),
    TESTS("tests", "testing");

    private final String tag;
    private final String workflow;

    AnalyzerType(String tag, String workflow) {
        this.tag = tag;
        this.workflow = workflow;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    /** Workflow that executes candidates of this category. */
    public String getWorkflow() {
        return workflow;
    }

    public static AnalyzerType fromTag(String tag) {
        if (tag == null) return null;
        String normalized = tag.trim().toLowerCase();
        for (AnalyzerType type : values()) {
            if (type.tag.equals(normalized) || type.name().toLowerCase().equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
