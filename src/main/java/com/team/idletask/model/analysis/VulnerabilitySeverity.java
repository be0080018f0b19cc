package com.team.idletask.model.analysis;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Security impact of a vulnerability, ordered from most to least severe.
 */
public enum VulnerabilitySeverity {
    @JsonProperty("critical") CRITICAL("critical"),
    @JsonProperty("high") HIGH("high"),
    @JsonProperty("medium") MEDIUM("medium"),
    @JsonEnumDefaultValue
    @JsonProperty("low") LOW("low");

    private final String tag;

    VulnerabilitySeverity(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /** "Critical", "High", ... for titles. */
    public String getLabel() {
        return Character.toUpperCase(tag.charAt(0)) + tag.substring(1);
    }
}
