package com.team.idletask.model.analysis;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Semantic-version distance between the installed and the latest release.
 */
public enum UpdateType {
    @JsonProperty("major") MAJOR("major"),
    @JsonProperty("minor") MINOR("minor"),
    @JsonEnumDefaultValue
    @JsonProperty("patch") PATCH("patch");

    private final String tag;

    UpdateType(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
