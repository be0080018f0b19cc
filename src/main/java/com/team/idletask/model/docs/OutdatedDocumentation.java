package com.team.idletask.model.docs;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A documentation problem found by the scanner: a stale TODO/FIXME, a version
 * reference that no longer matches package metadata, a broken cross-reference,
 * or a poorly documented @deprecated tag.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class OutdatedDocumentation {

    private String file;
    private DocType type;
    private String description;
    private DocSeverity severity;
    private Integer line;
    private String suggestion;

    public enum DocType {
        @JsonProperty("version-mismatch") VERSION_MISMATCH,
        @JsonProperty("deprecated-api") DEPRECATED_API,
        @JsonProperty("broken-link") BROKEN_LINK,
        @JsonEnumDefaultValue
        @JsonProperty("outdated-example") OUTDATED_EXAMPLE,
        @JsonProperty("stale-reference") STALE_REFERENCE
    }

    /**
     * For stale references the scanner assigns the tier by age:
     * HIGH over 90 days, MEDIUM over 60 days, LOW over 30 days.
     */
    public enum DocSeverity {
        @JsonProperty("high") HIGH,
        @JsonProperty("medium") MEDIUM,
        @JsonEnumDefaultValue
        @JsonProperty("low") LOW
    }
}
