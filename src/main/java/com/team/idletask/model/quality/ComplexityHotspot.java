package com.team.idletask.model.quality;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-file complexity metrics. Older scanners report a hotspot as a bare file
 * path; those are read with medium default metrics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ComplexityHotspot {

    static final int LEGACY_CYCLOMATIC = 15;
    static final int LEGACY_COGNITIVE = 20;
    static final int LEGACY_LINE_COUNT = 300;

    private String file;
    private int cyclomaticComplexity;
    private int cognitiveComplexity;
    private int lineCount;

    public static ComplexityHotspot legacy(String file) {
        return ComplexityHotspot.builder()
                .file(file)
                .cyclomaticComplexity(LEGACY_CYCLOMATIC)
                .cognitiveComplexity(LEGACY_COGNITIVE)
                .lineCount(LEGACY_LINE_COUNT)
                .build();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ComplexityHotspot fromJson(JsonNode node) {
        if (node.isTextual()) {
            return legacy(node.asText());
        }
        return ComplexityHotspot.builder()
                .file(node.hasNonNull("file") ? node.get("file").asText() : null)
                .cyclomaticComplexity(node.path("cyclomaticComplexity").asInt())
                .cognitiveComplexity(node.path("cognitiveComplexity").asInt())
                .lineCount(node.path("lineCount").asInt())
                .build();
    }
}
