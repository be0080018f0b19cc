package com.team.idletask.model.docs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * How much of the exported API surface carries documentation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ApiCompleteness {

    private double percentage;
    private Details details;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Details {
        private int totalEndpoints;
        private int documentedEndpoints;
        private List<ApiItem> undocumentedItems;
        private List<String> wellDocumentedExamples;
        private List<String> commonIssues;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiItem {
        private String name;
        private String file;
        private String type;
        private Integer line;
    }
}
