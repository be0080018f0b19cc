package com.team.idletask.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.team.idletask.model.docs.ApiCompleteness;
import com.team.idletask.model.docs.MissingReadmeSection;
import com.team.idletask.model.docs.OutdatedDocumentation;
import com.team.idletask.model.docs.UndocumentedExport;
import com.team.idletask.model.quality.CodeSmell;
import com.team.idletask.model.quality.ComplexityHotspot;
import com.team.idletask.model.quality.DuplicatePattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time snapshot of a project, produced by the external scanner.
 *
 * Every list except the top-level sections may be null. Analyzers treat a
 * missing list as "nothing to report", never as an error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProjectAnalysis {

    private CodebaseSize codebaseSize;
    private TestCoverage testCoverage;
    private Dependencies dependencies;
    private CodeQuality codeQuality;
    private Documentation documentation;
    private Performance performance;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CodebaseSize {
        private int files;
        private int lines;
        private Map<String, Integer> languages;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TestCoverage {
        private double percentage;
        private List<String> uncoveredFiles;
    }

    /**
     * Dependency health in two shapes: the legacy free-form token lists and the
     * structured lists that replaced them. Both are kept so that older scanners
     * still produce usable snapshots.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Dependencies {
        private List<String> outdated;                       // legacy "name@version" tokens
        private List<String> security;                       // legacy free-form descriptions
        private List<OutdatedDependency> outdatedPackages;
        private List<SecurityVulnerability> securityIssues;
        private List<DeprecatedPackage> deprecatedPackages;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CodeQuality {
        private int lintIssues;
        private List<DuplicatePattern> duplicatedCode;
        private List<ComplexityHotspot> complexityHotspots;
        private List<CodeSmell> codeSmells;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Documentation {
        private double coverage;                             // percent, 0 - 100
        private List<String> missingDocs;
        private List<OutdatedDocumentation> outdatedDocs;
        private List<UndocumentedExport> undocumentedExports;
        private List<MissingReadmeSection> missingReadmeSections;
        private ApiCompleteness apiCompleteness;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Performance {
        private Long bundleSize;
        private List<String> slowTests;
        private List<String> bottlenecks;
    }
}
