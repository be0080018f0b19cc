package com.team.idletask.analyzer;

import com.team.idletask.config.DocsRulesConfig.DocsRules;
import com.team.idletask.model.analysis.ProjectAnalysis;
import com.team.idletask.model.candidate.TaskCandidate;
import com.team.idletask.model.candidate.TaskCandidate.Effort;
import com.team.idletask.model.candidate.TaskCandidate.Priority;
import com.team.idletask.model.docs.ApiCompleteness;
import com.team.idletask.model.docs.MissingReadmeSection;
import com.team.idletask.model.docs.MissingReadmeSection.SectionPriority;
import com.team.idletask.model.docs.OutdatedDocumentation;
import com.team.idletask.model.docs.OutdatedDocumentation.DocSeverity;
import com.team.idletask.model.docs.OutdatedDocumentation.DocType;
import com.team.idletask.model.docs.UndocumentedExport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Documentation strategy: coverage, missing files, outdated documentation,
 * undocumented exports, README gaps and API completeness.
 */
@Component
@Order(2)
@Slf4j
@RequiredArgsConstructor
public class DocsAnalyzer extends BaseAnalyzer {

    private static final double CRITICAL_COVERAGE_THRESHOLD = 20.0;
    private static final double TARGET_COVERAGE = 50.0;
    private static final int MISSING_DOCS_THRESHOLD = 5;
    private static final int OTHER_EXPORTS_THRESHOLD = 5;
    private static final int OPTIONAL_SECTIONS_THRESHOLD = 2;

    private static final Set<String> CORE_TYPE_KINDS = Set.of("class", "interface");

    private static final Comparator<OutdatedDocumentation> OUTDATED_DOC_ORDER =
            Comparator.comparing((OutdatedDocumentation d) -> nullToEmpty(d.getFile()))
                    .thenComparing(d -> d.getLine() != null ? d.getLine() : 0)
                    .thenComparing(d -> nullToEmpty(d.getDescription()));

    private static final Comparator<UndocumentedExport> EXPORT_ORDER =
            Comparator.comparing((UndocumentedExport e) -> nullToEmpty(e.getFile()))
                    .thenComparingInt(UndocumentedExport::getLine)
                    .thenComparing(e -> nullToEmpty(e.getName()));

    private final DocsRules docsRules;

    @Override
    public AnalyzerType type() {
        return AnalyzerType.DOCS;
    }

    @Override
    public List<TaskCandidate> analyze(ProjectAnalysis analysis) {
        List<TaskCandidate> candidates = new ArrayList<>();
        ProjectAnalysis.Documentation documentation = analysis != null ? analysis.getDocumentation() : null;
        if (documentation == null) {
            return candidates;
        }

        addCoverageCandidates(documentation.getCoverage(), candidates);
        addMissingDocsCandidates(orEmpty(documentation.getMissingDocs()), candidates);

        List<OutdatedDocumentation> outdatedDocs = orEmpty(documentation.getOutdatedDocs()).stream()
                .sorted(OUTDATED_DOC_ORDER)
                .collect(Collectors.toList());
        for (OutdatedDocGroup group : OutdatedDocGroup.values()) {
            addOutdatedDocCandidate(group, outdatedDocs, candidates);
        }

        addUndocumentedExportCandidates(orEmpty(documentation.getUndocumentedExports()), candidates);
        addReadmeCandidates(orEmpty(documentation.getMissingReadmeSections()), candidates);
        addApiCompletenessCandidates(documentation.getApiCompleteness(), candidates);

        log.debug("Docs analysis produced {} candidates", candidates.size());
        return candidates;
    }

    // ========== Coverage and missing files ==========

    private void addCoverageCandidates(double coverage, List<TaskCandidate> candidates) {
        if (coverage < CRITICAL_COVERAGE_THRESHOLD) {
            candidates.add(createCandidate(
                    "docs-critical-docs",
                    "Add Critical Documentation",
                    String.format("Documentation coverage is only %.1f%%. Add documentation for the most important modules first.", coverage),
                    Priority.HIGH,
                    Effort.HIGH,
                    "Very low documentation coverage makes the codebase hard to understand and onboard onto",
                    0.9));
        } else if (coverage < TARGET_COVERAGE) {
            candidates.add(createCandidate(
                    "docs-improve-docs-coverage",
                    "Improve Documentation Coverage",
                    String.format("Improve documentation coverage from %.1f%% to at least 50%%", coverage),
                    Priority.LOW,
                    Effort.MEDIUM,
                    "Better documentation coverage improves maintainability",
                    0.4));
        }
    }

    private void addMissingDocsCandidates(List<String> missingDocs, List<TaskCandidate> candidates) {
        List<String> sortedFiles = missingDocs.stream().sorted().collect(Collectors.toList());

        List<String> coreFiles = sortedFiles.stream()
                .filter(this::isCoreModule)
                .collect(Collectors.toList());

        if (!coreFiles.isEmpty()) {
            int count = coreFiles.size();
            candidates.add(createCandidate(
                    "docs-core-module-docs",
                    "Document Core Modules",
                    String.format("Add documentation to %d core %s: %s", count,
                            plural(count, "module", "modules"), sample(coreFiles, 3)),
                    Priority.NORMAL,
                    Effort.MEDIUM,
                    "Core modules are entry points that other developers read first",
                    0.7));
        }

        if (sortedFiles.size() > MISSING_DOCS_THRESHOLD) {
            int count = sortedFiles.size();
            candidates.add(createCandidate(
                    "docs-missing-docs",
                    "Add Missing Documentation",
                    String.format("Add documentation to %d undocumented files: %s", count, sample(sortedFiles, 5)),
                    Priority.LOW,
                    count > 10 ? Effort.HIGH : Effort.MEDIUM,
                    "Undocumented files slow down maintenance and code review",
                    0.5));
        }
    }

    private boolean isCoreModule(String path) {
        String normalized = path.replace('\\', '/').toLowerCase(Locale.ROOT);
        return docsRules.getCoreModuleKeywords().stream().anyMatch(normalized::contains);
    }

    // ========== Outdated documentation ==========

    /**
     * Only the highest non-empty severity tier of a group yields a candidate.
     */
    private void addOutdatedDocCandidate(OutdatedDocGroup group, List<OutdatedDocumentation> outdatedDocs,
                                         List<TaskCandidate> candidates) {
        List<OutdatedDocumentation> ofType = outdatedDocs.stream()
                .filter(d -> d.getType() == group.docType)
                .collect(Collectors.toList());
        if (ofType.isEmpty()) {
            return;
        }

        for (DocSeverity severity : DocSeverity.values()) {
            List<OutdatedDocumentation> tier = ofType.stream()
                    .filter(d -> severityOf(d) == severity)
                    .collect(Collectors.toList());
            if (!tier.isEmpty()) {
                candidates.add(createOutdatedDocTask(group, severity, tier));
                return;
            }
        }
    }

    private TaskCandidate createOutdatedDocTask(OutdatedDocGroup group, DocSeverity severity,
                                                List<OutdatedDocumentation> entries) {
        int count = entries.size();
        int tier = severity.ordinal();
        List<String> locations = entries.stream()
                .map(d -> d.getLine() != null ? nullToEmpty(d.getFile()) + ":" + d.getLine() : nullToEmpty(d.getFile()))
                .distinct()
                .collect(Collectors.toList());

        String suffix = switch (severity) {
            case HIGH -> "-critical";
            case MEDIUM -> "-medium";
            case LOW -> "";
        };
        Priority priority = switch (severity) {
            case HIGH -> Priority.HIGH;
            case MEDIUM -> Priority.NORMAL;
            case LOW -> Priority.LOW;
        };
        double score = switch (severity) {
            case HIGH -> 0.8;
            case MEDIUM -> 0.6;
            case LOW -> 0.4;
        };
        Effort effort = severity == DocSeverity.HIGH ? Effort.MEDIUM : Effort.LOW;

        String noun = count == 1 ? group.singular[tier] : group.plural[tier];
        return createCandidate(
                group.idBase + suffix,
                group.titles[tier],
                String.format(group.descriptions[tier], count, noun) + ": " + sample(locations, 5),
                priority,
                effort,
                group.rationales[tier],
                score);
    }

    private static DocSeverity severityOf(OutdatedDocumentation doc) {
        return doc.getSeverity() != null ? doc.getSeverity() : DocSeverity.LOW;
    }

    /**
     * Outdated documentation kinds that produce candidates. Text arrays are
     * indexed by {@link DocSeverity} ordinal (high, medium, low).
     */
    private enum OutdatedDocGroup {
        STALE_REFERENCES(DocType.STALE_REFERENCE, "docs-resolve-stale-comments",
                new String[]{"Resolve Critical Stale Comments", "Resolve Stale Comments", "Review Stale Comments"},
                new String[]{"Resolve %d %s older than 90 days", "Resolve %d %s older than 60 days", "Review %d %s older than 30 days"},
                new String[]{"critical stale comment", "stale comment", "stale comment"},
                new String[]{"critical stale comments", "stale comments", "stale comments"},
                new String[]{
                        "TODO and FIXME comments left for months usually point at forgotten bugs",
                        "Stale comments should be resolved or turned into tracked work",
                        "Regular review of stale comments keeps them from piling up"}),

        VERSION_MISMATCHES(DocType.VERSION_MISMATCH, "docs-fix-version-mismatches",
                new String[]{"Fix Critical Version Mismatches", "Fix Version Mismatches", "Review Version References"},
                new String[]{"Fix %d %s in documentation", "Fix %d %s in documentation", "Review %d %s in documentation"},
                new String[]{"critical version mismatch", "version mismatch", "version reference"},
                new String[]{"critical version mismatches", "version mismatches", "version references"},
                new String[]{
                        "Version mismatches cause confusion and lead users to install the wrong release",
                        "Version mismatches should be resolved to keep documentation trustworthy",
                        "Regular review of version references prevents documentation drift"}),

        BROKEN_LINKS(DocType.BROKEN_LINK, "docs-fix-broken-links",
                new String[]{"Fix Critical Broken Links", "Fix Broken Documentation Links", "Review Documentation Links"},
                new String[]{"Fix %d %s in documentation", "Fix %d %s in documentation", "Review %d %s"},
                new String[]{"critical broken link", "broken link", "documentation link"},
                new String[]{"critical broken links", "broken links", "documentation links"},
                new String[]{
                        "Broken @see tags and cross-references leave readers at dead ends",
                        "Broken links reduce documentation usability",
                        "Regular review of documentation links keeps references valid"}),

        DEPRECATED_APIS(DocType.DEPRECATED_API, "docs-fix-deprecated-api-docs",
                new String[]{"Document Critical Deprecated APIs", "Improve Deprecated API Documentation", "Review Deprecated API Tags"},
                new String[]{"Document %d %s without migration guidance", "Improve %d %s", "Review %d %s"},
                new String[]{"critical @deprecated tag", "@deprecated tag", "@deprecated tag"},
                new String[]{"critical @deprecated tags", "@deprecated tags", "@deprecated tags"},
                new String[]{
                        "Deprecated APIs without guidance make migration difficult for consumers",
                        "Deprecated APIs need clear alternatives and migration paths",
                        "Regular review ensures deprecated APIs give adequate guidance"});

        private final DocType docType;
        private final String idBase;
        private final String[] titles;
        private final String[] descriptions;
        private final String[] singular;
        private final String[] plural;
        private final String[] rationales;

        OutdatedDocGroup(DocType docType, String idBase, String[] titles, String[] descriptions,
                         String[] singular, String[] plural, String[] rationales) {
            this.docType = docType;
            this.idBase = idBase;
            this.titles = titles;
            this.descriptions = descriptions;
            this.singular = singular;
            this.plural = plural;
            this.rationales = rationales;
        }
    }

    // ========== Undocumented exports ==========

    private void addUndocumentedExportCandidates(List<UndocumentedExport> exports, List<TaskCandidate> candidates) {
        if (exports.isEmpty()) {
            return;
        }
        List<UndocumentedExport> sorted = exports.stream().sorted(EXPORT_ORDER).collect(Collectors.toList());

        List<UndocumentedExport> publicExports = sorted.stream()
                .filter(UndocumentedExport::isPublicExport)
                .collect(Collectors.toList());
        List<UndocumentedExport> coreTypes = sorted.stream()
                .filter(e -> !e.isPublicExport() && isCoreType(e))
                .collect(Collectors.toList());
        List<UndocumentedExport> others = sorted.stream()
                .filter(e -> !e.isPublicExport() && !isCoreType(e))
                .collect(Collectors.toList());

        if (!publicExports.isEmpty()) {
            int count = publicExports.size();
            candidates.add(createCandidate(
                    "docs-undocumented-public-exports",
                    "Document Public API Exports",
                    String.format("Add documentation to %d public API %s: %s", count,
                            plural(count, "export", "exports"), describeExports(publicExports)),
                    Priority.HIGH,
                    exportEffort(count),
                    "Public APIs are user-facing and need documentation for consumers",
                    0.85));
        } else if (!coreTypes.isEmpty()) {
            int count = coreTypes.size();
            candidates.add(createCandidate(
                    "docs-undocumented-critical-types",
                    "Document Core Type Exports",
                    String.format("Add documentation to %d core type %s: %s", count,
                            plural(count, "export", "exports"), describeExports(coreTypes)),
                    Priority.NORMAL,
                    exportEffort(count),
                    "Classes and interfaces define contracts that other code depends on",
                    0.65));
        } else if (others.size() > OTHER_EXPORTS_THRESHOLD) {
            int count = others.size();
            candidates.add(createCandidate(
                    "docs-undocumented-exports",
                    "Add JSDoc to Undocumented Exports",
                    String.format("Add documentation to %d undocumented exports: %s", count, describeExports(others)),
                    Priority.LOW,
                    exportEffort(count),
                    "Documented exports make internal code easier to reuse",
                    0.45));
        }
    }

    private static boolean isCoreType(UndocumentedExport export) {
        return export.getType() != null && CORE_TYPE_KINDS.contains(export.getType().toLowerCase(Locale.ROOT));
    }

    private static String describeExports(List<UndocumentedExport> exports) {
        List<String> described = exports.stream()
                .map(e -> nullToEmpty(e.getName()) + " (" + nullToEmpty(e.getType()) + ")")
                .collect(Collectors.toList());
        return sample(described, 5);
    }

    private static Effort exportEffort(int count) {
        if (count <= 5) return Effort.LOW;
        if (count <= 15) return Effort.MEDIUM;
        return Effort.HIGH;
    }

    // ========== README sections ==========

    private void addReadmeCandidates(List<MissingReadmeSection> sections, List<TaskCandidate> candidates) {
        if (sections.isEmpty()) {
            return;
        }

        List<String> required = sectionNames(sections, SectionPriority.REQUIRED);
        List<String> recommended = sectionNames(sections, SectionPriority.RECOMMENDED);
        List<String> optional = sectionNames(sections, SectionPriority.OPTIONAL);

        if (!required.isEmpty()) {
            candidates.add(createReadmeTask("docs-readme-required-sections", "Add Required README Sections",
                    "required", required, Priority.HIGH,
                    "Required README sections are essential for anyone installing or using the project", 0.8));
        } else if (!recommended.isEmpty()) {
            candidates.add(createReadmeTask("docs-readme-recommended-sections", "Add Recommended README Sections",
                    "recommended", recommended, Priority.NORMAL,
                    "Recommended README sections help contributors and users get started", 0.55));
        } else if (optional.size() > OPTIONAL_SECTIONS_THRESHOLD) {
            candidates.add(createReadmeTask("docs-readme-optional-sections", "Enhance README with Additional Sections",
                    "optional", optional, Priority.LOW,
                    "Optional README sections round out project documentation", 0.35));
        }
    }

    private TaskCandidate createReadmeTask(String id, String title, String tier, List<String> sections,
                                           Priority priority, String rationale, double score) {
        int count = sections.size();
        return createCandidate(
                id,
                title,
                String.format("Add %d %s README %s: %s", count, tier,
                        plural(count, "section", "sections"), String.join(", ", sections)),
                priority,
                readmeEffort(count),
                rationale,
                score);
    }

    private static List<String> sectionNames(List<MissingReadmeSection> sections, SectionPriority priority) {
        return sections.stream()
                .filter(s -> (s.getPriority() != null ? s.getPriority() : SectionPriority.OPTIONAL) == priority)
                .map(s -> nullToEmpty(s.getSection()))
                .sorted()
                .collect(Collectors.toList());
    }

    private static Effort readmeEffort(int count) {
        if (count <= 2) return Effort.LOW;
        if (count <= 4) return Effort.MEDIUM;
        return Effort.HIGH;
    }

    // ========== API completeness ==========

    private void addApiCompletenessCandidates(ApiCompleteness apiCompleteness, List<TaskCandidate> candidates) {
        if (apiCompleteness == null) {
            return;
        }
        ApiCompleteness.Details details = apiCompleteness.getDetails() != null
                ? apiCompleteness.getDetails()
                : new ApiCompleteness.Details();

        int undocumented = orEmpty(details.getUndocumentedItems()).size();
        List<String> issues = orEmpty(details.getCommonIssues());

        // A project with no API surface has nothing to document
        if (details.getTotalEndpoints() == 0 && undocumented == 0) {
            return;
        }

        double percentage = apiCompleteness.getPercentage();
        Effort effort = apiEffort(undocumented);

        if (percentage < 30) {
            candidates.add(createCandidate(
                    "docs-api-docs-critical",
                    "Document Critical API Surface",
                    String.format("API documentation coverage is %.1f%%. Document %d API %s.",
                            percentage, undocumented, plural(undocumented, "item", "items")),
                    Priority.HIGH,
                    effort,
                    "Low API coverage indicates major gaps in the public contract",
                    0.75));
        } else if (percentage < 60) {
            candidates.add(createCandidate(
                    "docs-api-docs-improvement",
                    "Improve API Documentation Coverage",
                    String.format("Raise API documentation coverage from %.1f%% by documenting %d API %s.",
                            percentage, undocumented, plural(undocumented, "item", "items")),
                    Priority.NORMAL,
                    effort,
                    "Partial API documentation forces consumers to read the source",
                    0.55));
        } else if (percentage < 80 && undocumented > 0) {
            candidates.add(createCandidate(
                    "docs-api-docs-completion",
                    "Complete API Documentation",
                    String.format("API documentation coverage is %.1f%%. Document the remaining %d API %s.",
                            percentage, undocumented, plural(undocumented, "item", "items")),
                    Priority.LOW,
                    effort,
                    "Closing the last gaps makes the API reference complete",
                    0.4));
        } else if (!issues.isEmpty()) {
            int count = issues.size();
            candidates.add(createCandidate(
                    "docs-api-docs-quality",
                    "Address API Documentation Quality Issues",
                    String.format("Fix %d common API documentation %s: %s", count,
                            plural(count, "issue", "issues"), String.join(", ", issues)),
                    Priority.LOW,
                    effort,
                    "Consistent API documentation quality improves the developer experience",
                    0.3));
        }
    }

    private static Effort apiEffort(int undocumentedItems) {
        if (undocumentedItems <= 10) return Effort.LOW;
        if (undocumentedItems <= 25) return Effort.MEDIUM;
        return Effort.HIGH;
    }
}
