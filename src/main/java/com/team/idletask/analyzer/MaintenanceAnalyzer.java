package com.team.idletask.analyzer;

import com.team.idletask.config.IdleProcessingConfig;
import com.team.idletask.model.analysis.DeprecatedPackage;
import com.team.idletask.model.analysis.OutdatedDependency;
import com.team.idletask.model.analysis.ProjectAnalysis;
import com.team.idletask.model.analysis.SecurityVulnerability;
import com.team.idletask.model.analysis.UpdateType;
import com.team.idletask.model.analysis.VulnerabilitySeverity;
import com.team.idletask.model.candidate.RemediationSuggestion;
import com.team.idletask.model.candidate.TaskCandidate;
import com.team.idletask.model.candidate.TaskCandidate.Effort;
import com.team.idletask.model.candidate.TaskCandidate.Priority;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maintenance strategy: security vulnerabilities, outdated dependencies and
 * deprecated packages.
 *
 * Each rule group reads either the structured dependency lists or, when the
 * scanner did not supply them, the legacy token lists. Inputs are sorted by
 * natural key first so the output never depends on scanner ordering.
 */
@Component
@Order(1)
@Slf4j
@RequiredArgsConstructor
public class MaintenanceAnalyzer extends BaseAnalyzer {

    private static final Pattern CANONICAL_CVE = Pattern.compile("^CVE-\\d{4}-\\d{4,}$");
    private static final String SYNTHETIC_CVE_PREFIX = "NO-CVE-";

    // Security scores by severity
    static final double CRITICAL_SECURITY_SCORE = 1.0;
    static final double HIGH_SECURITY_SCORE = 0.9;
    static final double MEDIUM_SECURITY_SCORE = 0.7;
    static final double LOW_SECURITY_SCORE = 0.5;

    // Dependency update scores by update type
    static final double MAJOR_UPDATE_SCORE = 0.8;
    static final double MINOR_UPDATE_SCORE = 0.6;
    static final double PATCH_UPDATE_SCORE = 0.4;

    static final double LEGACY_CRITICAL_OUTDATED_SCORE = 0.8;
    static final double LEGACY_OUTDATED_SCORE = 0.5;

    static final double DEPRECATED_WITH_REPLACEMENT_SCORE = 0.6;
    static final double DEPRECATED_WITHOUT_REPLACEMENT_SCORE = 0.8;

    // Counts at or below these thresholds get one candidate per item
    private static final int HIGH_SEVERITY_INDIVIDUAL_LIMIT = 2;
    private static final int MINOR_UPDATE_INDIVIDUAL_LIMIT = 3;
    private static final int PATCH_UPDATE_INDIVIDUAL_LIMIT = 2;

    private static final Comparator<SecurityVulnerability> VULNERABILITY_ORDER =
            Comparator.comparing((SecurityVulnerability v) -> nullToEmpty(v.getCveId()))
                    .thenComparing(v -> nullToEmpty(v.getName()))
                    .thenComparing(v -> nullToEmpty(v.getAffectedVersions()))
                    .thenComparing(v -> nullToEmpty(v.getDescription()));

    private static final Comparator<OutdatedDependency> DEPENDENCY_ORDER =
            Comparator.comparing((OutdatedDependency d) -> nullToEmpty(d.getName()))
                    .thenComparing(d -> nullToEmpty(d.getCurrentVersion()))
                    .thenComparing(d -> nullToEmpty(d.getLatestVersion()));

    private static final Comparator<DeprecatedPackage> DEPRECATED_ORDER =
            Comparator.comparing((DeprecatedPackage p) -> nullToEmpty(p.getName()))
                    .thenComparing(p -> nullToEmpty(p.getCurrentVersion()))
                    .thenComparing(p -> nullToEmpty(p.getReplacement()))
                    .thenComparing(p -> nullToEmpty(p.getReason()));

    private final IdleProcessingConfig config;

    @Override
    public AnalyzerType type() {
        return AnalyzerType.MAINTENANCE;
    }

    @Override
    public List<TaskCandidate> analyze(ProjectAnalysis analysis) {
        List<TaskCandidate> candidates = new ArrayList<>();
        ProjectAnalysis.Dependencies dependencies = analysis != null ? analysis.getDependencies() : null;
        if (dependencies == null) {
            return candidates;
        }

        addSecurityCandidates(dependencies, candidates);
        addOutdatedCandidates(dependencies, candidates);
        addDeprecatedCandidates(dependencies, candidates);

        log.debug("Maintenance analysis produced {} candidates", candidates.size());
        return candidates;
    }

    // ========== Security vulnerabilities ==========

    private void addSecurityCandidates(ProjectAnalysis.Dependencies dependencies, List<TaskCandidate> candidates) {
        DependencySource<SecurityVulnerability> source =
                DependencySource.richWhenNonEmpty(dependencies.getSecurityIssues(), dependencies.getSecurity());

        if (!source.isRich()) {
            List<String> legacy = sorted(source.legacy());
            if (!legacy.isEmpty()) {
                candidates.add(createLegacySecurityTask(legacy));
            }
            return;
        }

        Map<VulnerabilitySeverity, List<SecurityVulnerability>> bySeverity = groupBySeverity(source.rich());

        List<SecurityVulnerability> critical = bySeverity.get(VulnerabilitySeverity.CRITICAL);
        Set<String> sharedCriticalCves = sharedCveKeys(critical);
        for (SecurityVulnerability vulnerability : critical) {
            candidates.add(createSecurityTask(vulnerability, Priority.URGENT, CRITICAL_SECURITY_SCORE, sharedCriticalCves));
        }

        List<SecurityVulnerability> high = bySeverity.get(VulnerabilitySeverity.HIGH);
        if (high.size() > HIGH_SEVERITY_INDIVIDUAL_LIMIT) {
            candidates.add(createSecurityGroupTask(VulnerabilitySeverity.HIGH, high, Priority.HIGH, HIGH_SECURITY_SCORE));
        } else {
            Set<String> sharedHighCves = sharedCveKeys(high);
            for (SecurityVulnerability vulnerability : high) {
                candidates.add(createSecurityTask(vulnerability, Priority.HIGH, HIGH_SECURITY_SCORE, sharedHighCves));
            }
        }

        List<SecurityVulnerability> medium = bySeverity.get(VulnerabilitySeverity.MEDIUM);
        if (!medium.isEmpty()) {
            candidates.add(createSecurityGroupTask(VulnerabilitySeverity.MEDIUM, medium, Priority.NORMAL, MEDIUM_SECURITY_SCORE));
        }

        List<SecurityVulnerability> low = bySeverity.get(VulnerabilitySeverity.LOW);
        if (!low.isEmpty()) {
            candidates.add(createSecurityGroupTask(VulnerabilitySeverity.LOW, low, Priority.LOW, LOW_SECURITY_SCORE));
        }
    }

    private Map<VulnerabilitySeverity, List<SecurityVulnerability>> groupBySeverity(List<SecurityVulnerability> vulnerabilities) {
        Map<VulnerabilitySeverity, List<SecurityVulnerability>> grouped = new EnumMap<>(VulnerabilitySeverity.class);
        for (VulnerabilitySeverity severity : VulnerabilitySeverity.values()) {
            grouped.put(severity, new ArrayList<>());
        }

        orEmpty(vulnerabilities).stream()
                .sorted(VULNERABILITY_ORDER)
                .forEach(v -> grouped.get(severityOf(v)).add(v));

        return grouped;
    }

    /**
     * CVE keys that occur more than once in one severity tier. Individual ids
     * for those records also carry the package name.
     */
    private static Set<String> sharedCveKeys(List<SecurityVulnerability> tier) {
        Set<String> seen = new HashSet<>();
        Set<String> shared = new HashSet<>();
        for (SecurityVulnerability vulnerability : tier) {
            String key = cveKey(vulnerability);
            if (!seen.add(key)) {
                shared.add(key);
            }
        }
        return shared;
    }

    private static String cveKey(SecurityVulnerability vulnerability) {
        return nullToEmpty(vulnerability.getCveId()).trim();
    }

    private TaskCandidate createSecurityTask(SecurityVulnerability vulnerability, Priority priority, double score,
                                             Set<String> sharedCves) {
        VulnerabilitySeverity severity = severityOf(vulnerability);
        Effort effort = severity == VulnerabilitySeverity.CRITICAL ? Effort.HIGH : Effort.MEDIUM;
        String cveId = displayCveId(vulnerability.getCveId());

        String key = cveKey(vulnerability);
        String id = "security-" + severity.getTag() + "-" + sanitizeId(key);
        if (key.isEmpty() || "unknown".equalsIgnoreCase(key) || sharedCves.contains(key)) {
            id += "-" + sanitizeId(packageName(vulnerability.getName()));
        }

        return createCandidate(
                id,
                String.format("Fix %s Security Vulnerability: %s", severity.getLabel(), cveId),
                buildSecurityDescription(vulnerability, severity),
                priority,
                effort,
                buildSecurityRationale(vulnerability, severity),
                score,
                buildSecurityRemediation(vulnerability, severity));
    }

    private TaskCandidate createSecurityGroupTask(VulnerabilitySeverity severity, List<SecurityVulnerability> vulnerabilities,
                                                  Priority priority, double score) {
        int count = vulnerabilities.size();
        Effort effort = count > 5 ? Effort.HIGH : Effort.MEDIUM;

        List<String> cveIds = vulnerabilities.stream()
                .map(v -> displayCveId(v.getCveId()))
                .distinct()
                .collect(Collectors.toList());

        return createCandidate(
                "security-group-" + severity.getTag(),
                String.format("Fix %d %s Security %s", count, severity.getLabel(),
                        plural(count, "Vulnerability", "Vulnerabilities")),
                String.format("Address %d %s severity security %s in dependencies: %s",
                        count, severity.getTag(), plural(count, "vulnerability", "vulnerabilities"), sample(cveIds, 3)),
                priority,
                effort,
                buildGroupSecurityRationale(vulnerabilities, severity),
                score,
                buildGroupSecurityRemediation(vulnerabilities, severity));
    }

    private TaskCandidate createLegacySecurityTask(List<String> security) {
        int count = security.size();
        return createCandidate(
                "security-deps-legacy",
                "Fix Security Vulnerabilities",
                String.format("Fix %d security %s in dependencies: %s",
                        count, plural(count, "vulnerability", "vulnerabilities"), sample(security, 3)),
                Priority.URGENT,
                Effort.MEDIUM,
                "Security vulnerabilities can expose the system to attacks and data breaches",
                CRITICAL_SECURITY_SCORE,
                buildLegacySecurityRemediation());
    }

    private String buildSecurityDescription(SecurityVulnerability vulnerability, VulnerabilitySeverity severity) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s vulnerability in %s@%s:", severity.getLabel(),
                packageName(vulnerability.getName()), nullToEmpty(vulnerability.getAffectedVersions())));
        if (vulnerability.getDescription() != null && !vulnerability.getDescription().isBlank()) {
            sb.append(' ').append(vulnerability.getDescription());
        }
        if (isPublicIdentifier(vulnerability.getCveId())) {
            sb.append(" CVE: ").append(vulnerability.getCveId());
        }
        return sb.toString();
    }

    private String buildSecurityRationale(SecurityVulnerability vulnerability, VulnerabilitySeverity severity) {
        String base = switch (severity) {
            case CRITICAL -> "Critical vulnerabilities require immediate attention to prevent system compromise";
            case HIGH -> "High severity vulnerabilities pose significant security risks";
            case MEDIUM -> "Medium severity vulnerabilities should be addressed promptly";
            case LOW -> "Low severity vulnerabilities help maintain overall security posture";
        };

        if (isPublicIdentifier(vulnerability.getCveId())) {
            return base + ". " + vulnerability.getCveId() + " has been publicly disclosed and may be actively exploited.";
        }
        return base;
    }

    private String buildGroupSecurityRationale(List<SecurityVulnerability> vulnerabilities, VulnerabilitySeverity severity) {
        long withCve = vulnerabilities.stream().filter(v -> isPublicIdentifier(v.getCveId())).count();
        String base = String.format("%d %s severity vulnerabilities need to be addressed", vulnerabilities.size(), severity.getTag());

        if (withCve > 0) {
            return base + ". " + withCve + " have public CVE identifiers and may be actively exploited.";
        }
        return base + " to maintain security posture.";
    }

    private List<RemediationSuggestion> buildSecurityRemediation(SecurityVulnerability vulnerability, VulnerabilitySeverity severity) {
        List<RemediationSuggestion> suggestions = new ArrayList<>();
        String name = packageName(vulnerability.getName());
        RemediationSuggestion.Priority priority = suggestionPriority(severity);

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.DEPENDENCY_UPDATE)
                .description("Update " + name + " to the latest secure version")
                .command("npm update " + name)
                .priority(priority)
                .expectedOutcome(name + " will be updated to resolve the security vulnerability")
                .build());

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.PACKAGE_MANAGER_UPGRADE)
                .description("Alternative: Use Yarn to upgrade " + name)
                .command("yarn upgrade " + name)
                .priority(priority)
                .expectedOutcome(name + " will be updated using Yarn package manager")
                .build());

        if (isCanonicalCve(vulnerability.getCveId())) {
            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.SECURITY_ADVISORY_LINK)
                    .description("Review official security advisory for " + vulnerability.getCveId())
                    .link(config.getAdvisoryBaseUrl() + vulnerability.getCveId())
                    .priority(RemediationSuggestion.Priority.MEDIUM)
                    .expectedOutcome("Better understanding of the vulnerability impact and mitigation strategies")
                    .build());
        }

        if (severity == VulnerabilitySeverity.CRITICAL) {
            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.MANUAL_REVIEW)
                    .description("Manually review code using " + name + " for potential exploitation")
                    .priority(RemediationSuggestion.Priority.HIGH)
                    .expectedOutcome("Identification of any vulnerable code patterns that need immediate attention")
                    .warning("Critical vulnerabilities may require immediate mitigation steps beyond just updating")
                    .build());
        }

        return suggestions;
    }

    private List<RemediationSuggestion> buildGroupSecurityRemediation(List<SecurityVulnerability> vulnerabilities,
                                                                      VulnerabilitySeverity severity) {
        List<RemediationSuggestion> suggestions = new ArrayList<>();
        String packages = vulnerabilities.stream()
                .map(v -> packageName(v.getName()))
                .collect(Collectors.toCollection(LinkedHashSet::new))
                .stream()
                .collect(Collectors.joining(" "));

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.DEPENDENCY_UPDATE)
                .description("Update all vulnerable packages in batch")
                .command("npm update " + packages)
                .priority(suggestionPriority(severity))
                .expectedOutcome("All " + vulnerabilities.size() + " security vulnerabilities will be resolved")
                .build());

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.SHELL_COMMAND)
                .description("Run npm audit fix to automatically apply security fixes")
                .command("npm audit fix")
                .priority(RemediationSuggestion.Priority.HIGH)
                .expectedOutcome("Automatic resolution of vulnerabilities where possible")
                .warning("May update packages to breaking versions. Review changes carefully.")
                .build());

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.PACKAGE_MANAGER_UPGRADE)
                .description("Alternative: Use Yarn to upgrade the vulnerable packages")
                .command("yarn upgrade " + packages)
                .priority(RemediationSuggestion.Priority.MEDIUM)
                .expectedOutcome("Security vulnerabilities resolved using Yarn package manager")
                .build());

        return suggestions;
    }

    private List<RemediationSuggestion> buildLegacySecurityRemediation() {
        List<RemediationSuggestion> suggestions = new ArrayList<>();

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.SHELL_COMMAND)
                .description("Run npm audit fix to automatically resolve security vulnerabilities")
                .command("npm audit fix")
                .priority(RemediationSuggestion.Priority.CRITICAL)
                .expectedOutcome("Automatic resolution of known security vulnerabilities")
                .warning("May update packages to breaking versions. Test thoroughly after applying.")
                .build());

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.SHELL_COMMAND)
                .description("Review detailed security audit report")
                .command("npm audit")
                .priority(RemediationSuggestion.Priority.HIGH)
                .expectedOutcome("Detailed information about each vulnerability for manual resolution")
                .build());

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.PACKAGE_MANAGER_UPGRADE)
                .description("Alternative: Use Yarn to upgrade dependencies")
                .command("yarn upgrade")
                .priority(RemediationSuggestion.Priority.MEDIUM)
                .expectedOutcome("Security fixes applied using Yarn package manager")
                .build());

        return suggestions;
    }

    // ========== Outdated dependencies ==========

    private void addOutdatedCandidates(ProjectAnalysis.Dependencies dependencies, List<TaskCandidate> candidates) {
        DependencySource<OutdatedDependency> source =
                DependencySource.richWhenPresent(dependencies.getOutdatedPackages(), dependencies.getOutdated());

        if (source.isRich()) {
            addRichOutdatedCandidates(source.rich(), candidates);
        } else {
            addLegacyOutdatedCandidates(sorted(source.legacy()), candidates);
        }
    }

    private void addLegacyOutdatedCandidates(List<String> outdated, List<TaskCandidate> candidates) {
        if (outdated.isEmpty()) {
            return;
        }

        // 0.x releases make no compatibility promise
        List<String> preRelease = outdated.stream()
                .filter(dep -> dep.contains("@^0.") || dep.contains("@~0."))
                .collect(Collectors.toList());

        if (!preRelease.isEmpty()) {
            int count = preRelease.size();
            candidates.add(createCandidate(
                    "critical-outdated-deps",
                    "Update Pre-1.0 Dependencies",
                    String.format("Update %d pre-1.0 %s: %s", count,
                            plural(count, "dependency", "dependencies"), sample(preRelease, 3)),
                    Priority.HIGH,
                    Effort.MEDIUM,
                    "Pre-1.0 dependencies may have breaking changes and security issues",
                    LEGACY_CRITICAL_OUTDATED_SCORE,
                    buildLegacyOutdatedRemediation(preRelease, true)));
        }

        int count = outdated.size();
        candidates.add(createCandidate(
                "outdated-deps",
                "Update Outdated Dependencies",
                String.format("Update %d outdated %s", count, plural(count, "dependency", "dependencies")),
                Priority.NORMAL,
                count > 10 ? Effort.HIGH : Effort.MEDIUM,
                "Outdated dependencies may have security vulnerabilities and missing features",
                LEGACY_OUTDATED_SCORE,
                buildLegacyOutdatedRemediation(outdated, false)));
    }

    private void addRichOutdatedCandidates(List<OutdatedDependency> outdatedPackages, List<TaskCandidate> candidates) {
        Map<UpdateType, List<OutdatedDependency>> byType = new EnumMap<>(UpdateType.class);
        for (UpdateType type : UpdateType.values()) {
            byType.put(type, new ArrayList<>());
        }
        orEmpty(outdatedPackages).stream()
                .sorted(DEPENDENCY_ORDER)
                .forEach(d -> byType.get(d.getUpdateType() != null ? d.getUpdateType() : UpdateType.PATCH).add(d));

        for (OutdatedDependency major : byType.get(UpdateType.MAJOR)) {
            candidates.add(createUpdateTask(major, UpdateType.MAJOR, Priority.HIGH, Effort.MEDIUM, MAJOR_UPDATE_SCORE));
        }

        addIndividualOrGrouped(byType.get(UpdateType.MINOR), UpdateType.MINOR, MINOR_UPDATE_INDIVIDUAL_LIMIT,
                Priority.NORMAL, MINOR_UPDATE_SCORE, candidates);
        addIndividualOrGrouped(byType.get(UpdateType.PATCH), UpdateType.PATCH, PATCH_UPDATE_INDIVIDUAL_LIMIT,
                Priority.LOW, PATCH_UPDATE_SCORE, candidates);
    }

    private void addIndividualOrGrouped(List<OutdatedDependency> dependencies, UpdateType updateType, int individualLimit,
                                        Priority priority, double score, List<TaskCandidate> candidates) {
        if (dependencies.isEmpty()) {
            return;
        }
        if (dependencies.size() <= individualLimit) {
            for (OutdatedDependency dependency : dependencies) {
                candidates.add(createUpdateTask(dependency, updateType, priority, Effort.LOW, score));
            }
        } else {
            candidates.add(createUpdateGroupTask(dependencies, updateType, priority, score));
        }
    }

    private TaskCandidate createUpdateTask(OutdatedDependency dependency, UpdateType updateType,
                                           Priority priority, Effort effort, double score) {
        String name = packageName(dependency.getName());
        String label = capitalize(updateType.getTag());

        return createCandidate(
                "outdated-" + updateType.getTag() + "-" + sanitizeId(dependency.getName()),
                String.format("%s Update: %s %s → %s", label, name,
                        nullToEmpty(dependency.getCurrentVersion()), nullToEmpty(dependency.getLatestVersion())),
                String.format("Update %s from %s to %s (%s version update)", name,
                        nullToEmpty(dependency.getCurrentVersion()), nullToEmpty(dependency.getLatestVersion()),
                        updateType.getTag()),
                priority,
                effort,
                updateRationale(updateType),
                score,
                buildUpdateRemediation(dependency, updateType));
    }

    private TaskCandidate createUpdateGroupTask(List<OutdatedDependency> dependencies, UpdateType updateType,
                                                Priority priority, double score) {
        int count = dependencies.size();
        List<String> summaries = dependencies.stream()
                .map(d -> String.format("%s (%s → %s)", packageName(d.getName()),
                        nullToEmpty(d.getCurrentVersion()), nullToEmpty(d.getLatestVersion())))
                .collect(Collectors.toList());

        return createCandidate(
                "outdated-group-" + updateType.getTag(),
                String.format("Apply %d %s Dependency Updates", count, capitalize(updateType.getTag())),
                String.format("Update %d dependencies with %s updates available: %s",
                        count, updateType.getTag(), sample(summaries, 5)),
                priority,
                count <= 5 ? Effort.LOW : Effort.HIGH,
                updateRationale(updateType),
                score,
                buildUpdateGroupRemediation(dependencies, updateType));
    }

    private String updateRationale(UpdateType updateType) {
        return switch (updateType) {
            case MAJOR -> "Major version updates may contain breaking changes; falling behind makes security fixes and support harder to adopt";
            case MINOR -> "Minor updates add features and fixes while remaining backward compatible";
            default -> "Patch updates contain bug and security fixes with minimal risk";
        };
    }

    private List<RemediationSuggestion> buildUpdateRemediation(OutdatedDependency dependency, UpdateType updateType) {
        List<RemediationSuggestion> suggestions = new ArrayList<>();
        String name = packageName(dependency.getName());
        String target = installTarget(dependency);

        if (updateType == UpdateType.MAJOR) {
            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.MIGRATION_GUIDE)
                    .description("Review the " + name + " migration guide and changelog before upgrading")
                    .priority(RemediationSuggestion.Priority.HIGH)
                    .expectedOutcome("Understanding of breaking changes and required code updates")
                    .warning(String.format("Major version update from %s to %s may include breaking changes. "
                                    + "Plan for code updates and thorough testing.",
                            nullToEmpty(dependency.getCurrentVersion()), nullToEmpty(dependency.getLatestVersion())))
                    .build());
        }

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.DEPENDENCY_UPDATE)
                .description("Install " + target)
                .command("npm install " + target)
                .priority(updateType == UpdateType.MAJOR ? RemediationSuggestion.Priority.HIGH : RemediationSuggestion.Priority.MEDIUM)
                .expectedOutcome(name + " updated to " + latestOrDefault(dependency))
                .build());

        if (updateType == UpdateType.MAJOR) {
            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.TESTING_REMINDER)
                    .description("Run the full test suite after upgrading " + name)
                    .priority(RemediationSuggestion.Priority.HIGH)
                    .expectedOutcome("Regressions caused by the upgrade are caught before merge")
                    .build());
        } else {
            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.PACKAGE_MANAGER_UPGRADE)
                    .description("Alternative: Use Yarn to upgrade " + name)
                    .command("yarn upgrade " + target)
                    .priority(RemediationSuggestion.Priority.LOW)
                    .expectedOutcome(name + " updated using Yarn package manager")
                    .build());
        }

        return suggestions;
    }

    private List<RemediationSuggestion> buildUpdateGroupRemediation(List<OutdatedDependency> dependencies, UpdateType updateType) {
        List<RemediationSuggestion> suggestions = new ArrayList<>();
        String targets = dependencies.stream().map(this::installTarget).collect(Collectors.joining(" "));

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.DEPENDENCY_UPDATE)
                .description("Apply all " + updateType.getTag() + " updates in one batch")
                .command("npm install " + targets)
                .priority(RemediationSuggestion.Priority.MEDIUM)
                .expectedOutcome("All " + dependencies.size() + " dependencies updated to their latest " + updateType.getTag() + " release")
                .build());

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.SHELL_COMMAND)
                .description("Check which packages are outdated and their available versions")
                .command("npm outdated")
                .priority(RemediationSuggestion.Priority.LOW)
                .expectedOutcome("List of outdated packages with current, wanted, and latest versions")
                .build());

        return suggestions;
    }

    private List<RemediationSuggestion> buildLegacyOutdatedRemediation(List<String> outdated, boolean preRelease) {
        List<RemediationSuggestion> suggestions = new ArrayList<>();
        String packageNames = outdated.stream()
                .map(this::legacyPackageName)
                .filter(name -> !name.isEmpty())
                .distinct()
                .collect(Collectors.joining(" "));

        if (preRelease) {
            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.MIGRATION_GUIDE)
                    .description("Review migration guides before updating pre-1.0 dependencies")
                    .priority(RemediationSuggestion.Priority.HIGH)
                    .expectedOutcome("Understanding of breaking changes and migration requirements")
                    .warning("Pre-1.0 versions may introduce breaking changes. Plan for testing and potential code updates.")
                    .build());
        }

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.DEPENDENCY_UPDATE)
                .description("Update " + (preRelease ? "pre-1.0 " : "") + "outdated dependencies")
                .command(packageNames.isEmpty() ? "npm update" : "npm update " + packageNames)
                .priority(preRelease ? RemediationSuggestion.Priority.HIGH : RemediationSuggestion.Priority.MEDIUM)
                .expectedOutcome("All outdated dependencies updated to latest compatible versions")
                .build());

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.SHELL_COMMAND)
                .description("Check which packages are outdated and their available versions")
                .command("npm outdated")
                .priority(RemediationSuggestion.Priority.MEDIUM)
                .expectedOutcome("List of outdated packages with current, wanted, and latest versions")
                .build());

        suggestions.add(RemediationSuggestion.builder()
                .type(RemediationSuggestion.Type.PACKAGE_MANAGER_UPGRADE)
                .description("Alternative: Use Yarn to upgrade outdated dependencies")
                .command("yarn upgrade")
                .priority(RemediationSuggestion.Priority.MEDIUM)
                .expectedOutcome("Dependencies updated using Yarn package manager")
                .build());

        return suggestions;
    }

    // ========== Deprecated packages ==========

    private void addDeprecatedCandidates(ProjectAnalysis.Dependencies dependencies, List<TaskCandidate> candidates) {
        orEmpty(dependencies.getDeprecatedPackages()).stream()
                .sorted(DEPRECATED_ORDER)
                .map(this::createDeprecatedPackageTask)
                .forEach(candidates::add);
    }

    private TaskCandidate createDeprecatedPackageTask(DeprecatedPackage deprecated) {
        String name = packageName(deprecated.getName());
        boolean hasReplacement = hasReplacement(deprecated);

        String title = hasReplacement
                ? String.format("Replace Deprecated Package: %s → %s", name, deprecated.getReplacement())
                : "Replace Deprecated Package: " + name;

        String rationale = hasReplacement
                ? "Deprecated packages may stop receiving security updates and bug fixes. Migration to "
                        + deprecated.getReplacement() + " ensures continued support and compatibility."
                : "Deprecated packages may stop receiving security updates and bug fixes, requiring urgent attention to find alternative solutions.";

        return createCandidate(
                "deprecated-pkg-" + sanitizeId(deprecated.getName()),
                title,
                buildDeprecatedDescription(deprecated, hasReplacement),
                hasReplacement ? Priority.NORMAL : Priority.HIGH,
                Effort.MEDIUM,
                rationale,
                hasReplacement ? DEPRECATED_WITH_REPLACEMENT_SCORE : DEPRECATED_WITHOUT_REPLACEMENT_SCORE,
                buildDeprecatedRemediation(deprecated, hasReplacement));
    }

    private String buildDeprecatedDescription(DeprecatedPackage deprecated, boolean hasReplacement) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Package %s@%s is deprecated.", packageName(deprecated.getName()),
                nullToEmpty(deprecated.getCurrentVersion())));
        if (deprecated.getReason() != null && !deprecated.getReason().isBlank()) {
            sb.append(" Reason: ").append(deprecated.getReason());
        }
        if (hasReplacement) {
            sb.append(" Recommended replacement: ").append(deprecated.getReplacement());
        } else {
            sb.append(" No direct replacement available - manual migration required.");
        }
        return sb.toString();
    }

    private List<RemediationSuggestion> buildDeprecatedRemediation(DeprecatedPackage deprecated, boolean hasReplacement) {
        List<RemediationSuggestion> suggestions = new ArrayList<>();
        String name = packageName(deprecated.getName());

        if (hasReplacement) {
            String replacement = deprecated.getReplacement();

            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.PACKAGE_REPLACEMENT)
                    .description("Replace " + name + " with " + replacement)
                    .command("npm uninstall " + name + " && npm install " + replacement)
                    .priority(RemediationSuggestion.Priority.HIGH)
                    .expectedOutcome(name + " replaced with modern alternative " + replacement)
                    .build());

            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.MIGRATION_GUIDE)
                    .description("Review migration guide for transitioning from " + name + " to " + replacement)
                    .priority(RemediationSuggestion.Priority.HIGH)
                    .expectedOutcome("Understanding of API changes and required code updates")
                    .warning("API changes may require updates to existing code")
                    .build());

            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.MANUAL_REVIEW)
                    .description("Update all imports and usage of " + name + " to use " + replacement)
                    .priority(RemediationSuggestion.Priority.MEDIUM)
                    .expectedOutcome("All code updated to use the new package API")
                    .build());
        } else {
            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.MANUAL_REVIEW)
                    .description("Research alternative packages to replace " + name)
                    .priority(RemediationSuggestion.Priority.CRITICAL)
                    .expectedOutcome("Identification of suitable alternative packages or implementations")
                    .warning("No direct replacement available. Manual research and potentially significant code changes required.")
                    .build());

            suggestions.add(RemediationSuggestion.builder()
                    .type(RemediationSuggestion.Type.DOCUMENTATION_POINTER)
                    .description("Check " + name + " documentation for recommended alternatives")
                    .priority(RemediationSuggestion.Priority.HIGH)
                    .expectedOutcome("Official guidance on migration paths and alternatives")
                    .build());
        }

        return suggestions;
    }

    // ========== Helpers ==========

    private static VulnerabilitySeverity severityOf(SecurityVulnerability vulnerability) {
        return vulnerability.getSeverity() != null ? vulnerability.getSeverity() : VulnerabilitySeverity.LOW;
    }

    private static RemediationSuggestion.Priority suggestionPriority(VulnerabilitySeverity severity) {
        return switch (severity) {
            case CRITICAL -> RemediationSuggestion.Priority.CRITICAL;
            case HIGH -> RemediationSuggestion.Priority.HIGH;
            case MEDIUM -> RemediationSuggestion.Priority.MEDIUM;
            case LOW -> RemediationSuggestion.Priority.LOW;
        };
    }

    static boolean isCanonicalCve(String cveId) {
        return cveId != null && CANONICAL_CVE.matcher(cveId).matches();
    }

    private static boolean isPublicIdentifier(String cveId) {
        return cveId != null && !cveId.isBlank()
                && !"unknown".equalsIgnoreCase(cveId)
                && !cveId.startsWith(SYNTHETIC_CVE_PREFIX);
    }

    private static String displayCveId(String cveId) {
        return cveId != null && !cveId.isBlank() ? cveId : "unknown";
    }

    private static boolean hasReplacement(DeprecatedPackage deprecated) {
        return deprecated.getReplacement() != null && !deprecated.getReplacement().isBlank();
    }

    private static String packageName(String name) {
        return name != null && !name.isBlank() ? name.trim() : "unknown-package";
    }

    private String installTarget(OutdatedDependency dependency) {
        return packageName(dependency.getName()) + "@" + latestOrDefault(dependency);
    }

    private static String latestOrDefault(OutdatedDependency dependency) {
        String latest = dependency.getLatestVersion();
        return latest != null && !latest.isBlank() ? latest.trim() : "latest";
    }

    /** "lodash@^4.17.0" → "lodash", "@types/node@^18.0.0" → "@types/node". */
    private String legacyPackageName(String token) {
        int versionSeparator = token.lastIndexOf('@');
        return versionSeparator > 0 ? token.substring(0, versionSeparator).trim() : token.trim();
    }

    private static List<String> sorted(List<String> tokens) {
        return orEmpty(tokens).stream().sorted().collect(Collectors.toList());
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
