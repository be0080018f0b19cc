package com.team.idletask.analyzer;

import com.team.idletask.model.analysis.ProjectAnalysis;
import com.team.idletask.model.candidate.TaskCandidate;
import com.team.idletask.model.candidate.TaskCandidate.Effort;
import com.team.idletask.model.candidate.TaskCandidate.Priority;
import com.team.idletask.model.quality.CodeSmell;
import com.team.idletask.model.quality.CodeSmell.SmellSeverity;
import com.team.idletask.model.quality.ComplexityHotspot;
import com.team.idletask.model.quality.DuplicatePattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Refactoring strategy: duplicated code, complexity hotspots, code smells
 * and lint issues.
 */
@Component
@Order(3)
@Slf4j
public class RefactoringAnalyzer extends BaseAnalyzer {

    // Thresholds: low, medium, high, critical
    private static final int[] CYCLOMATIC_THRESHOLDS = {10, 20, 30, 50};
    private static final int[] COGNITIVE_THRESHOLDS = {15, 25, 40, 60};
    private static final int[] LINE_COUNT_THRESHOLDS = {200, 500, 1000, 2000};

    private static final double CYCLOMATIC_WEIGHT = 0.40;
    private static final double COGNITIVE_WEIGHT = 0.35;
    private static final double LINE_COUNT_WEIGHT = 0.25;
    private static final double COMBINED_HIGH_COMPLEXITY_BONUS = 0.15;

    private static final Comparator<CodeSmell> SMELL_ORDER =
            Comparator.comparing((CodeSmell s) -> nullToEmpty(s.getFile()))
                    .thenComparing(s -> nullToEmpty(s.getType()))
                    .thenComparing(s -> nullToEmpty(s.getDetails()))
                    .thenComparing(RefactoringAnalyzer::smellSeverity);

    private static final Comparator<DuplicatePattern> DUPLICATE_ORDER =
            Comparator.comparing((DuplicatePattern p) -> nullToEmpty(p.getPattern()))
                    .thenComparing(p -> -p.getSimilarity())
                    .thenComparingInt(p -> orEmpty(p.getLocations()).size())
                    .thenComparing(p -> String.join("\n", orEmpty(p.getLocations())));

    enum ComplexityLevel {
        LOW, MEDIUM, HIGH, CRITICAL;

        boolean isHighOrWorse() {
            return this == HIGH || this == CRITICAL;
        }

        String getTag() {
            return name().toLowerCase();
        }
    }

    @Override
    public AnalyzerType type() {
        return AnalyzerType.REFACTORING;
    }

    @Override
    public List<TaskCandidate> analyze(ProjectAnalysis analysis) {
        List<TaskCandidate> candidates = new ArrayList<>();
        ProjectAnalysis.CodeQuality codeQuality = analysis != null ? analysis.getCodeQuality() : null;
        if (codeQuality == null) {
            return candidates;
        }

        addDuplicatedCodeCandidates(orEmpty(codeQuality.getDuplicatedCode()), candidates);
        addComplexityCandidates(orEmpty(codeQuality.getComplexityHotspots()), candidates);
        addCodeSmellCandidates(orEmpty(codeQuality.getCodeSmells()), candidates);
        addLintCandidate(codeQuality.getLintIssues(), candidates);

        log.debug("Refactoring analysis produced {} candidates", candidates.size());
        return candidates;
    }

    // ========== Duplicated code ==========

    private void addDuplicatedCodeCandidates(List<DuplicatePattern> patterns, List<TaskCandidate> candidates) {
        List<DuplicatePattern> sorted = patterns.stream().sorted(DUPLICATE_ORDER).collect(Collectors.toList());

        for (int i = 0; i < sorted.size(); i++) {
            DuplicatePattern pattern = sorted.get(i);
            List<String> locations = orEmpty(pattern.getLocations());
            int count = locations.size();
            double similarity = pattern.getSimilarity();

            candidates.add(createCandidate(
                    "refactoring-duplicated-code-" + i,
                    "Eliminate Duplicated Code",
                    String.format("Consolidate a pattern duplicated across %d %s (%.0f%% similar): %s",
                            count, plural(count, "location", "locations"), similarity * 100, sample(locations, 5)),
                    similarity >= 0.9 ? Priority.HIGH : Priority.NORMAL,
                    duplicateEffort(count),
                    "Duplicated code increases maintenance burden and bug risk when changes are needed",
                    duplicateScore(similarity)));
        }
    }

    static double duplicateScore(double similarity) {
        return Math.max(0.5, Math.min(0.9, 0.5 + 0.4 * similarity));
    }

    private static Effort duplicateEffort(int locations) {
        if (locations <= 2) return Effort.LOW;
        if (locations <= 4) return Effort.MEDIUM;
        return Effort.HIGH;
    }

    // ========== Complexity hotspots ==========

    private void addComplexityCandidates(List<ComplexityHotspot> hotspots, List<TaskCandidate> candidates) {
        List<ComplexityHotspot> ranked = hotspots.stream()
                .sorted(Comparator.comparingDouble(RefactoringAnalyzer::weightedScore).reversed()
                        .thenComparing(h -> nullToEmpty(h.getFile())))
                .collect(Collectors.toList());

        for (int i = 0; i < ranked.size(); i++) {
            ComplexityHotspot hotspot = ranked.get(i);
            ComplexityLevel overall = overallLevel(hotspot);

            candidates.add(createCandidate(
                    "refactoring-complexity-hotspot-" + i,
                    "Refactor " + fileName(hotspot.getFile()),
                    describeHotspot(hotspot),
                    priorityFor(overall),
                    overall.isHighOrWorse() ? Effort.HIGH : Effort.MEDIUM,
                    hotspotRationale(hotspot),
                    Math.min(0.95, 0.6 + 0.35 * weightedScore(hotspot))));
        }
    }

    static ComplexityLevel classify(int value, int[] thresholds) {
        if (value > thresholds[3]) return ComplexityLevel.CRITICAL;
        if (value > thresholds[2]) return ComplexityLevel.HIGH;
        if (value > thresholds[1]) return ComplexityLevel.MEDIUM;
        return ComplexityLevel.LOW;
    }

    static ComplexityLevel cyclomaticLevel(ComplexityHotspot hotspot) {
        return classify(hotspot.getCyclomaticComplexity(), CYCLOMATIC_THRESHOLDS);
    }

    static ComplexityLevel cognitiveLevel(ComplexityHotspot hotspot) {
        return classify(hotspot.getCognitiveComplexity(), COGNITIVE_THRESHOLDS);
    }

    static ComplexityLevel lineLevel(ComplexityHotspot hotspot) {
        return classify(hotspot.getLineCount(), LINE_COUNT_THRESHOLDS);
    }

    static ComplexityLevel overallLevel(ComplexityHotspot hotspot) {
        ComplexityLevel max = cyclomaticLevel(hotspot);
        if (cognitiveLevel(hotspot).compareTo(max) > 0) max = cognitiveLevel(hotspot);
        if (lineLevel(hotspot).compareTo(max) > 0) max = lineLevel(hotspot);
        return max;
    }

    /**
     * Weighted complexity in [0, 1.15]: each metric normalized against its
     * critical threshold, plus a bonus when branching and readability are
     * both high.
     */
    static double weightedScore(ComplexityHotspot hotspot) {
        double cyclomatic = normalize(hotspot.getCyclomaticComplexity(), CYCLOMATIC_THRESHOLDS[3]);
        double cognitive = normalize(hotspot.getCognitiveComplexity(), COGNITIVE_THRESHOLDS[3]);
        double lines = normalize(hotspot.getLineCount(), LINE_COUNT_THRESHOLDS[3]);

        double score = CYCLOMATIC_WEIGHT * cyclomatic + COGNITIVE_WEIGHT * cognitive + LINE_COUNT_WEIGHT * lines;
        if (hasCombinedHighComplexity(hotspot)) {
            score += COMBINED_HIGH_COMPLEXITY_BONUS;
        }
        return score;
    }

    private static double normalize(int value, int critical) {
        return Math.max(0.0, Math.min(1.0, (double) value / critical));
    }

    private static boolean hasCombinedHighComplexity(ComplexityHotspot hotspot) {
        return cyclomaticLevel(hotspot).isHighOrWorse() && cognitiveLevel(hotspot).isHighOrWorse();
    }

    private static Priority priorityFor(ComplexityLevel level) {
        return switch (level) {
            case CRITICAL -> Priority.URGENT;
            case HIGH -> Priority.HIGH;
            case MEDIUM -> Priority.NORMAL;
            case LOW -> Priority.LOW;
        };
    }

    private String describeHotspot(ComplexityHotspot hotspot) {
        ComplexityLevel cyclomatic = cyclomaticLevel(hotspot);
        ComplexityLevel cognitive = cognitiveLevel(hotspot);
        ComplexityLevel lines = lineLevel(hotspot);

        StringBuilder sb = new StringBuilder();
        sb.append("Reduce complexity in ").append(nullToEmpty(hotspot.getFile())).append(':');
        sb.append("\n• Cyclomatic Complexity: ").append(hotspot.getCyclomaticComplexity())
                .append(" (").append(cyclomatic.getTag())
                .append(cyclomatic == ComplexityLevel.CRITICAL ? " - many execution paths"
                        : cyclomatic == ComplexityLevel.HIGH ? " - complex branching" : "")
                .append(')');
        sb.append("\n• Cognitive Complexity: ").append(hotspot.getCognitiveComplexity())
                .append(" (").append(cognitive.getTag())
                .append(cognitive == ComplexityLevel.CRITICAL ? " - very hard to understand"
                        : cognitive == ComplexityLevel.HIGH ? " - difficult to follow" : "")
                .append(')');
        sb.append("\n• Lines: ").append(hotspot.getLineCount())
                .append(" (").append(lines.getTag())
                .append(lines == ComplexityLevel.CRITICAL ? " - extremely large file"
                        : lines == ComplexityLevel.HIGH ? " - consider splitting" : "")
                .append(')');

        String summary = switch (overallLevel(hotspot)) {
            case CRITICAL -> "\n\nThis file requires immediate attention due to critically high complexity.";
            case HIGH -> "\n\nThis file should be prioritized for refactoring to improve maintainability.";
            case MEDIUM -> "\n\nThis file would benefit from targeted refactoring efforts.";
            case LOW -> "";
        };
        sb.append(summary);
        if (hasCombinedHighComplexity(hotspot)) {
            sb.append(" The combination of high cyclomatic and cognitive complexity indicates a major refactoring is needed.");
        }
        return sb.toString();
    }

    private String hotspotRationale(ComplexityHotspot hotspot) {
        List<String> actions = new ArrayList<>();

        if (cyclomaticLevel(hotspot).isHighOrWorse()) {
            actions.add("Extract methods to reduce branching complexity");
            actions.add("Replace complex conditionals with polymorphism or a strategy");
            actions.add("Simplify nested control structures using early returns");
        }
        if (cognitiveLevel(hotspot).isHighOrWorse()) {
            actions.add("Flatten control flow to improve readability");
            actions.add("Extract helper methods for complex logic blocks");
            actions.add("Improve variable and method naming for clarity");
        }
        if (lineLevel(hotspot).isHighOrWorse()) {
            actions.add("Split into multiple modules with a single responsibility each");
            actions.add("Extract related functionality into separate classes");
        }
        if (hasCombinedHighComplexity(hotspot)) {
            actions.add("Break down into smaller, focused modules");
        }
        if (actions.isEmpty()) {
            actions.add("Review for potential simplification opportunities");
            actions.add("Consider extracting reusable utility functions");
        }

        return String.format("Complexity Analysis:%n- Cyclomatic: %d (%s)%n- Cognitive: %d (%s)%n- Lines: %d%n%nRecommended actions:%n",
                hotspot.getCyclomaticComplexity(), cyclomaticLevel(hotspot).getTag(),
                hotspot.getCognitiveComplexity(), cognitiveLevel(hotspot).getTag(),
                hotspot.getLineCount())
                + actions.stream().map(a -> "• " + a).collect(Collectors.joining("\n"));
    }

    // ========== Code smells ==========

    private void addCodeSmellCandidates(List<CodeSmell> smells, List<TaskCandidate> candidates) {
        List<CodeSmell> sorted = smells.stream().sorted(SMELL_ORDER).collect(Collectors.toList());

        for (int i = 0; i < sorted.size(); i++) {
            CodeSmell smell = sorted.get(i);
            SmellSeverity severity = smellSeverity(smell);

            Priority priority = switch (severity) {
                case CRITICAL -> Priority.URGENT;
                case HIGH -> Priority.HIGH;
                case MEDIUM -> Priority.NORMAL;
                case LOW -> Priority.LOW;
            };
            Effort effort = switch (severity) {
                case CRITICAL, HIGH -> Effort.HIGH;
                case MEDIUM -> Effort.MEDIUM;
                case LOW -> Effort.LOW;
            };
            double score = switch (severity) {
                case CRITICAL -> 0.85;
                case HIGH -> 0.75;
                case MEDIUM -> 0.6;
                case LOW -> 0.4;
            };

            candidates.add(createCandidate(
                    "refactoring-code-smell-" + sanitizeId(smell.getType()) + "-" + i,
                    smellTitle(smell.getType()) + " in " + fileName(smell.getFile()),
                    describeSmell(smell),
                    priority,
                    effort,
                    smellRationale(smell.getType()),
                    score));
        }
    }

    private static String smellTitle(String type) {
        return switch (nullToEmpty(type)) {
            case "long-method" -> "Refactor Long Method";
            case "large-class" -> "Break Down Large Class";
            case "deep-nesting" -> "Reduce Deep Nesting";
            case "duplicate-code" -> "Eliminate Code Duplication";
            case "dead-code" -> "Remove Dead Code";
            case "magic-numbers" -> "Replace Magic Numbers";
            case "feature-envy" -> "Fix Feature Envy";
            case "data-clumps" -> "Consolidate Data Clumps";
            default -> "Fix " + (type == null || type.isBlank() ? "Unknown" : type) + " Code Smell";
        };
    }

    private static String smellRationale(String type) {
        return switch (nullToEmpty(type)) {
            case "long-method" -> "Long methods are hard to understand, test and reuse";
            case "large-class" -> "Large classes usually carry more than one responsibility";
            case "deep-nesting" -> "Deeply nested code hides the main path and invites bugs";
            case "duplicate-code" -> "Duplicated logic must be fixed in every copy";
            case "dead-code" -> "Unused code adds noise and maintenance cost";
            case "magic-numbers" -> "Named constants document intent and keep values consistent";
            case "feature-envy" -> "Methods that mostly use another class's data belong with that data";
            case "data-clumps" -> "Values that always travel together should become a single object";
            default -> "Code smell type '" + nullToEmpty(type) + "' detected. Review and refactor to improve code quality.";
        };
    }

    private static SmellSeverity smellSeverity(CodeSmell smell) {
        return smell.getSeverity() != null ? smell.getSeverity() : SmellSeverity.LOW;
    }

    private static String describeSmell(CodeSmell smell) {
        String base = String.format("Address %s in %s", nullToEmpty(smell.getType()).isEmpty() ? "code smell" : smell.getType(),
                nullToEmpty(smell.getFile()));
        return smell.getDetails() != null && !smell.getDetails().isBlank() ? base + ": " + smell.getDetails() : base;
    }

    // ========== Lint ==========

    private void addLintCandidate(int lintIssues, List<TaskCandidate> candidates) {
        if (lintIssues <= 0) {
            return;
        }

        Priority priority;
        Effort effort;
        double score;
        if (lintIssues > 200) {
            priority = Priority.HIGH;
            effort = Effort.HIGH;
            score = 0.7;
        } else if (lintIssues > 50) {
            priority = Priority.NORMAL;
            effort = Effort.MEDIUM;
            score = 0.5;
        } else if (lintIssues > 10) {
            priority = Priority.LOW;
            effort = Effort.LOW;
            score = 0.3;
        } else {
            priority = Priority.LOW;
            effort = Effort.LOW;
            score = 0.2;
        }

        candidates.add(createCandidate(
                "refactoring-lint-issues",
                "Fix Linting Issues",
                String.format("Address %d linting %s in the codebase", lintIssues, plural(lintIssues, "issue", "issues")),
                priority,
                effort,
                "Linting issues indicate code quality problems that could lead to bugs",
                score));
    }
}
