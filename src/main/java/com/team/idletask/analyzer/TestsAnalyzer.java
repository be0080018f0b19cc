package com.team.idletask.analyzer;

import com.team.idletask.model.analysis.ProjectAnalysis;
import com.team.idletask.model.candidate.RemediationSuggestion;
import com.team.idletask.model.candidate.TaskCandidate;
import com.team.idletask.model.candidate.TaskCandidate.Effort;
import com.team.idletask.model.candidate.TaskCandidate.Priority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Testing strategy: overall coverage, uncovered critical code paths,
 * remaining uncovered files and slow tests.
 */
@Component
@Order(4)
@Slf4j
public class TestsAnalyzer extends BaseAnalyzer {

    static final double CRITICAL_COVERAGE_THRESHOLD = 30.0;
    static final double LOW_COVERAGE_THRESHOLD = 60.0;
    static final int UNCOVERED_FILES_THRESHOLD = 5;

    /** An uncovered file whose path contains one of these is a critical code path. */
    static final List<String> CRITICAL_PATH_KEYWORDS = List.of("service", "controller", "handler", "auth", "api");

    static final String COVERAGE_COMMAND = "npm run test -- --coverage";

    @Override
    public AnalyzerType type() {
        return AnalyzerType.TESTS;
    }

    @Override
    public List<TaskCandidate> analyze(ProjectAnalysis analysis) {
        List<TaskCandidate> candidates = new ArrayList<>();
        if (analysis == null) {
            return candidates;
        }

        ProjectAnalysis.TestCoverage coverage = analysis.getTestCoverage();
        if (coverage != null) {
            addCoverageCandidate(coverage.getPercentage(), candidates);
            addUncoveredFileCandidates(orEmpty(coverage.getUncoveredFiles()), candidates);
        }
        if (analysis.getPerformance() != null) {
            addSlowTestsCandidate(orEmpty(analysis.getPerformance().getSlowTests()), candidates);
        }

        log.debug("Tests analysis produced {} candidates", candidates.size());
        return candidates;
    }

    // ========== Coverage ==========

    private void addCoverageCandidate(double percentage, List<TaskCandidate> candidates) {
        if (percentage < CRITICAL_COVERAGE_THRESHOLD) {
            candidates.add(createCandidate(
                    "tests-critical-coverage",
                    "Add Critical Test Coverage",
                    String.format("Increase test coverage from %.1f%% to at least 50%%", percentage),
                    Priority.HIGH,
                    Effort.HIGH,
                    "Very low test coverage leaves most changes unverified and makes regressions likely",
                    0.9,
                    coverageRemediation("Create tests for the least covered modules first")));
        } else if (percentage < LOW_COVERAGE_THRESHOLD) {
            candidates.add(createCandidate(
                    "tests-improve-coverage",
                    "Improve Test Coverage",
                    String.format("Increase test coverage from %.1f%% to at least 70%%", percentage),
                    Priority.NORMAL,
                    Effort.MEDIUM,
                    "Higher test coverage catches regressions before they reach users",
                    0.6,
                    coverageRemediation("Add tests for uncovered functions and error paths")));
        }
    }

    // ========== Uncovered files ==========

    private void addUncoveredFileCandidates(List<String> uncoveredFiles, List<TaskCandidate> candidates) {
        List<String> sorted = uncoveredFiles.stream().sorted().distinct().collect(Collectors.toList());
        List<String> criticalPaths = sorted.stream().filter(TestsAnalyzer::isCriticalPath).collect(Collectors.toList());
        List<String> others = sorted.stream().filter(f -> !isCriticalPath(f)).collect(Collectors.toList());

        if (!criticalPaths.isEmpty()) {
            int count = criticalPaths.size();
            candidates.add(createCandidate(
                    "tests-critical-paths",
                    "Test Critical Code Paths",
                    String.format("Add tests for %d uncovered critical %s: %s",
                            count, plural(count, "file", "files"), sample(criticalPaths, 3)),
                    Priority.HIGH,
                    count <= 3 ? Effort.MEDIUM : Effort.HIGH,
                    "Services, controllers and handlers carry the business logic users depend on",
                    0.8,
                    coverageRemediation("Create tests for request handling, validation and error branches")));
        }

        if (others.size() > UNCOVERED_FILES_THRESHOLD) {
            int count = others.size();
            candidates.add(createCandidate(
                    "tests-uncovered-files",
                    "Add Tests for Uncovered Files",
                    String.format("Add tests for %d uncovered files: %s", count, sample(others, 5)),
                    Priority.LOW,
                    count > 10 ? Effort.HIGH : Effort.MEDIUM,
                    "Untested files make refactoring risky",
                    0.5,
                    coverageRemediation("Create tests for the uncovered files")));
        }
    }

    static boolean isCriticalPath(String file) {
        String normalized = nullToEmpty(file).replace('\\', '/').toLowerCase(Locale.ROOT);
        return CRITICAL_PATH_KEYWORDS.stream().anyMatch(normalized::contains);
    }

    // ========== Slow tests ==========

    private void addSlowTestsCandidate(List<String> slowTests, List<TaskCandidate> candidates) {
        if (slowTests.isEmpty()) {
            return;
        }
        List<String> sorted = slowTests.stream().sorted().distinct().collect(Collectors.toList());
        int count = sorted.size();

        candidates.add(createCandidate(
                "tests-slow-tests",
                "Optimize Slow Tests",
                String.format("Optimize %d slow %s: %s", count, plural(count, "test", "tests"), sample(sorted, 3)),
                Priority.LOW,
                count <= 3 ? Effort.LOW : Effort.MEDIUM,
                "Slow tests lengthen the feedback loop and discourage running the suite",
                0.4,
                List.of(RemediationSuggestion.builder()
                        .type(RemediationSuggestion.Type.MANUAL_REVIEW)
                        .description("Profile slow tests for real I/O, fixed sleeps and repeated heavy setup")
                        .priority(RemediationSuggestion.Priority.LOW)
                        .expectedOutcome("Shorter test runs with the same assertions")
                        .build())));
    }

    private static List<RemediationSuggestion> coverageRemediation(String testingAdvice) {
        return List.of(
                RemediationSuggestion.builder()
                        .type(RemediationSuggestion.Type.TESTING_REMINDER)
                        .description(testingAdvice)
                        .priority(RemediationSuggestion.Priority.MEDIUM)
                        .expectedOutcome("New tests exercising previously uncovered code")
                        .build(),
                RemediationSuggestion.builder()
                        .type(RemediationSuggestion.Type.SHELL_COMMAND)
                        .description("Generate a coverage report")
                        .command(COVERAGE_COMMAND)
                        .priority(RemediationSuggestion.Priority.LOW)
                        .expectedOutcome("Coverage report showing improved coverage")
                        .build());
    }
}
