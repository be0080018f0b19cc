package com.team.idletask.service.selection;

import com.team.idletask.analyzer.AnalyzerType;
import com.team.idletask.analyzer.DocsAnalyzer;
import com.team.idletask.analyzer.MaintenanceAnalyzer;
import com.team.idletask.analyzer.RefactoringAnalyzer;
import com.team.idletask.analyzer.StrategyAnalyzer;
import com.team.idletask.analyzer.TestsAnalyzer;
import com.team.idletask.config.DocsRulesConfig.DocsRules;
import com.team.idletask.config.IdleProcessingConfig;
import com.team.idletask.model.analysis.DeprecatedPackage;
import com.team.idletask.model.analysis.ProjectAnalysis;
import com.team.idletask.model.analysis.SecurityVulnerability;
import com.team.idletask.model.analysis.VulnerabilitySeverity;
import com.team.idletask.model.candidate.IdleTask;
import com.team.idletask.model.candidate.TaskCandidate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IdleTaskGeneratorTest {

    private IdleProcessingConfig config;
    private IdleTaskGenerator generator;

    @BeforeEach
    void setUp() {
        config = new IdleProcessingConfig();
        generator = new IdleTaskGenerator(List.of(
                new MaintenanceAnalyzer(config),
                new DocsAnalyzer(new DocsRules()),
                new RefactoringAnalyzer(),
                new TestsAnalyzer()), config);
    }

    @Test
    void generateCandidates_concatenatesInAnalyzerOrder() {
        List<TaskCandidate> candidates = generator.generateCandidates(fullSnapshot());

        assertThat(candidates).extracting(TaskCandidate::getWorkflow)
                .containsExactly("maintenance", "documentation", "refactoring");
    }

    @Test
    void selectTask_wrapsHighestScoringCandidate() {
        Optional<IdleTask> task = generator.selectTask(fullSnapshot());

        assertThat(task).hasValueSatisfying(t -> {
            assertThat(t.getId()).isEqualTo("idle-security-critical-CVE-2021-44228");
            assertThat(t.getType()).isEqualTo("maintenance");
            assertThat(t.getCandidateId()).isEqualTo("security-critical-CVE-2021-44228");
            assertThat(t.getScore()).isEqualTo(1.0);
            assertThat(t.getPriority()).isEqualTo(TaskCandidate.Priority.LOW);
            assertThat(t.getSuggestedWorkflow()).isEqualTo("maintenance");
            assertThat(t.getRemediationSuggestions()).isNotEmpty();
            assertThat(t.getCreatedAt()).isNotNull();
            assertThat(t.isImplemented()).isFalse();
        });
    }

    @Test
    void selectTask_typeFollowsProducingAnalyzer() {
        ProjectAnalysis docsOnly = ProjectAnalysis.builder()
                .documentation(ProjectAnalysis.Documentation.builder().coverage(10).build())
                .build();

        assertThat(generator.selectTask(docsOnly)).hasValueSatisfying(t -> {
            assertThat(t.getType()).isEqualTo("docs");
            assertThat(t.getSuggestedWorkflow()).isEqualTo("documentation");
        });
    }

    @Test
    void selectTask_alwaysHandsOffAtLowPriority() {
        ProjectAnalysis analysis = ProjectAnalysis.builder()
                .codeQuality(ProjectAnalysis.CodeQuality.builder().lintIssues(300).build())
                .build();

        assertThat(generator.selectBest(analysis))
                .hasValueSatisfying(c -> assertThat(c.getPriority()).isEqualTo(TaskCandidate.Priority.HIGH));
        assertThat(generator.selectTask(analysis))
                .hasValueSatisfying(t -> {
                    assertThat(t.getCandidateId()).isEqualTo("refactoring-lint-issues");
                    assertThat(t.getPriority()).isEqualTo(TaskCandidate.Priority.LOW);
                    assertThat(t.getScore()).isEqualTo(0.7);
                });
    }

    @Test
    void testsAnalyzer_candidatesAreTypedTests() {
        ProjectAnalysis analysis = ProjectAnalysis.builder()
                .testCoverage(ProjectAnalysis.TestCoverage.builder().percentage(15).build())
                .build();

        assertThat(generator.selectTask(analysis)).hasValueSatisfying(t -> {
            assertThat(t.getCandidateId()).isEqualTo("tests-critical-coverage");
            assertThat(t.getType()).isEqualTo("tests");
            assertThat(t.getSuggestedWorkflow()).isEqualTo("testing");
        });
    }

    @Test
    void failingAnalyzer_doesNotAbortSelection() {
        StrategyAnalyzer failing = mock(StrategyAnalyzer.class);
        StrategyAnalyzer silent = mock(StrategyAnalyzer.class);
        when(failing.type()).thenReturn(AnalyzerType.DOCS);
        when(failing.analyze(any())).thenThrow(new IllegalStateException("analyzer crashed"));
        when(silent.type()).thenReturn(AnalyzerType.TESTS);
        when(silent.analyze(any())).thenReturn(null);

        IdleTaskGenerator resilient = new IdleTaskGenerator(List.of(
                new MaintenanceAnalyzer(config), failing, new RefactoringAnalyzer(), silent), config);
        ProjectAnalysis analysis = ProjectAnalysis.builder()
                .codeQuality(ProjectAnalysis.CodeQuality.builder().lintIssues(300).build())
                .build();

        assertThat(resilient.generateCandidates(analysis))
                .extracting(TaskCandidate::getCandidateId)
                .containsExactly("refactoring-lint-issues");
        assertThat(resilient.selectTask(analysis))
                .hasValueSatisfying(t -> assertThat(t.getCandidateId()).isEqualTo("refactoring-lint-issues"));
    }

    @Test
    void crossAnalyzerDuplicates_areKept() {
        ProjectAnalysis analysis = ProjectAnalysis.builder()
                .dependencies(ProjectAnalysis.Dependencies.builder()
                        .deprecatedPackages(List.of(DeprecatedPackage.builder().name("request").replacement("axios").build()))
                        .build())
                .codeQuality(ProjectAnalysis.CodeQuality.builder().lintIssues(3).build())
                .build();

        assertThat(generator.generateCandidates(analysis)).hasSize(2);
    }

    @Test
    void disabledAnalyzers_areSkipped() {
        config.setDisabledAnalyzers(List.of("maintenance", "Refactoring", "bogus"));

        List<TaskCandidate> candidates = generator.generateCandidates(fullSnapshot());

        assertThat(candidates).extracting(TaskCandidate::getWorkflow).containsOnly("documentation");
    }

    @Test
    void disabledProcessing_selectsNothing() {
        config.setEnabled(false);

        assertThat(generator.selectTask(fullSnapshot())).isEmpty();
        assertThat(generator.generateCandidates(fullSnapshot())).isNotEmpty();
    }

    @Test
    void emptySnapshot_selectsNothing() {
        assertThat(generator.selectTask(new ProjectAnalysis())).isEmpty();
        assertThat(generator.selectBest(new ProjectAnalysis())).isEmpty();
    }

    @Test
    void nullSnapshot_isRejected() {
        assertThatThrownBy(() -> generator.generateCandidates(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> generator.selectTask(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generatorDependsOnlyOnAnalyzerContract() {
        StrategyAnalyzer stub = mock(StrategyAnalyzer.class);
        StrategyAnalyzer disabled = mock(StrategyAnalyzer.class);
        when(stub.type()).thenReturn(AnalyzerType.REFACTORING);
        when(disabled.type()).thenReturn(AnalyzerType.DOCS);
        when(stub.analyze(any())).thenReturn(List.of(
                TaskCandidate.builder().candidateId("b").score(0.5).priority(TaskCandidate.Priority.LOW).build(),
                TaskCandidate.builder().candidateId("a").score(0.5).priority(TaskCandidate.Priority.LOW).build()));

        config.setDisabledAnalyzers(List.of("docs"));
        IdleTaskGenerator custom = new IdleTaskGenerator(List.of(disabled, stub), config);

        assertThat(custom.selectTask(new ProjectAnalysis()))
                .hasValueSatisfying(t -> {
                    assertThat(t.getCandidateId()).isEqualTo("a");
                    assertThat(t.getType()).isEqualTo("refactoring");
                });
        verify(disabled, never()).analyze(any());
    }

    private static ProjectAnalysis fullSnapshot() {
        return ProjectAnalysis.builder()
                .dependencies(ProjectAnalysis.Dependencies.builder()
                        .securityIssues(List.of(SecurityVulnerability.builder()
                                .name("log4j-core").cveId("CVE-2021-44228").severity(VulnerabilitySeverity.CRITICAL)
                                .affectedVersions("<2.15.0").description("Remote code execution")
                                .build()))
                        .build())
                .documentation(ProjectAnalysis.Documentation.builder().coverage(35).build())
                .codeQuality(ProjectAnalysis.CodeQuality.builder().lintIssues(60).build())
                .build();
    }
}
