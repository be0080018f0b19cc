package com.team.idletask.service.selection;

import com.team.idletask.analyzer.AnalyzerType;
import com.team.idletask.analyzer.CandidateRanking;
import com.team.idletask.analyzer.StrategyAnalyzer;
import com.team.idletask.config.IdleProcessingConfig;
import com.team.idletask.model.analysis.ProjectAnalysis;
import com.team.idletask.model.candidate.IdleTask;
import com.team.idletask.model.candidate.TaskCandidate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs every enabled analyzer on a project snapshot and picks the single
 * task to hand off during idle time.
 *
 * Flow:
 * 1. Run analyzers in order (maintenance, docs, refactoring, tests)
 * 2. Concatenate their candidates, keeping duplicates across analyzers
 * 3. Select the best one by score, priority and candidate id
 * 4. Wrap it as an IdleTask at low priority
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IdleTaskGenerator {

    private final List<StrategyAnalyzer> analyzers;
    private final IdleProcessingConfig config;

    /**
     * All candidates from the enabled analyzers, in analyzer order.
     */
    public List<TaskCandidate> generateCandidates(ProjectAnalysis analysis) {
        return collect(analysis).stream()
                .map(SourcedCandidate::getCandidate)
                .collect(Collectors.toList());
    }

    /**
     * The highest ranked candidate, or empty when no analyzer found anything.
     */
    public Optional<TaskCandidate> selectBest(ProjectAnalysis analysis) {
        return CandidateRanking.best(generateCandidates(analysis));
    }

    /**
     * The task to run next. Empty when idle processing is disabled or there is
     * nothing worth doing.
     */
    public Optional<IdleTask> selectTask(ProjectAnalysis analysis) {
        requireSnapshot(analysis);

        if (!config.isEnabled()) {
            log.info("Idle processing is disabled. Skipping task selection.");
            return Optional.empty();
        }

        List<SourcedCandidate> sourced = collect(analysis);
        Comparator<SourcedCandidate> order = Comparator.comparing(SourcedCandidate::getCandidate, CandidateRanking.BEST_FIRST);
        Optional<SourcedCandidate> best = sourced.stream().min(order);

        if (best.isEmpty()) {
            log.info("No idle task candidates found");
            return Optional.empty();
        }

        IdleTask task = toIdleTask(best.get());
        log.info("Selected idle task {} ({}, score {}) from {} candidates",
                task.getCandidateId(), task.getType(), task.getScore(), sourced.size());
        return Optional.of(task);
    }

    private List<SourcedCandidate> collect(ProjectAnalysis analysis) {
        requireSnapshot(analysis);

        Set<AnalyzerType> disabled = disabledAnalyzers();
        List<SourcedCandidate> result = new ArrayList<>();

        for (StrategyAnalyzer analyzer : analyzers) {
            if (disabled.contains(analyzer.type())) {
                log.debug("Analyzer {} is disabled", analyzer.type().getTag());
                continue;
            }
            List<TaskCandidate> candidates = runAnalyzer(analyzer, analysis);
            for (TaskCandidate candidate : candidates) {
                if (candidate != null) {
                    result.add(new SourcedCandidate(analyzer.type(), candidate));
                }
            }
            log.debug("Analyzer {} produced {} candidates", analyzer.type().getTag(), candidates.size());
        }
        return result;
    }

    /**
     * A failing analyzer contributes no candidates; the others still run.
     */
    private List<TaskCandidate> runAnalyzer(StrategyAnalyzer analyzer, ProjectAnalysis analysis) {
        try {
            List<TaskCandidate> candidates = analyzer.analyze(analysis);
            return candidates != null ? candidates : List.of();
        } catch (Exception e) {
            log.error("Analyzer {} failed: {}", analyzer.type().getTag(), e.getMessage(), e);
            return List.of();
        }
    }

    private Set<AnalyzerType> disabledAnalyzers() {
        if (config.getDisabledAnalyzers() == null) {
            return Set.of();
        }
        Set<AnalyzerType> disabled = config.getDisabledAnalyzers().stream()
                .map(AnalyzerType::fromTag)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (disabled.size() < config.getDisabledAnalyzers().size()) {
            log.warn("Ignoring unknown analyzer categories in disabled-analyzers: {}", config.getDisabledAnalyzers());
        }
        return disabled;
    }

    private IdleTask toIdleTask(SourcedCandidate sourced) {
        TaskCandidate candidate = sourced.getCandidate();
        return IdleTask.builder()
                .id("idle-" + candidate.getCandidateId())
                .type(sourced.getSource().getTag())
                .candidateId(candidate.getCandidateId())
                .title(candidate.getTitle())
                .description(candidate.getDescription())
                // idle tasks always queue behind user work
                .priority(TaskCandidate.Priority.LOW)
                .estimatedEffort(candidate.getEffort())
                .suggestedWorkflow(candidate.getWorkflow())
                .rationale(candidate.getRationale())
                .score(candidate.getScore())
                .remediationSuggestions(candidate.getRemediationSuggestions() != null
                        ? new ArrayList<>(candidate.getRemediationSuggestions())
                        : new ArrayList<>())
                .createdAt(LocalDateTime.now())
                .implemented(false)
                .build();
    }

    private static void requireSnapshot(ProjectAnalysis analysis) {
        if (analysis == null) {
            throw new IllegalArgumentException("Project analysis snapshot is required");
        }
    }

    /** A candidate together with the analyzer category that produced it. */
    private static final class SourcedCandidate {
        private final AnalyzerType source;
        private final TaskCandidate candidate;

        SourcedCandidate(AnalyzerType source, TaskCandidate candidate) {
            this.source = source;
            this.candidate = candidate;
        }

        AnalyzerType getSource() {
            return source;
        }

        TaskCandidate getCandidate() {
            return candidate;
        }
    }
}
