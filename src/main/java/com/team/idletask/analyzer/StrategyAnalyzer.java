package com.team.idletask.analyzer;

import com.team.idletask.model.analysis.ProjectAnalysis;
import com.team.idletask.model.candidate.TaskCandidate;

import java.util.List;
import java.util.Optional;

/**
 * A maintenance strategy that turns a project snapshot into scored task candidates.
 *
 * Implementations are stateless: {@link #analyze} must be total over any
 * well-formed snapshot, including one whose optional sections are missing, and
 * must return the same list in the same order for the same snapshot.
 */
public interface StrategyAnalyzer {

    AnalyzerType type();

    List<TaskCandidate> analyze(ProjectAnalysis analysis);

    /**
     * Pick the most valuable candidate.
     *
     * @return the best candidate by {@link CandidateRanking}, or empty for an empty list
     */
    Optional<TaskCandidate> prioritize(List<TaskCandidate> candidates);
}
