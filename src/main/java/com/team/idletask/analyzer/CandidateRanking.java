package com.team.idletask.analyzer;

import com.team.idletask.model.candidate.TaskCandidate;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Total order used to pick one candidate: highest score first, then the more
 * pressing priority, then the smaller candidate id.
 */
public final class CandidateRanking {

    public static final Comparator<TaskCandidate> BEST_FIRST =
            Comparator.comparingDouble(TaskCandidate::getScore).reversed()
                    .thenComparing(CandidateRanking::priorityRank)
                    .thenComparing(CandidateRanking::candidateId);

    private CandidateRanking() {
    }

    public static Optional<TaskCandidate> best(List<TaskCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return candidates.stream().min(BEST_FIRST);
    }

    private static int priorityRank(TaskCandidate candidate) {
        // unset priority sorts after LOW
        return candidate.getPriority() != null ? candidate.getPriority().getRank() : Integer.MAX_VALUE;
    }

    private static String candidateId(TaskCandidate candidate) {
        return candidate.getCandidateId() != null ? candidate.getCandidateId() : "";
    }
}
