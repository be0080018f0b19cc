package com.team.idletask.analyzer;

import com.team.idletask.model.candidate.RemediationSuggestion;
import com.team.idletask.model.candidate.TaskCandidate;
import com.team.idletask.model.candidate.TaskCandidate.Effort;
import com.team.idletask.model.candidate.TaskCandidate.Priority;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shared scoring vocabulary and candidate construction for all analyzers.
 */
public abstract class BaseAnalyzer implements StrategyAnalyzer {

    private static final Pattern UNSAFE_ID_CHARS = Pattern.compile("[^a-zA-Z0-9-]");

    @Override
    public Optional<TaskCandidate> prioritize(List<TaskCandidate> candidates) {
        return CandidateRanking.best(candidates);
    }

    protected TaskCandidate createCandidate(String candidateId, String title, String description,
                                            Priority priority, Effort effort, String rationale,
                                            double score) {
        return createCandidate(candidateId, title, description, priority, effort, rationale, score, List.of());
    }

    protected TaskCandidate createCandidate(String candidateId, String title, String description,
                                            Priority priority, Effort effort, String rationale,
                                            double score, List<RemediationSuggestion> suggestions) {
        return TaskCandidate.builder()
                .candidateId(candidateId)
                .title(title)
                .description(description)
                .priority(priority)
                .effort(effort)
                .workflow(type().getWorkflow())
                .rationale(rationale)
                .score(score)
                .remediationSuggestions(new ArrayList<>(suggestions))
                .build();
    }

    /**
     * Replace every character outside {@code [A-Za-z0-9-]} with {@code -}.
     * The result is a stable routing key for a given natural key.
     */
    public static String sanitizeId(String naturalKey) {
        if (naturalKey == null || naturalKey.isEmpty()) {
            return "unknown";
        }
        return UNSAFE_ID_CHARS.matcher(naturalKey).replaceAll("-");
    }

    protected static <T> List<T> orEmpty(List<T> list) {
        if (list == null) return List.of();
        return list.stream().filter(Objects::nonNull).collect(Collectors.toList());
    }

    protected static String plural(int count, String singular, String plural) {
        return count == 1 ? singular : plural;
    }

    protected static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    /**
     * Join the first {@code limit} items and append an ellipsis when more exist.
     */
    protected static String sample(List<String> items, int limit) {
        String joined = items.stream().limit(limit).collect(Collectors.joining(", "));
        return items.size() > limit ? joined + "..." : joined;
    }

    /** Last path segment, used for short file names in titles. */
    protected static String fileName(String path) {
        if (path == null || path.isEmpty()) return "unknown file";
        String normalized = path.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        String name = slash >= 0 ? normalized.substring(slash + 1) : normalized;
        return name.isEmpty() ? path : name;
    }
}
