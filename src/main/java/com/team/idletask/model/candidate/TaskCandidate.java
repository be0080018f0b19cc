package com.team.idletask.model.candidate;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One scored, actionable maintenance opportunity derived from a snapshot.
 * {@code candidateId} depends only on the issue's natural key, so an unchanged
 * project yields the same ids on every run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskCandidate {

    private String candidateId;
    private String title;
    private String description;
    private Priority priority;
    private Effort effort;
    private String workflow;         // downstream workflow that executes the task
    private String rationale;
    private double score;            // 0.0 - 1.0, the ranking key

    @Builder.Default
    private List<RemediationSuggestion> remediationSuggestions = new ArrayList<>();

    public enum Priority {
        @JsonProperty("urgent") URGENT(0),
        @JsonProperty("high") HIGH(1),
        @JsonProperty("normal") NORMAL(2),
        @JsonProperty("low") LOW(3);

        private final int rank;

        Priority(int rank) {
            this.rank = rank;
        }

        /** Lower rank means more pressing. */
        public int getRank() {
            return rank;
        }
    }

    public enum Effort {
        @JsonProperty("low") LOW,
        @JsonProperty("medium") MEDIUM,
        @JsonProperty("high") HIGH
    }
}
