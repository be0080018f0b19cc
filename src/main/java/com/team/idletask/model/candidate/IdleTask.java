package com.team.idletask.model.candidate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * The selected candidate as handed to the task execution subsystem.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IdleTask {

    private String id;
    private String type;                 // analyzer category that produced the candidate
    private String candidateId;
    private String title;
    private String description;
    private TaskCandidate.Priority priority;
    private TaskCandidate.Effort estimatedEffort;
    private String suggestedWorkflow;
    private String rationale;
    private double score;
    private List<RemediationSuggestion> remediationSuggestions;

    // Metadata
    private LocalDateTime createdAt;
    private boolean implemented;
}
