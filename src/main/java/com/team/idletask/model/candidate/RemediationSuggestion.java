package com.team.idletask.model.candidate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A concrete follow-up attached to a candidate: a command to run, a link to
 * read, or a note for manual review.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RemediationSuggestion {

    private Type type;
    private String description;
    private String command;
    private String link;
    private Priority priority;
    private String expectedOutcome;
    private String warning;

    public enum Type {
        @JsonProperty("dependency-update") DEPENDENCY_UPDATE(true),
        @JsonProperty("package-manager-upgrade") PACKAGE_MANAGER_UPGRADE(true),
        @JsonProperty("shell-command") SHELL_COMMAND(true),
        @JsonProperty("security-advisory-link") SECURITY_ADVISORY_LINK(false),
        @JsonProperty("manual-review") MANUAL_REVIEW(false),
        @JsonProperty("migration-guide") MIGRATION_GUIDE(false),
        @JsonProperty("package-replacement") PACKAGE_REPLACEMENT(true),
        @JsonProperty("documentation-pointer") DOCUMENTATION_POINTER(false),
        @JsonProperty("testing-reminder") TESTING_REMINDER(false);

        private final boolean requiresCommand;

        Type(boolean requiresCommand) {
            this.requiresCommand = requiresCommand;
        }

        /** Suggestions of these types are always executed as a command. */
        public boolean requiresCommand() {
            return requiresCommand;
        }
    }

    public enum Priority {
        @JsonProperty("critical") CRITICAL,
        @JsonProperty("high") HIGH,
        @JsonProperty("medium") MEDIUM,
        @JsonProperty("low") LOW
    }
}
