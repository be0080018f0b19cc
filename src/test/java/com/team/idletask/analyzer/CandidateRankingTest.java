package com.team.idletask.analyzer;

import com.team.idletask.model.candidate.TaskCandidate;
import com.team.idletask.model.candidate.TaskCandidate.Priority;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CandidateRankingTest {

    @Test
    void best_picksHighestScore() {
        List<TaskCandidate> candidates = List.of(
                candidate("a", 0.4, Priority.URGENT),
                candidate("b", 0.9, Priority.LOW),
                candidate("c", 0.7, Priority.HIGH));

        assertThat(CandidateRanking.best(candidates)).map(TaskCandidate::getCandidateId).hasValue("b");
    }

    @Test
    void equalScores_fallBackToPriorityThenId() {
        List<TaskCandidate> byPriority = List.of(
                candidate("a", 0.8, Priority.NORMAL),
                candidate("b", 0.8, Priority.HIGH));
        assertThat(CandidateRanking.best(byPriority)).map(TaskCandidate::getCandidateId).hasValue("b");

        List<TaskCandidate> byId = List.of(
                candidate("outdated-major-vue", 0.8, Priority.HIGH),
                candidate("deprecated-pkg-tslint", 0.8, Priority.HIGH),
                candidate("outdated-major-react", 0.8, Priority.HIGH));
        assertThat(CandidateRanking.best(byId)).map(TaskCandidate::getCandidateId).hasValue("deprecated-pkg-tslint");
    }

    @Test
    void selection_doesNotDependOnInputOrder() {
        List<TaskCandidate> candidates = new ArrayList<>(List.of(
                candidate("x", 0.8, Priority.HIGH),
                candidate("y", 0.8, null),
                candidate("w", 0.8, Priority.HIGH)));
        String forward = CandidateRanking.best(candidates).orElseThrow().getCandidateId();

        java.util.Collections.reverse(candidates);
        String backward = CandidateRanking.best(candidates).orElseThrow().getCandidateId();

        assertThat(forward).isEqualTo("w").isEqualTo(backward);
    }

    @Test
    void emptyOrNull_returnsEmpty() {
        assertThat(CandidateRanking.best(List.of())).isEmpty();
        assertThat(CandidateRanking.best(null)).isEmpty();
    }

    @Test
    void sanitizeId_replacesUnsafeCharacters() {
        assertThat(BaseAnalyzer.sanitizeId("CVE-2021-44228")).isEqualTo("CVE-2021-44228");
        assertThat(BaseAnalyzer.sanitizeId("@babel/core")).isEqualTo("-babel-core");
        assertThat(BaseAnalyzer.sanitizeId("lodash.merge")).isEqualTo("lodash-merge");
        assertThat(BaseAnalyzer.sanitizeId("päckage name")).isEqualTo("p-ckage-name");
        assertThat(BaseAnalyzer.sanitizeId("")).isEqualTo("unknown");
        assertThat(BaseAnalyzer.sanitizeId(null)).isEqualTo("unknown");
    }

    @Test
    void dependencySource_precedenceRules() {
        DependencySource<String> emptyRichPresent = DependencySource.richWhenPresent(List.of(), List.of("a@^0.1.0"));
        assertThat(emptyRichPresent.isRich()).isTrue();
        assertThat(emptyRichPresent.legacy()).isEmpty();

        DependencySource<String> emptyRichNonEmpty = DependencySource.richWhenNonEmpty(List.of(), List.of("legacy"));
        assertThat(emptyRichNonEmpty.isRich()).isFalse();
        assertThat(emptyRichNonEmpty.legacy()).containsExactly("legacy");
        assertThat(emptyRichNonEmpty.rich()).isEmpty();

        DependencySource<String> absent = DependencySource.richWhenPresent(null, null);
        assertThat(absent.isRich()).isFalse();
        assertThat(absent.legacy()).isEmpty();
    }

    private static TaskCandidate candidate(String id, double score, Priority priority) {
        return TaskCandidate.builder().candidateId(id).score(score).priority(priority).build();
    }
}
