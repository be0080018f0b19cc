package com.team.idletask.controller;

import com.team.idletask.model.analysis.ProjectAnalysis;
import com.team.idletask.model.analysis.SecurityVulnerability;
import com.team.idletask.model.analysis.VulnerabilitySeverity;
import com.team.idletask.model.candidate.IdleTask;
import com.team.idletask.model.candidate.TaskCandidate;
import com.team.idletask.service.security.VulnerabilityParser;
import com.team.idletask.service.selection.IdleTaskGenerator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = IdleTaskController.class)
class IdleTaskControllerTest {

    @Autowired MockMvc mvc;
    @MockBean IdleTaskGenerator idleTaskGenerator;
    @MockBean VulnerabilityParser vulnerabilityParser;

    @Test
    void health_reportsUp() throws Exception {
        mvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("Idle Task Engine"));
    }

    @Test
    void candidates_returnsGeneratedList() throws Exception {
        when(idleTaskGenerator.generateCandidates(any(ProjectAnalysis.class))).thenReturn(List.of(
                TaskCandidate.builder()
                        .candidateId("docs-improve-docs-coverage").title("Improve Documentation Coverage")
                        .score(0.6).priority(TaskCandidate.Priority.NORMAL).effort(TaskCandidate.Effort.MEDIUM)
                        .workflow("documentation")
                        .build()));

        mvc.perform(post("/api/idle/candidates").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documentation\": {\"coverage\": 35.0}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].candidateId").value("docs-improve-docs-coverage"))
                .andExpect(jsonPath("$[0].priority").value("normal"))
                .andExpect(jsonPath("$[0].effort").value("medium"));
    }

    @Test
    void select_returnsTask() throws Exception {
        when(idleTaskGenerator.selectTask(any(ProjectAnalysis.class))).thenReturn(Optional.of(
                IdleTask.builder()
                        .id("idle-security-critical-CVE-2021-44228")
                        .type("maintenance")
                        .candidateId("security-critical-CVE-2021-44228")
                        .priority(TaskCandidate.Priority.URGENT)
                        .score(1.0)
                        .build()));

        mvc.perform(post("/api/idle/select").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("idle-security-critical-CVE-2021-44228"))
                .andExpect(jsonPath("$.type").value("maintenance"))
                .andExpect(jsonPath("$.priority").value("urgent"));
    }

    @Test
    void select_noCandidate_returnsNoContent() throws Exception {
        when(idleTaskGenerator.selectTask(any(ProjectAnalysis.class))).thenReturn(Optional.empty());

        mvc.perform(post("/api/idle/select").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void missingSnapshot_returnsBadRequest() throws Exception {
        when(idleTaskGenerator.generateCandidates(isNull()))
                .thenThrow(new IllegalArgumentException("Project analysis snapshot is required"));

        mvc.perform(post("/api/idle/candidates").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Project analysis snapshot is required"));
    }

    @Test
    void npmAudit_returnsParsedRecords() throws Exception {
        when(vulnerabilityParser.parseNpmAuditOutput(anyString())).thenReturn(List.of(
                SecurityVulnerability.builder()
                        .name("lodash").cveId("CVE-2021-23337").severity(VulnerabilitySeverity.HIGH)
                        .affectedVersions("<4.17.21").description("Command Injection in lodash")
                        .build()));

        mvc.perform(post("/api/idle/npm-audit").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vulnerabilities\": {}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("lodash"))
                .andExpect(jsonPath("$[0].cveId").value("CVE-2021-23337"))
                .andExpect(jsonPath("$[0].severity").value("high"));
    }
}
