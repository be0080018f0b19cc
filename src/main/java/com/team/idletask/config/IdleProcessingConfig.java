package com.team.idletask.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Idle-time task selection settings.
 * The worker asks for one maintenance task while the project is quiet.
 */
@Configuration
@ConfigurationProperties(prefix = "workflow.idle-processing")
@Getter
@Setter
public class IdleProcessingConfig {

    /** Whether a task is handed off at all */
    private boolean enabled = true;

    /** Analyzer categories to skip (maintenance, docs, refactoring) */
    private List<String> disabledAnalyzers = new ArrayList<>();

    /** Base URL of the public advisory page, the CVE id is appended */
    private String advisoryBaseUrl = "https://nvd.nist.gov/vuln/detail/";
}
