package com.team.idletask.model.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A known vulnerability in an installed dependency.
 * The severity is already resolved to one of four levels; CVSS conversion happens upstream.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SecurityVulnerability {

    private String name;
    private String cveId;              // real CVE, vendor advisory id, or NO-CVE-* placeholder
    private VulnerabilitySeverity severity;
    private String affectedVersions;
    private String description;
}
