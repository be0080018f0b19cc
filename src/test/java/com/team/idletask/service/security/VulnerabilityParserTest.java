package com.team.idletask.service.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.idletask.model.analysis.SecurityVulnerability;
import com.team.idletask.model.analysis.VulnerabilitySeverity;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VulnerabilityParserTest {

    private final VulnerabilityParser parser = new VulnerabilityParser(new ObjectMapper());

    // ========== CVE ids ==========

    @Test
    void isValidCve_requiresCanonicalForm() {
        assertThat(parser.isValidCve("CVE-2021-44228")).isTrue();
        assertThat(parser.isValidCve("CVE-2021-1234567")).isTrue();
        assertThat(parser.isValidCve("CVE-2021-123")).isFalse();
        assertThat(parser.isValidCve("cve-2021-44228")).isFalse();
        assertThat(parser.isValidCve(" CVE-2021-44228")).isFalse();
        assertThat(parser.isValidCve("GHSA-jfh8-c2jp-5v3q")).isFalse();
        assertThat(parser.isValidCve(null)).isFalse();
    }

    @Test
    void extractCves_keepsFirstMatchOrderAndUpperCases() {
        List<String> cves = parser.extractCves(
                "Fixes CVE-2021-44228 and cve-2021-45046; see also CVE-2021-44228 and CVE-2019-10744.");

        assertThat(cves).containsExactly("CVE-2021-44228", "CVE-2021-45046", "CVE-2019-10744");
        assertThat(parser.extractCves("no identifiers here")).isEmpty();
        assertThat(parser.extractCves(null)).isEmpty();
    }

    // ========== CVSS ==========

    @Test
    void parseCvssScore_acceptsNumbersAndText() {
        assertThat(parser.parseCvssScore(7.5)).hasValue(7.5);
        assertThat(parser.parseCvssScore(9)).hasValue(9.0);
        assertThat(parser.parseCvssScore("5.3")).hasValue(5.3);
        assertThat(parser.parseCvssScore("CVSS: 8.1")).hasValue(8.1);
        assertThat(parser.parseCvssScore("CVSS:3.1 score: 6.4")).isPresent();
    }

    @Test
    void parseCvssScore_readsNestedObjects() {
        assertThat(parser.parseCvssScore(Map.of("score", 6.5))).hasValue(6.5);
        assertThat(parser.parseCvssScore(Map.of("baseScore", "4.2"))).hasValue(4.2);
        assertThat(parser.parseCvssScore(Map.of("cvss", Map.of("score", 9.8)))).hasValue(9.8);
        assertThat(parser.parseCvssScore(Map.of("cvssV3", Map.of("baseScore", 7.0)))).hasValue(7.0);
    }

    @Test
    void parseCvssScore_clampsAndRejects() {
        assertThat(parser.parseCvssScore(12.0)).hasValue(10.0);
        assertThat(parser.parseCvssScore(-1.0)).isEmpty();
        assertThat(parser.parseCvssScore("-3")).isEmpty();
        assertThat(parser.parseCvssScore(Double.NaN)).isEmpty();
        assertThat(parser.parseCvssScore("high")).isEmpty();
        assertThat(parser.parseCvssScore(List.of(5.0))).isEmpty();
        assertThat(parser.parseCvssScore(Map.of("vector", "AV:N"))).isEmpty();
        assertThat(parser.parseCvssScore(null)).isEmpty();
    }

    @Test
    void severityFromCvss_boundaries() {
        assertThat(parser.severityFromCvss(0.0)).isEqualTo(VulnerabilitySeverity.LOW);
        assertThat(parser.severityFromCvss(3.9)).isEqualTo(VulnerabilitySeverity.LOW);
        assertThat(parser.severityFromCvss(4.0)).isEqualTo(VulnerabilitySeverity.MEDIUM);
        assertThat(parser.severityFromCvss(6.9)).isEqualTo(VulnerabilitySeverity.MEDIUM);
        assertThat(parser.severityFromCvss(7.0)).isEqualTo(VulnerabilitySeverity.HIGH);
        assertThat(parser.severityFromCvss(8.9)).isEqualTo(VulnerabilitySeverity.HIGH);
        assertThat(parser.severityFromCvss(9.0)).isEqualTo(VulnerabilitySeverity.CRITICAL);
        assertThat(parser.severityFromCvss(10.0)).isEqualTo(VulnerabilitySeverity.CRITICAL);
    }

    @Test
    void parseSeverityLabel_isLenient() {
        assertThat(parser.parseSeverityLabel("  CRITICAL ")).isEqualTo(VulnerabilitySeverity.CRITICAL);
        assertThat(parser.parseSeverityLabel("High")).isEqualTo(VulnerabilitySeverity.HIGH);
        assertThat(parser.parseSeverityLabel("moderate")).isEqualTo(VulnerabilitySeverity.MEDIUM);
        assertThat(parser.parseSeverityLabel("medium")).isEqualTo(VulnerabilitySeverity.MEDIUM);
        assertThat(parser.parseSeverityLabel("info")).isEqualTo(VulnerabilitySeverity.LOW);
        assertThat(parser.parseSeverityLabel(null)).isEqualTo(VulnerabilitySeverity.LOW);
    }

    // ========== Records ==========

    @Test
    void createVulnerability_fillsSyntheticIdAndLowSeverity() {
        SecurityVulnerability created = parser.createVulnerability(
                SecurityVulnerability.builder().name("left-pad").build());

        assertThat(created.getCveId()).isEqualTo("NO-CVE-LEFT-PAD");
        assertThat(created.getSeverity()).isEqualTo(VulnerabilitySeverity.LOW);
        assertThat(parser.isValidVulnerability(created)).isTrue();

        SecurityVulnerability scoped = parser.createVulnerability(
                SecurityVulnerability.builder().name("@scope/pkg").cveId("CVE-2020-8203").severity(VulnerabilitySeverity.HIGH).build());
        assertThat(scoped.getCveId()).isEqualTo("CVE-2020-8203");
        assertThat(scoped.getSeverity()).isEqualTo(VulnerabilitySeverity.HIGH);
        assertThat(parser.createVulnerability(SecurityVulnerability.builder().name("@scope/pkg").build()).getCveId())
                .isEqualTo("NO-CVE--SCOPE-PKG");
    }

    @Test
    void isValidVulnerability_requiresNameIdAndSeverity() {
        assertThat(parser.isValidVulnerability(null)).isFalse();
        assertThat(parser.isValidVulnerability(SecurityVulnerability.builder()
                .name("lodash").cveId("CVE-2020-8203").build())).isFalse();
        assertThat(parser.isValidVulnerability(SecurityVulnerability.builder()
                .name(" ").cveId("CVE-2020-8203").severity(VulnerabilitySeverity.LOW).build())).isFalse();
        assertThat(parser.isValidVulnerability(SecurityVulnerability.builder()
                .name("lodash").cveId("CVE-2020-8203").severity(VulnerabilitySeverity.LOW).build())).isTrue();
    }

    // ========== npm audit ==========

    @Test
    void parseNpmAuditOutput_v7Format() {
        String json = "{\n" +
                "  \"auditReportVersion\": 2,\n" +
                "  \"vulnerabilities\": {\n" +
                "    \"lodash\": {\n" +
                "      \"name\": \"lodash\",\n" +
                "      \"severity\": \"high\",\n" +
                "      \"range\": \"<4.17.21\",\n" +
                "      \"via\": [\n" +
                "        {\"title\": \"Command Injection in lodash (CVE-2021-23337)\", \"url\": \"https://github.com/advisories/GHSA-35jh-r3h4-6jhm\", \"cvss\": {\"score\": 7.2}}\n" +
                "      ]\n" +
                "    },\n" +
                "    \"nth-check\": {\n" +
                "      \"name\": \"nth-check\",\n" +
                "      \"severity\": \"moderate\",\n" +
                "      \"range\": \"<2.0.1\",\n" +
                "      \"via\": [\"css-select\", {\"title\": \"Inefficient Regular Expression Complexity\", \"url\": \"https://github.com/advisories/GHSA-rp65-9cf3-cjxr\"}]\n" +
                "    }\n" +
                "  }\n" +
                "}";

        List<SecurityVulnerability> result = parser.parseNpmAuditOutput(json);

        assertThat(result).hasSize(2);
        SecurityVulnerability lodash = result.get(0);
        assertThat(lodash.getName()).isEqualTo("lodash");
        assertThat(lodash.getCveId()).isEqualTo("CVE-2021-23337");
        assertThat(lodash.getSeverity()).isEqualTo(VulnerabilitySeverity.HIGH);
        assertThat(lodash.getAffectedVersions()).isEqualTo("<4.17.21");
        assertThat(lodash.getDescription()).contains("Command Injection");

        SecurityVulnerability nthCheck = result.get(1);
        assertThat(nthCheck.getCveId()).isEqualTo("NO-CVE-NTH-CHECK");
        assertThat(nthCheck.getSeverity()).isEqualTo(VulnerabilitySeverity.MEDIUM);
        assertThat(result).allMatch(parser::isValidVulnerability);
    }

    @Test
    void parseNpmAuditOutput_severityFromCvssWhenLabelMissing() {
        String json = "{\"vulnerabilities\": {\"minimist\": {\"name\": \"minimist\", \"range\": \"<1.2.6\"," +
                " \"via\": [{\"title\": \"Prototype Pollution\", \"cvss\": {\"score\": 9.8}}]}}}";

        assertThat(parser.parseNpmAuditOutput(json))
                .singleElement()
                .extracting(SecurityVulnerability::getSeverity)
                .isEqualTo(VulnerabilitySeverity.CRITICAL);
    }

    @Test
    void parseNpmAuditOutput_v6Format() {
        String json = "{\"advisories\": {\"1523\": {\"module_name\": \"lodash\", \"severity\": \"low\"," +
                " \"cves\": [\"CVE-2019-10744\", \"CVE-2020-8203\"], \"vulnerable_versions\": \"<4.17.19\"," +
                " \"title\": \"Prototype Pollution\"}}}";

        List<SecurityVulnerability> result = parser.parseNpmAuditOutput(json);

        assertThat(result).extracting(SecurityVulnerability::getCveId).containsExactly("CVE-2019-10744", "CVE-2020-8203");
        assertThat(result).allSatisfy(v -> {
            assertThat(v.getName()).isEqualTo("lodash");
            assertThat(v.getSeverity()).isEqualTo(VulnerabilitySeverity.LOW);
            assertThat(v.getAffectedVersions()).isEqualTo("<4.17.19");
        });
    }

    @Test
    void parseNpmAuditOutput_malformedInputYieldsEmptyList() {
        assertThat(parser.parseNpmAuditOutput("not json")).isEmpty();
        assertThat(parser.parseNpmAuditOutput("{\"metadata\": {}}")).isEmpty();
        assertThat(parser.parseNpmAuditOutput("")).isEmpty();
        assertThat(parser.parseNpmAuditOutput(null)).isEmpty();
    }
}
