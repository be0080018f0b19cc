package com.team.idletask.service.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.idletask.analyzer.BaseAnalyzer;
import com.team.idletask.model.analysis.SecurityVulnerability;
import com.team.idletask.model.analysis.VulnerabilitySeverity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CVE and CVSS helpers plus conversion of npm audit JSON into
 * {@link SecurityVulnerability} records.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VulnerabilityParser {

    private static final Pattern CVE_EXACT = Pattern.compile("^CVE-\\d{4}-\\d{4,}$");
    private static final Pattern CVE_IN_TEXT = Pattern.compile("\\bCVE-\\d{4}-\\d{4,}\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCORE_IN_TEXT = Pattern.compile(":\\s*(-?\\d+(?:\\.\\d+)?)");

    private static final String[] SCORE_KEYS = {"score", "baseScore"};
    private static final String[] NESTED_KEYS = {"cvss", "cvssV3", "cvssV2"};

    static final String SYNTHETIC_CVE_PREFIX = "NO-CVE-";

    private final ObjectMapper objectMapper;

    // ========== CVE identifiers ==========

    public boolean isValidCve(String cveId) {
        return cveId != null && CVE_EXACT.matcher(cveId).matches();
    }

    /**
     * CVE ids found in free text, upper-cased, in order of first appearance.
     */
    public List<String> extractCves(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = CVE_IN_TEXT.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group().toUpperCase(Locale.ROOT));
        }
        return new ArrayList<>(found);
    }

    // ========== CVSS ==========

    /**
     * Read a CVSS base score from a number, a numeric string, free text such
     * as "CVSS: 7.5", or a nested map. Scores above 10 are clamped to 10.
     */
    public Optional<Double> parseCvssScore(Object value) {
        Double score = extractScore(value);
        if (score == null || score.isNaN() || score.isInfinite() || score < 0) {
            return Optional.empty();
        }
        return Optional.of(Math.min(10.0, score));
    }

    private Double extractScore(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            return scoreFromText((String) value);
        }
        if (value instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) value;
            for (String key : SCORE_KEYS) {
                if (map.containsKey(key)) {
                    Double score = extractScore(map.get(key));
                    if (score != null) return score;
                }
            }
            for (String key : NESTED_KEYS) {
                if (map.containsKey(key)) {
                    Double score = extractScore(map.get(key));
                    if (score != null) return score;
                }
            }
        }
        return null;
    }

    private Double scoreFromText(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(trimmed);
        } catch (NumberFormatException e) {
            Matcher matcher = SCORE_IN_TEXT.matcher(trimmed);
            return matcher.find() ? Double.parseDouble(matcher.group(1)) : null;
        }
    }

    public VulnerabilitySeverity severityFromCvss(double score) {
        if (score >= 9.0) return VulnerabilitySeverity.CRITICAL;
        if (score >= 7.0) return VulnerabilitySeverity.HIGH;
        if (score >= 4.0) return VulnerabilitySeverity.MEDIUM;
        return VulnerabilitySeverity.LOW;
    }

    /**
     * Map a scanner label to a severity. "moderate" is npm's name for medium;
     * anything unrecognized is treated as low.
     */
    public VulnerabilitySeverity parseSeverityLabel(String label) {
        if (label == null) return VulnerabilitySeverity.LOW;
        return switch (label.trim().toLowerCase(Locale.ROOT)) {
            case "critical" -> VulnerabilitySeverity.CRITICAL;
            case "high" -> VulnerabilitySeverity.HIGH;
            case "medium", "moderate" -> VulnerabilitySeverity.MEDIUM;
            default -> VulnerabilitySeverity.LOW;
        };
    }

    // ========== Records ==========

    /**
     * Complete a partially filled vulnerability: a missing CVE id becomes
     * {@code NO-CVE-<NAME>} and a missing severity becomes low.
     */
    public SecurityVulnerability createVulnerability(SecurityVulnerability partial) {
        String name = partial.getName() != null && !partial.getName().isBlank() ? partial.getName().trim() : "unknown";
        String cveId = partial.getCveId() != null && !partial.getCveId().isBlank()
                ? partial.getCveId().trim()
                : syntheticCveId(name);

        return SecurityVulnerability.builder()
                .name(name)
                .cveId(cveId)
                .severity(partial.getSeverity() != null ? partial.getSeverity() : VulnerabilitySeverity.LOW)
                .affectedVersions(partial.getAffectedVersions() != null ? partial.getAffectedVersions() : "")
                .description(partial.getDescription() != null ? partial.getDescription() : "")
                .build();
    }

    public boolean isValidVulnerability(SecurityVulnerability vulnerability) {
        return vulnerability != null
                && vulnerability.getName() != null && !vulnerability.getName().isBlank()
                && vulnerability.getCveId() != null && !vulnerability.getCveId().isBlank()
                && vulnerability.getSeverity() != null;
    }

    static String syntheticCveId(String packageName) {
        return SYNTHETIC_CVE_PREFIX + BaseAnalyzer.sanitizeId(packageName.toUpperCase(Locale.ROOT));
    }

    // ========== npm audit ==========

    /**
     * Parse {@code npm audit --json} output. Supports the npm 7+ format
     * (top-level "vulnerabilities" keyed by package) and the npm 6 format
     * (top-level "advisories" keyed by advisory id). Malformed input yields an
     * empty list.
     */
    public List<SecurityVulnerability> parseNpmAuditOutput(String rawJson) {
        if (rawJson == null || rawJson.isBlank()) {
            return List.of();
        }
        try {
            JsonNode root = objectMapper.readTree(rawJson);
            List<SecurityVulnerability> result = new ArrayList<>();

            if (root.path("vulnerabilities").isObject()) {
                parseVulnerabilitiesSection(root.get("vulnerabilities"), result);
            } else if (root.path("advisories").isObject()) {
                parseAdvisoriesSection(root.get("advisories"), result);
            } else {
                log.warn("npm audit output has neither 'vulnerabilities' nor 'advisories'");
            }

            log.info("Parsed {} vulnerabilities from npm audit output", result.size());
            return result;

        } catch (Exception e) {
            log.error("Failed to parse npm audit output: {}", e.getMessage());
            return List.of();
        }
    }

    private void parseVulnerabilitiesSection(JsonNode vulnerabilities, List<SecurityVulnerability> result) {
        Iterator<Map.Entry<String, JsonNode>> fields = vulnerabilities.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode node = entry.getValue();
            String name = node.path("name").asText(entry.getKey());

            StringBuilder advisoryText = new StringBuilder();
            String title = null;
            Double cvss = null;
            for (JsonNode via : node.path("via")) {
                // string entries only name the transitive package that pulls the issue in
                if (!via.isObject()) continue;
                if (title == null && via.hasNonNull("title")) {
                    title = via.get("title").asText();
                }
                advisoryText.append(' ').append(via.path("title").asText(""))
                        .append(' ').append(via.path("url").asText(""));
                if (cvss == null && via.has("cvss")) {
                    cvss = parseCvssScore(objectMapper.convertValue(via.get("cvss"), Object.class)).orElse(null);
                }
            }

            VulnerabilitySeverity severity = node.hasNonNull("severity")
                    ? parseSeverityLabel(node.get("severity").asText())
                    : cvss != null ? severityFromCvss(cvss) : VulnerabilitySeverity.LOW;

            addRecords(name, extractCves(advisoryText.toString()), severity,
                    node.path("range").asText(""), title != null ? title : "", result);
        }
    }

    private void parseAdvisoriesSection(JsonNode advisories, List<SecurityVulnerability> result) {
        for (JsonNode advisory : advisories) {
            String name = advisory.path("module_name").asText("");

            List<String> cves = new ArrayList<>();
            for (JsonNode cve : advisory.path("cves")) {
                String id = cve.asText("").trim().toUpperCase(Locale.ROOT);
                if (isValidCve(id) && !cves.contains(id)) {
                    cves.add(id);
                }
            }
            if (cves.isEmpty()) {
                cves.addAll(extractCves(advisory.path("title").asText("") + " " + advisory.path("url").asText("")));
            }

            String description = advisory.hasNonNull("title")
                    ? advisory.get("title").asText()
                    : advisory.path("overview").asText("");

            addRecords(name, cves, parseSeverityLabel(advisory.path("severity").asText(null)),
                    advisory.path("vulnerable_versions").asText(""), description, result);
        }
    }

    private void addRecords(String name, List<String> cves, VulnerabilitySeverity severity,
                            String affectedVersions, String description, List<SecurityVulnerability> result) {
        if (cves.isEmpty()) {
            result.add(createVulnerability(SecurityVulnerability.builder()
                    .name(name)
                    .severity(severity)
                    .affectedVersions(affectedVersions)
                    .description(description)
                    .build()));
            return;
        }
        for (String cve : cves) {
            result.add(createVulnerability(SecurityVulnerability.builder()
                    .name(name)
                    .cveId(cve)
                    .severity(severity)
                    .affectedVersions(affectedVersions)
                    .description(description)
                    .build()));
        }
    }
}
