package com.team.idletask.config;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Loads documentation rule settings from docs-rules.yml on the classpath.
 */
@Configuration
@Slf4j
public class DocsRulesConfig {

    static final String RESOURCE = "docs-rules.yml";

    @Bean
    public DocsRules docsRules() {
        return load(RESOURCE);
    }

    DocsRules load(String resource) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (inputStream == null) {
                log.warn("{} not found, using default docs rules", resource);
                return new DocsRules();
            }

            Map<String, Object> raw = new Yaml().load(inputStream);
            return parseDocsRules(raw);

        } catch (IOException | RuntimeException e) {
            log.error("Failed to load {}: {}", resource, e.getMessage());
            return new DocsRules();
        }
    }

    @SuppressWarnings("unchecked")
    private DocsRules parseDocsRules(Map<String, Object> raw) {
        DocsRules rules = new DocsRules();
        if (raw == null) {
            return rules;
        }

        Object keywords = raw.get("core-module-keywords");
        if (keywords instanceof List) {
            List<String> parsed = ((List<Object>) keywords).stream()
                    .filter(k -> k != null && !k.toString().isBlank())
                    .map(k -> k.toString().trim().toLowerCase())
                    .collect(Collectors.toList());
            if (!parsed.isEmpty()) {
                rules.setCoreModuleKeywords(parsed);
            }
        }

        log.info("Loaded docs rules with {} core module keywords", rules.getCoreModuleKeywords().size());
        return rules;
    }

    /**
     * Settings consumed by the docs analyzer.
     */
    @Data
    public static class DocsRules {
        /** A missing-doc file whose path contains one of these is a core module */
        private List<String> coreModuleKeywords = new ArrayList<>(List.of("index", "core", "main", "api", "service"));
    }
}
