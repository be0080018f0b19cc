package com.team.idletask.config;

import com.team.idletask.config.DocsRulesConfig.DocsRules;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocsRulesConfigTest {

    private final DocsRulesConfig config = new DocsRulesConfig();

    @Test
    void load_readsKeywordsFromClasspath() {
        DocsRules rules = config.load(DocsRulesConfig.RESOURCE);

        assertThat(rules.getCoreModuleKeywords()).containsExactly("index", "core", "main", "api", "service");
    }

    @Test
    void load_missingResourceFallsBackToDefaults() {
        DocsRules rules = config.load("no-such-rules.yml");

        assertThat(rules.getCoreModuleKeywords()).isEqualTo(new DocsRules().getCoreModuleKeywords());
    }
}
