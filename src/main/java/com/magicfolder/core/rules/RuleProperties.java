package com.magicfolder.core.rules;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Optional overrides for the built-in rule table. Empty sections fall back to
 * {@link RuleSet#defaults()}.
 */
@Component
@ConfigurationProperties(prefix = "magicfolder.rules")
public class RuleProperties {

    /** Category label to extensions, e.g. {@code Audio: [mp3, wav]}. */
    private Map<String, List<String>> hardRules = new LinkedHashMap<>();
    private List<Keyword> keywordRules = new ArrayList<>();

    public Map<String, List<String>> getHardRules() {
        return hardRules;
    }

    public void setHardRules(Map<String, List<String>> hardRules) {
        this.hardRules = hardRules;
    }

    public List<Keyword> getKeywordRules() {
        return keywordRules;
    }

    public void setKeywordRules(List<Keyword> keywordRules) {
        this.keywordRules = keywordRules;
    }

    public static class Keyword {
        private String category;
        private List<String> keywords = List.of();

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public List<String> getKeywords() {
            return keywords;
        }

        public void setKeywords(List<String> keywords) {
            this.keywords = keywords;
        }
    }
}
