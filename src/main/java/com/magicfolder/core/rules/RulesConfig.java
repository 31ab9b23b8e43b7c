package com.magicfolder.core.rules;

import com.magicfolder.core.model.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Configuration
public class RulesConfig {

    private static final Logger log = LoggerFactory.getLogger(RulesConfig.class);

    /**
     * Builds the rule table once at startup. Unknown category labels fail the
     * context rather than silently dropping a rule.
     */
    @Bean
    public RuleSet ruleSet(RuleProperties properties) {
        Map<String, Category> hardRules = properties.getHardRules().isEmpty()
                ? RuleSet.defaultHardRules()
                : toHardRules(properties.getHardRules());
        List<KeywordRule> keywordRules = properties.getKeywordRules().isEmpty()
                ? RuleSet.defaultKeywordRules()
                : toKeywordRules(properties.getKeywordRules());

        var ruleSet = new RuleSet(hardRules, keywordRules);
        log.info("Rule set loaded: {} hard-rule extensions, {} keyword rules",
                ruleSet.hardRuleExtensions().size(), ruleSet.keywordRules().size());
        return ruleSet;
    }

    static Map<String, Category> toHardRules(Map<String, List<String>> configured) {
        var rules = new LinkedHashMap<String, Category>();
        configured.forEach((label, extensions) -> {
            Category category = resolve(label);
            for (String extension : extensions) {
                rules.put(extension, category);
            }
        });
        return rules;
    }

    static List<KeywordRule> toKeywordRules(List<RuleProperties.Keyword> configured) {
        var rules = new ArrayList<KeywordRule>();
        for (var entry : configured) {
            rules.add(new KeywordRule(resolve(entry.getCategory()), entry.getKeywords()));
        }
        return rules;
    }

    private static Category resolve(String label) {
        return Category.fromLabel(label).orElseThrow(() ->
                new IllegalStateException("Unknown category in magicfolder.rules: " + label));
    }
}
