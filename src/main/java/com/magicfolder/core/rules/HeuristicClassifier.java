package com.magicfolder.core.rules;

import com.magicfolder.core.model.Category;
import com.magicfolder.core.model.FileExtensions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic, rule-based first tier of classification.
 * <p>
 * Phase 1 checks the extension against the hard rules (audio, video, archives);
 * a hit is final and content is never inspected. Phase 2 lower-cases the content
 * and walks the keyword rules in order, returning the first rule with any
 * substring hit. Anything else is {@link Category#MISC}.
 */
@Service
public class HeuristicClassifier {

    private static final Logger log = LoggerFactory.getLogger(HeuristicClassifier.class);

    /** How a verdict was reached. */
    public enum Source { HARD_RULE, KEYWORD, DEFAULT }

    public record Verdict(Category category, Source source, String matchedKeyword) {

        static Verdict fallback() {
            return new Verdict(Category.MISC, Source.DEFAULT, null);
        }

        public boolean isHardRule() {
            return source == Source.HARD_RULE;
        }
    }

    private final RuleSet ruleSet;

    public HeuristicClassifier(RuleSet ruleSet) {
        this.ruleSet = ruleSet;
    }

    public Category classify(String path, String content) {
        return evaluate(path, content).category();
    }

    public Verdict evaluate(String path, String content) {
        Optional<Category> hard = ruleSet.hardRuleFor(FileExtensions.of(path));
        if (hard.isPresent()) {
            return new Verdict(hard.get(), Source.HARD_RULE, null);
        }
        if (content == null || content.isEmpty()) {
            return Verdict.fallback();
        }

        String lowerContent = content.toLowerCase(Locale.ROOT);
        for (KeywordRule rule : ruleSet.keywordRules()) {
            Optional<String> keyword = rule.firstMatch(lowerContent);
            if (keyword.isPresent()) {
                log.debug("{} matched keyword '{}' -> {}", path, keyword.get(), rule.category());
                return new Verdict(rule.category(), Source.KEYWORD, keyword.get());
            }
        }
        return Verdict.fallback();
    }
}
