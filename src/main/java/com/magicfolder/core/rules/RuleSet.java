package com.magicfolder.core.rules;

import com.magicfolder.core.model.Category;
import com.magicfolder.core.model.FileExtensions;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable rule table for the {@link HeuristicClassifier}: extension hard rules
 * plus an ordered list of keyword rules. Earlier keyword rules win.
 */
public final class RuleSet {

    private static final List<KeywordRule> DEFAULT_KEYWORD_RULES = List.of(
            KeywordRule.of(Category.TRAIN_TICKETS,
                    "irctc", "pnr", "electronic reservation slip", "train no", "berth", "boarding station"),
            KeywordRule.of(Category.INVOICES,
                    "invoice", "gstin", "tax invoice", "bill to", "amount due", "subtotal", "hsn"),
            KeywordRule.of(Category.MARKSHEETS,
                    "marksheet", "mark sheet", "statement of marks", "grade sheet", "cgpa", "sgpa",
                    "marks obtained"),
            KeywordRule.of(Category.ID_PROOFS,
                    "aadhaar", "aadhar", "passport", "permanent account number", "income tax department",
                    "driving licence", "driving license", "election commission", "voter id"),
            KeywordRule.of(Category.CREDENTIALS,
                    "password", "passwd", "api key", "api_key", "secret key", "access token",
                    "private key", "client secret"),
            KeywordRule.of(Category.NOTES,
                    "meeting notes", "minutes of meeting", "action items", "agenda", "todo", "to-do")
    );

    private static final Map<String, Category> DEFAULT_HARD_RULES = buildDefaultHardRules();

    private final Map<String, Category> hardRules;
    private final List<KeywordRule> keywordRules;

    public RuleSet(Map<String, Category> hardRules, List<KeywordRule> keywordRules) {
        var normalized = new LinkedHashMap<String, Category>();
        hardRules.forEach((extension, category) -> {
            if (category == Category.MISC) {
                throw new IllegalArgumentException("Hard rule for '" + extension + "' cannot map to Misc");
            }
            normalized.put(FileExtensions.normalize(extension), category);
        });
        this.hardRules = Map.copyOf(normalized);
        this.keywordRules = keywordRules.stream()
                .filter(rule -> !rule.keywords().isEmpty())
                .toList();
    }

    public static RuleSet defaults() {
        return new RuleSet(DEFAULT_HARD_RULES, DEFAULT_KEYWORD_RULES);
    }

    public static Map<String, Category> defaultHardRules() {
        return DEFAULT_HARD_RULES;
    }

    public static List<KeywordRule> defaultKeywordRules() {
        return DEFAULT_KEYWORD_RULES;
    }

    public Optional<Category> hardRuleFor(String extension) {
        return Optional.ofNullable(hardRules.get(FileExtensions.normalize(extension)));
    }

    public Set<String> hardRuleExtensions() {
        return hardRules.keySet();
    }

    /** Keyword rules in evaluation order. Rules with no usable keywords are not included. */
    public List<KeywordRule> keywordRules() {
        return keywordRules;
    }

    private static Map<String, Category> buildDefaultHardRules() {
        var rules = new LinkedHashMap<String, Category>();
        for (String ext : List.of("mp3", "wav", "flac", "aac", "ogg", "m4a", "wma")) {
            rules.put(ext, Category.AUDIO);
        }
        for (String ext : List.of("mp4", "mov", "avi", "mkv", "webm", "wmv", "flv", "m4v")) {
            rules.put(ext, Category.VIDEO);
        }
        for (String ext : List.of("zip", "tar", "gz", "tgz", "rar", "7z", "bz2", "xz")) {
            rules.put(ext, Category.ARCHIVES);
        }
        return Map.copyOf(rules);
    }
}
