package com.magicfolder.core.rules;

import com.magicfolder.core.model.Category;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * One entry of the ordered keyword table: a category and the keywords that
 * select it. Keywords are stored lower-cased; blank keywords are dropped so a
 * rule can never match every non-empty document.
 */
public record KeywordRule(Category category, List<String> keywords) {

    public KeywordRule {
        Objects.requireNonNull(category, "category");
        var cleaned = new LinkedHashSet<String>();
        if (keywords != null) {
            for (String keyword : keywords) {
                if (keyword != null && !keyword.isBlank()) {
                    cleaned.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        keywords = List.copyOf(cleaned);
    }

    public static KeywordRule of(Category category, String... keywords) {
        return new KeywordRule(category, List.of(keywords));
    }

    /**
     * Returns the first keyword contained in {@code lowerContent}. Plain substring
     * containment: "invoice" also matches "invoices" and "proforma-invoice".
     */
    public Optional<String> firstMatch(String lowerContent) {
        for (String keyword : keywords) {
            if (lowerContent.contains(keyword)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }
}
