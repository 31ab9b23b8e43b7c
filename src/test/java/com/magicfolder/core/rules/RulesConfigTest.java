package com.magicfolder.core.rules;

import com.magicfolder.core.model.Category;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RulesConfigTest {

    private final RulesConfig config = new RulesConfig();

    @Test
    @DisplayName("empty properties fall back to the built-in tables")
    void emptyPropertiesUseDefaults() {
        RuleSet ruleSet = config.ruleSet(new RuleProperties());

        assertEquals(RuleSet.defaults().keywordRules(), ruleSet.keywordRules());
        assertEquals(Category.AUDIO, ruleSet.hardRuleFor("mp3").orElseThrow());
    }

    @Test
    @DisplayName("configured rules keep their declared order")
    void configuredRulesKeepOrder() {
        var props = new RuleProperties();
        var notes = new RuleProperties.Keyword();
        notes.setCategory("Notes");
        notes.setKeywords(List.of("todo"));
        var tickets = new RuleProperties.Keyword();
        tickets.setCategory("TrainTickets");
        tickets.setKeywords(List.of("irctc"));
        props.setKeywordRules(List.of(notes, tickets));
        props.setHardRules(Map.of("Video", List.of("mp4")));

        RuleSet ruleSet = config.ruleSet(props);

        assertEquals(Category.NOTES, ruleSet.keywordRules().get(0).category());
        assertEquals(Category.TRAIN_TICKETS, ruleSet.keywordRules().get(1).category());
        assertEquals(Category.VIDEO, ruleSet.hardRuleFor("mp4").orElseThrow());
        assertTrue(ruleSet.hardRuleFor("mp3").isEmpty());
    }

    @Test
    @DisplayName("an unknown category label fails fast")
    void unknownCategoryFails() {
        var props = new RuleProperties();
        var bogus = new RuleProperties.Keyword();
        bogus.setCategory("Receipts");
        bogus.setKeywords(List.of("receipt"));
        props.setKeywordRules(List.of(bogus));

        assertThrows(IllegalStateException.class, () -> config.ruleSet(props));
    }
}
