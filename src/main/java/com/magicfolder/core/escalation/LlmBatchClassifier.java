package com.magicfolder.core.escalation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.magicfolder.core.llm.LlmParseException;
import com.magicfolder.core.llm.LlmProperties;
import com.magicfolder.core.llm.LlmService;
import com.magicfolder.core.model.Category;
import com.magicfolder.core.model.CategoryOverride;
import com.magicfolder.core.model.EscalationItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Batch classifier backed by a chat model. All uncertain files go into a
 * single prompt and come back as one {@link BatchVerdict}.
 */
@Component
public class LlmBatchClassifier implements BatchClassifier {

    private static final Logger log = LoggerFactory.getLogger(LlmBatchClassifier.class);

    static final String SYSTEM_PROMPT = """
            You classify personal files for a folder organizer.
            Assign each file exactly one category from:
            Screenshots, Invoices, TrainTickets, IDProofs, Marksheets, Credentials, Notes, Resume, Misc

            Rules:
            - Base your decision on the file path, extension, and extracted content.
            - An image clearly captured from a screen -> Screenshots
            - Billing, GST, totals, invoice numbers -> Invoices
            - IRCTC, PNR, journey details -> TrainTickets
            - Government-issued identity information -> IDProofs
            - Exam results, grades, statement of marks -> Marksheets
            - Usernames, passwords, API keys -> Credentials
            - A CV or professional profile -> Resume
            - Meeting notes, ideas, todos -> Notes
            - If confidence is low -> Misc

            Return one verdict per input file, using the exact "path" value you were given.
            Respond with valid JSON matching the schema provided.
            """;

    /** Structured reply expected from the model. */
    public record BatchVerdict(List<FileVerdict> verdicts) {}

    public record FileVerdict(String path, String category, double confidence, String reason) {}

    private final LlmService llmService;
    private final LlmProperties properties;
    private final ObjectMapper objectMapper;

    public LlmBatchClassifier(@Autowired(required = false) LlmService llmService,
                              LlmProperties properties,
                              ObjectMapper objectMapper) {
        this.llmService = llmService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean available() {
        return llmService != null && properties.isEnabled() && properties.hasApiKey();
    }

    @Override
    public List<CategoryOverride> classify(List<EscalationItem> items) {
        if (items.isEmpty()) {
            return List.of();
        }
        BatchVerdict reply = llmService.structuredCall(SYSTEM_PROMPT, userPrompt(items), BatchVerdict.class);
        if (reply == null || reply.verdicts() == null) {
            return List.of();
        }

        var overrides = new ArrayList<CategoryOverride>();
        for (FileVerdict verdict : reply.verdicts()) {
            if (verdict == null || verdict.path() == null) {
                continue;
            }
            Optional<Category> category = Category.fromLabel(verdict.category());
            if (category.isEmpty()) {
                log.warn("Dropping verdict for {}: unknown category '{}'", verdict.path(), verdict.category());
                continue;
            }
            overrides.add(new CategoryOverride(verdict.path(), category.get(), verdict.confidence(), verdict.reason()));
        }
        return overrides;
    }

    String userPrompt(List<EscalationItem> items) {
        var truncated = items.stream()
                .map(item -> new EscalationItem(item.path(), truncate(item.content())))
                .toList();
        try {
            return "Files to classify:\n" + objectMapper.writeValueAsString(truncated);
        } catch (JsonProcessingException e) {
            throw new LlmParseException("Could not serialize escalation batch", e);
        }
    }

    private String truncate(String content) {
        int max = properties.getMaxContentChars();
        return content.length() > max ? content.substring(0, max) : content;
    }
}
