package com.magicfolder.core.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmServiceTest {

    public record Verdict(String path, String category, double confidence) {}

    public record VerdictList(List<Verdict> verdicts) {}

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        // Wire up the fluent API chain
        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "http://test:1234");
    }

    @Test
    @DisplayName("structuredCall sends system prompt and user prompt with format instructions")
    void sendsPromptsWithFormat() {
        when(mockCallResponse.content()).thenReturn("{\"path\":\"/a.txt\",\"category\":\"Notes\",\"confidence\":0.7}");

        llmService.structuredCall("System prompt", "User prompt", Verdict.class);

        verify(mockRequestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        assertTrue(userCaptor.getValue().startsWith("User prompt\n\n"));
        assertTrue(userCaptor.getValue().length() > "User prompt\n\n".length(), "format instructions appended");
    }

    @Test
    @DisplayName("structuredCall deserializes nested records")
    void deserializesNestedRecords() {
        when(mockCallResponse.content()).thenReturn("""
                {"verdicts":[{"path":"/a.txt","category":"Resume","confidence":0.9},
                             {"path":"/b.txt","category":"Notes","confidence":0.6}]}
                """);

        VerdictList result = llmService.structuredCall("s", "u", VerdictList.class);

        assertEquals(2, result.verdicts().size());
        assertEquals("Resume", result.verdicts().get(0).category());
        assertEquals(0.6, result.verdicts().get(1).confidence());
    }

    @Test
    @DisplayName("structuredCall strips markdown fences")
    void stripsMarkdownFences() {
        when(mockCallResponse.content()).thenReturn("""
                Here you go:
                ```json
                {"path":"/a.txt","category":"Invoices","confidence":0.95}
                ```
                """);

        Verdict result = llmService.structuredCall("s", "u", Verdict.class);

        assertEquals("Invoices", result.category());
    }

    @Test
    @DisplayName("structuredCall throws LlmEmptyResponseException on blank content")
    void emptyResponse() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("s", "u", Verdict.class));
    }

    @Test
    @DisplayName("structuredCall throws LlmParseException on unparseable content")
    void unparseableResponse() {
        when(mockCallResponse.content()).thenReturn("I could not classify these files, sorry.");

        assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("s", "u", Verdict.class));
    }

    @Test
    @DisplayName("stripCodeFence leaves plain JSON untouched")
    void stripCodeFencePlain() {
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("  {\"a\":1}\n"));
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("```\n{\"a\":1}\n```"));
    }
}
