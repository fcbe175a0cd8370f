package com.eidos.core.llm;

import com.eidos.core.refinement.RescueVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmServiceTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, "http://test:1234");
    }

    @Test
    @DisplayName("textCall passes prompts through unchanged")
    void textCallSendsPrompts() {
        when(mockCallResponse.content()).thenReturn("Pin base image tags");

        assertEquals("Pin base image tags", llmService.textCall("System", "User"));
        verify(mockRequestSpec).system("System");
        verify(mockRequestSpec).user("User");
    }

    @Test
    @DisplayName("textCall throws LlmEmptyResponseException on blank content")
    void textCallBlank() {
        when(mockCallResponse.content()).thenReturn("   ");
        assertThrows(LlmEmptyResponseException.class, () -> llmService.textCall("System", "User"));
    }

    @Test
    @DisplayName("structuredCall appends format instructions and parses the response")
    void structuredCallParses() {
        when(mockCallResponse.content()).thenReturn("""
                {"rescue": true, "reason": "real insight", "rewrite": "Retry idempotent calls because networks flake"}
                """);

        RescueVerdict verdict = llmService.structuredCall("System", "User", RescueVerdict.class);

        assertTrue(verdict.rescue());
        assertEquals("Retry idempotent calls because networks flake", verdict.rewrite());
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).user(userCaptor.capture());
        assertTrue(userCaptor.getValue().startsWith("User\n\n"));
        assertTrue(userCaptor.getValue().length() > "User\n\n".length());
    }

    @Test
    @DisplayName("structuredCall falls back to Jackson for fenced JSON")
    void structuredCallFenced() {
        when(mockCallResponse.content()).thenReturn("```json\n{\"rescue\": false, \"reason\": \"noise\", \"rewrite\": \"\", \"extra\": 1}\n```");

        RescueVerdict verdict = llmService.structuredCall("System", "User", RescueVerdict.class);

        assertFalse(verdict.rescue());
        assertEquals("noise", verdict.reason());
    }

    @Test
    @DisplayName("structuredCall throws LlmParseException on garbage")
    void structuredCallGarbage() {
        when(mockCallResponse.content()).thenReturn("definitely not json");
        assertThrows(LlmParseException.class, () -> llmService.structuredCall("System", "User", RescueVerdict.class));
    }

    @Test
    @DisplayName("structuredCall throws LlmEmptyResponseException on null content")
    void structuredCallNull() {
        when(mockCallResponse.content()).thenReturn(null);
        assertThrows(LlmEmptyResponseException.class, () -> llmService.structuredCall("System", "User", RescueVerdict.class));
    }

    @Test
    @DisplayName("stripFence removes fences with and without a language tag")
    void stripFence() {
        assertEquals("{\"a\":1}", LlmService.stripFence("```json\n{\"a\":1}\n```"));
        assertEquals("plain", LlmService.stripFence("```\nplain\n```"));
        assertEquals("untouched", LlmService.stripFence("  untouched "));
        assertEquals("", LlmService.stripFence(null));
    }
}
