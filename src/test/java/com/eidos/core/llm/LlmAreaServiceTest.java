package com.eidos.core.llm;

import com.eidos.core.config.EidosProperties;
import com.eidos.core.metrics.EidosMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmAreaService}. The {@link LlmService} is mocked so no model is called.
 */
class LlmAreaServiceTest {

    private LlmService llm;
    private EidosProperties properties;
    private SimpleMeterRegistry registry;
    private LlmAreaService service;

    @BeforeEach
    void setUp() {
        llm = mock(LlmService.class);
        when(llm.provider()).thenReturn("openai");
        properties = new EidosProperties();
        registry = new SimpleMeterRegistry();
        service = new LlmAreaService(llm, properties, new EidosMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private EidosProperties.Area enable(String key) {
        EidosProperties.Area area = new EidosProperties.Area();
        area.setEnabled(true);
        properties.getLlm().getAreas().put(key, area);
        return area;
    }

    private double calls(String result) {
        return registry.get("eidos.llm.area.calls").tag("result", result).counter().count();
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Gating
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Gating")
    class GatingTests {

        @Test
        @DisplayName("a disabled area returns the fallback without calling the model")
        void disabledReturnsFallback() {
            LlmAreaResult result = service.call(LlmArea.ARCHIVE_REWRITE, "keep me", "s", "r", "0.1");

            assertEquals("keep me", result.text());
            assertFalse(result.usedLlm());
            assertEquals("none", result.provider());
            assertEquals(0.0, result.latencyMs());
            verifyNoInteractions(llm);
            assertEquals(1.0, calls("disabled"));
        }

        @Test
        @DisplayName("area keys match regardless of separator style")
        void relaxedKeys() {
            enable("runtimerefine");
            enable("archive-rewrite");

            assertTrue(service.isEnabled(LlmArea.RUNTIME_REFINE));
            assertTrue(service.isEnabled(LlmArea.ARCHIVE_REWRITE));
            assertFalse(service.isEnabled(LlmArea.ARCHIVE_RESCUE));
        }

        @Test
        @DisplayName("timeouts and budgets are clamped and default per area")
        void clamping() {
            EidosProperties.Area area = enable("archive_rescue");
            assertEquals(8.0, service.timeoutSeconds(LlmArea.ARCHIVE_RESCUE));
            assertEquals(400, service.maxChars(LlmArea.ARCHIVE_RESCUE));

            area.setTimeoutSeconds(1000.0);
            area.setMaxChars(10);
            assertEquals(120.0, service.timeoutSeconds(LlmArea.ARCHIVE_RESCUE));
            assertEquals(50, service.maxChars(LlmArea.ARCHIVE_RESCUE));

            area.setTimeoutSeconds(0.01);
            area.setMaxChars(100_000);
            assertEquals(0.5, service.timeoutSeconds(LlmArea.ARCHIVE_RESCUE));
            assertEquals(5000, service.maxChars(LlmArea.ARCHIVE_RESCUE));
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Text calls
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Text calls")
    class TextCallTests {

        @Test
        @DisplayName("sends the area prompts and truncates at a word boundary")
        void truncatesAtWordBoundary() {
            enable("archive_rewrite").setMaxChars(50);
            String longAnswer = "Validate every webhook signature before parsing the body because forged payloads crash workers";
            when(llm.textCall(anyString(), anyString())).thenReturn("  " + longAnswer + "\n");

            LlmAreaResult result = service.call(LlmArea.ARCHIVE_REWRITE, "fallback", "orig", "too_short", "0.20");

            assertTrue(result.usedLlm());
            assertEquals("openai", result.provider());
            assertTrue(result.text().length() <= 50);
            assertTrue(longAnswer.startsWith(result.text()));
            assertFalse(result.text().endsWith(" "));
            verify(llm).textCall(eq(LlmArea.ARCHIVE_REWRITE.systemPrompt()), contains("Original: orig"));
            assertEquals(1.0, calls("ok"));
        }

        @Test
        @DisplayName("an empty model answer falls back but still counts as an LLM use")
        void emptyAnswer() {
            enable("archive_rewrite");
            when(llm.textCall(anyString(), anyString())).thenThrow(new LlmEmptyResponseException("blank"));

            LlmAreaResult result = service.call(LlmArea.ARCHIVE_REWRITE, "fallback", "s", "r", "0.1");

            assertEquals("fallback", result.text());
            assertTrue(result.usedLlm());
            assertTrue(result.failure().startsWith("empty"));
        }

        @Test
        @DisplayName("client errors never escape")
        void clientErrorsContained() {
            enable("archive_rewrite");
            when(llm.textCall(anyString(), anyString())).thenThrow(new IllegalStateException("connection refused"));

            LlmAreaResult result = assertDoesNotThrow(
                    () -> service.call(LlmArea.ARCHIVE_REWRITE, "fallback", "s", "r", "0.1"));

            assertEquals("fallback", result.text());
            assertTrue(result.failure().contains("connection refused"));
            assertEquals(1.0, calls("failed"));
        }

        @Test
        @DisplayName("slow answers are abandoned after the area timeout")
        void timeout() {
            enable("archive_rewrite").setTimeoutSeconds(0.5);
            when(llm.textCall(anyString(), anyString())).thenAnswer(inv -> {
                Thread.sleep(5_000);
                return "too late";
            });

            LlmAreaResult result = service.call(LlmArea.ARCHIVE_REWRITE, "fallback", "s", "r", "0.1");

            assertEquals("fallback", result.text());
            assertTrue(result.failure().startsWith("timeout"));
            assertTrue(result.latencyMs() < 5_000);
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Structured calls
    // ═══════════════════════════════════════════════════════════════════

    record Verdict(boolean rescue, String rewrite) {}

    @Nested
    @DisplayName("Structured calls")
    class StructuredCallTests {

        @Test
        @DisplayName("disabled areas yield empty")
        void disabled() {
            assertEquals(Optional.empty(), service.callStructured(LlmArea.ARCHIVE_RESCUE, Verdict.class, "s", "0.1", "r", "d"));
            verifyNoInteractions(llm);
        }

        @Test
        @DisplayName("parsed values are returned")
        void parsed() {
            enable("archive_rescue");
            when(llm.structuredCall(anyString(), anyString(), eq(Verdict.class)))
                    .thenReturn(new Verdict(true, "Pin base images because tags move"));

            Optional<Verdict> verdict = service.callStructured(LlmArea.ARCHIVE_RESCUE, Verdict.class, "s", "0.1", "r", "d");

            assertTrue(verdict.isPresent());
            assertTrue(verdict.get().rescue());
        }

        @Test
        @DisplayName("parse failures yield empty")
        void parseFailure() {
            enable("archive_rescue");
            when(llm.structuredCall(anyString(), anyString(), eq(Verdict.class)))
                    .thenThrow(new LlmParseException("not json"));

            assertTrue(service.callStructured(LlmArea.ARCHIVE_RESCUE, Verdict.class, "s", "0.1", "r", "d").isEmpty());
        }
    }

    @Test
    @DisplayName("truncate keeps short text and cuts long text at the last space")
    void truncate() {
        assertEquals("short", LlmAreaService.truncate("short", 50));
        assertEquals("alpha beta", LlmAreaService.truncate("alpha beta gamma", 12));
        assertEquals("abcdefgh", LlmAreaService.truncate("abcdefghijkl", 8));
    }
}
