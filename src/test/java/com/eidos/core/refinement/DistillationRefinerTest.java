package com.eidos.core.refinement;

import com.eidos.core.config.EidosProperties;
import com.eidos.core.elevation.Elevator;
import com.eidos.core.llm.LlmArea;
import com.eidos.core.llm.LlmAreaResult;
import com.eidos.core.llm.LlmAreaService;
import com.eidos.core.llm.LlmService;
import com.eidos.core.metrics.EidosMetrics;
import com.eidos.core.quality.AdvisoryGrader;
import com.eidos.core.quality.AdvisoryQuality;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DistillationRefinerTest {

    private static final String BASE = "Input validation matters a lot here";

    private AdvisoryGrader grader;
    private Elevator elevator;
    private FakeAreas areas;
    private EidosProperties properties;
    private SimpleMeterRegistry registry;
    private DistillationRefiner refiner;
    private final Map<String, AdvisoryQuality> grades = new HashMap<>();

    /** Scripted LLM areas: an area answers only when enabled and given an answer. */
    static class FakeAreas extends LlmAreaService {
        final Set<LlmArea> enabled = EnumSet.noneOf(LlmArea.class);
        final Map<LlmArea, String> answers = new EnumMap<>(LlmArea.class);
        RescueVerdict verdict;
        final List<LlmArea> invoked = new ArrayList<>();

        FakeAreas() {
            super(mock(LlmService.class), new EidosProperties(), new EidosMetrics(new SimpleMeterRegistry()));
        }

        @Override
        public boolean isEnabled(LlmArea area) {
            return enabled.contains(area);
        }

        @Override
        public int maxChars(LlmArea area) {
            return area.defaultMaxChars();
        }

        @Override
        public LlmAreaResult call(LlmArea area, String fallback, Object... args) {
            invoked.add(area);
            if (!enabled.contains(area) || !answers.containsKey(area)) {
                return new LlmAreaResult(area.id(), fallback, false, "none", 0.0, "");
            }
            return new LlmAreaResult(area.id(), answers.get(area), true, "openai", 5.0, "");
        }

        @Override
        @SuppressWarnings("unchecked")
        public <T> Optional<T> callStructured(LlmArea area, Class<T> type, Object... args) {
            invoked.add(area);
            if (!enabled.contains(area) || verdict == null) {
                return Optional.empty();
            }
            return Optional.of((T) verdict);
        }
    }

    private static AdvisoryQuality q(double unified, boolean suppressed, AdvisoryQuality.Structure structure, String text) {
        return new AdvisoryQuality(unified, suppressed, suppressed ? "too_generic" : "",
                unified, unified, unified, 0.0, structure, text, false);
    }

    private void grade(String text, double unified) {
        grades.put(text, q(unified, false, AdvisoryQuality.Structure.EMPTY, text));
    }

    @BeforeEach
    void setUp() {
        grader = mock(AdvisoryGrader.class);
        when(grader.grade(anyString(), anyString())).thenAnswer(inv -> {
            String text = inv.getArgument(0);
            return grades.getOrDefault(text, q(0.05, false, AdvisoryQuality.Structure.EMPTY, text));
        });
        elevator = mock(Elevator.class);
        when(elevator.elevate(anyString(), any())).thenAnswer(inv -> inv.getArgument(0));
        areas = new FakeAreas();
        properties = new EidosProperties();
        registry = new SimpleMeterRegistry();
        refiner = new DistillationRefiner(grader, elevator, areas, properties, new EidosMetrics(registry));
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Deterministic steps
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Deterministic steps")
    class DeterministicTests {

        @Test
        @DisplayName("empty input returns empty text with its grade")
        void emptyInput() {
            RefinementResult result = refiner.refine("   ", "eidos", Map.of(), 0.6);

            assertEquals("", result.text());
            assertFalse(result.changed());
            verify(grader).grade("", "eidos");
            verifyNoInteractions(elevator);
        }

        @Test
        @DisplayName("a statement already at target is returned untouched")
        void alreadyGoodEnough() {
            grade(BASE, 0.8);

            RefinementResult result = refiner.refine("  " + BASE + "  ", "eidos", Map.of(), 0.6);

            assertEquals(BASE, result.text());
            assertEquals(0.8, result.quality().unifiedScore());
            verifyNoInteractions(elevator);
            assertTrue(areas.invoked.isEmpty());
        }

        @Test
        @DisplayName("a better elevated form replaces the original")
        void elevationImproves() {
            grade(BASE, 0.3);
            String elevated = "Validate input at the boundary because bad payloads crash parsers";
            grade(elevated, 0.7);
            when(elevator.elevate(eq(BASE), any())).thenReturn(elevated);

            RefinementResult result = refiner.refine(BASE, "eidos", Map.of(), 0.6);

            assertEquals(elevated, result.text());
            assertTrue(result.changed());
            assertEquals(1.0, registry.get("eidos.refinement.attempts").tag("outcome", "improved").counter().count());
        }

        @Test
        @DisplayName("a worse candidate never replaces the current best")
        void neverRegresses() {
            grade(BASE, 0.4);
            String worse = "Something about input I guess maybe";
            grade(worse, 0.2);
            when(elevator.elevate(eq(BASE), any())).thenReturn(worse);

            RefinementResult result = refiner.refine(BASE, "eidos", Map.of(), 0.6);

            assertEquals(BASE, result.text());
            assertEquals(0.4, result.quality().unifiedScore());
            assertFalse(result.changed());
        }

        @Test
        @DisplayName("the structured rewrite is tried when elevation falls short")
        void structureRewrite() {
            AdvisoryQuality.Structure structure = new AdvisoryQuality.Structure(
                    "parsing webhooks", "validate signatures", "forged payloads crash workers", "");
            grades.put(BASE, q(0.3, false, structure, BASE));
            String rewritten = "When parsing webhooks: validate signatures because forged payloads crash workers";
            grade(rewritten, 0.75);

            RefinementResult result = refiner.refine(BASE, "eidos", Map.of(), 0.6);

            assertEquals(rewritten, result.text());
        }

        @Test
        @DisplayName("the best candidate is returned even when the target is never reached")
        void bestEffort() {
            grade(BASE, 0.2);
            String better = "Validate input on every request to the API";
            grade(better, 0.4);
            when(elevator.elevate(eq(BASE), any())).thenReturn(better);

            RefinementResult result = refiner.refine(BASE, "eidos", Map.of(), 0.9);

            assertEquals(better, result.text());
            assertTrue(result.quality().unifiedScore() < 0.9);
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  LLM areas
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("LLM areas")
    class LlmTests {

        @Test
        @DisplayName("the runtime rewrite is not requested when its area is disabled")
        void runtimeDisabled() {
            grade(BASE, 0.1);

            refiner.refine(BASE, "eidos", Map.of(), 0.6);

            assertFalse(areas.invoked.contains(LlmArea.RUNTIME_REFINE));
        }

        @Test
        @DisplayName("a better runtime rewrite is accepted")
        void runtimeAccepted() {
            grade(BASE, 0.1);
            String refined = "When accepting uploads: validate MIME type because spoofed files break thumbnails";
            grade(refined, 0.8);
            areas.enabled.add(LlmArea.RUNTIME_REFINE);
            areas.answers.put(LlmArea.RUNTIME_REFINE, "```json\n{\"refined\": \"" + refined + "\"}\n```");

            RefinementResult result = refiner.refine(BASE, "eidos", Map.of("domain", "uploads"), 0.6);

            assertEquals(refined, result.text());
        }

        @Test
        @DisplayName("a worse runtime rewrite is ignored")
        void runtimeRejected() {
            grade(BASE, 0.3);
            String refined = "Be careful with stuff in general okay";
            grade(refined, 0.1);
            areas.enabled.add(LlmArea.RUNTIME_REFINE);
            areas.answers.put(LlmArea.RUNTIME_REFINE, refined);

            RefinementResult result = refiner.refine(BASE, "eidos", Map.of(), 0.6);

            assertEquals(BASE, result.text());
        }

        @Test
        @DisplayName("the runtime rewrite is skipped above its floor")
        void runtimeAboveFloor() {
            grade(BASE, 0.5);
            areas.enabled.add(LlmArea.RUNTIME_REFINE);

            refiner.refine(BASE, "eidos", Map.of(), 0.6);

            assertFalse(areas.invoked.contains(LlmArea.RUNTIME_REFINE));
            assertTrue(areas.invoked.contains(LlmArea.ARCHIVE_REWRITE));
        }

        @Test
        @DisplayName("archive rescue is asked only for suppressed low scorers and honours rescue=false")
        void rescue() {
            grades.put(BASE, q(0.1, true, AdvisoryQuality.Structure.EMPTY, BASE));
            String rescued = "Validate request bodies at the edge because malformed JSON crashes handlers";
            grade(rescued, 0.7);
            areas.enabled.add(LlmArea.ARCHIVE_RESCUE);

            areas.verdict = new RescueVerdict(false, "noise", rescued);
            assertEquals(BASE, refiner.refine(BASE, "eidos", Map.of(), 0.6).text());

            areas.verdict = new RescueVerdict(true, "real insight", rescued);
            assertEquals(rescued, refiner.refine(BASE, "eidos", Map.of(), 0.6).text());
        }

        @Test
        @DisplayName("archive rescue is not asked for unsuppressed statements")
        void noRescueWhenVisible() {
            grade(BASE, 0.1);

            refiner.refine(BASE, "eidos", Map.of(), 0.6);

            assertFalse(areas.invoked.contains(LlmArea.ARCHIVE_RESCUE));
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Text helpers
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Text helpers")
    class HelperTests {

        @Test
        @DisplayName("rewrite joins condition, action, reasoning and outcome")
        void rewriteFormat() {
            var s = new AdvisoryQuality.Structure("deploying", "run migrations first", "schema drift", "keep startup green");
            assertEquals("When deploying: run migrations first because schema drift to keep startup green",
                    DistillationRefiner.rewriteFromStructure(s, "fallback"));
        }

        @Test
        @DisplayName("rewrite capitalises a bare action and falls back when too short")
        void rewriteBareAndShort() {
            var bare = new AdvisoryQuality.Structure("", "retry idempotent calls", "networks flake", "");
            assertEquals("Retry idempotent calls because networks flake",
                    DistillationRefiner.rewriteFromStructure(bare, "fallback"));

            var tiny = new AdvisoryQuality.Structure("", "retry", "", "");
            assertEquals("fallback", DistillationRefiner.rewriteFromStructure(tiny, "fallback"));
            assertEquals("fallback", DistillationRefiner.rewriteFromStructure(AdvisoryQuality.Structure.EMPTY, "fallback"));
        }

        @Test
        @DisplayName("compose puts the outcome in parentheses and needs an action")
        void composeFormat() {
            var s = new AdvisoryQuality.Structure("", "cache tokens", "lookups are slow", "p95 under 200ms");
            assertEquals("Cache tokens because lookups are slow (p95 under 200ms)",
                    DistillationRefiner.composeFromStructure(s));
            assertEquals("", DistillationRefiner.composeFromStructure(AdvisoryQuality.Structure.EMPTY));
        }

        @Test
        @DisplayName("extraction prefers known JSON keys")
        void extractJson() {
            assertEquals("Use parameterized queries for every SQL call",
                    DistillationRefiner.extractRefinement("{\"text\": \"Use parameterized queries for every SQL call\"}", 280));
            assertEquals("Use parameterized queries for every SQL call",
                    DistillationRefiner.extractRefinement(
                            "{\"other\": 1, \"advisory_text\": \"Use parameterized queries for every SQL call\"}", 280));
        }

        @Test
        @DisplayName("extraction takes the first line and strips bullets and extra spaces")
        void extractFirstLine() {
            assertEquals("Use parameterized queries for every SQL call",
                    DistillationRefiner.extractRefinement("1)   Use parameterized   queries for every SQL call\nsecond line", 280));
            assertEquals("Pin dependency versions in the lockfile",
                    DistillationRefiner.extractRefinement("- Pin dependency versions in the lockfile", 280));
        }

        @Test
        @DisplayName("extraction truncates to the budget and drops short results")
        void extractBudget() {
            String out = DistillationRefiner.extractRefinement(
                    "Always run the full integration suite, before merging, to main", 40);
            assertTrue(out.length() <= 40);
            assertFalse(out.endsWith(","));
            assertEquals("", DistillationRefiner.extractRefinement("Too short", 280));
            assertEquals("", DistillationRefiner.extractRefinement("", 280));
        }
    }
}
