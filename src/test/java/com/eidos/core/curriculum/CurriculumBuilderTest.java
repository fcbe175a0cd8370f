package com.eidos.core.curriculum;

import com.eidos.core.config.EidosProperties;
import com.eidos.core.llm.LlmAreaService;
import com.eidos.core.llm.LlmService;
import com.eidos.core.metrics.EidosMetrics;
import com.eidos.core.persistence.DistillationTable;
import com.eidos.core.persistence.SqliteConnections;
import com.eidos.core.quality.AdvisoryQuality;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.eidos.core.curriculum.CurriculumDb.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CurriculumBuilderTest {

    @TempDir
    Path tempDir;

    private LlmService llmService;
    private EidosProperties properties;
    private SimpleMeterRegistry registry;
    private CurriculumBuilder builder;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        properties = new EidosProperties();
        registry = new SimpleMeterRegistry();
        EidosMetrics metrics = new EidosMetrics(registry);
        builder = new CurriculumBuilder(new SqliteConnections(1000),
                new LlmAreaService(llmService, properties, metrics), properties, metrics);
    }

    private static DistillationRow row(AdvisoryQuality q, int used, int helped, DistillationTable source, String reason) {
        return new DistillationRow("d1", "heuristic", "When x: do y", "", q, used, helped, source, reason);
    }

    private static List<GapType> gaps(List<GapCard> cards) {
        return cards.stream().map(GapCard::gap).toList();
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Card rules
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Card rules")
    class CardRules {

        @Test
        @DisplayName("a healthy row yields no cards")
        void healthyRow() {
            assertTrue(CurriculumBuilder.deriveCards(
                    row(quality(0.8, false, 0.7), 10, 8, DistillationTable.ACTIVE, "")).isEmpty());
        }

        @Test
        @DisplayName("suppressed quality yields a high suppressed_statement card with the LLM loop")
        void suppressed() {
            List<GapCard> cards = CurriculumBuilder.deriveCards(
                    row(quality(0.5, true, 0.7), 0, 0, DistillationTable.ACTIVE, ""));
            assertEquals(List.of(GapType.SUPPRESSED_STATEMENT), gaps(cards));
            GapCard card = cards.get(0);
            assertEquals(Severity.HIGH, card.severity());
            assertEquals(RecommendedLoop.DETERMINISTIC_THEN_LLM, card.recommendedLoop());
            assertTrue(card.llmRuntimeRecommended());
            assertEquals("single_plus_llm", card.answerMode());
            assertEquals("distillations:d1:suppressed_statement", card.cardId());
        }

        @Test
        @DisplayName("archive reasons trigger cards even when quality looks fine")
        void archiveReasons() {
            List<GapCard> cards = CurriculumBuilder.deriveCards(row(quality(0.8, false, 0.7), 0, 0,
                    DistillationTable.ARCHIVE, "suppressed:too_generic"));
            assertEquals(List.of(GapType.SUPPRESSED_STATEMENT), gaps(cards));

            cards = CurriculumBuilder.deriveCards(row(quality(0.8, false, 0.7), 0, 0,
                    DistillationTable.ARCHIVE, "unified_score_below_floor:0.31"));
            assertEquals(List.of(GapType.LOW_UNIFIED_SCORE), gaps(cards));
            assertEquals(RecommendedLoop.DETERMINISTIC_ONLY, cards.get(0).recommendedLoop());
            assertEquals("distillations_archive", cards.get(0).source());
        }

        @Test
        @DisplayName("low unified score picks the LLM loop only below 0.25")
        void unifiedLoop() {
            GapCard low = CurriculumBuilder.deriveCards(
                    row(quality(0.20, false, 0.7), 0, 0, DistillationTable.ACTIVE, "")).get(0);
            GapCard mid = CurriculumBuilder.deriveCards(
                    row(quality(0.30, false, 0.7), 0, 0, DistillationTable.ACTIVE, "")).get(0);
            assertEquals(RecommendedLoop.DETERMINISTIC_THEN_LLM, low.recommendedLoop());
            assertEquals(RecommendedLoop.DETERMINISTIC_ONLY, mid.recommendedLoop());
            assertEquals("Unified score 0.30 is below advisory floor.", mid.why());
        }

        @Test
        @DisplayName("sub-score floors are 0.40 / 0.35 / 0.35")
        void subScoreFloors() {
            AdvisoryQuality q = new AdvisoryQuality(0.8, false, "", 0.39, 0.35, 0.34, 0.0,
                    AdvisoryQuality.Structure.EMPTY, "", false);
            List<GapCard> cards = CurriculumBuilder.deriveCards(row(q, 0, 0, DistillationTable.ACTIVE, ""));
            assertEquals(List.of(GapType.LOW_ACTIONABILITY, GapType.LOW_SPECIFICITY), gaps(cards));
            assertEquals("Actionability is low (0.39).", cards.get(0).why());
            assertTrue(cards.stream().allMatch(c -> c.severity() == Severity.MEDIUM));
        }

        @Test
        @DisplayName("low effectiveness needs at least five uses")
        void effectiveness() {
            assertTrue(CurriculumBuilder.deriveCards(
                    row(quality(0.8, false, 0.7), 4, 0, DistillationTable.ACTIVE, "")).isEmpty());

            List<GapCard> cards = CurriculumBuilder.deriveCards(
                    row(quality(0.8, false, 0.7), 8, 2, DistillationTable.ACTIVE, ""));
            assertEquals(List.of(GapType.LOW_EFFECTIVENESS), gaps(cards));
            assertEquals("Usage effectiveness is low (25.00%).", cards.get(0).why());
        }

        @Test
        @DisplayName("card statement prefers the refined text and is cut to 300 chars")
        void statementPreview() {
            String longText = "x".repeat(400);
            DistillationRow r = new DistillationRow("", "heuristic", "raw", longText,
                    quality(0.1, false, 0.7), 0, 0, DistillationTable.ACTIVE, "");
            GapCard card = CurriculumBuilder.deriveCards(r).get(0);
            assertEquals(300, card.statement().length());
            assertEquals("distillations:unknown:low_unified_score", card.cardId());
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    //  Building from a database
    // ═══════════════════════════════════════════════════════════════════

    @Nested
    @DisplayName("Building from a database")
    class Building {

        @Test
        @DisplayName("suppressed active row and below-floor archive row produce both gap kinds")
        void activeAndArchive() throws Exception {
            Path db = current(tempDir);
            insertActive(db, "a1", "Check the config", quality(0.20, true, 0.7), 0, 0);
            insertArchive(db, "z1", "Something vague", quality(0.5, false, 0.7), "unified_score_below_floor:0.31");

            CurriculumReport report = builder.build(db, 300, 200, true);

            assertFalse(report.hasError());
            assertEquals(2, report.stats().rowsScanned());
            List<GapType> found = gaps(report.cards());
            assertTrue(found.contains(GapType.SUPPRESSED_STATEMENT));
            assertTrue(found.contains(GapType.LOW_UNIFIED_SCORE));
            assertTrue(report.cards().stream().anyMatch(c -> c.source().equals("distillations_archive")));
            assertEquals("", report.gapSummary());
        }

        @Test
        @DisplayName("cards are ordered by severity, LLM loop first within a severity")
        void priorityOrder() throws Exception {
            Path db = current(tempDir);
            insertActive(db, "a1", "Check the config", quality(0.30, false, 0.1), 0, 0);
            insertActive(db, "a2", "Check the config again", quality(0.10, false, 0.7), 0, 0);

            List<GapCard> cards = builder.build(db, 300, 200, false).cards();

            for (int i = 1; i < cards.size(); i++) {
                assertTrue(GapCard.PRIORITY.compare(cards.get(i - 1), cards.get(i)) <= 0,
                        "out of order at " + i);
            }
            assertEquals(Severity.HIGH, cards.get(0).severity());
            assertTrue(cards.get(0).llmRuntimeRecommended());
        }

        @Test
        @DisplayName("max cards truncates and stats count only emitted cards")
        void truncation() throws Exception {
            Path db = current(tempDir);
            for (int i = 0; i < 5; i++) {
                insertActive(db, "a" + i, "Vague note " + i, quality(0.1, true, 0.1), 0, 0);
            }
            CurriculumReport report = builder.build(db, 300, 3, false);

            assertEquals(5, report.stats().rowsScanned());
            assertEquals(3, report.cards().size());
            assertEquals(3, report.stats().cardsGenerated());
            assertEquals(3, report.stats().severityCount(Severity.HIGH));
            assertEquals(3.0, registry.counter("eidos.curriculum.cards", "severity", "high").count());
        }

        @Test
        @DisplayName("archive rows are skipped when not included")
        void excludeArchive() throws Exception {
            Path db = current(tempDir);
            insertArchive(db, "z1", "Something vague", quality(0.1, true, 0.1), "suppressed:noise");
            CurriculumReport report = builder.build(db, 300, 200, false);
            assertEquals(0, report.stats().rowsScanned());
            assertTrue(report.cards().isEmpty());
        }

        @Test
        @DisplayName("missing database reports db_missing")
        void missingDb() {
            CurriculumReport report = builder.build(tempDir.resolve("absent.db"), 300, 200, true);
            assertEquals("db_missing", report.error());
            assertTrue(report.cards().isEmpty());
            assertEquals("db_missing", report.toMap().get("error"));
        }

        @Test
        @DisplayName("legacy tables without quality columns still produce cards")
        void legacySchema() throws Exception {
            Path db = legacy(tempDir);
            exec(db, "INSERT INTO distillations VALUES ('l1', 'heuristic', 'Old rule', 6, 0)");
            exec(db, "INSERT INTO distillations_archive VALUES ('l2', 'heuristic', 'Older rule', 'suppressed:x')");

            CurriculumReport report = builder.build(db, 300, 200, true);

            assertFalse(report.hasError());
            assertEquals(2, report.stats().rowsScanned());
            List<GapType> found = gaps(report.cards());
            assertTrue(found.contains(GapType.LOW_EFFECTIVENESS));
            assertTrue(found.contains(GapType.SUPPRESSED_STATEMENT));
        }

        @Test
        @DisplayName("gap summary comes from the summarization area when enabled")
        void gapSummary() throws Exception {
            EidosProperties.Area area = new EidosProperties.Area();
            area.setEnabled(true);
            properties.getLlm().getAreas().put("curriculum_gap_summarize", area);
            when(llmService.textCall(anyString(), anyString())).thenReturn("Most rules lack reasons.");
            when(llmService.provider()).thenReturn("openai");

            Path db = current(tempDir);
            insertActive(db, "a1", "Check the config", quality(0.2, true, 0.1), 0, 0);

            CurriculumReport report = builder.build(db, 300, 200, true);

            assertEquals("Most rules lack reasons.", report.gapSummary());
            verify(llmService).textCall(anyString(), contains("Rows scanned: 1"));
        }
    }
}
