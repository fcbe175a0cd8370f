package com.eidos.core.curriculum;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CurriculumSnapshotStoreTest {

    @TempDir
    Path tempDir;

    private CurriculumSnapshotStore store;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-04T10:15:30Z"), ZoneOffset.UTC);
        store = new CurriculumSnapshotStore(tempDir.resolve("reports"), clock);
    }

    private static CurriculumReport report(int high, int medium) {
        GapCard card = new GapCard("distillations:d1:low_reasoning", "d1", "heuristic", "distillations",
                GapType.LOW_REASONING, Severity.MEDIUM, RecommendedLoop.DETERMINISTIC_THEN_LLM,
                "When x: do y", "Reasoning is low (0.10).", "");
        return new CurriculumReport(1_700_000_000L, "/tmp/eidos.db",
                new CurriculumStats(12, high + medium, Map.of("low_reasoning", 1),
                        Map.of("high", high, "medium", medium)),
                List.of(card), "", "");
    }

    @Test
    @DisplayName("save writes the latest report with saved_at and returns the history row")
    void saveLatest() {
        CurriculumSnapshotStore.HistoryRow row = store.save(report(2, 3));

        assertEquals(Instant.parse("2026-03-04T10:15:30Z").getEpochSecond(), row.ts());
        assertEquals("2026-03-04", row.date());
        assertEquals(12, row.rowsScanned());
        assertEquals(5, row.cardsGenerated());
        assertEquals(2, row.high());
        assertEquals(3, row.medium());
        assertEquals(0, row.low());

        Map<String, Object> latest = store.loadLatest();
        assertEquals(((Number) latest.get("saved_at")).longValue(), row.ts());
        assertEquals("/tmp/eidos.db", latest.get("db_path"));
        assertEquals(1, ((List<?>) latest.get("cards")).size());
    }

    @Test
    @DisplayName("history appends one line per save and tails the newest lines")
    void history() throws Exception {
        store.save(report(1, 0));
        store.save(report(2, 0));
        store.save(report(3, 0));

        assertEquals(3, Files.readAllLines(store.historyPath()).size());
        List<Map<String, Object>> tail = store.tailHistory(2);
        assertEquals(2, tail.size());
        assertEquals(2, ((Number) tail.get(0).get("high")).intValue());
        assertEquals(3, ((Number) tail.get(1).get("high")).intValue());
        assertTrue(tail.get(1).containsKey("rows_scanned"));
    }

    @Test
    @DisplayName("missing or corrupt files read as empty")
    void missingOrCorrupt() throws Exception {
        assertTrue(store.loadLatest().isEmpty());
        assertTrue(store.tailHistory(10).isEmpty());

        Files.createDirectories(store.latestPath().getParent());
        Files.writeString(store.latestPath(), "{not json");
        Files.writeString(store.historyPath(), "garbage\n{\"ts\": 1}\n");

        assertTrue(store.loadLatest().isEmpty());
        List<Map<String, Object>> tail = store.tailHistory(10);
        assertEquals(1, tail.size());
        assertEquals(1, ((Number) tail.get(0).get("ts")).intValue());
    }
}
