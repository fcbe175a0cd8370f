package com.eidos.core.curriculum;

import com.eidos.core.config.EidosProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the latest curriculum report as JSON and a one-line-per-run history as JSONL
 * under the reports directory.
 */
@Component
public class CurriculumSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(CurriculumSnapshotStore.class);

    static final String LATEST_FILE = "eidos_curriculum_latest.json";
    static final String HISTORY_FILE = "eidos_curriculum_history.jsonl";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final ObjectMapper lineMapper = new ObjectMapper();
    private final Path latestPath;
    private final Path historyPath;
    private final Clock clock;

    @Autowired
    public CurriculumSnapshotStore(EidosProperties properties) {
        this(Path.of(properties.getReportsDir()), Clock.systemUTC());
    }

    CurriculumSnapshotStore(Path reportsDir, Clock clock) {
        this.latestPath = reportsDir.resolve(LATEST_FILE);
        this.historyPath = reportsDir.resolve(HISTORY_FILE);
        this.clock = clock;
    }

    /** One history line. */
    public record HistoryRow(
            long ts,
            String date,
            @JsonProperty("rows_scanned") int rowsScanned,
            @JsonProperty("cards_generated") int cardsGenerated,
            int high,
            int medium,
            int low
    ) {}

    /**
     * Overwrites the latest report (stamped with {@code saved_at}) and appends a history line.
     *
     * @throws UncheckedIOException if either file cannot be written
     */
    public HistoryRow save(CurriculumReport report) {
        Instant now = clock.instant();
        Map<String, Object> payload = report.toMap();
        payload.put("saved_at", now.getEpochSecond());

        CurriculumStats stats = report.stats();
        HistoryRow row = new HistoryRow(
                now.getEpochSecond(),
                DATE.format(now),
                stats.rowsScanned(),
                stats.cardsGenerated(),
                stats.severityCount(Severity.HIGH),
                stats.severityCount(Severity.MEDIUM),
                stats.severityCount(Severity.LOW));
        try {
            Files.createDirectories(latestPath.getParent());
            Files.writeString(latestPath, mapper.writeValueAsString(payload), StandardCharsets.UTF_8);
            Files.writeString(historyPath, lineMapper.writeValueAsString(row) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save curriculum snapshot to " + latestPath.getParent(), e);
        }
        log.info("Saved curriculum snapshot: {} cards ({} high)", row.cardsGenerated(), row.high());
        return row;
    }

    /** The last saved report as a plain map, or an empty map when there is none or it is unreadable. */
    public Map<String, Object> loadLatest() {
        if (!Files.exists(latestPath)) {
            return new LinkedHashMap<>();
        }
        try {
            return mapper.readValue(Files.readString(latestPath, StandardCharsets.UTF_8), MAP_TYPE);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", latestPath, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    /** The last {@code limit} history lines, oldest first. Malformed lines are skipped. */
    public List<Map<String, Object>> tailHistory(int limit) {
        List<Map<String, Object>> out = new ArrayList<>();
        if (!Files.exists(historyPath)) {
            return out;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(historyPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", historyPath, e.getMessage());
            return out;
        }
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        for (String line : lines.subList(from, lines.size())) {
            if (line.isBlank()) continue;
            try {
                out.add(lineMapper.readValue(line, MAP_TYPE));
            } catch (IOException e) {
                log.debug("Skipping malformed history line: {}", e.getMessage());
            }
        }
        return out;
    }

    Path latestPath() {
        return latestPath;
    }

    Path historyPath() {
        return historyPath;
    }
}
