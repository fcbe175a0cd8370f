package com.eidos.core.llm;

import com.eidos.core.config.EidosProperties;
import com.eidos.core.metrics.EidosMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Gated access to the LLM, one {@link LlmArea} at a time.
 * <p>
 * Every area is off unless {@code eidos.llm.areas.<id>.enabled} is true. Calls run with the
 * area's timeout and character budget. Nothing thrown by the model client escapes: failures
 * come back as an {@link LlmAreaResult} holding the caller's fallback text.
 */
@Service
public class LlmAreaService {

    private static final Logger log = LoggerFactory.getLogger(LlmAreaService.class);

    private final LlmService llmService;
    private final EidosProperties properties;
    private final EidosMetrics metrics;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "eidos-llm-area");
        t.setDaemon(true);
        return t;
    });

    public LlmAreaService(LlmService llmService, EidosProperties properties, EidosMetrics metrics) {
        this.llmService = llmService;
        this.properties = properties;
        this.metrics = metrics;
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }

    public boolean isEnabled(LlmArea area) {
        return areaConfig(area).map(EidosProperties.Area::isEnabled).orElse(false);
    }

    public double timeoutSeconds(LlmArea area) {
        Double configured = areaConfig(area).map(EidosProperties.Area::getTimeoutSeconds).orElse(null);
        return LlmArea.clampTimeout(configured, area.defaultTimeoutSeconds());
    }

    public int maxChars(LlmArea area) {
        Integer configured = areaConfig(area).map(EidosProperties.Area::getMaxChars).orElse(null);
        return LlmArea.clampMaxChars(configured, area.defaultMaxChars());
    }

    /**
     * Asks the model for free text using the area's prompt filled with {@code args}.
     *
     * @param fallback returned as {@code text} when the area is disabled or the call fails
     */
    public LlmAreaResult call(LlmArea area, String fallback, Object... args) {
        if (!isEnabled(area)) {
            metrics.recordLlmAreaCall(area.id(), "disabled");
            return LlmAreaResult.disabled(area.id(), fallback);
        }
        String prompt = area.prompt(args);
        long start = System.nanoTime();
        try {
            String raw = runWithTimeout(area, () -> llmService.textCall(area.systemPrompt(), prompt));
            double latency = elapsedMs(start);
            String text = truncate(raw.strip(), maxChars(area));
            metrics.recordLlmAreaCall(area.id(), "ok");
            log.debug("LLM area {} answered in {}ms ({} chars)", area.id(), Math.round(latency), text.length());
            return new LlmAreaResult(area.id(), text, true, llmService.provider(), latency, "");
        } catch (AreaCallFailure f) {
            metrics.recordLlmAreaCall(area.id(), f.kind);
            log.warn("LLM area {} fell back ({}): {}", area.id(), f.kind, f.getMessage());
            return new LlmAreaResult(area.id(), fallback, true, llmService.provider(), elapsedMs(start), f.describe());
        }
    }

    /**
     * Asks the model for a JSON object of {@code type}. Empty when the area is disabled or
     * the call fails in any way.
     */
    public <T> Optional<T> callStructured(LlmArea area, Class<T> type, Object... args) {
        if (!isEnabled(area)) {
            metrics.recordLlmAreaCall(area.id(), "disabled");
            return Optional.empty();
        }
        String prompt = area.prompt(args);
        try {
            T value = runWithTimeout(area, () -> llmService.structuredCall(area.systemPrompt(), prompt, type));
            metrics.recordLlmAreaCall(area.id(), "ok");
            return Optional.ofNullable(value);
        } catch (AreaCallFailure f) {
            metrics.recordLlmAreaCall(area.id(), f.kind);
            log.warn("LLM area {} returned no {} ({}): {}", area.id(), type.getSimpleName(), f.kind, f.getMessage());
            return Optional.empty();
        }
    }

    private <T> T runWithTimeout(LlmArea area, Callable<T> task) throws AreaCallFailure {
        Future<T> future = executor.submit(task);
        try {
            return future.get(Math.round(timeoutSeconds(area) * 1000), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AreaCallFailure("timeout", "no answer within " + timeoutSeconds(area) + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AreaCallFailure("failed", "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String kind = cause instanceof LlmEmptyResponseException ? "empty" : "failed";
            throw new AreaCallFailure(kind, cause.getMessage(), cause);
        }
    }

    private Optional<EidosProperties.Area> areaConfig(LlmArea area) {
        Map<String, EidosProperties.Area> areas = properties.getLlm().getAreas();
        if (areas == null || areas.isEmpty()) {
            return Optional.empty();
        }
        String wanted = normalizeKey(area.id());
        return areas.entrySet().stream()
                .filter(e -> normalizeKey(e.getKey()).equals(wanted))
                .map(Map.Entry::getValue)
                .filter(Objects::nonNull)
                .findFirst();
    }

    // relaxed binding may turn runtime_refine into runtimerefine or runtime-refine
    private static String normalizeKey(String key) {
        return key == null ? "" : key.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }

    /** Cuts to {@code max} chars, backing off to the last word boundary when there is one. */
    static String truncate(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        String cut = text.substring(0, max);
        int space = cut.lastIndexOf(' ');
        return space > 0 ? cut.substring(0, space) : cut;
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static final class AreaCallFailure extends Exception {

        private final String kind;

        AreaCallFailure(String kind, String message, Throwable cause) {
            super(message, cause);
            this.kind = kind;
        }

        String describe() {
            return getMessage() == null ? kind : kind + ": " + getMessage();
        }
    }
}
