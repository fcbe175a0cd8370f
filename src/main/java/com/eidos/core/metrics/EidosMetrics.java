package com.eidos.core.metrics;

import com.eidos.core.model.DistillationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for distillation, refinement and curriculum work.
 */
@Service
public class EidosMetrics {

    private final MeterRegistry registry;

    public EidosMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDistillationGenerated(DistillationType type) {
        Counter.builder("eidos.distillations.generated")
                .tag("type", type.value())
                .register(registry)
                .increment();
    }

    public void recordFeedback(boolean helped) {
        Counter.builder("eidos.distillations.feedback")
                .tag("result", helped ? "helped" : "unhelped")
                .register(registry)
                .increment();
    }

    public void recordRefinement(boolean improved) {
        Counter.builder("eidos.refinement.attempts")
                .tag("outcome", improved ? "improved" : "unchanged")
                .register(registry)
                .increment();
    }

    /**
     * @param result one of {@code disabled}, {@code ok}, {@code empty}, {@code timeout}, {@code failed}
     */
    public void recordLlmAreaCall(String areaId, String result) {
        Counter.builder("eidos.llm.area.calls")
                .tag("area", areaId)
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordCurriculumCard(String severity) {
        Counter.builder("eidos.curriculum.cards")
                .tag("severity", severity)
                .register(registry)
                .increment();
    }

    public void recordAutofixRow(String action) {
        Counter.builder("eidos.autofix.rows")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void recordAutofixDuration(long ms, boolean applied) {
        Timer.builder("eidos.autofix.duration")
                .tag("mode", applied ? "apply" : "dry_run")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
