package com.eidos.core.curriculum;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One prioritized question about one distillation.
 */
public record GapCard(
        String cardId,
        String distillationId,
        String type,
        String source,
        GapType gap,
        Severity severity,
        RecommendedLoop recommendedLoop,
        String statement,
        String why,
        String archiveReason
) {

    /** Highest severity first, LLM-assisted loops ahead of deterministic ones at equal severity. */
    public static final Comparator<GapCard> PRIORITY = Comparator
            .comparingInt((GapCard c) -> c.severity().weight())
            .thenComparing(c -> c.recommendedLoop().usesLlm())
            .reversed();

    public String question() {
        return gap.question();
    }

    public String clearAnswer() {
        return gap.clearAnswer();
    }

    public boolean llmRuntimeRecommended() {
        return recommendedLoop.usesLlm();
    }

    public String answerMode() {
        return recommendedLoop.answerMode();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("card_id", cardId);
        out.put("distillation_id", distillationId);
        out.put("type", type);
        out.put("source", source);
        out.put("gap", gap.value());
        out.put("severity", severity.value());
        out.put("question", question());
        out.put("clear_answer", clearAnswer());
        out.put("recommended_loop", recommendedLoop.value());
        out.put("llm_runtime_recommended", llmRuntimeRecommended());
        out.put("answer_mode", answerMode());
        out.put("statement", statement);
        out.put("why", why);
        out.put("archive_reason", archiveReason);
        return out;
    }
}
