package com.eidos.core.llm;

/**
 * Outcome of one {@link LlmAreaService} call. {@code text} is the model output, or the
 * caller's fallback when the area is disabled or the call failed.
 *
 * @param failure empty on success; otherwise a short description such as {@code timeout}
 */
public record LlmAreaResult(
        String areaId,
        String text,
        boolean usedLlm,
        String provider,
        double latencyMs,
        String failure
) {

    public LlmAreaResult {
        text = text == null ? "" : text;
        provider = provider == null ? "none" : provider;
        failure = failure == null ? "" : failure;
    }

    static LlmAreaResult disabled(String areaId, String fallback) {
        return new LlmAreaResult(areaId, fallback, false, "none", 0.0, "");
    }

    public boolean hasText() {
        return !text.isBlank();
    }
}
