package com.eidos.core.curriculum;

/**
 * Which refinement loop a card suggests.
 */
public enum RecommendedLoop {
    DETERMINISTIC_ONLY("deterministic_only", "single_clear"),
    DETERMINISTIC_THEN_LLM("deterministic_then_llm", "single_plus_llm");

    private final String value;
    private final String answerMode;

    RecommendedLoop(String value, String answerMode) {
        this.value = value;
        this.answerMode = answerMode;
    }

    public String value() {
        return value;
    }

    public String answerMode() {
        return answerMode;
    }

    public boolean usesLlm() {
        return this == DETERMINISTIC_THEN_LLM;
    }
}
