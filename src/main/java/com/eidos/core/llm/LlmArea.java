package com.eidos.core.llm;

import java.util.Arrays;
import java.util.Optional;

/**
 * The gated places where an LLM may be consulted. Each area carries its own prompt pair
 * and the defaults used when {@code eidos.llm.areas.<id>} leaves a value unset.
 * <p>
 * Templates are {@link String#formatted} patterns; argument order is documented per area.
 */
public enum LlmArea {

    /** Args: source, context JSON, statement. */
    RUNTIME_REFINE("runtime_refine", 6.0, 280,
            "Return JSON only.",
            """
            Rewrite this distillation into ONE concise, action-first advisory sentence.
            Rules:
            - Keep original meaning and constraints.
            - Do not invent facts.
            - Prefer format: 'When <condition>: <action> because <reason>'.
            - 20 to 220 chars.
            - Output JSON only: {"refined": "..."}

            Source: %s
            Context: %s
            Input: %s"""),

    /** Args: statement, suppression reason, score. */
    ARCHIVE_REWRITE("archive_rewrite", 6.0, 300,
            "You improve suppressed learning statements so they can pass quality gates. "
            + "Make statements actionable, specific, and grounded in evidence. "
            + "Preserve the original insight. Return ONLY the rewritten statement.",
            """
            Rewrite this suppressed statement to be actionable and specific:

            Original: %s
            Suppression reason: %s
            Quality score: %s/10

            Rewritten statement:"""),

    /** Args: statement, unified score, suppression reason, domain. */
    ARCHIVE_RESCUE("archive_rescue", 8.0, 400,
            "You evaluate whether suppressed learning items contain genuine insight "
            + "worth rescuing. Consider the original intent, not just the wording. "
            + "Return JSON: {\"rescue\": true/false, \"reason\": \"...\", \"rewrite\": \"...\"}",
            """
            Should this suppressed item be rescued?

            Statement: %s
            Unified score: %s
            Suppression reason: %s
            Domain: %s

            Return only JSON."""),

    /** Args: gap counts, severity counts, rows scanned. */
    CURRICULUM_GAP_SUMMARIZE("curriculum_gap_summarize", 10.0, 600,
            "You summarize which learning loops are stagnating and why. "
            + "Identify: loops with no new distillations, loops repeating same errors, "
            + "domains with zero coverage. Be concise and actionable.",
            """
            Summarize curriculum gaps from this data:

            Gap counts: %s
            Severity counts: %s
            Rows scanned: %s

            Gap summary:""");

    static final double MIN_TIMEOUT_SECONDS = 0.5;
    static final double MAX_TIMEOUT_SECONDS = 120.0;
    static final int MIN_MAX_CHARS = 50;
    static final int MAX_MAX_CHARS = 5000;

    private final String id;
    private final double defaultTimeoutSeconds;
    private final int defaultMaxChars;
    private final String systemPrompt;
    private final String template;

    LlmArea(String id, double defaultTimeoutSeconds, int defaultMaxChars, String systemPrompt, String template) {
        this.id = id;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds;
        this.defaultMaxChars = defaultMaxChars;
        this.systemPrompt = systemPrompt;
        this.template = template;
    }

    public String id() {
        return id;
    }

    public double defaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public int defaultMaxChars() {
        return defaultMaxChars;
    }

    public String systemPrompt() {
        return systemPrompt;
    }

    public String prompt(Object... args) {
        return template.formatted(args);
    }

    public static Optional<LlmArea> fromId(String id) {
        return Arrays.stream(values()).filter(a -> a.id.equals(id)).findFirst();
    }

    static double clampTimeout(Double configured, double fallback) {
        double v = configured == null || configured.isNaN() ? fallback : configured;
        return Math.max(MIN_TIMEOUT_SECONDS, Math.min(MAX_TIMEOUT_SECONDS, v));
    }

    static int clampMaxChars(Integer configured, int fallback) {
        int v = configured == null ? fallback : configured;
        return Math.max(MIN_MAX_CHARS, Math.min(MAX_MAX_CHARS, v));
    }
}
