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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Improves a distillation statement for advisory use without ever making it worse.
 * <p>
 * The raw statement is graded first. Deterministic rewrites (elevation, a template rewrite
 * from the graded structure, a from-scratch compose) are tried while the best score stays
 * under the target; the gated LLM areas are consulted afterwards. Each candidate is graded
 * and replaces the current best only if it ranks strictly higher under
 * {@link AdvisoryQuality#RANK}.
 */
@Component
public class DistillationRefiner {

    private static final Logger log = LoggerFactory.getLogger(DistillationRefiner.class);

    static final int MIN_CANDIDATE_LENGTH = 20;
    static final double RESCUE_FLOOR = 0.35;

    private static final List<String> REFINED_KEYS = List.of("refined", "refinement", "advisory_text", "text");
    private static final Pattern BULLET = Pattern.compile("^\\s*(?:\\d+[.):\\-]|-|\\*)\\s*");
    private static final Pattern TRAILING_PUNCT = Pattern.compile("[ ,.;:]+$");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final AdvisoryGrader grader;
    private final Elevator elevator;
    private final LlmAreaService llmAreas;
    private final EidosProperties properties;
    private final EidosMetrics metrics;

    public DistillationRefiner(AdvisoryGrader grader, Elevator elevator, LlmAreaService llmAreas,
                               EidosProperties properties, EidosMetrics metrics) {
        this.grader = grader;
        this.elevator = elevator;
        this.llmAreas = llmAreas;
        this.properties = properties;
        this.metrics = metrics;
    }

    public RefinementResult refine(String statement, String source, Map<String, ?> context) {
        return refine(statement, source, context, properties.getRefiner().getMinUnifiedScore());
    }

    public RefinementResult refine(String statement, String source, Map<String, ?> context, double minUnifiedScore) {
        String base = statement == null ? "" : statement.strip();
        if (base.isEmpty()) {
            return new RefinementResult("", grader.grade("", source), false);
        }
        Map<String, ?> ctx = context == null ? Map.of() : context;
        Best best = new Best(base, grader.grade(base, source));

        if (best.score() < minUnifiedScore) {
            consider(best, elevator.elevate(base, ctx), source, "elevate");
        }
        if (best.score() < minUnifiedScore) {
            consider(best, rewriteFromStructure(best.quality.structure(), best.text), source, "rewrite");
        }
        if (best.score() < minUnifiedScore) {
            consider(best, composeFromStructure(best.quality.structure()), source, "compose");
        }

        double currentScore = best.score();
        boolean suppressed = best.quality.suppressed();
        double llmFloor = properties.getRefiner().getLlmMinUnifiedScore();

        if (llmAreas.isEnabled(LlmArea.RUNTIME_REFINE) && (suppressed || currentScore < llmFloor)) {
            consider(best, runtimeCandidate(best.text, source, ctx), source, "runtime_llm");
        }
        if (suppressed || currentScore < minUnifiedScore) {
            consider(best, archiveRewrite(best.text, best.quality), source, "archive_rewrite");
        }
        if (suppressed && currentScore < RESCUE_FLOOR) {
            consider(best, archiveRescue(best.text, best.quality, source), source, "archive_rescue");
        }

        boolean changed = !best.text.equals(base);
        metrics.recordRefinement(changed);
        return new RefinementResult(best.text, best.quality, changed);
    }

    private void consider(Best best, String candidateText, String source, String step) {
        String candidate = candidateText == null ? "" : candidateText.strip();
        if (candidate.isEmpty() || candidate.equals(best.text)) {
            return;
        }
        AdvisoryQuality quality = grader.grade(candidate, source);
        if (quality.outranks(best.quality)) {
            log.debug("Refinement step {} improved unified score {} -> {}", step,
                    fmt(best.score()), fmt(quality.unifiedScore()));
            best.text = candidate;
            best.quality = quality;
        }
    }

    // ─── Deterministic candidates ───────────────────────────────────

    static String rewriteFromStructure(AdvisoryQuality.Structure structure, String fallback) {
        if (structure.action().isEmpty()) {
            return fallback;
        }
        StringBuilder sb = new StringBuilder(lead(structure));
        if (!structure.reasoning().isEmpty()) {
            sb.append(" because ").append(structure.reasoning());
        }
        if (!structure.outcome().isEmpty()) {
            sb.append(" to ").append(structure.outcome());
        }
        String rewritten = sb.toString().strip();
        return rewritten.length() >= MIN_CANDIDATE_LENGTH ? rewritten : fallback;
    }

    static String composeFromStructure(AdvisoryQuality.Structure structure) {
        if (structure.action().isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(lead(structure));
        if (!structure.reasoning().isEmpty()) {
            sb.append(" because ").append(structure.reasoning());
        }
        if (!structure.outcome().isEmpty()) {
            sb.append(" (").append(structure.outcome()).append(')');
        }
        return sb.toString().strip();
    }

    private static String lead(AdvisoryQuality.Structure structure) {
        String action = structure.action();
        if (!structure.condition().isEmpty()) {
            return "When " + structure.condition() + ": " + action;
        }
        return action.length() > 1 ? Character.toUpperCase(action.charAt(0)) + action.substring(1) : action;
    }

    // ─── LLM candidates ─────────────────────────────────────────────

    private String runtimeCandidate(String text, String source, Map<String, ?> context) {
        LlmAreaResult result = llmAreas.call(LlmArea.RUNTIME_REFINE, "", source, contextJson(context), text);
        if (!result.usedLlm() || !result.hasText()) {
            return "";
        }
        return extractRefinement(result.text(), llmAreas.maxChars(LlmArea.RUNTIME_REFINE));
    }

    private String archiveRewrite(String text, AdvisoryQuality quality) {
        String reason = quality.suppressionReason().isEmpty() ? "low score" : quality.suppressionReason();
        LlmAreaResult result = llmAreas.call(LlmArea.ARCHIVE_REWRITE, text, text, reason, fmt(quality.unifiedScore()));
        return result.text();
    }

    private String archiveRescue(String text, AdvisoryQuality quality, String source) {
        return llmAreas.callStructured(LlmArea.ARCHIVE_RESCUE, RescueVerdict.class,
                        text, fmt(quality.unifiedScore()), quality.suppressionReason(), source)
                .filter(RescueVerdict::rescue)
                .map(RescueVerdict::rewrite)
                .orElse("");
    }

    /**
     * Pulls a single advisory sentence out of free-form model output: code fences removed,
     * a JSON {@code refined}-style field preferred over the first line, list bullets and
     * repeated whitespace dropped. Returns "" when fewer than 20 characters remain.
     */
    static String extractRefinement(String raw, int maxChars) {
        String text = LlmService.stripFence(raw);
        String candidate = "";
        if (text.startsWith("{")) {
            candidate = fromJson(text);
        }
        if (candidate.isEmpty()) {
            candidate = text.isEmpty() ? "" : text.split("\\R", 2)[0].strip();
        }
        candidate = BULLET.matcher(candidate).replaceFirst("").strip();
        candidate = candidate.replaceAll("\\s+", " ").strip();
        if (candidate.length() > maxChars) {
            candidate = TRAILING_PUNCT.matcher(candidate.substring(0, maxChars)).replaceFirst("");
        }
        return candidate.length() >= MIN_CANDIDATE_LENGTH ? candidate : "";
    }

    private static String fromJson(String text) {
        try {
            Map<String, Object> payload = MAPPER.readValue(text, new TypeReference<Map<String, Object>>() {});
            for (String key : REFINED_KEYS) {
                if (payload.get(key) instanceof String s && !s.isBlank()) {
                    return s.strip();
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("LLM refinement was not JSON: {}", e.getOriginalMessage());
        }
        return "";
    }

    private static String contextJson(Map<String, ?> context) {
        try {
            return MAPPER.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            log.debug("Context not serializable for LLM prompt: {}", e.getOriginalMessage());
            return "{}";
        }
    }

    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.2f", v);
    }

    private static final class Best {
        private String text;
        private AdvisoryQuality quality;

        Best(String text, AdvisoryQuality quality) {
            this.text = text;
            this.quality = quality;
        }

        double score() {
            return quality.unifiedScore();
        }
    }
}
