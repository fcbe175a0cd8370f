package com.eidos.core.quality;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Grading result for one statement, as produced by an {@link AdvisoryGrader} and stored
 * in the {@code advisory_quality} JSON column.
 *
 * @param unifiedScore      single scalar quality in [0, 1]
 * @param suppressed        whether the statement would be withheld from advice
 * @param suppressionReason why it was suppressed, empty otherwise
 * @param actionability     sub-score in [0, 1]
 * @param reasoning         sub-score in [0, 1]
 * @param specificity       sub-score in [0, 1]
 * @param outcomeLinked     sub-score in [0, 1]
 * @param structure         condition/action/reasoning/outcome parts
 * @param advisoryText      the text that was graded
 * @param softPromoted      set by autofix when an archive row passed the soft promotion floor
 */
public record AdvisoryQuality(
    double unifiedScore,
    boolean suppressed,
    String suppressionReason,
    double actionability,
    double reasoning,
    double specificity,
    double outcomeLinked,
    Structure structure,
    String advisoryText,
    boolean softPromoted
) {

    /**
     * Preference order between two candidates: not suppressed first, then unified score,
     * then actionability + reasoning + specificity, then shorter text.
     */
    public static final Comparator<AdvisoryQuality> RANK = Comparator
            .comparing((AdvisoryQuality q) -> !q.suppressed())
            .thenComparingDouble(AdvisoryQuality::unifiedScore)
            .thenComparingDouble(AdvisoryQuality::combinedScore)
            .thenComparingInt(q -> -q.advisoryText().length());

    public AdvisoryQuality {
        suppressionReason = suppressionReason == null ? "" : suppressionReason;
        structure = structure == null ? Structure.EMPTY : structure;
        advisoryText = advisoryText == null ? "" : advisoryText;
    }

    public static AdvisoryQuality empty() {
        return new AdvisoryQuality(0.0, false, "", 0.0, 0.0, 0.0, 0.0, Structure.EMPTY, "", false);
    }

    public double combinedScore() {
        return actionability + reasoning + specificity;
    }

    /** Strictly better under {@link #RANK}. */
    public boolean outranks(AdvisoryQuality other) {
        return RANK.compare(this, other) > 0;
    }

    public AdvisoryQuality withSoftPromoted(boolean value) {
        return new AdvisoryQuality(unifiedScore, suppressed, suppressionReason, actionability, reasoning,
                specificity, outcomeLinked, structure, advisoryText, value);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("unified_score", unifiedScore);
        out.put("suppressed", suppressed);
        out.put("suppression_reason", suppressionReason);
        out.put("actionability", actionability);
        out.put("reasoning", reasoning);
        out.put("specificity", specificity);
        out.put("outcome_linked", outcomeLinked);
        out.put("structure", structure.toMap());
        if (!advisoryText.isEmpty()) {
            out.put("advisory_text", advisoryText);
        }
        if (softPromoted) {
            out.put("soft_promoted", true);
        }
        return out;
    }

    /** Lenient decode: missing or mistyped fields take their defaults. Never throws. */
    public static AdvisoryQuality fromMap(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return empty();
        }
        Object rawStructure = data.get("structure");
        Structure structure = rawStructure instanceof Map<?, ?> m ? Structure.fromMap(m) : Structure.EMPTY;
        return new AdvisoryQuality(
                number(data.get("unified_score")),
                bool(data.get("suppressed")),
                text(data.get("suppression_reason")),
                number(data.get("actionability")),
                number(data.get("reasoning")),
                number(data.get("specificity")),
                number(data.get("outcome_linked")),
                structure,
                text(data.get("advisory_text")),
                bool(data.get("soft_promoted")));
    }

    private static double number(Object v) {
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    private static boolean bool(Object v) {
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() != 0;
        if (v instanceof String s) return Boolean.parseBoolean(s.trim());
        return false;
    }

    private static String text(Object v) {
        return v == null ? "" : String.valueOf(v);
    }

    /**
     * The structured parts of a statement. Empty strings for parts that were not found.
     */
    public record Structure(String condition, String action, String reasoning, String outcome) {

        public static final Structure EMPTY = new Structure("", "", "", "");

        public Structure {
            condition = condition == null ? "" : condition.strip();
            action = action == null ? "" : action.strip();
            reasoning = reasoning == null ? "" : reasoning.strip();
            outcome = outcome == null ? "" : outcome.strip();
        }

        public Map<String, Object> toMap() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("condition", condition.isEmpty() ? null : condition);
            out.put("action", action.isEmpty() ? null : action);
            out.put("reasoning", reasoning.isEmpty() ? null : reasoning);
            out.put("outcome", outcome.isEmpty() ? null : outcome);
            return out;
        }

        static Structure fromMap(Map<?, ?> data) {
            return new Structure(
                    text(data.get("condition")),
                    text(data.get("action")),
                    text(data.get("reasoning")),
                    text(data.get("outcome")));
        }
    }
}
