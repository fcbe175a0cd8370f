package com.eidos.core.quality;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword-based {@link AdvisoryGrader}. Deterministic and offline; each sub-score is
 * 0.0, 0.5 or 1.0 and the unified score is their weighted sum.
 */
@Component
public class HeuristicAdvisoryGrader implements AdvisoryGrader {

    private static final Logger log = LoggerFactory.getLogger(HeuristicAdvisoryGrader.class);

    static final double W_ACTIONABILITY = 0.35;
    static final double W_REASONING = 0.25;
    static final double W_SPECIFICITY = 0.25;
    static final double W_OUTCOME = 0.15;

    static final int MIN_LENGTH = 20;

    private static final Pattern STRONG_ACTION = Pattern.compile(
            "^(?:when [^:]+:\\s*|if [^:]+:\\s*)?(?:always|never|use|avoid|add|remove|enable|disable|set|check|"
            + "ensure|run|prefer|validate|verify|cache|retry|pin|split|limit|keep|replace|call|wrap|log|test)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WEAK_ACTION = Pattern.compile(
            "\\b(?:consider|try|should|could|might|maybe|think about)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern STRONG_REASON = Pattern.compile(
            "\\b(?:because|since|due to|so that|otherwise)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WEAK_REASON = Pattern.compile(
            "\\b(?:helps?|prevents?|avoids?|reduces?|improves?)\\b", Pattern.CASE_INSENSITIVE);

    // acronyms and camelCase are case-sensitive; the rest is not
    private static final Pattern SPECIFIC_TOKEN = Pattern.compile(
            "(?i:\\b[\\w-]+\\.(?:java|py|ts|js|json|ya?ml|xml|sql|md|toml|sh|go|rs)\\b)"
            + "|\\b[A-Z]{2,}[A-Za-z0-9]*\\b"
            + "|\\b[a-z]+[A-Z][A-Za-z0-9]+\\b"
            + "|(?i:\\b\\d+(?:\\.\\d+)?\\s?(?:ms|s|%|mb|gb|kb)(?!\\w))"
            + "|(?i:\\b(?:sqlite|postgres|redis|kafka|docker|kubernetes|jwt|oauth|regex|json|http|grpc)\\b)");
    private static final Pattern DOMAIN_WORD = Pattern.compile(
            "\\b(?:auth\\w*|database|api|cache|config\\w*|deploy\\w*|tests?|schema|query|queries|input|"
            + "latency|memory|network|timeout|build|migration|endpoint|login)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern STRONG_OUTCOME = Pattern.compile(
            "\\b(?:fixed|resolved|prevented|reduced|dropped|cut|eliminated|saved)\\b|\\d+(?:\\.\\d+)?\\s?(?:ms|s|%|x)(?!\\w)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WEAK_OUTCOME = Pattern.compile(
            "\\b(?:faster|safer|fewer|better|improves?|speeds? up)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern NOISE = Pattern.compile(
            "^(?:ok(?:ay)?|done|yes|no|thanks|n/a|none|todo|tbd)[.!]?$", Pattern.CASE_INSENSITIVE);

    private static final Pattern CONDITION = Pattern.compile("^(?:when|if)\\s+([^:]+):\\s*(.*)$",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern REASON_SPLIT = Pattern.compile("\\s+(?:because|since|due to)\\s+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern OUTCOME_SPLIT = Pattern.compile("\\s+(?:to|so that)\\s+(?=\\w)",
            Pattern.CASE_INSENSITIVE);

    @Override
    public AdvisoryQuality grade(String text, String source) {
        String normalized = text == null ? "" : text.strip().replaceAll("\\s+", " ");
        if (normalized.isEmpty()) {
            return new AdvisoryQuality(0.0, true, "empty", 0.0, 0.0, 0.0, 0.0,
                    AdvisoryQuality.Structure.EMPTY, "", false);
        }

        double actionability = tiered(normalized, STRONG_ACTION, WEAK_ACTION, true);
        double reasoning = tiered(normalized, STRONG_REASON, WEAK_REASON, false);
        double specificity = tiered(normalized, SPECIFIC_TOKEN, DOMAIN_WORD, false);
        double outcome = tiered(normalized, STRONG_OUTCOME, WEAK_OUTCOME, false);

        double unified = W_ACTIONABILITY * actionability
                + W_REASONING * reasoning
                + W_SPECIFICITY * specificity
                + W_OUTCOME * outcome;
        unified = Math.max(0.0, Math.min(1.0, unified));

        String reason = suppressionReason(normalized, actionability, reasoning, specificity);
        AdvisoryQuality quality = new AdvisoryQuality(unified, !reason.isEmpty(), reason,
                actionability, reasoning, specificity, outcome, structureOf(normalized), normalized, false);
        log.debug("Graded {} statement: unified={} suppressed={} reason={}",
                source, String.format(Locale.ROOT, "%.3f", unified), quality.suppressed(), reason);
        return quality;
    }

    private static double tiered(String text, Pattern strong, Pattern weak, boolean anchored) {
        Matcher m = strong.matcher(text);
        if (anchored ? m.lookingAt() : m.find()) {
            return 1.0;
        }
        return weak.matcher(text).find() ? 0.5 : 0.0;
    }

    private static String suppressionReason(String text, double actionability, double reasoning, double specificity) {
        if (NOISE.matcher(text).matches()) {
            return "noise_pattern";
        }
        if (text.length() < MIN_LENGTH) {
            return "too_short";
        }
        if (actionability == 0.0 && reasoning == 0.0 && specificity == 0.0) {
            return "no_actionable_signal";
        }
        return "";
    }

    static AdvisoryQuality.Structure structureOf(String text) {
        String condition = "";
        String rest = text;
        Matcher cond = CONDITION.matcher(text);
        if (cond.matches()) {
            condition = cond.group(1);
            rest = cond.group(2);
        }
        String reasoning = "";
        String[] byReason = REASON_SPLIT.split(rest, 2);
        if (byReason.length == 2) {
            rest = byReason[0];
            reasoning = byReason[1];
        }
        String outcome = "";
        String[] byOutcome = OUTCOME_SPLIT.split(reasoning.isEmpty() ? rest : reasoning, 2);
        if (byOutcome.length == 2) {
            if (reasoning.isEmpty()) {
                rest = byOutcome[0];
            } else {
                reasoning = byOutcome[0];
            }
            outcome = byOutcome[1];
        }
        return new AdvisoryQuality.Structure(condition, trimPunctuation(rest),
                trimPunctuation(reasoning), trimPunctuation(outcome));
    }

    private static String trimPunctuation(String s) {
        return s.strip().replaceAll("[\\s.,;:]+$", "");
    }
}
