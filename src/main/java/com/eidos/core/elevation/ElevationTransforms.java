package com.eidos.core.elevation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The deterministic text transforms behind {@link Elevator}, in pipeline order.
 * <p>
 * Rules every transform follows: never add information that is not in the text or the
 * context, keep numbers verbatim, prefer shorter output, and return empty rather than
 * force a change when the context has nothing useful.
 */
public final class ElevationTransforms {

    private static final int MAX_LENGTH = 200;
    private static final int CI = Pattern.CASE_INSENSITIVE;

    private ElevationTransforms() {}

    /** Language clean-up first, then context enrichment, then structure. */
    public static List<ElevationTransform> pipeline() {
        return List.of(
                ElevationTransforms::stripHedges,
                ElevationTransforms::restructurePassive,
                ElevationTransforms::errorToPrevention,
                ElevationTransforms::extractActionFromObservation,
                ElevationTransforms::splitCompound,
                ElevationTransforms::addConditionFromContext,
                ElevationTransforms::addTemporalContext,
                ElevationTransforms::addReasoningFromContext,
                ElevationTransforms::addImplicitReasoning,
                ElevationTransforms::quantifyVagueOutcome,
                ElevationTransforms::addOutcomeFromContext,
                ElevationTransforms::collapseRedundant);
    }

    // ── Hedges ──────────────────────────────────────────────────────

    private static final List<Pattern> HEDGES = List.of(
            Pattern.compile("^I think (?:you )?(?:should |could )?(?:maybe |perhaps )?", CI),
            Pattern.compile("^(?:Maybe |Perhaps |Possibly )", CI),
            Pattern.compile("^It (?:might|could|would) be (?:worth|a good idea|helpful) (?:to |if (?:we |you )?)?", CI),
            Pattern.compile(",? just a thought$", CI),
            Pattern.compile("^(?:You )?(?:should |could |might want to )?(?:maybe |perhaps )?consider ", CI),
            Pattern.compile("^(?:You )?(?:should |could |might want to )?(?:maybe |perhaps )?look(?:ing)? into "
                    + "(?:whether (?:we |you )?(?:could )?(?:possibly )?)?", CI),
            Pattern.compile("^Possibly ", CI));

    private static final Pattern GERUND_START =
            Pattern.compile("^(Using|Adding|Enabling|Running|Configuring|Avoiding|Preferring)\\b(.*)$", CI);

    private static final Map<String, String> GERUND_TO_IMPERATIVE = Map.of(
            "using", "Use", "adding", "Add", "enabling", "Enable", "running", "Run",
            "configuring", "Configure", "avoiding", "Avoid", "preferring", "Prefer");

    /** "Maybe consider using Redis" becomes "Use Redis". */
    static Optional<String> stripHedges(String text, Map<String, ?> context) {
        String result = text;
        boolean changed = false;
        for (Pattern hedge : HEDGES) {
            String next = hedge.matcher(result).replaceAll("");
            if (!next.equals(result)) {
                result = next;
                changed = true;
            }
        }
        if (!changed) return Optional.empty();
        if (!result.isEmpty()) {
            Matcher m = GERUND_START.matcher(result);
            if (m.lookingAt()) {
                String imperative = GERUND_TO_IMPERATIVE.getOrDefault(m.group(1).toLowerCase(Locale.ROOT), m.group(1));
                result = imperative + m.group(2);
            }
        }
        return Optional.of(upperFirst(result).strip());
    }

    // ── Passive voice ───────────────────────────────────────────────

    private static final List<Pattern> TRAILING_PASSIVES = List.of(
            Pattern.compile(",?\\s*it was determined\\.?$", CI),
            Pattern.compile(",?\\s*it has been observed\\.?$", CI),
            Pattern.compile(",?\\s*it was found\\.?$", CI),
            Pattern.compile(",?\\s*it was noted\\.?$", CI));

    private static final List<Pattern> PASSIVE_STARTERS = List.of(
            Pattern.compile("^It (?:was|has been) (?:found|observed|determined|noted|discovered) that ", CI),
            Pattern.compile("^It (?:is|was) (?:recommended|suggested|advised) (?:that |to )", CI),
            Pattern.compile(",? it was determined$", CI),
            Pattern.compile(",? it has been observed$", CI));

    private static final Pattern SHOULD_NOT_BE = Pattern.compile("^(?:The )?(.+?) should not be (\\w+?)$", CI);
    private static final Pattern SHOULD_BE = Pattern.compile("^(?:The )?(.+?) should be (\\w+)(.*?)$", CI);
    private static final Pattern NEEDS_TO_BE = Pattern.compile("^(?:The )?(.+?) needs to be (\\w+)(.*?)$", CI);

    /** "Caching should be enabled for reads" becomes "Enable caching for reads". */
    static Optional<String> restructurePassive(String text, Map<String, ?> context) {
        String result = text;
        boolean changed = false;
        for (Pattern p : TRAILING_PASSIVES) {
            String next = p.matcher(result).replaceAll("");
            if (!next.equals(result)) {
                result = next;
                changed = true;
            }
        }
        for (Pattern p : PASSIVE_STARTERS) {
            String next = p.matcher(result).replaceAll("");
            if (!next.equals(result)) {
                result = next;
                changed = true;
            }
        }

        Matcher m = SHOULD_NOT_BE.matcher(result);
        if (m.lookingAt()) {
            String verb = pastParticipleToImperative(rstrip(m.group(2), "."));
            result = "Never " + verb + " the " + m.group(1);
            changed = true;
        } else if ((m = SHOULD_BE.matcher(result)).lookingAt()) {
            String verb = pastParticipleToImperative(m.group(2));
            result = upperFirst(verb) + " " + m.group(1) + rstrip(m.group(3), ".");
            changed = true;
        } else if ((m = NEEDS_TO_BE.matcher(result)).lookingAt()) {
            String verb = pastParticipleToImperative(m.group(2));
            result = upperFirst(verb) + " the " + m.group(1) + rstrip(m.group(3), ".");
            changed = true;
        }
        return changed ? Optional.of(upperFirst(result).strip()) : Optional.empty();
    }

    private static final Map<String, String> KNOWN_PARTICIPLES = new LinkedHashMap<>();

    static {
        String[][] pairs = {
                {"enabled", "enable"}, {"disabled", "disable"}, {"configured", "configure"},
                {"hardcoded", "hardcode"}, {"increased", "increase"}, {"decreased", "decrease"},
                {"updated", "update"}, {"removed", "remove"}, {"validated", "validate"},
                {"determined", "determine"}, {"observed", "observe"}, {"discovered", "discover"},
                {"recommended", "recommend"}, {"suggested", "suggest"}, {"noted", "note"},
                {"optimized", "optimize"}, {"minimized", "minimize"}, {"maximized", "maximize"},
                {"cached", "cache"}, {"indexed", "index"}, {"deployed", "deploy"},
                {"checked", "check"}, {"stopped", "stop"}, {"added", "add"}, {"used", "use"}};
        for (String[] pair : pairs) {
            KNOWN_PARTICIPLES.put(pair[0], pair[1]);
        }
    }

    /** "enabled" to "enable", "hardcoded" to "hardcode", "stopped" to "stop". */
    static String pastParticipleToImperative(String word) {
        String w = rstrip(word.toLowerCase(Locale.ROOT), ".");
        String known = KNOWN_PARTICIPLES.get(w);
        if (known != null) return known;
        if (w.endsWith("ied") && w.length() > 4) {
            return w.substring(0, w.length() - 3) + "y";
        }
        if (w.endsWith("ed") && w.length() > 3) {
            String stem = w.substring(0, w.length() - 2);
            if (stem.length() >= 2 && stem.charAt(stem.length() - 1) == stem.charAt(stem.length() - 2)) {
                return stem.substring(0, stem.length() - 1);
            }
            char beforeEd = w.charAt(w.length() - 3);
            if ("dlrstcgvz".indexOf(beforeEd) >= 0 && !w.endsWith("cked") && !w.endsWith("shed")) {
                return stem + "e";
            }
            return stem;
        }
        return w;
    }

    // ── Errors and observations ─────────────────────────────────────

    private static final Pattern ERROR_OCCURS_WHEN =
            Pattern.compile("^(\\w+Error) (?:occurs|happens|thrown|raised) when (.+?)$", CI);
    private static final Pattern ERROR_WHEN = Pattern.compile("^(\\w+Error) when (\\w+) (.+?)$", CI);

    /** "TypeError occurs when config is None" becomes a validate-first rule. */
    static Optional<String> errorToPrevention(String text, Map<String, ?> context) {
        Matcher m = ERROR_OCCURS_WHEN.matcher(text);
        if (m.lookingAt()) {
            String when = rstrip(m.group(2), ".");
            return bounded("Always validate before " + when + " because " + m.group(1) + " occurs when " + when);
        }
        m = ERROR_WHEN.matcher(text);
        if (m.lookingAt()) {
            return bounded("Use safe access patterns instead of " + m.group(2) + " " + rstrip(m.group(3), ".")
                    + " because " + m.group(1) + " occurs on missing keys");
        }
        return Optional.empty();
    }

    private static final Pattern SLOW_WHEN = Pattern.compile(
            "^(?:The )?(.+?) (?:was|were|is) (?:very )?(?:slow|failing|broken|unstable|unreliable) when (.+?)$", CI);
    private static final Pattern KEPT_GROWING = Pattern.compile(
            "^(.+?) kept (\\w+) because (?:the )?(.+?) (?:were|was) never (.+?)$", CI);

    /** "The API was slow when X" becomes "Add X because missing it causes slow api". */
    static Optional<String> extractActionFromObservation(String text, Map<String, ?> context) {
        Matcher m = SLOW_WHEN.matcher(text);
        if (m.lookingAt()) {
            return bounded("Add " + rstrip(m.group(2), ".") + " because missing it causes slow "
                    + m.group(1).toLowerCase(Locale.ROOT));
        }
        m = KEPT_GROWING.matcher(text);
        if (m.lookingAt()) {
            return bounded("Always " + m.group(4) + " " + m.group(3) + " because leaked " + m.group(3)
                    + " cause " + m.group(1).toLowerCase(Locale.ROOT) + " to keep " + m.group(2));
        }
        return Optional.empty();
    }

    // ── Compound statements ─────────────────────────────────────────

    private static final Pattern AND_WORD = Pattern.compile("\\band\\b", CI);
    private static final Pattern AND_SPLIT = Pattern.compile("\\s+and\\s+", CI);
    private static final Pattern INDEPENDENT_CLAUSE = Pattern.compile(
            "^(.+?)\\s+and\\s+((?:never|always|also|then|enable|add|use|avoid)\\s+.+?)(?:\\s+because\\s+(.+))?$", CI);
    private static final Pattern BECAUSE_CLAUSE = Pattern.compile("\\s+because\\s+(.+?)(?:\\s+and\\s+|$)", CI);

    /** Keeps the first clause of a compound statement and any trailing "because" clause. */
    static Optional<String> splitCompound(String text, Map<String, ?> context) {
        int andCount = 0;
        Matcher counter = AND_WORD.matcher(text);
        while (counter.find()) andCount++;

        if (andCount < 2) {
            Matcher m = INDEPENDENT_CLAUSE.matcher(text);
            if (!m.lookingAt()) return Optional.empty();
            String first = m.group(1).strip();
            String because = m.group(3);
            return Optional.of(because != null ? first + " because " + because.strip() : first);
        }

        String because = null;
        String withoutBecause = text;
        Matcher bm = BECAUSE_CLAUSE.matcher(text);
        if (bm.find()) {
            because = rstrip(bm.group(1).strip(), ".");
            withoutBecause = text.substring(0, bm.start()).strip();
        }
        String[] parts = AND_SPLIT.split(withoutBecause);
        if (parts.length < 2) return Optional.empty();
        String first = parts[0].strip();
        return Optional.of(because != null ? first + " because " + because : first);
    }

    // ── Context enrichment ──────────────────────────────────────────

    private static final Pattern HAS_CONDITION = Pattern.compile("^(?:When|If|For|In|During) ", CI);
    private static final Set<String> GENERIC_DOMAINS = Set.of("code", "general", "unknown");

    /** Prefixes "When editing {file}:" or "When working on {domain}:" from context. */
    static Optional<String> addConditionFromContext(String text, Map<String, ?> context) {
        if (text.isEmpty() || HAS_CONDITION.matcher(text).lookingAt()) return Optional.empty();

        String filePath = contextValue(context, "file_path");
        String domain = contextValue(context, "domain");
        String toolName = contextValue(context, "tool_name");

        if (!filePath.isEmpty()) {
            String normalized = filePath.replace("\\", "/");
            String basename = filePath.length() > 40
                    ? normalized.substring(normalized.lastIndexOf('/') + 1)
                    : filePath;
            if (!toolName.isEmpty()) {
                return Optional.of("When using " + toolName + " on " + basename + ": " + lowerFirst(text));
            }
            return Optional.of("When editing " + basename + ": " + lowerFirst(text));
        }
        if (!domain.isEmpty() && !GENERIC_DOMAINS.contains(domain)) {
            return Optional.of("When working on " + domain.replace("_", " ") + ": " + lowerFirst(text));
        }
        return Optional.empty();
    }

    private static final Pattern HAS_TEMPORAL =
            Pattern.compile("\\b(?:since|as of|after|before|from|in \\d{4})\\b", CI);
    private static final Pattern YEAR_MONTH = Pattern.compile("(\\d{4})-(\\d{2})(?:-\\d{2})?");
    private static final String[] MONTHS = {
            "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"};

    /** Prefixes "Since {Mon} {year}:" from a context timestamp. */
    static Optional<String> addTemporalContext(String text, Map<String, ?> context) {
        String timestamp = contextValue(context, "timestamp");
        if (timestamp.isEmpty() || text.isEmpty()) return Optional.empty();
        if (HAS_TEMPORAL.matcher(text).find()) return Optional.empty();

        Matcher m = YEAR_MONTH.matcher(timestamp);
        if (!m.lookingAt()) return Optional.empty();
        int month = Integer.parseInt(m.group(2));
        String monthName = month >= 1 && month <= 12 ? MONTHS[month - 1] : m.group(2);
        return Optional.of("Since " + monthName + " " + m.group(1) + ": " + lowerFirst(text));
    }

    private static final Pattern HAS_REASONING =
            Pattern.compile("\\b(?:because|since|due to|the reason)\\b", CI);

    /**
     * Appends "because {error}" from context, unless the reason restates the action
     * (three or more shared words among the first five of each).
     */
    static Optional<String> addReasoningFromContext(String text, Map<String, ?> context) {
        if (HAS_REASONING.matcher(text).find()) return Optional.empty();
        String error = contextValue(context, "error");
        if (error.length() < 5) return Optional.empty();

        String reason = rstrip(error.length() > 80 ? error.substring(0, 80) : error, ".");
        String composed = rstrip(text, ".") + " because " + reason;

        Set<String> actionWords = firstWords(text, 5);
        actionWords.retainAll(firstWords(reason, 5));
        if (actionWords.size() >= 3) return Optional.empty();
        return bounded(composed);
    }

    private static final Pattern HAS_IMPLICIT_REASONING =
            Pattern.compile("\\b(?:because|since|due to|as|so that)\\b", CI);
    private static final Pattern PURPOSE_CLAUSE = Pattern.compile(
            "^((?:Use|Add|Enable|Implement|Set|Configure|Run|Prefer|Avoid)\\s+.+?)\\s+to\\s+(\\w+\\s+.+?)$", CI);

    /** "Use X to Y" becomes "Use X because Y"; only purpose clauses, not "for" context. */
    static Optional<String> addImplicitReasoning(String text, Map<String, ?> context) {
        if (HAS_IMPLICIT_REASONING.matcher(text).find()) return Optional.empty();
        Matcher m = PURPOSE_CLAUSE.matcher(text);
        if (!m.lookingAt()) return Optional.empty();
        return bounded(rstrip(m.group(1), ".") + " because " + rstrip(m.group(2), "."));
    }

    private static final List<Pattern> VAGUE_OUTCOMES = List.of(
            Pattern.compile("(?:made |was )?(?:things |it |everything )?(?:much |way |really |significantly )?"
                    + "(?:faster|slower|better|worse)", CI),
            Pattern.compile("(?:really |significantly )?(?:helped|improved|fixed)(?: with)? (?:\\w+ )*"
                    + "(?:performance|speed|latency|throughput)", CI),
            Pattern.compile("(?:things|it|everything) (?:got |became )?(?:much |way )?(?:faster|slower|better|worse)", CI));

    /** Replaces "much faster" style phrases with the concrete metric in {@code outcome_evidence}. */
    static Optional<String> quantifyVagueOutcome(String text, Map<String, ?> context) {
        String evidence = contextValue(context, "outcome_evidence");
        if (evidence.length() < 5) return Optional.empty();
        for (Pattern vague : VAGUE_OUTCOMES) {
            Matcher m = vague.matcher(text);
            if (m.find()) {
                String cleaned = m.replaceFirst(Matcher.quoteReplacement(rstrip(evidence, ".")));
                if (!cleaned.equals(text) && cleaned.length() <= MAX_LENGTH) {
                    return Optional.of(cleaned);
                }
            }
        }
        return Optional.empty();
    }

    private static final Pattern HAS_METRIC = Pattern.compile("\\d+(?:ms|s|%|x)\\b");

    /** Appends ", which {outcome_evidence}" unless the text already carries a metric. */
    static Optional<String> addOutcomeFromContext(String text, Map<String, ?> context) {
        String evidence = contextValue(context, "outcome_evidence");
        if (evidence.length() < 5) return Optional.empty();
        if (HAS_METRIC.matcher(text).find()) return Optional.empty();
        return bounded(rstrip(text, ".") + ", which " + rstrip(evidence, "."));
    }

    // ── Redundancy ──────────────────────────────────────────────────

    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.!]\\s+");
    private static final Pattern ACTION_VERBS = Pattern.compile(
            "\\b(?:always|never|use|avoid|enable|disable|add|remove|set|check|ensure|run|prefer)\\b", CI);

    /** Keeps the sentence with the most action verbs, only if materially shorter than the whole. */
    static Optional<String> collapseRedundant(String text, Map<String, ?> context) {
        List<String> sentences = new ArrayList<>();
        for (String s : SENTENCE_BREAK.split(text)) {
            if (!s.isBlank()) sentences.add(s.strip());
        }
        if (sentences.size() < 2) return Optional.empty();

        String best = null;
        int bestScore = -1;
        for (String s : sentences) {
            int score = 0;
            Matcher m = ACTION_VERBS.matcher(s);
            while (m.find()) score++;
            if (score > bestScore || (score == bestScore && s.length() > (best == null ? 0 : best.length()))) {
                best = s;
                bestScore = score;
            }
        }
        if (best != null && best.length() < text.length() * 0.8) {
            return Optional.of(rstrip(best, "."));
        }
        return Optional.empty();
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private static Optional<String> bounded(String candidate) {
        return candidate.length() <= MAX_LENGTH ? Optional.of(candidate) : Optional.empty();
    }

    private static String contextValue(Map<String, ?> context, String key) {
        Object v = context == null ? null : context.get(key);
        return v == null ? "" : String.valueOf(v).strip();
    }

    private static Set<String> firstWords(String text, int n) {
        String[] words = text.toLowerCase(Locale.ROOT).strip().split("\\s+");
        Set<String> out = new HashSet<>();
        for (int i = 0; i < Math.min(n, words.length); i++) {
            if (!words[i].isEmpty()) out.add(words[i]);
        }
        return out;
    }

    static String rstrip(String text, String chars) {
        int end = text.length();
        while (end > 0 && chars.indexOf(text.charAt(end - 1)) >= 0) end--;
        return text.substring(0, end);
    }

    private static String upperFirst(String text) {
        if (text.isEmpty() || !Character.isLowerCase(text.charAt(0))) return text;
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static String lowerFirst(String text) {
        if (text.isEmpty()) return text;
        return Character.toLowerCase(text.charAt(0)) + text.substring(1);
    }
}
