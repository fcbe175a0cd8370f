package com.eidos.core.distillation;

import com.eidos.core.model.ContentIds;
import com.eidos.core.model.Distillation;
import com.eidos.core.model.DistillationType;
import com.eidos.core.model.Episode;
import com.eidos.core.model.Evaluation;
import com.eidos.core.model.Outcome;
import com.eidos.core.model.Step;
import com.eidos.core.model.WordSets;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns finished episodes into candidate rules and merges near-duplicate rules.
 * <p>
 * Reflection dispatches on the episode outcome, one handler per outcome, each
 * producing the same {@link ReflectionResult} shape. Candidate generation is additive:
 * every reflection field that is set yields its own candidate.
 */
@Component
public class DistillationEngine {

    private static final Set<String> DOMAIN_KEYWORDS =
            new LinkedHashSet<>(List.of("api", "auth", "database", "ui", "test", "deploy", "config"));

    static final double SIMILARITY_THRESHOLD = 0.5;
    private static final int MAX_TRIGGERS = 5;
    private static final int MAX_PLAYBOOK_STEPS = 5;

    public ReflectionResult reflectOnEpisode(Episode episode, List<Step> steps) {
        if (steps.isEmpty()) {
            return ReflectionResult.empty();
        }
        return switch (episode.getOutcome()) {
            case SUCCESS -> reflectOnSuccess(steps);
            case FAILURE -> reflectOnFailure(steps);
            case ESCALATED -> reflectOnEscalation(steps);
            default -> reflectOnPartial(steps);
        };
    }

    private ReflectionResult reflectOnSuccess(List<Step> steps) {
        String keyInsight = "";
        String newRule = "";
        for (int i = steps.size() - 1; i >= 0; i--) {
            Step s = steps.get(i);
            if (s.getEvaluation() == Evaluation.PASS && s.getConfidenceAfter() > 0.7) {
                keyInsight = "Success came from: " + s.getDecision();
                newRule = "When " + s.getIntent() + ", try: " + s.getDecision();
                break;
            }
        }

        String wrongAssumption = "";
        String preventiveCheck = "";
        for (Step s : steps) {
            if (s.getEvaluation() == Evaluation.FAIL && !s.getAssumptions().isEmpty()) {
                String assumption = s.getAssumptions().get(0);
                wrongAssumption = "Initially assumed: " + assumption;
                preventiveCheck = "Check assumption: " + assumption;
                break;
            }
        }

        String bottleneck = steps.size() > 5
                ? "Took " + steps.size() + " steps - could optimize discovery phase"
                : "";
        return new ReflectionResult(bottleneck, wrongAssumption, preventiveCheck, newRule, "", keyInsight, 0.8);
    }

    private ReflectionResult reflectOnFailure(List<Step> steps) {
        List<Step> failures = withEvaluation(steps, Evaluation.FAIL);
        String bottleneck = failures.size() >= 2 ? "Repeated failures (" + failures.size() + " times)" : "";

        String wrongAssumption = "";
        String preventiveCheck = "";
        if (!failures.isEmpty()) {
            Step first = failures.get(0);
            wrongAssumption = "First failure: " + first.getPrediction() + " vs " + first.getResult();
            if (!first.getAssumptions().isEmpty()) {
                preventiveCheck = "Validate: " + first.getAssumptions().get(0);
            }
        }
        return new ReflectionResult(bottleneck, wrongAssumption, preventiveCheck, "",
                identifyAntiPattern(failures), "", 0.6);
    }

    private ReflectionResult reflectOnEscalation(List<Step> steps) {
        Set<String> approaches = new LinkedHashSet<>();
        for (Step s : steps) {
            if (!s.getDecision().isEmpty()) {
                approaches.add(ContentIds.prefix(s.getDecision(), 50));
            }
        }
        String keyInsight = approaches.isEmpty() ? "" : "Tried " + approaches.size() + " approaches without success";
        return new ReflectionResult("Escalated - exceeded capability or budget", "", "",
                "Escalate earlier when similar patterns appear", "", keyInsight, 0.5);
    }

    private ReflectionResult reflectOnPartial(List<Step> steps) {
        int passed = withEvaluation(steps, Evaluation.PASS).size();
        int failed = withEvaluation(steps, Evaluation.FAIL).size();
        String keyInsight = passed > 0 ? passed + " steps succeeded, " + failed + " failed" : "";
        return new ReflectionResult("", "", "", "", "", keyInsight, 0.6);
    }

    /** The most repeated failing decision, when it failed at least twice. */
    private String identifyAntiPattern(List<Step> failures) {
        if (failures.size() < 2) return "";
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Step s : failures) {
            counts.merge(s.getDecision(), 1, Integer::sum);
        }
        Map.Entry<String, Integer> top = null;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (top == null || e.getValue() > top.getValue()) top = e;
        }
        if (top != null && top.getValue() >= 2) {
            return "Stop: " + ContentIds.prefix(top.getKey(), 50);
        }
        return "";
    }

    public List<DistillationCandidate> generateDistillations(Episode episode, List<Step> steps,
                                                             ReflectionResult reflection) {
        List<DistillationCandidate> candidates = new ArrayList<>();
        String goal = ContentIds.prefix(episode.getGoal(), 50);

        if (!reflection.newRule().isEmpty()) {
            candidates.add(new DistillationCandidate(
                    DistillationType.HEURISTIC,
                    reflection.newRule(),
                    extractDomains(episode, steps),
                    extractTriggers(steps),
                    stepIds(withEvaluation(steps, Evaluation.PASS)),
                    reflection.confidence(),
                    "Derived from successful episode: " + goal));
        }
        if (!reflection.stopDoing().isEmpty()) {
            candidates.add(new DistillationCandidate(
                    DistillationType.ANTI_PATTERN,
                    reflection.stopDoing(),
                    extractDomains(episode, steps),
                    extractTriggers(steps),
                    stepIds(withEvaluation(steps, Evaluation.FAIL)),
                    reflection.confidence() * 0.8,
                    "Derived from failures in: " + goal));
        }
        if (!reflection.preventiveCheck().isEmpty()) {
            candidates.add(new DistillationCandidate(
                    DistillationType.SHARP_EDGE,
                    reflection.preventiveCheck(),
                    extractDomains(episode, steps),
                    List.of("before", "check", "validate"),
                    stepIds(steps.subList(0, Math.min(3, steps.size()))),
                    reflection.confidence() * 0.7,
                    "Would have prevented issues in: " + goal));
        }
        if (episode.getOutcome() == Outcome.SUCCESS && steps.size() >= 3) {
            DistillationCandidate playbook = generatePlaybook(episode, steps);
            if (playbook != null) {
                candidates.add(playbook);
            }
        }
        return candidates;
    }

    private DistillationCandidate generatePlaybook(Episode episode, List<Step> steps) {
        List<Step> passed = withEvaluation(steps, Evaluation.PASS);
        if (passed.size() < 2) {
            return null;
        }
        List<String> sequence = new ArrayList<>();
        for (int i = 0; i < Math.min(MAX_PLAYBOOK_STEPS, passed.size()); i++) {
            sequence.add((i + 1) + ". " + ContentIds.prefix(passed.get(i).getDecision(), 60));
        }
        String statement = "Playbook for '" + ContentIds.prefix(episode.getGoal(), 30) + "': "
                + String.join(" → ", sequence);
        String[] goalWords = episode.getGoal().trim().split("\\s+");
        List<String> triggers = goalWords[0].isEmpty()
                ? List.of()
                : List.of(goalWords[0].toLowerCase(Locale.ROOT));
        return new DistillationCandidate(DistillationType.PLAYBOOK, statement,
                extractDomains(episode, steps), triggers, stepIds(passed), 0.6,
                "Successful step sequence");
    }

    List<String> extractDomains(Episode episode, List<Step> steps) {
        Set<String> found = new LinkedHashSet<>();
        for (String word : words(episode.getGoal())) {
            if (DOMAIN_KEYWORDS.contains(word)) found.add(word);
        }
        for (Step s : steps.subList(0, Math.min(5, steps.size()))) {
            List<String> intentWords = words(s.getIntent());
            for (String word : intentWords.subList(0, Math.min(3, intentWords.size()))) {
                if (DOMAIN_KEYWORDS.contains(word)) found.add(word);
            }
        }
        return found.isEmpty() ? List.of("general") : new ArrayList<>(found);
    }

    List<String> extractTriggers(List<Step> steps) {
        Set<String> triggers = new LinkedHashSet<>();
        for (Step s : steps) {
            List<String> intentWords = words(s.getIntent());
            if (!intentWords.isEmpty()) triggers.add(intentWords.get(0));
        }
        return new ArrayList<>(triggers).subList(0, Math.min(MAX_TRIGGERS, triggers.size()));
    }

    /**
     * Converts a candidate into a persistable distillation with a fresh id and a
     * revalidation deadline seven days out.
     */
    public Distillation finalizeDistillation(DistillationCandidate candidate) {
        double now = ContentIds.now();
        Distillation d = new Distillation(null, candidate.type(), candidate.statement(), now);
        d.setDomains(candidate.domains());
        d.setTriggers(candidate.triggers());
        d.setSourceSteps(candidate.sourceSteps());
        d.setConfidence(candidate.confidence());
        d.setRevalidateBy(now + Distillation.REVALIDATION_WINDOW_SECONDS);
        return d;
    }

    /** Feedback hook: a retrieved distillation was used and either helped or did not. */
    public Distillation validateDistillation(Distillation distillation, boolean helped) {
        distillation.recordUsage(helped);
        return distillation;
    }

    /**
     * Groups by type, then greedily clusters statements with word-set Jaccard similarity
     * above 0.5. Each cluster collapses onto a copy of its highest-confidence member with
     * the evidence and usage counters summed and source steps unioned. Inputs are not modified.
     */
    public List<Distillation> mergeSimilarDistillations(List<Distillation> distillations) {
        if (distillations.size() < 2) {
            return new ArrayList<>(distillations);
        }
        Map<DistillationType, List<Distillation>> byType = new LinkedHashMap<>();
        for (Distillation d : distillations) {
            byType.computeIfAbsent(d.getType(), t -> new ArrayList<>()).add(d);
        }
        List<Distillation> merged = new ArrayList<>();
        byType.values().forEach(group -> merged.addAll(mergeGroup(group)));
        return merged;
    }

    private List<Distillation> mergeGroup(List<Distillation> group) {
        if (group.size() < 2) return group;
        List<Distillation> result = new ArrayList<>();
        boolean[] used = new boolean[group.size()];
        for (int i = 0; i < group.size(); i++) {
            if (used[i]) continue;
            Distillation first = group.get(i);
            List<Distillation> cluster = new ArrayList<>();
            cluster.add(first);
            for (int j = i + 1; j < group.size(); j++) {
                if (!used[j] && WordSets.jaccard(first.getStatement(), group.get(j).getStatement()) > SIMILARITY_THRESHOLD) {
                    cluster.add(group.get(j));
                    used[j] = true;
                }
            }
            used[i] = true;
            result.add(cluster.size() > 1 ? mergeCluster(cluster) : first);
        }
        return result;
    }

    private Distillation mergeCluster(List<Distillation> cluster) {
        Distillation base = cluster.stream()
                .max(Comparator.comparingDouble(Distillation::getConfidence))
                .orElseThrow()
                .copy();
        Set<String> sources = new LinkedHashSet<>();
        int validations = 0;
        int contradictions = 0;
        int used = 0;
        int helped = 0;
        for (Distillation d : cluster) {
            sources.addAll(d.getSourceSteps());
            validations += d.getValidationCount();
            contradictions += d.getContradictionCount();
            used += d.getTimesUsed();
            helped += d.getTimesHelped();
        }
        base.setSourceSteps(new ArrayList<>(sources));
        base.setValidationCount(validations);
        base.setContradictionCount(contradictions);
        base.setTimesUsed(used);
        base.setTimesHelped(helped);
        return base;
    }

    private static List<Step> withEvaluation(List<Step> steps, Evaluation evaluation) {
        return steps.stream().filter(s -> s.getEvaluation() == evaluation).toList();
    }

    private static List<String> stepIds(List<Step> steps) {
        return steps.stream().map(Step::getStepId).toList();
    }

    private static List<String> words(String text) {
        String trimmed = text == null ? "" : text.toLowerCase(Locale.ROOT).trim();
        return trimmed.isEmpty() ? List.of() : List.of(trimmed.split("\\s+"));
    }
}
