package com.eidos.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A bounded learning unit: one goal, one budget, one terminal outcome.
 *
 * <p>Episodes are created at task start, mutated while steps run and completed exactly once,
 * at which point they become eligible for distillation.
 */
public class Episode {

    private String episodeId;
    private String goal;
    private String successCriteria;
    private List<String> constraints;
    private Budget budget;
    private Phase phase;
    private Outcome outcome;
    private String finalEvaluation;
    private double startTs;
    private Double endTs;
    private int stepCount;
    private Map<String, Integer> errorCounts;

    public Episode(String goal, String successCriteria) {
        this(null, goal, successCriteria, Budget.defaults(), ContentIds.now());
    }

    public Episode(String episodeId, String goal, String successCriteria, Budget budget, double startTs) {
        this.goal = goal == null ? "" : goal;
        this.successCriteria = successCriteria == null ? "" : successCriteria;
        this.constraints = new ArrayList<>();
        this.budget = budget == null ? Budget.defaults() : budget;
        this.phase = Phase.EXPLORE;
        this.outcome = Outcome.IN_PROGRESS;
        this.finalEvaluation = "";
        this.startTs = startTs;
        this.errorCounts = new LinkedHashMap<>();
        this.episodeId = ContentIds.isBlank(episodeId)
                ? ContentIds.generate(ContentIds.prefix(this.goal, 50), startTs)
                : episodeId;
    }

    public boolean isBudgetExceeded() {
        return isBudgetExceeded(ContentIds.now());
    }

    public boolean isBudgetExceeded(double now) {
        if (stepCount >= budget.maxSteps()) {
            return true;
        }
        return now - startTs >= budget.maxTimeSeconds();
    }

    public boolean isErrorLimitExceeded(String errorSignature) {
        return errorCounts.getOrDefault(errorSignature, 0) >= budget.maxRetriesPerError();
    }

    public void recordError(String errorSignature) {
        errorCounts.merge(errorSignature, 1, Integer::sum);
    }

    public void recordStep() {
        stepCount++;
    }

    /**
     * Moves to {@code next} when the phase rules allow it.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public void transitionTo(Phase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal phase transition " + phase + " -> " + next);
        }
        phase = next;
    }

    public boolean isComplete() {
        return outcome.isTerminal();
    }

    public void complete(Outcome terminal, String evaluation) {
        complete(terminal, evaluation, ContentIds.now());
    }

    /**
     * Records the terminal outcome. An episode completes exactly once.
     */
    public void complete(Outcome terminal, String evaluation, double now) {
        if (terminal == null || !terminal.isTerminal()) {
            throw new IllegalArgumentException("Episode must complete with a terminal outcome, got " + terminal);
        }
        if (outcome.isTerminal()) {
            throw new IllegalStateException("Episode " + episodeId + " already completed as " + outcome);
        }
        outcome = terminal;
        finalEvaluation = evaluation == null ? "" : evaluation;
        endTs = now;
        if (terminal == Outcome.ESCALATED) {
            phase = Phase.ESCALATE;
        }
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("episode_id", episodeId);
        out.put("goal", goal);
        out.put("success_criteria", successCriteria);
        out.put("constraints", new ArrayList<>(constraints));
        out.put("budget", budget.toMap());
        out.put("phase", phase.value());
        out.put("outcome", outcome.value());
        out.put("final_evaluation", finalEvaluation);
        out.put("start_ts", startTs);
        out.put("end_ts", endTs);
        out.put("step_count", stepCount);
        out.put("error_counts", new LinkedHashMap<>(errorCounts));
        return out;
    }

    public static Episode fromMap(Map<String, ?> data) {
        Episode e = new Episode(
                MapValues.string(data, "episode_id", null),
                MapValues.string(data, "goal", ""),
                MapValues.string(data, "success_criteria", ""),
                Budget.fromMap(MapValues.map(data, "budget")),
                MapValues.number(data, "start_ts", ContentIds.now()));
        e.constraints = MapValues.strings(data, "constraints");
        e.phase = Phase.fromValue(MapValues.string(data, "phase", null));
        e.outcome = Outcome.fromValue(MapValues.string(data, "outcome", null));
        e.finalEvaluation = MapValues.string(data, "final_evaluation", "");
        e.endTs = MapValues.nullableNumber(data, "end_ts");
        e.stepCount = MapValues.integer(data, "step_count", 0);
        e.errorCounts = MapValues.counts(data, "error_counts");
        return e;
    }

    public String getEpisodeId() { return episodeId; }
    public String getGoal() { return goal; }
    public void setGoal(String goal) { this.goal = goal; }
    public String getSuccessCriteria() { return successCriteria; }
    public void setSuccessCriteria(String successCriteria) { this.successCriteria = successCriteria; }
    public List<String> getConstraints() { return constraints; }
    public void setConstraints(List<String> constraints) { this.constraints = new ArrayList<>(constraints); }
    public Budget getBudget() { return budget; }
    public Phase getPhase() { return phase; }
    public void setPhase(Phase phase) { this.phase = phase; }
    public Outcome getOutcome() { return outcome; }
    public void setOutcome(Outcome outcome) { this.outcome = outcome; }
    public String getFinalEvaluation() { return finalEvaluation; }
    public void setFinalEvaluation(String finalEvaluation) { this.finalEvaluation = finalEvaluation; }
    public double getStartTs() { return startTs; }
    public Double getEndTs() { return endTs; }
    public void setEndTs(Double endTs) { this.endTs = endTs; }
    public int getStepCount() { return stepCount; }
    public void setStepCount(int stepCount) { this.stepCount = stepCount; }
    public Map<String, Integer> getErrorCounts() { return errorCounts; }
}
