package com.eidos.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The atomic decision packet: intent, decision and prediction before the action,
 * result and evaluation after it. Owned by exactly one {@link Episode} through {@code episodeId}.
 */
public class Step {

    private String stepId;
    private String episodeId;

    private String intent;
    private String decision;
    private List<String> alternatives = new ArrayList<>();
    private List<String> assumptions = new ArrayList<>();
    private String prediction = "";
    private double confidenceBefore = 0.5;

    private ActionType actionType = ActionType.REASONING;
    private Map<String, Object> actionDetails = new LinkedHashMap<>();

    private String result = "";
    private Evaluation evaluation = Evaluation.UNKNOWN;
    private double surpriseLevel;
    private String lesson = "";
    private double confidenceAfter = 0.5;

    private List<String> retrievedMemories = new ArrayList<>();
    private boolean memoryCited;
    private Boolean memoryUseful;

    private boolean validated;
    private String validationMethod = "";

    private double createdAt;

    public Step(String episodeId, String intent, String decision) {
        this(null, episodeId, intent, decision, ContentIds.now());
    }

    public Step(String stepId, String episodeId, String intent, String decision, double createdAt) {
        this.episodeId = episodeId == null ? "" : episodeId;
        this.intent = intent == null ? "" : intent;
        this.decision = decision == null ? "" : decision;
        this.createdAt = createdAt;
        this.stepId = ContentIds.isBlank(stepId)
                ? ContentIds.generate(this.episodeId + ":" + ContentIds.prefix(this.intent, 30), createdAt)
                : stepId;
    }

    /** Mandatory pre-action fields that are still missing; empty when the step may act. */
    public List<String> missingBeforeAction() {
        List<String> missing = new ArrayList<>();
        if (intent.isEmpty()) missing.add("intent");
        if (decision.isEmpty()) missing.add("decision");
        if (prediction.isEmpty()) missing.add("prediction");
        return missing;
    }

    /** Mandatory post-action fields that are still missing; empty when the step is fully recorded. */
    public List<String> missingAfterAction() {
        List<String> missing = new ArrayList<>();
        if (result.isEmpty()) missing.add("result");
        if (evaluation == Evaluation.UNKNOWN) missing.add("evaluation");
        if (!validated && validationMethod.isEmpty()) missing.add("validation");
        return missing;
    }

    public boolean isValidBeforeAction() {
        return missingBeforeAction().isEmpty();
    }

    public boolean isValidAfterAction() {
        return missingAfterAction().isEmpty();
    }

    /** Only complete steps may feed distillation. */
    public boolean isComplete() {
        return isValidBeforeAction() && isValidAfterAction();
    }

    public double calculateSurprise() {
        if (prediction.isEmpty() || result.isEmpty()) {
            return 0.0;
        }
        if (evaluation == Evaluation.FAIL) return 0.8;
        if (evaluation == Evaluation.PARTIAL) return 0.5;

        if (WordSets.of(prediction).isEmpty() || WordSets.of(result).isEmpty()) {
            return 0.0;
        }
        return 1.0 - WordSets.jaccard(prediction, result);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("step_id", stepId);
        out.put("episode_id", episodeId);
        out.put("intent", intent);
        out.put("decision", decision);
        out.put("alternatives", new ArrayList<>(alternatives));
        out.put("assumptions", new ArrayList<>(assumptions));
        out.put("prediction", prediction);
        out.put("confidence_before", confidenceBefore);
        out.put("action_type", actionType.value());
        out.put("action_details", new LinkedHashMap<>(actionDetails));
        out.put("result", result);
        out.put("evaluation", evaluation.value());
        out.put("surprise_level", surpriseLevel);
        out.put("lesson", lesson);
        out.put("confidence_after", confidenceAfter);
        out.put("retrieved_memories", new ArrayList<>(retrievedMemories));
        out.put("memory_cited", memoryCited);
        out.put("memory_useful", memoryUseful);
        out.put("validated", validated);
        out.put("validation_method", validationMethod);
        out.put("created_at", createdAt);
        return out;
    }

    public static Step fromMap(Map<String, ?> data) {
        Step s = new Step(
                MapValues.string(data, "step_id", null),
                MapValues.string(data, "episode_id", ""),
                MapValues.string(data, "intent", ""),
                MapValues.string(data, "decision", ""),
                MapValues.number(data, "created_at", ContentIds.now()));
        s.alternatives = MapValues.strings(data, "alternatives");
        s.assumptions = MapValues.strings(data, "assumptions");
        s.prediction = MapValues.string(data, "prediction", "");
        s.confidenceBefore = MapValues.number(data, "confidence_before", 0.5);
        s.actionType = ActionType.fromValue(MapValues.string(data, "action_type", null));
        s.actionDetails = MapValues.map(data, "action_details");
        s.result = MapValues.string(data, "result", "");
        s.evaluation = Evaluation.fromValue(MapValues.string(data, "evaluation", null));
        s.surpriseLevel = MapValues.number(data, "surprise_level", 0.0);
        s.lesson = MapValues.string(data, "lesson", "");
        s.confidenceAfter = MapValues.number(data, "confidence_after", 0.5);
        s.retrievedMemories = MapValues.strings(data, "retrieved_memories");
        s.memoryCited = MapValues.bool(data, "memory_cited", false);
        s.memoryUseful = MapValues.nullableBool(data, "memory_useful");
        s.validated = MapValues.bool(data, "validated", false);
        s.validationMethod = MapValues.string(data, "validation_method", "");
        return s;
    }

    public String getStepId() { return stepId; }
    public String getEpisodeId() { return episodeId; }
    public String getIntent() { return intent; }
    public void setIntent(String intent) { this.intent = intent == null ? "" : intent; }
    public String getDecision() { return decision; }
    public void setDecision(String decision) { this.decision = decision == null ? "" : decision; }
    public List<String> getAlternatives() { return alternatives; }
    public void setAlternatives(List<String> alternatives) { this.alternatives = new ArrayList<>(alternatives); }
    public List<String> getAssumptions() { return assumptions; }
    public void setAssumptions(List<String> assumptions) { this.assumptions = new ArrayList<>(assumptions); }
    public String getPrediction() { return prediction; }
    public void setPrediction(String prediction) { this.prediction = prediction == null ? "" : prediction; }
    public double getConfidenceBefore() { return confidenceBefore; }
    public void setConfidenceBefore(double confidenceBefore) { this.confidenceBefore = confidenceBefore; }
    public ActionType getActionType() { return actionType; }
    public void setActionType(ActionType actionType) { this.actionType = actionType; }
    public Map<String, Object> getActionDetails() { return actionDetails; }
    public void setActionDetails(Map<String, Object> actionDetails) { this.actionDetails = new LinkedHashMap<>(actionDetails); }
    public String getResult() { return result; }
    public void setResult(String result) { this.result = result == null ? "" : result; }
    public Evaluation getEvaluation() { return evaluation; }
    public void setEvaluation(Evaluation evaluation) { this.evaluation = evaluation; }
    public double getSurpriseLevel() { return surpriseLevel; }
    public void setSurpriseLevel(double surpriseLevel) { this.surpriseLevel = surpriseLevel; }
    public String getLesson() { return lesson; }
    public void setLesson(String lesson) { this.lesson = lesson == null ? "" : lesson; }
    public double getConfidenceAfter() { return confidenceAfter; }
    public void setConfidenceAfter(double confidenceAfter) { this.confidenceAfter = confidenceAfter; }
    public List<String> getRetrievedMemories() { return retrievedMemories; }
    public void setRetrievedMemories(List<String> retrievedMemories) { this.retrievedMemories = new ArrayList<>(retrievedMemories); }
    public boolean isMemoryCited() { return memoryCited; }
    public void setMemoryCited(boolean memoryCited) { this.memoryCited = memoryCited; }
    public Boolean getMemoryUseful() { return memoryUseful; }
    public void setMemoryUseful(Boolean memoryUseful) { this.memoryUseful = memoryUseful; }
    public boolean isValidated() { return validated; }
    public void setValidated(boolean validated) { this.validated = validated; }
    public String getValidationMethod() { return validationMethod; }
    public void setValidationMethod(String validationMethod) { this.validationMethod = validationMethod == null ? "" : validationMethod; }
    public double getCreatedAt() { return createdAt; }
}
