package com.eidos.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A persisted, reusable rule extracted from experience.
 *
 * <p>{@code sourceSteps} are weak references to {@link Step} ids; deleting a step never touches
 * the distillations built from it. Confidence stays within [{@value #MIN_CONFIDENCE}, {@value #MAX_CONFIDENCE}].
 */
public class Distillation {

    public static final double MIN_CONFIDENCE = 0.1;
    public static final double MAX_CONFIDENCE = 1.0;
    public static final double HELPED_DELTA = 0.05;
    public static final double UNHELPED_DELTA = 0.10;
    public static final double REVALIDATION_WINDOW_SECONDS = 7 * 24 * 3600;

    private String distillationId;
    private DistillationType type;
    private String statement;

    private List<String> domains = new ArrayList<>();
    private List<String> triggers = new ArrayList<>();
    private List<String> antiTriggers = new ArrayList<>();

    private List<String> sourceSteps = new ArrayList<>();
    private int validationCount;
    private int contradictionCount;
    private double confidence = 0.5;

    private int timesRetrieved;
    private int timesUsed;
    private int timesHelped;

    private double createdAt;
    private Double revalidateBy;

    private String refinedStatement = "";
    private Map<String, Object> advisoryQuality = new LinkedHashMap<>();

    public Distillation(DistillationType type, String statement) {
        this(null, type, statement, ContentIds.now());
    }

    public Distillation(String distillationId, DistillationType type, String statement, double createdAt) {
        this.type = type == null ? DistillationType.HEURISTIC : type;
        this.statement = statement == null ? "" : statement;
        this.createdAt = createdAt;
        this.revalidateBy = createdAt + REVALIDATION_WINDOW_SECONDS;
        this.distillationId = ContentIds.isBlank(distillationId)
                ? ContentIds.generate(this.type.value() + ":" + ContentIds.prefix(this.statement, 50), createdAt)
                : distillationId;
    }

    /** Share of uses that helped; 0.5 while unused. */
    public double effectiveness() {
        if (timesUsed == 0) return 0.5;
        return (double) timesHelped / timesUsed;
    }

    /** Share of validations among all evidence; falls back to confidence without evidence. */
    public double reliability() {
        int total = validationCount + contradictionCount;
        if (total == 0) return confidence;
        return (double) validationCount / total;
    }

    public void recordRetrieval() {
        timesRetrieved++;
    }

    public void recordUsage(boolean helped) {
        timesUsed++;
        if (helped) {
            timesHelped++;
            validationCount++;
            confidence = Math.min(MAX_CONFIDENCE, confidence + HELPED_DELTA);
        } else {
            contradictionCount++;
            confidence = Math.max(MIN_CONFIDENCE, confidence - UNHELPED_DELTA);
        }
    }

    public boolean isDueForRevalidation(double now) {
        return revalidateBy != null && revalidateBy <= now;
    }

    /** The refined text when one exists, otherwise the raw statement. */
    public String effectiveStatement() {
        return refinedStatement == null || refinedStatement.isBlank() ? statement : refinedStatement;
    }

    /** An independent copy with the same id and every field. */
    public Distillation copy() {
        return fromMap(toMap());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("distillation_id", distillationId);
        out.put("type", type.value());
        out.put("statement", statement);
        out.put("domains", new ArrayList<>(domains));
        out.put("triggers", new ArrayList<>(triggers));
        out.put("anti_triggers", new ArrayList<>(antiTriggers));
        out.put("source_steps", new ArrayList<>(sourceSteps));
        out.put("validation_count", validationCount);
        out.put("contradiction_count", contradictionCount);
        out.put("confidence", confidence);
        out.put("times_retrieved", timesRetrieved);
        out.put("times_used", timesUsed);
        out.put("times_helped", timesHelped);
        out.put("created_at", createdAt);
        out.put("revalidate_by", revalidateBy);
        out.put("refined_statement", refinedStatement);
        out.put("advisory_quality", new LinkedHashMap<>(advisoryQuality));
        return out;
    }

    public static Distillation fromMap(Map<String, ?> data) {
        Distillation d = new Distillation(
                MapValues.string(data, "distillation_id", null),
                DistillationType.fromValue(MapValues.string(data, "type", null)),
                MapValues.string(data, "statement", ""),
                MapValues.number(data, "created_at", ContentIds.now()));
        d.domains = MapValues.strings(data, "domains");
        d.triggers = MapValues.strings(data, "triggers");
        d.antiTriggers = MapValues.strings(data, "anti_triggers");
        d.sourceSteps = MapValues.strings(data, "source_steps");
        d.validationCount = MapValues.integer(data, "validation_count", 0);
        d.contradictionCount = MapValues.integer(data, "contradiction_count", 0);
        d.confidence = MapValues.number(data, "confidence", 0.5);
        d.timesRetrieved = MapValues.integer(data, "times_retrieved", 0);
        d.timesUsed = MapValues.integer(data, "times_used", 0);
        d.timesHelped = MapValues.integer(data, "times_helped", 0);
        if (data.containsKey("revalidate_by")) {
            d.revalidateBy = MapValues.nullableNumber(data, "revalidate_by");
        }
        d.refinedStatement = MapValues.string(data, "refined_statement", "");
        d.advisoryQuality = MapValues.map(data, "advisory_quality");
        return d;
    }

    public String getDistillationId() { return distillationId; }
    public void setDistillationId(String distillationId) { this.distillationId = distillationId; }
    public DistillationType getType() { return type; }
    public String getStatement() { return statement; }
    public void setStatement(String statement) { this.statement = statement == null ? "" : statement; }
    public List<String> getDomains() { return domains; }
    public void setDomains(List<String> domains) { this.domains = new ArrayList<>(domains); }
    public List<String> getTriggers() { return triggers; }
    public void setTriggers(List<String> triggers) { this.triggers = new ArrayList<>(triggers); }
    public List<String> getAntiTriggers() { return antiTriggers; }
    public void setAntiTriggers(List<String> antiTriggers) { this.antiTriggers = new ArrayList<>(antiTriggers); }
    public List<String> getSourceSteps() { return sourceSteps; }
    public void setSourceSteps(List<String> sourceSteps) { this.sourceSteps = new ArrayList<>(sourceSteps); }
    public int getValidationCount() { return validationCount; }
    public void setValidationCount(int validationCount) { this.validationCount = validationCount; }
    public int getContradictionCount() { return contradictionCount; }
    public void setContradictionCount(int contradictionCount) { this.contradictionCount = contradictionCount; }
    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) {
        this.confidence = Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
    }
    public int getTimesRetrieved() { return timesRetrieved; }
    public void setTimesRetrieved(int timesRetrieved) { this.timesRetrieved = timesRetrieved; }
    public int getTimesUsed() { return timesUsed; }
    public void setTimesUsed(int timesUsed) { this.timesUsed = timesUsed; }
    public int getTimesHelped() { return timesHelped; }
    public void setTimesHelped(int timesHelped) { this.timesHelped = timesHelped; }
    public double getCreatedAt() { return createdAt; }
    public Double getRevalidateBy() { return revalidateBy; }
    public void setRevalidateBy(Double revalidateBy) { this.revalidateBy = revalidateBy; }
    public String getRefinedStatement() { return refinedStatement; }
    public void setRefinedStatement(String refinedStatement) { this.refinedStatement = refinedStatement == null ? "" : refinedStatement; }
    public Map<String, Object> getAdvisoryQuality() { return advisoryQuality; }
    public void setAdvisoryQuality(Map<String, Object> advisoryQuality) {
        this.advisoryQuality = advisoryQuality == null ? new LinkedHashMap<>() : new LinkedHashMap<>(advisoryQuality);
    }
}
