package com.eidos.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resource constraints attached to an {@link Episode} at creation.
 *
 * @param maxSteps           steps allowed before the budget is exhausted
 * @param maxTimeSeconds     wall-clock seconds allowed
 * @param maxRetriesPerError retries allowed for a single error signature
 */
public record Budget(
    int maxSteps,
    int maxTimeSeconds,
    int maxRetriesPerError
) implements Serializable {

    public static final int DEFAULT_MAX_STEPS = 25;
    public static final int DEFAULT_MAX_TIME_SECONDS = 720;
    public static final int DEFAULT_MAX_RETRIES_PER_ERROR = 3;

    public static Budget defaults() {
        return new Budget(DEFAULT_MAX_STEPS, DEFAULT_MAX_TIME_SECONDS, DEFAULT_MAX_RETRIES_PER_ERROR);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("max_steps", maxSteps);
        out.put("max_time_seconds", maxTimeSeconds);
        out.put("max_retries_per_error", maxRetriesPerError);
        return out;
    }

    public static Budget fromMap(Map<String, ?> data) {
        return new Budget(
                MapValues.integer(data, "max_steps", DEFAULT_MAX_STEPS),
                MapValues.integer(data, "max_time_seconds", DEFAULT_MAX_TIME_SECONDS),
                MapValues.integer(data, "max_retries_per_error", DEFAULT_MAX_RETRIES_PER_ERROR));
    }
}
