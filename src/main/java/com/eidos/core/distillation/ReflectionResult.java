package com.eidos.core.distillation;

/**
 * Deterministic post-episode analysis. Empty strings mean "nothing identified".
 *
 * @param bottleneck      what slowed or stopped the episode
 * @param wrongAssumption the assumption that turned out false
 * @param preventiveCheck a check that would have prevented the failure
 * @param newRule         a rule worth adopting
 * @param stopDoing       a repeated failing decision, prefixed {@code "Stop: "}
 * @param keyInsight      the most important learning
 * @param confidence      confidence in this reflection
 */
public record ReflectionResult(
    String bottleneck,
    String wrongAssumption,
    String preventiveCheck,
    String newRule,
    String stopDoing,
    String keyInsight,
    double confidence
) {

    public static ReflectionResult empty() {
        return new ReflectionResult("", "", "", "", "", "", 0.5);
    }
}
