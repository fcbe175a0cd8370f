package com.eidos.core.distillation;

import com.eidos.core.model.DistillationType;

import java.util.List;

/**
 * A proposed rule, not yet persisted. See {@link DistillationEngine#finalizeDistillation}.
 */
public record DistillationCandidate(
    DistillationType type,
    String statement,
    List<String> domains,
    List<String> triggers,
    List<String> sourceSteps,
    double confidence,
    String rationale
) {

    public DistillationCandidate {
        domains = List.copyOf(domains);
        triggers = List.copyOf(triggers);
        sourceSteps = List.copyOf(sourceSteps);
    }
}
