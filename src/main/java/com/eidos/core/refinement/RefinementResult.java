package com.eidos.core.refinement;

import com.eidos.core.quality.AdvisoryQuality;

/**
 * Best-ranked text found by {@link DistillationRefiner} and its grade.
 *
 * @param text    the chosen text, empty only when the input was empty
 * @param quality grade of {@code text}
 * @param changed whether {@code text} differs from the stripped input
 */
public record RefinementResult(String text, AdvisoryQuality quality, boolean changed) {
}
