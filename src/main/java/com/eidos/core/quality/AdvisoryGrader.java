package com.eidos.core.quality;

/**
 * Scores a candidate statement for advisory usefulness.
 */
public interface AdvisoryGrader {

    /**
     * @param text   the statement to grade
     * @param source where the statement came from (e.g. {@code eidos}, {@code archive})
     */
    AdvisoryQuality grade(String text, String source);
}
