package com.eidos.core.curriculum;

/**
 * Knobs for one {@link CurriculumAutofixService#run} batch.
 *
 * @param maxCards              rows to attempt, at least 1
 * @param minGain               unified-score delta that counts as an improvement on its own
 * @param apply                 write changes; false opens the database read-only
 * @param includeArchive        also target archived rows
 * @param promoteOnSuccess      copy improved archive rows back into the active table
 * @param promoteMinUnified     unified-score floor for that copy
 * @param archiveFallbackLlm    give archive rows a second refinement pass when the first one stalls
 * @param softPromoteOnSuccess  tag improved archive rows as soft promoted instead
 * @param softPromoteMinUnified unified-score floor for soft promotion
 */
public record AutofixOptions(
        int maxCards,
        double minGain,
        boolean apply,
        boolean includeArchive,
        boolean promoteOnSuccess,
        double promoteMinUnified,
        boolean archiveFallbackLlm,
        boolean softPromoteOnSuccess,
        double softPromoteMinUnified
) {

    public AutofixOptions {
        maxCards = Math.max(1, maxCards);
        minGain = Math.max(0.0, minGain);
    }

    public static AutofixOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Label reported as {@code mode_used}. */
    public String modeUsed() {
        return archiveFallbackLlm ? "deterministic_plus_fallback" : "deterministic_only";
    }

    public static final class Builder {
        private int maxCards = 5;
        private double minGain = 0.03;
        private boolean apply;
        private boolean includeArchive;
        private boolean promoteOnSuccess;
        private double promoteMinUnified = 0.60;
        private boolean archiveFallbackLlm = true;
        private boolean softPromoteOnSuccess;
        private double softPromoteMinUnified = 0.35;

        private Builder() {}

        public Builder maxCards(int maxCards) {
            this.maxCards = maxCards;
            return this;
        }

        public Builder minGain(double minGain) {
            this.minGain = minGain;
            return this;
        }

        public Builder apply(boolean apply) {
            this.apply = apply;
            return this;
        }

        public Builder includeArchive(boolean includeArchive) {
            this.includeArchive = includeArchive;
            return this;
        }

        public Builder promoteOnSuccess(boolean promoteOnSuccess) {
            this.promoteOnSuccess = promoteOnSuccess;
            return this;
        }

        public Builder promoteMinUnified(double promoteMinUnified) {
            this.promoteMinUnified = promoteMinUnified;
            return this;
        }

        public Builder archiveFallbackLlm(boolean archiveFallbackLlm) {
            this.archiveFallbackLlm = archiveFallbackLlm;
            return this;
        }

        public Builder softPromoteOnSuccess(boolean softPromoteOnSuccess) {
            this.softPromoteOnSuccess = softPromoteOnSuccess;
            return this;
        }

        public Builder softPromoteMinUnified(double softPromoteMinUnified) {
            this.softPromoteMinUnified = softPromoteMinUnified;
            return this;
        }

        public AutofixOptions build() {
            return new AutofixOptions(maxCards, minGain, apply, includeArchive, promoteOnSuccess,
                    promoteMinUnified, archiveFallbackLlm, softPromoteOnSuccess, softPromoteMinUnified);
        }
    }
}
