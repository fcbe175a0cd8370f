package com.eidos.core.curriculum;

/**
 * Kinds of weakness a curriculum card can point at, each with its drill question
 * and the short answer an operator should aim for.
 */
public enum GapType {

    SUPPRESSED_STATEMENT("suppressed_statement",
            "What single action-first rewrite would remove suppression without changing meaning?",
            "Rewrite to explicit 'When <condition>: <action> because <reason>' and keep it under 220 chars."),
    LOW_UNIFIED_SCORE("low_unified_score",
            "Which missing component (condition/action/reason) most directly raises unified quality above floor?",
            "Fill the weakest missing component first, then re-score before any further edits."),
    LOW_ACTIONABILITY("low_actionability",
            "What exact operator action should be taken first?",
            "Replace observations with a direct verb-led action and include scope."),
    LOW_REASONING("low_reasoning",
            "What causal 'because' clause is supported by episode evidence?",
            "Attach one evidence-grounded reason; avoid speculative rationale."),
    LOW_SPECIFICITY("low_specificity",
            "Which concrete context (tool/file/constraint) should be named?",
            "Name one concrete context anchor and remove vague terms."),
    LOW_EFFECTIVENESS("low_effectiveness",
            "Why is this distillation retrieved often but helping rarely?",
            "Tighten trigger conditions or archive until stronger evidence exists.");

    private final String value;
    private final String question;
    private final String clearAnswer;

    GapType(String value, String question, String clearAnswer) {
        this.value = value;
        this.question = question;
        this.clearAnswer = clearAnswer;
    }

    public String value() {
        return value;
    }

    public String question() {
        return question;
    }

    public String clearAnswer() {
        return clearAnswer;
    }
}
