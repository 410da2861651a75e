package com.deepcheck.verification.explanation;

import com.deepcheck.common.explanation.AudienceLevel;

import java.util.List;

/**
 * One prompt per {@link AudienceLevel}. Every prompt asks for the same JSON object so a single
 * parser reads all three.
 */
final class ExplanationPrompts {

    private static final String ANSWER_SHAPE = """

        Respond with a single JSON object and nothing else:
        {
          "title": "<headline for the result>",
          "summary": "<%s>",
          "detailed_explanation": "<%s>",
          "what_to_do": "<%s>",
          "what_to_avoid": "<%s>",
          "key_points": ["<point>", "<point>", "<point>"]
        }
        """;

    private static final String SIMPLE = """
        Explain a fact-check result to the general public in plain, everyday words.

        CLAIM: %s
        VERDICT: %s
        CONFIDENCE: %s
        REASONING: %s

        Write at an 8th grade reading level, avoid jargon and technical terms,
        be empathetic and non-judgmental, and give clear practical guidance.
        """ + ANSWER_SHAPE.formatted(
            "2-3 sentences on the verdict",
            "the full explanation in simple terms",
            "practical advice on what to do with this information",
            "what not to do or believe");

    private static final String GENERAL = """
        Explain a fact-check result to an informed general audience.

        CLAIM: %s
        VERDICT: %s
        CONFIDENCE: %s
        REASONING: %s

        Balance accessibility with detail, give context, cite the evidence behind the verdict
        and offer actionable guidance.
        """ + ANSWER_SHAPE.formatted(
            "3-4 sentences with the key context",
            "a complete explanation with evidence",
            "recommended actions based on this information",
            "common misconceptions or harmful actions to avoid");

    private static final String EXPERT = """
        Explain a fact-check result to researchers, journalists and policymakers.

        CLAIM: %s
        VERDICT: %s
        CONFIDENCE: %s
        REASONING: %s
        EVIDENCE: %s

        Go into technical depth, discuss how confident the assessment is and why,
        reference the specific evidence, and address implications and limitations.
        """ + ANSWER_SHAPE.formatted(
            "a concise technical summary",
            "an in-depth analysis including method and confidence",
            "expert recommendations and open research questions",
            "analytical pitfalls and limitations to keep in mind");

    private ExplanationPrompts() {}

    static String forLevel(AudienceLevel level, String claim, String verdict, double confidence,
                           String reasoning, List<String> evidence) {
        String percent = Math.round(confidence * 100) + "%";
        String why = reasoning == null || reasoning.isBlank() ? "none given" : reasoning;
        return switch (level) {
            case SIMPLE -> SIMPLE.formatted(claim, verdict, percent, why);
            case GENERAL -> GENERAL.formatted(claim, verdict, percent, why);
            case EXPERT -> EXPERT.formatted(claim, verdict, percent, why,
                evidence.isEmpty() ? "none listed" : String.join("; ", evidence));
        };
    }
}
