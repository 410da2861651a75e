package com.deepcheck.verification.classifier;

/**
 * Prompt catalogue shared by every remote adapter, so both services are asked the same question
 * and answer in the same JSON shape.
 */
public final class ClassifierPrompts {

    public static final String MEDIA_FORENSICS = """
        You are a forensic image analyst. Your only job is to find flaws in this image; do not praise its quality.

        Work through these checks in order:

        1. Hands and fingers: locate every hand, count the fingers, look for malformed joints,
           merged fingers or impossible grips.
        2. Eyes and face: are the pupils round, do the reflections in both eyes match,
           are the teeth individual or a uniform white bar, does skin look glossy or plastic?
        3. Physics: do shadows fall consistently with the light source, do reflections match their objects?
        4. Boundaries: blending seams around hair, jaw and ears; warped background lines; smeared text.

        Verdict rules:
        - Any anatomical error (extra or missing fingers, fused teeth) means "fake" with high confidence.
        - Any strong physics error means "fake".
        - Perfect lighting with plastic-looking skin means "uncertain" or "fake".
        - Answer "real" only if no flaw survives close scrutiny.

        Respond with a single JSON object and nothing else:
        {
          "verdict": "fake" | "real" | "uncertain",
          "confidence": <number between 0.0 and 1.0>,
          "reasoning": "<what you checked and what you saw>",
          "artifacts_detected": ["<one entry per flaw>"]
        }
        """;

    private static final String FACT_CHECK = """
        You are an expert fact-checker verifying claims that circulate during breaking news and crises.

        CLAIM: %s

        1. Decide whether the claim is TRUE, FALSE, MIXED (partially true) or UNVERIFIABLE.
        2. Give a confidence between 0.0 and 1.0.
        3. Explain your reasoning with specific evidence.
        4. Consider whether the claim is taken out of context or relies on a logical fallacy.

        Respond with a single JSON object and nothing else:
        {
          "verdict": "true" | "false" | "mixed" | "unverifiable",
          "confidence": <number between 0.0 and 1.0>,
          "reasoning": "<detailed assessment>",
          "supporting_evidence": ["<evidence for the claim>"],
          "contradicting_evidence": ["<evidence against the claim>"]
        }
        """;

    public static final String FACT_CHECK_SYSTEM =
        "You are an expert fact-checker with deep knowledge of current events and crisis situations.";

    public static final String EXPLAINER_SYSTEM =
        "You explain fact-check results clearly and accurately to the audience you are given.";

    private ClassifierPrompts() {}

    public static String factCheck(String claim) {
        return String.format(FACT_CHECK, claim);
    }

    public static String forArtifact(Artifact artifact) {
        return artifact.isClaim() ? factCheck(artifact.text()) : MEDIA_FORENSICS;
    }
}
