package com.deepcheck.common.model;

import java.util.Locale;
import java.util.Map;

/**
 * Verdict labels produced by classifiers and by the consensus resolver.
 *
 * <p>Media artifacts use {@code AUTHENTIC / MANIPULATED / UNCERTAIN}; textual claims use
 * {@code TRUE / FALSE / UNCERTAIN}. Both share {@code UNCERTAIN}, which is how a classifier
 * abstains.
 *
 * <p><b>Cautionary priority</b> (used to break ties):
 * <pre>
 *   MANIPULATED / FALSE  → 2   (alarm-raising)
 *   AUTHENTIC   / TRUE   → 1
 *   UNCERTAIN            → 0
 * </pre>
 */
public enum Verdict {
    AUTHENTIC(1),
    MANIPULATED(2),
    TRUE(1),
    FALSE(2),
    UNCERTAIN(0);

    /** Wire labels emitted by the classifier prompts, lower-cased. */
    private static final Map<String, Verdict> MEDIA_LABELS = Map.of(
        "real",        AUTHENTIC,
        "authentic",   AUTHENTIC,
        "fake",        MANIPULATED,
        "manipulated", MANIPULATED,
        "deepfake",    MANIPULATED
    );

    private static final Map<String, Verdict> CLAIM_LABELS = Map.of(
        "true",  TRUE,
        "false", FALSE
    );

    private final int priority;

    Verdict(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }

    public boolean isDecisive() {
        return this != UNCERTAIN;
    }

    /**
     * Maps a classifier label to a verdict for the given domain.
     * Unknown, blank, {@code mixed} and {@code unverifiable} labels resolve to {@link #UNCERTAIN};
     * a label belonging to the other domain is also treated as an abstention.
     */
    public static Verdict parse(Domain domain, String label) {
        if (label == null || label.isBlank()) return UNCERTAIN;
        String key = label.trim().toLowerCase(Locale.ROOT);
        Map<String, Verdict> labels = domain == Domain.CLAIM ? CLAIM_LABELS : MEDIA_LABELS;
        return labels.getOrDefault(key, UNCERTAIN);
    }

    /**
     * Returns whichever of the two verdicts ranks higher in the cautionary order.
     * When both rank equally, {@code first} is returned.
     */
    public static Verdict mostCautious(Verdict first, Verdict second) {
        return second.priority > first.priority ? second : first;
    }
}
