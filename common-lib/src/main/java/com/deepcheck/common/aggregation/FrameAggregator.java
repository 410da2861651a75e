package com.deepcheck.common.aggregation;

import com.deepcheck.common.model.Finding;
import com.deepcheck.common.model.Judgment;
import com.deepcheck.common.model.Severity;
import com.deepcheck.common.model.Verdict;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a sequence of per-frame judgments to one media-level {@link Judgment}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Order frames by timestamp.</li>
 *   <li>Verdict: majority vote; a tie resolves to the most cautious verdict
 *       (MANIPULATED &gt; AUTHENTIC &gt; UNCERTAIN).</li>
 *   <li>Confidence: mean confidence of the frames in the winning group.</li>
 *   <li>Temporal consistency: count verdict changes between consecutive frames. When
 *       {@code changes > temporalFlipRatio × (K − 1)} a {@code temporal_inconsistency} finding is
 *       emitted, {@code HIGH} if every consecutive pair flips, {@code MEDIUM} otherwise.</li>
 *   <li>Findings: the temporal finding (if any), then the findings of the majority-group frames
 *       in timestamp order.</li>
 * </ol>
 *
 * <p>This class is stateless and thread-safe.
 */
public class FrameAggregator {

    public static final String TEMPORAL_INCONSISTENCY = "temporal_inconsistency";
    public static final double DEFAULT_TEMPORAL_FLIP_RATIO = 0.5;

    private final double temporalFlipRatio;

    public FrameAggregator() {
        this(DEFAULT_TEMPORAL_FLIP_RATIO);
    }

    public FrameAggregator(double temporalFlipRatio) {
        if (Double.isNaN(temporalFlipRatio) || temporalFlipRatio < 0.0 || temporalFlipRatio >= 1.0) {
            throw new IllegalArgumentException("temporalFlipRatio must be within [0,1) but was " + temporalFlipRatio);
        }
        this.temporalFlipRatio = temporalFlipRatio;
    }

    /**
     * @param source name recorded on the synthesized judgment (the adapter that judged the frames)
     * @param frames at least one frame judgment, any order
     */
    public FrameAggregate aggregate(String source, List<FrameJudgment> frames) {
        if (frames == null || frames.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty frame sequence");
        }
        List<FrameJudgment> ordered = new ArrayList<>(frames);
        ordered.sort(Comparator.comparing(FrameJudgment::timestamp).thenComparingInt(FrameJudgment::index));

        Verdict winner = majorityVerdict(ordered);

        List<FrameJudgment> majority = ordered.stream()
            .filter(f -> f.judgment().verdict() == winner)
            .toList();
        double confidence = majority.stream()
            .mapToDouble(f -> f.judgment().confidence())
            .average()
            .orElse(0.0);

        int changes = countVerdictChanges(ordered);

        List<Finding> findings = new ArrayList<>();
        Finding temporal = temporalFinding(changes, ordered.size());
        if (temporal != null) {
            findings.add(temporal);
        }
        for (FrameJudgment f : majority) {
            findings.addAll(f.judgment().findings());
        }

        String rationale = rationale(winner, majority, ordered.size(), changes);
        Judgment synthesized = Judgment.of(source, winner, Math.min(1.0, confidence), rationale, findings);
        return new FrameAggregate(synthesized, ordered, changes);
    }

    static Verdict majorityVerdict(List<FrameJudgment> frames) {
        Map<Verdict, Integer> votes = new EnumMap<>(Verdict.class);
        for (FrameJudgment f : frames) {
            votes.merge(f.judgment().verdict(), 1, Integer::sum);
        }
        Verdict best = null;
        int bestVotes = -1;
        for (Map.Entry<Verdict, Integer> e : votes.entrySet()) {
            if (e.getValue() > bestVotes) {
                best = e.getKey();
                bestVotes = e.getValue();
            } else if (e.getValue() == bestVotes) {
                best = Verdict.mostCautious(best, e.getKey());
            }
        }
        return best;
    }

    static int countVerdictChanges(List<FrameJudgment> ordered) {
        int changes = 0;
        for (int i = 1; i < ordered.size(); i++) {
            if (ordered.get(i).judgment().verdict() != ordered.get(i - 1).judgment().verdict()) {
                changes++;
            }
        }
        return changes;
    }

    private Finding temporalFinding(int changes, int frameCount) {
        int transitions = frameCount - 1;
        if (transitions < 1 || changes <= temporalFlipRatio * transitions) {
            return null;
        }
        Severity severity = changes == transitions ? Severity.HIGH : Severity.MEDIUM;
        return Finding.of(TEMPORAL_INCONSISTENCY,
            String.format("Verdict flipped %d times across %d consecutive frame pairs; abrupt changes suggest splicing",
                changes, transitions),
            severity);
    }

    private static String rationale(Verdict winner, List<FrameJudgment> majority, int total, int changes) {
        String summary = String.format("%s in %d of %d sampled frames (%d verdict changes).",
            winner, majority.size(), total, changes);
        return majority.stream()
            .max(Comparator.comparingDouble(f -> f.judgment().confidence()))
            .map(f -> f.judgment().rationale())
            .filter(r -> !r.isBlank())
            .map(r -> summary + " " + r)
            .orElse(summary);
    }
}
