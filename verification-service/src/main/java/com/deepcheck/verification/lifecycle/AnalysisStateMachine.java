package com.deepcheck.verification.lifecycle;

import com.deepcheck.common.consensus.ConsensusResult;
import com.deepcheck.common.exception.IllegalStateTransitionException;
import com.deepcheck.common.model.AnalysisStatus;
import com.deepcheck.common.model.FailureKind;
import com.deepcheck.verification.model.AnalysisRecord;
import com.deepcheck.verification.model.JsonColumns;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * The only place where an analysis record changes status.
 *
 * <pre>
 *   PENDING ──begin──▶ ANALYZING ──complete──▶ COMPLETED
 *                               └──fail──────▶ FAILED
 * </pre>
 * Every other move, including any move out of a terminal state, throws
 * {@link IllegalStateTransitionException} and leaves the record untouched.
 */
@Component
public class AnalysisStateMachine {

    private final JsonColumns json;
    private final Clock clock;

    public AnalysisStateMachine(JsonColumns json, Clock clock) {
        this.json = json;
        this.clock = clock;
    }

    public <R extends AnalysisRecord> R begin(R record) {
        transition(record, AnalysisStatus.ANALYZING);
        record.setStartedAt(now());
        return record;
    }

    public <R extends AnalysisRecord> R complete(R record, ConsensusResult result) {
        Objects.requireNonNull(result, "result");
        requireTransition(record, AnalysisStatus.COMPLETED);
        String consensusJson = json.write(result);

        record.setStatus(AnalysisStatus.COMPLETED.name());
        record.setVerdict(result.finalVerdict().name());
        record.setConfidence(result.finalConfidence());
        record.setAgreement(result.agreement());
        record.setExplanation(result.explanation());
        record.setMetadataAlignment(result.metadataAlignment().name());
        record.setConsensus(consensusJson);
        record.setCompletedAt(now());
        return record;
    }

    public <R extends AnalysisRecord> R fail(R record, FailureKind kind, String detail) {
        transition(record, AnalysisStatus.FAILED);
        record.setFailureKind(kind.name());
        record.setErrorReason(kind.reason(detail));
        record.setCompletedAt(now());
        return record;
    }

    private void transition(AnalysisRecord record, AnalysisStatus next) {
        requireTransition(record, next);
        record.setStatus(next.name());
    }

    private static void requireTransition(AnalysisRecord record, AnalysisStatus next) {
        AnalysisStatus current = record.status();
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateTransitionException(record.getId(), current, next);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
