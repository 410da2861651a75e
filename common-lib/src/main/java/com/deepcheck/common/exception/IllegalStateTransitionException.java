package com.deepcheck.common.exception;

import com.deepcheck.common.model.AnalysisStatus;

public class IllegalStateTransitionException extends VerificationException {
    private final AnalysisStatus from;
    private final AnalysisStatus to;

    public IllegalStateTransitionException(Long recordId, AnalysisStatus from, AnalysisStatus to) {
        super("illegal_transition",
              "Record " + recordId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to   = to;
    }

    public AnalysisStatus getFrom() {
        return from;
    }

    public AnalysisStatus getTo() {
        return to;
    }
}
