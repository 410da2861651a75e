package com.deepcheck.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a persisted analysis record.
 *
 * <pre>
 *   PENDING ──start──▶ ANALYZING ──▶ COMPLETED
 *                                 └─▶ FAILED
 * </pre>
 * {@code COMPLETED} and {@code FAILED} are terminal.
 */
public enum AnalysisStatus {
    PENDING,
    ANALYZING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public Set<AnalysisStatus> successors() {
        return switch (this) {
            case PENDING   -> EnumSet.of(ANALYZING);
            case ANALYZING -> EnumSet.of(COMPLETED, FAILED);
            case COMPLETED, FAILED -> EnumSet.noneOf(AnalysisStatus.class);
        };
    }

    public boolean canTransitionTo(AnalysisStatus next) {
        return successors().contains(next);
    }
}
