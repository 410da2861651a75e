package com.deepcheck.common.model;

/**
 * Why a record ended in {@link AnalysisStatus#FAILED}. The {@code reasonPrefix} is the stable
 * leading token of the persisted error reason.
 */
public enum FailureKind {
    /** Both classifiers were unavailable. Transient; the artifact may be resubmitted as is. */
    SERVICE_UNAVAILABLE("service_error"),
    /** The artifact could not be decoded or sliced. Resubmit in a supported format. */
    UNDECODABLE_ARTIFACT("decode_error"),
    /** An unexpected pipeline fault; the record is closed rather than left ANALYZING. */
    INTERNAL_ERROR("internal_error");

    private final String reasonPrefix;

    FailureKind(String reasonPrefix) {
        this.reasonPrefix = reasonPrefix;
    }

    public String reasonPrefix() {
        return reasonPrefix;
    }

    public String reason(String detail) {
        return detail == null || detail.isBlank() ? reasonPrefix : reasonPrefix + ": " + detail;
    }
}
