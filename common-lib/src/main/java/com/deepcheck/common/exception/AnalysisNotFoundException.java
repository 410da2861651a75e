package com.deepcheck.common.exception;

public class AnalysisNotFoundException extends VerificationException {

    public AnalysisNotFoundException(String kind, Long id) {
        super("not_found", kind + " analysis " + id + " not found");
    }
}
