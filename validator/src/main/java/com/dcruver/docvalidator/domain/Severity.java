package com.dcruver.docvalidator.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a finding.
 * Only BLOCKING findings fail a run.
 */
public enum Severity {
    /**
     * Fails the file and makes the run exit non-zero
     */
    BLOCKING,

    /**
     * Reported but never affects exit status
     */
    ADVISORY;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase();
    }
}
