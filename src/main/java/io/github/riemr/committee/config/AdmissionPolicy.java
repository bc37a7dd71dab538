package io.github.riemr.committee.config;

/**
 * How meeting admission treats capacity and calendar violations.
 */
public enum AdmissionPolicy {
    /** Always admit; violations are returned as warnings. */
    WARN,
    /** Admit only when there is no violation or the caller overrides. */
    BLOCK
}
