package com.signalmix.core.diagnostics;

/**
 * Why a stage did not finish cleanly.
 */
public enum CauseCode {
    NONE,
    MISSING_INPUT,
    MALFORMED_ROW,
    SCHEMA_AMBIGUITY,
    UPSTREAM_FAILURE,
    IO_ERROR,
    MISSING_ARTIFACT,
    RUNTIME_ERROR
}
