package com.signalmix.core.diagnostics;

public enum StageStatus {
    OK,
    DEGRADED,
    FAILED
}
