package com.purchasingpower.prreview.orchestration;

public enum StageOutcome {
    SUCCEEDED,
    FAILED,
    TIMED_OUT
}
