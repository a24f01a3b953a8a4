package com.purchasingpower.prreview.orchestration;

import lombok.Value;

/**
 * What happened to one stage during a run. Kept on the run state and logged, never
 * surfaced in the report.
 */
@Value
public class StageDiagnostic {
    String stageName;
    StageOutcome outcome;
    int commentCount;
    long elapsedMs;
    String error;

    public static StageDiagnostic succeeded(String stageName, int commentCount, long elapsedMs) {
        return new StageDiagnostic(stageName, StageOutcome.SUCCEEDED, commentCount, elapsedMs, null);
    }

    public static StageDiagnostic failed(String stageName, long elapsedMs, String error) {
        return new StageDiagnostic(stageName, StageOutcome.FAILED, 0, elapsedMs, error);
    }

    public static StageDiagnostic timedOut(String stageName, long elapsedMs, String error) {
        return new StageDiagnostic(stageName, StageOutcome.TIMED_OUT, 0, elapsedMs, error);
    }
}
