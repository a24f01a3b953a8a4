package com.purchasingpower.prreview.exception;

import lombok.Getter;

/**
 * An analysis stage raised or ran past its timeout. Isolated to that stage.
 */
@Getter
public class StageExecutionException extends RuntimeException {

    private final String stageName;
    private final boolean timedOut;

    public StageExecutionException(String stageName, String message, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.stageName = stageName;
        this.timedOut = timedOut;
    }

    public static StageExecutionException timeout(String stageName, long timeoutMs) {
        return new StageExecutionException(stageName,
                "Stage '" + stageName + "' timed out after " + timeoutMs + "ms", true, null);
    }

    public static StageExecutionException failure(String stageName, Throwable cause) {
        return new StageExecutionException(stageName,
                "Stage '" + stageName + "' failed: " + describe(cause), false, cause);
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
