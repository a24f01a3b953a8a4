package com.purchasingpower.prreview.stage;

import com.purchasingpower.prreview.model.diff.FileDiff;
import com.purchasingpower.prreview.model.review.ReviewComment;

import java.util.List;

/**
 * One independent review pass over a parsed diff.
 *
 * <p>Every registered stage receives the same immutable file list. The orchestrator runs
 * stages concurrently, each under its own timeout, and treats an exception from
 * {@link #analyze} as "no findings from this stage" for that run. Implementations must
 * not rely on other stages or on shared mutable state.
 */
public interface AnalysisStage {

    /**
     * Stable identifier, stamped on every comment as its source stage and used as the
     * key for per-stage configuration.
     */
    String getName();

    /**
     * @param files    parsed diff, empty when the input carried no hunks
     * @param language resolved language tag, possibly {@code "unknown"}
     * @param context  optional free-text context supplied with the request
     * @return findings, never {@code null}
     */
    List<ReviewComment> analyze(List<FileDiff> files, String language, String context);
}
