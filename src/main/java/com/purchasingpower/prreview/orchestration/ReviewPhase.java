package com.purchasingpower.prreview.orchestration;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of a single review run.
 *
 * <pre>
 * START -> FETCHING -> PARSING -> DISPATCHED -> AGGREGATING -> DONE
 * START -> PARSING                       (inline diff)
 * FETCHING -> FAILED, PARSING -> FAILED   (the only fatal transitions)
 * </pre>
 */
public enum ReviewPhase {
    START,
    FETCHING,
    PARSING,
    DISPATCHED,
    AGGREGATING,
    DONE,
    FAILED;

    public boolean canTransitionTo(ReviewPhase next) {
        return allowedNext().contains(next);
    }

    private Set<ReviewPhase> allowedNext() {
        return switch (this) {
            case START -> EnumSet.of(FETCHING, PARSING);
            case FETCHING -> EnumSet.of(PARSING, FAILED);
            case PARSING -> EnumSet.of(DISPATCHED, FAILED);
            case DISPATCHED -> EnumSet.of(AGGREGATING);
            case AGGREGATING -> EnumSet.of(DONE);
            case DONE, FAILED -> EnumSet.noneOf(ReviewPhase.class);
        };
    }
}
