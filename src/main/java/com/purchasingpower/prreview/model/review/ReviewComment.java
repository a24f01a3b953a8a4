package com.purchasingpower.prreview.model.review;

import lombok.Builder;
import lombok.Value;

/**
 * A single finding reported by an analysis stage. Immutable once built.
 */
@Value
@Builder(toBuilder = true)
public class ReviewComment {
    String filePath;

    /**
     * Post-image line the finding refers to, {@code null} when the stage could not pin one.
     */
    Integer lineNumber;

    Severity severity;
    String category;
    String message;
    String suggestion;
    String sourceStage;
}
