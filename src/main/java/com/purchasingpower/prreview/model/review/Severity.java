package com.purchasingpower.prreview.model.review;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a review comment, most severe first.
 */
public enum Severity {
    CRITICAL("critical", 0, "Critical issues that must be fixed immediately"),
    ERROR("error", 1, "Errors that should be fixed before merging"),
    WARNING("warning", 2, "Warnings that should be reviewed"),
    INFO("info", 3, "Informational suggestions for improvement");

    /**
     * Rank used for comments that carry no recognised severity; sorts after {@link #INFO}.
     */
    public static final int UNKNOWN_RANK = 4;

    private final String value;
    private final int rank;
    private final String description;

    Severity(String value, int rank, String description) {
        this.value = value;
        this.rank = rank;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    public String getDescription() {
        return description;
    }

    public static int rankOf(Severity severity) {
        return severity == null ? UNKNOWN_RANK : severity.rank;
    }

    /**
     * Lenient lookup, returns {@code null} for blank or unrecognised input.
     */
    @JsonCreator
    public static Severity fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.value.equals(normalized)) {
                return severity;
            }
        }
        return null;
    }
}
