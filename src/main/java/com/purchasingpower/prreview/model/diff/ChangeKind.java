package com.purchasingpower.prreview.model.diff;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a single line inside a hunk body, by its leading marker.
 */
public enum ChangeKind {
    ADDITION("addition"),
    DELETION("deletion"),
    CONTEXT("context");

    private final String value;

    ChangeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
