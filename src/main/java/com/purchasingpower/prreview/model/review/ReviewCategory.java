package com.purchasingpower.prreview.model.review;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Categories produced by the built-in analysis stages.
 * Comments carry the category as a plain tag so other stages may use their own.
 */
public enum ReviewCategory {
    LOGIC("logic", "Logic", "Logical errors, edge cases, and correctness issues"),
    SECURITY("security", "Security", "Security vulnerabilities and risks"),
    PERFORMANCE("performance", "Performance", "Performance issues and optimization opportunities"),
    READABILITY("readability", "Readability", "Code readability, style, and maintainability");

    private final String value;
    private final String label;
    private final String description;

    ReviewCategory(String value, String label, String description) {
        this.value = value;
        this.label = label;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }
}
