package com.purchasingpower.prreview.model;

/**
 * External services the pipeline talks to, tagged for call logging.
 *
 * @see com.purchasingpower.prreview.util.ExternalCallLogger
 */
public enum ServiceType {
    GITHUB("⚫", "GitHub"),
    GEMINI("🔴", "Gemini");

    private final String emoji;
    private final String displayName;

    ServiceType(String emoji, String displayName) {
        this.emoji = emoji;
        this.displayName = displayName;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getDisplayName() {
        return displayName;
    }
}
