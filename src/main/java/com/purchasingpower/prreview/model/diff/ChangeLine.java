package com.purchasingpower.prreview.model.diff;

import lombok.Value;

/**
 * One classified line of a hunk.
 *
 * <p>{@code lineNumber} is the post-image line for additions and context lines,
 * and the pre-image line for deletions. {@code content} has the marker character stripped.
 */
@Value
public class ChangeLine {
    ChangeKind kind;
    int lineNumber;
    String content;

    public static ChangeLine addition(int lineNumber, String content) {
        return new ChangeLine(ChangeKind.ADDITION, lineNumber, content);
    }

    public static ChangeLine deletion(int lineNumber, String content) {
        return new ChangeLine(ChangeKind.DELETION, lineNumber, content);
    }

    public static ChangeLine context(int lineNumber, String content) {
        return new ChangeLine(ChangeKind.CONTEXT, lineNumber, content);
    }

    public boolean isAddition() {
        return kind == ChangeKind.ADDITION;
    }

    public boolean isDeletion() {
        return kind == ChangeKind.DELETION;
    }
}
