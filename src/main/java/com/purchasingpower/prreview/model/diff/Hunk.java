package com.purchasingpower.prreview.model.diff;

import lombok.Value;

import java.util.List;

/**
 * A contiguous region of change bounded by a {@code @@ -a,b +c,d @@} header.
 * Start values are taken from the header as-is; only the parser's counters advance.
 */
@Value
public class Hunk {
    int oldStart;
    int newStart;

    /**
     * Trailing text after the closing {@code @@}, usually the enclosing function signature.
     */
    String section;

    List<ChangeLine> changes;

    public Hunk(int oldStart, int newStart, String section, List<ChangeLine> changes) {
        this.oldStart = oldStart;
        this.newStart = newStart;
        this.section = section;
        this.changes = List.copyOf(changes);
    }

    public long countOf(ChangeKind kind) {
        return changes.stream().filter(c -> c.getKind() == kind).count();
    }
}
