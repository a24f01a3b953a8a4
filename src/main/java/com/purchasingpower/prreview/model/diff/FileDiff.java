package com.purchasingpower.prreview.model.diff;

import lombok.Value;

import java.util.List;
import java.util.stream.Stream;

/**
 * All hunks recorded for one file of a unified diff.
 *
 * <p>The parser only emits instances with at least one hunk.
 */
@Value
public class FileDiff {
    String oldPath;

    /**
     * Path after the change; {@code null} when the diff carried no {@code +++ b/} line.
     */
    String newPath;

    String language;
    List<Hunk> hunks;

    public FileDiff(String oldPath, String newPath, String language, List<Hunk> hunks) {
        this.oldPath = oldPath;
        this.newPath = newPath;
        this.language = language;
        this.hunks = List.copyOf(hunks);
    }

    /**
     * Path comments should be reported against.
     */
    public String getPath() {
        return newPath != null ? newPath : oldPath;
    }

    public Stream<ChangeLine> changes() {
        return hunks.stream().flatMap(h -> h.getChanges().stream());
    }
}
