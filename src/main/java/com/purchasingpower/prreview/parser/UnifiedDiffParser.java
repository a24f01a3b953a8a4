package com.purchasingpower.prreview.parser;

import com.purchasingpower.prreview.exception.DiffParseException;
import com.purchasingpower.prreview.model.diff.ChangeLine;
import com.purchasingpower.prreview.model.diff.FileDiff;
import com.purchasingpower.prreview.model.diff.Hunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns unified diff text into per-file, per-hunk change records.
 *
 * <p>Single forward scan. A file opens on {@code --- a/<path>} (or {@code --- /dev/null}
 * for added files), {@code +++ b/<path>} names its post-image, and each {@code @@} header
 * opens a hunk whose body lines are classified by their first character:
 * <pre>
 *   '+'  addition  numbered from the new-side counter
 *   '-'  deletion  numbered from the old-side counter
 *   ' '  context   numbered from the new-side counter, advances both
 * </pre>
 * Any other line, including a stray {@code +++} or {@code ---}, closes the open hunk. Counters are driven purely by the body, header
 * counts are never checked, so a header that lies about its counts will desynchronize.
 *
 * <p>Files that end up with no hunks (binary notices, preambles) are dropped, and
 * unparseable hunk headers are skipped instead of failing the whole diff.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UnifiedDiffParser {

    static final String OLD_FILE_MARKER = "--- a/";
    static final String NEW_FILE_MARKER = "+++ b/";
    static final String ADDED_FILE_MARKER = "--- /dev/null";
    static final String DEV_NULL = "/dev/null";

    private static final Pattern HUNK_HEADER =
            Pattern.compile("^@@ -(\\d+)(?:,\\d+)? \\+(\\d+)(?:,\\d+)? @@(.*)$");

    private final LanguageClassifier languageClassifier;

    /**
     * @param diffText raw unified diff
     * @return files with at least one hunk, in input order
     * @throws DiffParseException if {@code diffText} is null or blank
     */
    public List<FileDiff> parse(String diffText) {
        if (diffText == null || diffText.isBlank()) {
            throw new DiffParseException("No diff content available to parse");
        }

        List<FileDiff> files = new ArrayList<>();
        OpenFile file = null;
        OpenHunk hunk = null;

        for (String rawLine : diffText.split("\n", -1)) {
            String line = stripCarriageReturn(rawLine);

            if (line.startsWith(OLD_FILE_MARKER) || line.startsWith(ADDED_FILE_MARKER)) {
                flush(file, files);
                String oldPath = line.startsWith(OLD_FILE_MARKER)
                        ? line.substring(OLD_FILE_MARKER.length())
                        : DEV_NULL;
                file = new OpenFile(oldPath);
                hunk = null;
                continue;
            }

            if (line.startsWith(NEW_FILE_MARKER)) {
                if (file != null) {
                    file.newPath = line.substring(NEW_FILE_MARKER.length());
                }
                hunk = null;
                continue;
            }

            if (line.startsWith("@@")) {
                hunk = file == null ? null : openHunk(line, file);
                continue;
            }

            if (hunk == null) {
                continue;
            }

            if (line.startsWith("+++") || line.startsWith("---")) {
                hunk = null;
                continue;
            }

            char marker = line.isEmpty() ? '\0' : line.charAt(0);
            switch (marker) {
                case '+' -> hunk.addition(line.substring(1));
                case '-' -> hunk.deletion(line.substring(1));
                case ' ' -> hunk.context(line.substring(1));
                // "\ No newline at end of file" annotates the previous line, the hunk goes on
                case '\\' -> { }
                default -> hunk = null;
            }
        }

        flush(file, files);
        log.debug("Parsed {} file(s) with changes", files.size());
        return files;
    }

    private OpenHunk openHunk(String header, OpenFile file) {
        Matcher matcher = HUNK_HEADER.matcher(header);
        if (!matcher.matches()) {
            log.debug("Skipping unrecognized hunk header in {}: {}", file.oldPath, header);
            return null;
        }
        try {
            OpenHunk hunk = new OpenHunk(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    matcher.group(3).strip());
            file.hunks.add(hunk);
            return hunk;
        } catch (NumberFormatException e) {
            log.debug("Skipping hunk header with out-of-range start in {}: {}", file.oldPath, header);
            return null;
        }
    }

    private void flush(OpenFile file, List<FileDiff> files) {
        if (file == null || file.hunks.isEmpty()) {
            return;
        }
        String path = file.newPath != null ? file.newPath : file.oldPath;
        List<Hunk> hunks = file.hunks.stream().map(OpenHunk::toHunk).toList();
        files.add(new FileDiff(file.oldPath, file.newPath, languageClassifier.classify(path), hunks));
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static final class OpenFile {
        private final String oldPath;
        private String newPath;
        private final List<OpenHunk> hunks = new ArrayList<>();

        private OpenFile(String oldPath) {
            this.oldPath = oldPath;
        }
    }

    private static final class OpenHunk {
        private final int oldStart;
        private final int newStart;
        private final String section;
        private final List<ChangeLine> changes = new ArrayList<>();
        private int oldLine;
        private int newLine;

        private OpenHunk(int oldStart, int newStart, String section) {
            this.oldStart = oldStart;
            this.newStart = newStart;
            this.section = section;
            this.oldLine = oldStart;
            this.newLine = newStart;
        }

        private void addition(String content) {
            changes.add(ChangeLine.addition(newLine++, content));
        }

        private void deletion(String content) {
            changes.add(ChangeLine.deletion(oldLine++, content));
        }

        private void context(String content) {
            changes.add(ChangeLine.context(newLine, content));
            oldLine++;
            newLine++;
        }

        private Hunk toHunk() {
            return new Hunk(oldStart, newStart, section, changes);
        }
    }
}
