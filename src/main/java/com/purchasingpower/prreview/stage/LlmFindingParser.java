package com.purchasingpower.prreview.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.prreview.model.review.ReviewComment;
import com.purchasingpower.prreview.model.review.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a model's JSON answer into review comments.
 *
 * Expected shape:
 * <pre>
 * [
 *   {"file_path": "src/app.py", "line_number": 42, "severity": "error",
 *    "message": "...", "suggestion": "..."}
 * ]
 * </pre>
 * Markdown code fences around the array are tolerated. Entries without a message are
 * dropped, a missing severity becomes {@code warning} and an unrecognised one {@code info},
 * a missing file path falls back to the file under review.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmFindingParser {

    private final ObjectMapper objectMapper;

    /**
     * @throws JsonProcessingException if the answer is not JSON at all
     */
    public List<ReviewComment> parse(String raw, String reviewedPath, String category, String stageName)
            throws JsonProcessingException {
        String json = stripCodeFences(raw);
        if (json.isEmpty()) {
            return List.of();
        }

        JsonNode root = objectMapper.readTree(json);
        if (!root.isArray()) {
            log.debug("Stage {} answered with a non-array payload for {}, ignoring", stageName, reviewedPath);
            return List.of();
        }

        List<ReviewComment> comments = new ArrayList<>();
        for (JsonNode item : root) {
            String message = text(item, "message");
            if (message == null || message.isBlank()) {
                continue;
            }
            String filePath = text(item, "file_path");
            Severity severity = severity(text(item, "severity"));

            comments.add(ReviewComment.builder()
                    .filePath(filePath == null || filePath.isBlank() ? reviewedPath : filePath)
                    .lineNumber(lineNumber(item.path("line_number")))
                    .severity(severity)
                    .category(category)
                    .message(message.trim())
                    .suggestion(text(item, "suggestion"))
                    .sourceStage(stageName)
                    .build());
        }
        return comments;
    }

    static String stripCodeFences(String raw) {
        if (raw == null) {
            return "";
        }
        String content = raw.strip();
        if (!content.startsWith("```")) {
            return content;
        }
        content = content.substring(3);
        int closing = content.indexOf("```");
        if (closing >= 0) {
            content = content.substring(0, closing);
        }
        content = content.strip();
        if (content.regionMatches(true, 0, "json", 0, 4)) {
            content = content.substring(4);
        }
        return content.strip();
    }

    private static Severity severity(String raw) {
        if (raw == null || raw.isBlank()) {
            return Severity.WARNING;
        }
        Severity severity = Severity.fromValue(raw);
        return severity != null ? severity : Severity.INFO;
    }

    private static String text(JsonNode item, String field) {
        JsonNode node = item.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static Integer lineNumber(JsonNode node) {
        if (node.isIntegralNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
