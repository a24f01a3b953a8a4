package com.purchasingpower.prreview.stage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.purchasingpower.prreview.client.GeminiClient;
import com.purchasingpower.prreview.configuration.ReviewProperties;
import com.purchasingpower.prreview.model.diff.ChangeLine;
import com.purchasingpower.prreview.model.diff.FileDiff;
import com.purchasingpower.prreview.model.review.ReviewCategory;
import com.purchasingpower.prreview.model.review.ReviewComment;
import com.purchasingpower.prreview.service.PromptLibraryService;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Analysis stage that asks Gemini to review each changed file through one prompt template.
 *
 * <p>All built-in reviewers (logic, security, performance, readability) are instances of
 * this class that differ only in name, category and template; see {@link AnalysisStageConfig}.
 *
 * <p>A model answer that is not valid JSON costs only that file's findings. A failed
 * Gemini call fails the whole stage and is handled by the orchestrator.
 */
@Slf4j
public class LlmAnalysisStage implements AnalysisStage {

    private final String name;
    private final ReviewCategory category;
    private final String templateName;
    private final GeminiClient geminiClient;
    private final PromptLibraryService promptLibrary;
    private final LlmFindingParser findingParser;
    private final ReviewProperties reviewProperties;

    public LlmAnalysisStage(String name,
                            ReviewCategory category,
                            String templateName,
                            GeminiClient geminiClient,
                            PromptLibraryService promptLibrary,
                            LlmFindingParser findingParser,
                            ReviewProperties reviewProperties) {
        this.name = name;
        this.category = category;
        this.templateName = templateName;
        this.geminiClient = geminiClient;
        this.promptLibrary = promptLibrary;
        this.findingParser = findingParser;
        this.reviewProperties = reviewProperties;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<ReviewComment> analyze(List<FileDiff> files, String language, String context) {
        List<ReviewComment> comments = new ArrayList<>();

        for (FileDiff file : files) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Stage " + name + " cancelled");
            }

            String changes = renderChanges(file, reviewProperties.getMaxChangesPerFile());
            if (changes.isEmpty()) {
                continue;
            }

            Map<String, Object> variables = new HashMap<>();
            variables.put("filePath", file.getPath());
            variables.put("changes", changes);
            variables.put("language", language);
            variables.put("context", context == null || context.isBlank()
                    ? reviewProperties.getDefaultContext()
                    : context);

            String answer = geminiClient.generate(promptLibrary.render(templateName, variables), name);

            try {
                comments.addAll(findingParser.parse(answer, file.getPath(), category.getValue(), name));
            } catch (JsonProcessingException e) {
                log.warn("Stage {} could not parse findings for {}: {}", name, file.getPath(), e.getOriginalMessage());
            }
        }

        log.info("Stage {} produced {} finding(s) across {} file(s)", name, comments.size(), files.size());
        return comments;
    }

    /**
     * Additions as {@code + content (line N)}, deletions as {@code - content}; context is
     * left out. At most {@code maxLines} lines are rendered.
     */
    static String renderChanges(FileDiff file, int maxLines) {
        return file.changes()
                .filter(c -> c.isAddition() || c.isDeletion())
                .limit(maxLines)
                .map(LlmAnalysisStage::renderLine)
                .collect(Collectors.joining("\n"));
    }

    private static String renderLine(ChangeLine change) {
        if (change.isAddition()) {
            return "+ " + change.getContent() + " (line " + change.getLineNumber() + ")";
        }
        return "- " + change.getContent();
    }

    @Override
    public String toString() {
        return "LlmAnalysisStage[" + name + "]";
    }
}
