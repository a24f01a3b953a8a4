package com.purchasingpower.prreview.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from {@code classpath:prompts/*.yaml}.
 *
 * <pre>
 * name: security-reviewer
 * version: 1.0
 * systemPrompt: |
 *   You are an expert...
 * userPrompt: |
 *   File: {{{filePath}}}
 * </pre>
 *
 * @see com.purchasingpower.prreview.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private String systemPrompt;
    private String userPrompt;
}
