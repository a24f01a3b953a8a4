package com.purchasingpower.prreview.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.prreview.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads stage prompts from YAML and renders them with Mustache.
 *
 * Usage:
 * String prompt = promptLibrary.render("logic-reviewer", Map.of(
 *     "filePath", "src/app.py",
 *     "changes", renderedChanges,
 *     "language", "python"
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    static final String DEFAULT_LOCATION = "classpath:prompts/*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        loadPrompts(DEFAULT_LOCATION);
    }

    void loadPrompts(String locationPattern) {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(locationPattern);
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    register(yamlMapper.readValue(in, PromptTemplate.class));
                }
            }
            log.info("Loaded {} prompt templates", templates.size());
        } catch (IOException e) {
            log.error("Failed to load prompt templates from {}", locationPattern, e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    public void register(PromptTemplate template) {
        if (template.getName() == null || template.getName().isBlank()) {
            throw new IllegalArgumentException("Prompt template has no name");
        }
        templates.put(template.getName(), template);
        compiled.remove(template.getName());
        log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
    }

    /**
     * Render system + user prompt with variables.
     */
    public String render(String templateName, Map<String, Object> variables) {
        Mustache mustache = compiled.computeIfAbsent(templateName, this::compile);
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }

    public boolean hasTemplate(String name) {
        return templates.containsKey(name);
    }

    public Set<String> templateNames() {
        return Set.copyOf(templates.keySet());
    }

    private Mustache compile(String templateName) {
        PromptTemplate template = templates.get(templateName);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + templateName);
        }
        String fullPrompt = template.getSystemPrompt() + "\n\n" + template.getUserPrompt();
        return mustacheFactory.compile(new StringReader(fullPrompt), templateName);
    }
}
