package com.purchasingpower.prreview.parser;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps file paths to language tags by well-known file name or extension.
 *
 * <p>Total and side-effect free: anything it does not recognise is {@value #UNKNOWN}.
 */
@Component
public class LanguageClassifier {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> FILENAMES = Map.of(
            "dockerfile", "dockerfile",
            "makefile", "makefile",
            "rakefile", "ruby",
            "gemfile", "ruby",
            "vagrantfile", "ruby"
    );

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry("py", "python"), Map.entry("pyw", "python"), Map.entry("pyi", "python"),
            Map.entry("js", "javascript"), Map.entry("jsx", "javascript"),
            Map.entry("mjs", "javascript"), Map.entry("cjs", "javascript"),
            Map.entry("ts", "typescript"), Map.entry("tsx", "typescript"),
            Map.entry("html", "html"), Map.entry("htm", "html"),
            Map.entry("css", "css"), Map.entry("scss", "scss"), Map.entry("sass", "sass"), Map.entry("less", "less"),
            Map.entry("java", "java"), Map.entry("kt", "kotlin"), Map.entry("kts", "kotlin"),
            Map.entry("scala", "scala"), Map.entry("groovy", "groovy"),
            Map.entry("c", "c"), Map.entry("h", "c"),
            Map.entry("cpp", "cpp"), Map.entry("cc", "cpp"), Map.entry("cxx", "cpp"),
            Map.entry("hpp", "cpp"), Map.entry("hh", "cpp"), Map.entry("hxx", "cpp"),
            Map.entry("cs", "csharp"),
            Map.entry("go", "go"),
            Map.entry("rs", "rust"),
            Map.entry("rb", "ruby"), Map.entry("rake", "ruby"),
            Map.entry("php", "php"), Map.entry("phtml", "php"),
            Map.entry("swift", "swift"),
            Map.entry("m", "objective-c"), Map.entry("mm", "objective-c"),
            Map.entry("sh", "shell"), Map.entry("bash", "bash"), Map.entry("zsh", "zsh"),
            Map.entry("r", "r"),
            Map.entry("dart", "dart"),
            Map.entry("ex", "elixir"), Map.entry("exs", "elixir"),
            Map.entry("hs", "haskell"),
            Map.entry("lua", "lua"),
            Map.entry("pl", "perl"), Map.entry("pm", "perl"),
            Map.entry("sql", "sql"),
            Map.entry("yaml", "yaml"), Map.entry("yml", "yaml"),
            Map.entry("json", "json"), Map.entry("toml", "toml"),
            Map.entry("md", "markdown"), Map.entry("markdown", "markdown"),
            Map.entry("xml", "xml"), Map.entry("ini", "ini"), Map.entry("conf", "conf"), Map.entry("config", "config"),
            Map.entry("vim", "vim"),
            Map.entry("dockerfile", "dockerfile")
    );

    public String classify(String path) {
        if (path == null || path.isBlank()) {
            return UNKNOWN;
        }

        String fileName = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1)
                .toLowerCase(Locale.ROOT);

        String byName = FILENAMES.get(fileName);
        if (byName != null) {
            return byName;
        }

        // ".bashrc" has no extension, only a leading dot
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return UNKNOWN;
        }
        return EXTENSIONS.getOrDefault(fileName.substring(dot + 1), UNKNOWN);
    }

    /**
     * Most frequent known language across {@code paths}.
     * Ties go to the tied language that appears first in {@code paths}.
     */
    public String classifyPrimary(Collection<String> paths) {
        if (paths == null || paths.isEmpty()) {
            return UNKNOWN;
        }

        // insertion order is first appearance
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (String path : paths) {
            String language = classify(path);
            if (!UNKNOWN.equals(language)) {
                counts.merge(language, 1, Integer::sum);
            }
        }

        int max = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        return counts.entrySet().stream()
                .filter(e -> e.getValue() == max)
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(UNKNOWN);
    }
}
