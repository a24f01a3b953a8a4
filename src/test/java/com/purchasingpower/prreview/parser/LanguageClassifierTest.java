package com.purchasingpower.prreview.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Language Classifier Tests")
class LanguageClassifierTest {

    private final LanguageClassifier classifier = new LanguageClassifier();

    @ParameterizedTest
    @CsvSource({
            "src/app.py, python",
            "web/index.TSX, typescript",
            "lib/Main.java, java",
            "Dockerfile, dockerfile",
            "build/Makefile, makefile",
            "config/settings.yml, yaml",
            "windows\\path\\tool.cs, csharp"
    })
    @DisplayName("Should map known extensions and file names")
    void testClassify_ShouldReturnLanguage(String path, String expected) {
        assertEquals(expected, classifier.classify(path));
    }

    @ParameterizedTest
    @CsvSource({"notes.xyz", "LICENSE", ".bashrc", "archive.", "''"})
    @DisplayName("Should return unknown for anything unmapped")
    void testClassifyUnmapped_ShouldReturnUnknown(String path) {
        assertEquals(LanguageClassifier.UNKNOWN, classifier.classify(path));
    }

    @Test
    @DisplayName("Should pick the most frequent known language")
    void testClassifyPrimary_ShouldReturnMode() {
        assertEquals("go", classifier.classifyPrimary(List.of("a.py", "b.go", "c.go", "README", "d.py", "e.go")));
    }

    @Test
    @DisplayName("Ties go to the tied language that appears first")
    void testClassifyPrimaryTie_ShouldPreferFirstAppearance() {
        assertEquals("java", classifier.classifyPrimary(List.of("A.java", "b.kt", "C.java", "d.kt")));
        assertEquals("kotlin", classifier.classifyPrimary(List.of("b.kt", "A.java", "d.kt", "C.java")));
    }

    @Test
    @DisplayName("A tie goes to first appearance, not to the first language to reach the count")
    void testClassifyPrimaryTie_ShouldIgnoreWhoReachedCountFirst() {
        // javascript reaches two first, python appeared first
        assertEquals("python", classifier.classifyPrimary(List.of("a.py", "b.js", "c.js", "d.py")));
    }

    @Test
    @DisplayName("Should return unknown when nothing is recognised")
    void testClassifyPrimaryNoKnown_ShouldReturnUnknown() {
        assertEquals(LanguageClassifier.UNKNOWN, classifier.classifyPrimary(List.of("LICENSE", "data.bin")));
        assertEquals(LanguageClassifier.UNKNOWN, classifier.classifyPrimary(List.of()));
    }
}
