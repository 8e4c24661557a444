package ai.codegauge.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

public class DocstringExtractorTest {
    private final TreeBuilder builder = new TreeBuilder(Languages.PYTHON);
    private final DocstringExtractor extractor = new DocstringExtractor(Languages.PYTHON.getSyntaxProfile());

    private Optional<String> describe(String code) {
        return extractor.extract(builder.parse(code));
    }

    @Test
    void tripleDoubleQuoted() {
        assertEquals(Optional.of("Handles widgets."), describe("\"\"\"Handles widgets.\"\"\"\n"));
    }

    @Test
    void tripleSingleQuotedMultiline() {
        var code = "'''\n    Parses configuration files.\n'''\nimport os\n";
        assertEquals(Optional.of("Parses configuration files."), describe(code));
    }

    @Test
    void plainQuotes() {
        assertEquals(Optional.of("double"), describe("\"double\"\n"));
        assertEquals(Optional.of("single"), describe("'single'\n"));
    }

    @Test
    void leadingCommentsAreSkipped() {
        var code = "#!/usr/bin/env python\n# -*- coding: utf-8 -*-\n\"\"\"Entry point.\"\"\"\n";
        assertEquals(Optional.of("Entry point."), describe(code));
    }

    @Test
    void stringAfterAnotherStatementIsIgnored() {
        assertEquals(Optional.empty(), describe("import os\n\"\"\"Too late.\"\"\"\n"));
    }

    @Test
    void onlyTheFirstExpressionStatementIsInspected() {
        assertEquals(Optional.empty(), describe("x = 1\n\"\"\"Not a docstring.\"\"\"\n"));
        assertEquals(Optional.empty(), describe("print('hi')\n\"\"\"Not a docstring.\"\"\"\n"));
    }

    @Test
    void functionFirstMeansNoDescription() {
        assertEquals(Optional.empty(), describe("def f():\n    \"\"\"Function doc.\"\"\"\n    return 1\n"));
    }

    @Test
    void commentOnlyModule() {
        assertEquals(Optional.empty(), describe("# nothing\n"));
    }

    @Test
    void stripQuotesPrefersLongestDelimiter() {
        assertEquals("doc", DocstringExtractor.stripQuotes("\"\"\"doc\"\"\""));
        assertEquals("doc", DocstringExtractor.stripQuotes("'''doc'''"));
        assertEquals("doc", DocstringExtractor.stripQuotes("\" doc \""));
        assertEquals("doc", DocstringExtractor.stripQuotes("'doc'"));
        assertEquals("", DocstringExtractor.stripQuotes("\"\""));
        // unmatched delimiters are left alone apart from trimming
        assertEquals("r\"\"\"raw\"\"\"", DocstringExtractor.stripQuotes("  r\"\"\"raw\"\"\"  "));
    }
}
