package com.purchasingpower.memory.indexing.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class PythonExtractorTest {

    private static final String SOURCE = String.join("\n",
            "import os",
            "",
            "class Repo:",
            "    def __init__(self, path):",
            "        self.path = path",
            "",
            "    async def load(self,",
            "                   name):  # multi-line header",
            "        # read it",
            "        return await os.read(name)",
            "",
            "def helper(x):",
            "    return x * 2");

    private final PythonExtractor extractor = new PythonExtractor();

    @Test
    @DisplayName("Blocks end at the first line indented no deeper than the def")
    void extractsByIndentation() {
        List<ExtractedFunction> functions = extractor.extract(SOURCE, ExtractionOptions.defaults());

        assertThat(functions)
                .extracting(ExtractedFunction::getName, ExtractedFunction::getStartLine,
                        ExtractedFunction::getEndLine, ExtractedFunction::getClassName)
                .containsExactly(
                        tuple("load", 7, 10, "Repo"),
                        tuple("helper", 12, 13, null));

        ExtractedFunction load = functions.get(0);
        assertThat(load.isAsync()).isTrue();
        assertThat(load.isMethod()).isTrue();
        assertThat(load.getSignature()).isEqualTo("async def load(self, name)");
    }

    @Test
    @DisplayName("Dunder methods are kept only for the target class")
    void keepsDundersOfTargetClass() {
        List<ExtractedFunction> functions = extractor.extract(SOURCE, new ExtractionOptions("Repo"));

        assertThat(functions).extracting(ExtractedFunction::getName)
                .containsExactly("__init__", "load", "helper");
        assertThat(functions.get(0).getEndLine()).isEqualTo(5);
    }

    @Test
    @DisplayName("Tabs count as four columns")
    void indentation() {
        assertThat(PythonExtractor.indentOf("\tx")).isEqualTo(4);
        assertThat(PythonExtractor.indentOf("  \tx")).isEqualTo(4);
        assertThat(PythonExtractor.indentOf("    x")).isEqualTo(4);
    }
}
