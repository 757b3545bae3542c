package com.purchasingpower.memory.indexing.extract;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class CSharpExtractorTest {

    @Test
    @DisplayName("Finds constructors, block methods and expression-bodied methods")
    void methods() {
        String source = String.join("\n",
                "namespace Shop",
                "{",
                "    public class Basket",
                "    {",
                "        private readonly List<Item> _items = new();",
                "",
                "        public Basket() { }",
                "",
                "        public async Task<decimal> TotalAsync(CancellationToken ct)",
                "        {",
                "            if (_items.Count == 0) { return 0; }",
                "            return _items.Sum(i => i.Price);",
                "        }",
                "",
                "        public int Count => _items.Count;",
                "",
                "        public string Describe() => $\"{Count} items\";",
                "    }",
                "}");

        List<ExtractedFunction> functions = new CSharpExtractor().extract(source, ExtractionOptions.defaults());

        assertThat(functions)
                .extracting(ExtractedFunction::getName, ExtractedFunction::getStartLine,
                        ExtractedFunction::getEndLine, ExtractedFunction::getClassName)
                .containsExactly(
                        tuple("Basket", 7, 7, "Basket"),
                        tuple("TotalAsync", 9, 13, "Basket"),
                        tuple("Describe", 17, 17, "Basket"));
        assertThat(functions.get(1).isAsync()).isTrue();
        assertThat(functions.get(1).getSignature())
                .isEqualTo("public async Task<decimal> TotalAsync(CancellationToken ct)");
    }
}
