package com.purchasingpower.memory.indexing;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps file extensions to language names.
 */
public final class LanguageDetector {

    private static final Map<String, String> BY_EXTENSION = Map.ofEntries(
            Map.entry(".ts", "typescript"),
            Map.entry(".tsx", "typescript"),
            Map.entry(".js", "javascript"),
            Map.entry(".jsx", "javascript"),
            Map.entry(".mjs", "javascript"),
            Map.entry(".cjs", "javascript"),
            Map.entry(".py", "python"),
            Map.entry(".go", "go"),
            Map.entry(".rs", "rust"),
            Map.entry(".java", "java"),
            Map.entry(".cs", "csharp"),
            Map.entry(".kt", "kotlin"),
            Map.entry(".rb", "ruby"),
            Map.entry(".php", "php"),
            Map.entry(".c", "c"),
            Map.entry(".h", "c"),
            Map.entry(".cpp", "cpp"),
            Map.entry(".hpp", "cpp"),
            Map.entry(".swift", "swift"),
            Map.entry(".scala", "scala"));

    private LanguageDetector() {
    }

    public static Optional<String> detect(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_EXTENSION.get(name.substring(dot).toLowerCase(Locale.ROOT)));
    }
}
