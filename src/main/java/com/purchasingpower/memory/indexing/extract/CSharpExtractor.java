package com.purchasingpower.memory.indexing.extract;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * C# methods and constructors inside classes, structs, interfaces and records.
 */
@Component
public class CSharpExtractor extends BraceScopedExtractor {

    private static final Pattern CLASS = Pattern.compile(
            "\\b(?:class|struct|interface|record)\\s+(?<name>[A-Za-z_]\\w*)");

    private static final Pattern METHOD = Pattern.compile(
            "^\\s*(?:\\[[^\\]]*\\]\\s*)*(?:(?:public|private|protected|internal|static|virtual|override|abstract|sealed|async|extern|unsafe|new|partial|readonly)\\s+)*"
                    + "(?:[\\w<>\\[\\],.?]+(?:\\s*<[^>]*>)?\\s+)?(?<name>[A-Za-z_]\\w*)\\s*(?:<[^>]*>)?\\s*\\((?:[^;]*|.*=>.*)$");

    @Override
    public Set<String> languages() {
        return Set.of("csharp");
    }

    @Override
    protected Pattern classPattern() {
        return CLASS;
    }

    @Override
    protected List<Pattern> functionPatterns() {
        return List.of();
    }

    @Override
    protected List<Pattern> methodPatterns() {
        return List.of(METHOD);
    }

    @Override
    protected boolean allowsExpressionBody(String signatureLine) {
        return signatureLine.contains("=>");
    }
}
