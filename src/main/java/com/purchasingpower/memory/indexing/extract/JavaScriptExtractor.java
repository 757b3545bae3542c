package com.purchasingpower.memory.indexing.extract;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * JavaScript and TypeScript: function declarations, arrow functions bound to a name, and
 * class methods.
 */
@Component
public class JavaScriptExtractor extends BraceScopedExtractor {

    private static final Pattern CLASS = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:abstract\\s+)?class\\s+(?<name>[A-Za-z_$][\\w$]*)");

    private static final Pattern FUNCTION = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:default\\s+)?(?:async\\s+)?function\\s*\\*?\\s*(?<name>[A-Za-z_$][\\w$]*)\\s*(?:<[^>]*>)?\\s*\\(");

    private static final Pattern ARROW = Pattern.compile(
            "^\\s*(?:export\\s+)?(?:const|let|var)\\s+(?<name>[A-Za-z_$][\\w$]*)\\s*(?::[^=]+)?=\\s*(?:async\\s+)?(?:\\([^)]*\\)|[A-Za-z_$][\\w$]*)\\s*(?::\\s*[^=]+)?=>");

    private static final Pattern METHOD = Pattern.compile(
            "^\\s*(?:(?:public|private|protected|static|readonly|override|abstract|get|set)\\s+)*(?:async\\s+)?\\*?\\s*(?<name>#?[A-Za-z_$][\\w$]*)\\s*(?:<[^>]*>)?\\s*\\([^;]*$");

    private static final Pattern CLASS_FIELD_ARROW = Pattern.compile(
            "^\\s*(?:(?:public|private|protected|static|readonly)\\s+)*(?<name>#?[A-Za-z_$][\\w$]*)\\s*(?::[^=]+)?=\\s*(?:async\\s+)?(?:\\([^)]*\\)|[A-Za-z_$][\\w$]*)\\s*(?::\\s*[^=]+)?=>");

    @Override
    public Set<String> languages() {
        return Set.of("javascript", "typescript");
    }

    @Override
    protected Pattern classPattern() {
        return CLASS;
    }

    @Override
    protected List<Pattern> functionPatterns() {
        return List.of(FUNCTION, ARROW);
    }

    @Override
    protected List<Pattern> methodPatterns() {
        return List.of(CLASS_FIELD_ARROW, METHOD);
    }

    @Override
    protected boolean allowsExpressionBody(String signatureLine) {
        return signatureLine.contains("=>");
    }

    @Override
    protected boolean singleQuotedStrings() {
        return true;
    }
}
