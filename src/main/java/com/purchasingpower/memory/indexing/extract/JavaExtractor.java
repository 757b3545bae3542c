package com.purchasingpower.memory.indexing.extract;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Java methods and constructors via JavaParser. Sources JavaParser cannot parse (snippets,
 * newer syntax) go through the brace scanner instead.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class JavaExtractor extends BraceScopedExtractor {

    private static final Pattern CLASS = Pattern.compile(
            "\\b(?:class|interface|enum|record)\\s+(?<name>[A-Za-z_$][\\w$]*)");

    private static final Pattern METHOD = Pattern.compile(
            "^\\s*(?:@\\w+(?:\\([^)]*\\))?\\s+)*(?:(?:public|private|protected|static|final|abstract|synchronized|native|default|strictfp)\\s+)*"
                    + "(?:<[^>]+>\\s+)?(?:[\\w$<>\\[\\],.?]+\\s+)?(?<name>[A-Za-z_$][\\w$]*)\\s*\\([^;]*$");

    private final JavaParser parser = new JavaParser();

    @Override
    public Set<String> languages() {
        return Set.of("java");
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
    protected boolean isAsync(String signature) {
        return false;
    }

    @Override
    public List<ExtractedFunction> extract(String source, ExtractionOptions options) {
        ParseResult<CompilationUnit> result = parser.parse(source);
        Optional<CompilationUnit> unit = result.getResult();
        if (!result.isSuccessful() || unit.isEmpty()) {
            log.debug("JavaParser rejected source ({} problems), using brace scanner",
                    result.getProblems().size());
            return super.extract(source, options);
        }

        String[] lines = source.split("\\r?\\n", -1);
        List<ExtractedFunction> functions = new ArrayList<>();
        for (MethodDeclaration method : unit.get().findAll(MethodDeclaration.class)) {
            if (method.getBody().isPresent()) {
                toFunction(method, lines).ifPresent(functions::add);
            }
        }
        for (ConstructorDeclaration constructor : unit.get().findAll(ConstructorDeclaration.class)) {
            toFunction(constructor, lines).ifPresent(functions::add);
        }
        functions.sort(Comparator.comparingInt(ExtractedFunction::getStartLine));
        return functions;
    }

    private Optional<ExtractedFunction> toFunction(CallableDeclaration<?> callable, String[] lines) {
        if (callable.getBegin().isEmpty() || callable.getEnd().isEmpty()) {
            return Optional.empty();
        }
        int start = callable.getBegin().get().line;
        int end = Math.min(callable.getEnd().get().line, lines.length);
        String className = enclosingType(callable);
        return Optional.of(ExtractedFunction.builder()
                .name(callable.getNameAsString())
                .body(String.join("\n", Arrays.copyOfRange(lines, start - 1, end)))
                .startLine(start)
                .endLine(end)
                .signature(callable.getDeclarationAsString(true, true, true))
                .async(false)
                .method(className != null)
                .className(className)
                .build());
    }

    private static String enclosingType(Node node) {
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            if (parent.get() instanceof TypeDeclaration<?> type) {
                return type.getNameAsString();
            }
            parent = parent.get().getParentNode();
        }
        return null;
    }
}
