package com.purchasingpower.memory.indexing.extract;

import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Python functions by indentation. A body ends before the first code line indented no
 * deeper than its {@code def}. Dunder methods are skipped unless their class is the
 * requested target class.
 *
 * @since 1.0.0
 */
@Component
public class PythonExtractor implements LanguageExtractor {

    private static final Pattern DEF = Pattern.compile("^(?<indent>[ \\t]*)(?<async>async\\s+)?def\\s+(?<name>[A-Za-z_]\\w*)\\s*\\(");
    private static final Pattern CLASS = Pattern.compile("^(?<indent>[ \\t]*)class\\s+(?<name>[A-Za-z_]\\w*)");

    @Override
    public Set<String> languages() {
        return Set.of("python");
    }

    @Override
    public List<ExtractedFunction> extract(String source, ExtractionOptions options) {
        String[] lines = source.split("\\r?\\n", -1);
        List<ExtractedFunction> functions = new ArrayList<>();
        Deque<ClassScope> classes = new ArrayDeque<>();

        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            if (isBlankOrComment(line)) {
                i++;
                continue;
            }
            int indent = indentOf(line);
            while (!classes.isEmpty() && indent <= classes.peek().indent) {
                classes.pop();
            }

            Matcher def = DEF.matcher(line);
            if (def.find()) {
                int signatureEnd = signatureEnd(lines, i);
                int end = blockEnd(lines, signatureEnd, indent);
                ClassScope enclosing = classes.peek();
                String className = enclosing != null ? enclosing.name : null;
                String name = def.group("name");

                if (!isDunder(name) || (className != null && className.equals(options.targetClass()))) {
                    functions.add(ExtractedFunction.builder()
                            .name(name)
                            .body(String.join("\n", Arrays.copyOfRange(lines, i, end + 1)))
                            .startLine(i + 1)
                            .endLine(end + 1)
                            .signature(signature(lines, i, signatureEnd))
                            .async(def.group("async") != null)
                            .method(className != null)
                            .className(className)
                            .build());
                }
                i = end + 1;
                continue;
            }

            Matcher declaration = CLASS.matcher(line);
            if (declaration.find()) {
                classes.push(new ClassScope(declaration.group("name"), indent));
            }
            i++;
        }
        return functions;
    }

    /**
     * Line holding the colon that closes a possibly multi-line {@code def} header.
     */
    static int signatureEnd(String[] lines, int start) {
        int parens = 0;
        for (int j = start; j < lines.length; j++) {
            String code = stripComment(lines[j]);
            for (char c : code.toCharArray()) {
                if (c == '(' || c == '[' || c == '{') {
                    parens++;
                } else if (c == ')' || c == ']' || c == '}') {
                    parens--;
                }
            }
            if (parens <= 0 && code.trim().endsWith(":")) {
                return j;
            }
        }
        return start;
    }

    /**
     * Last non-blank line of the block whose header ends at {@code headerEnd}.
     */
    static int blockEnd(String[] lines, int headerEnd, int headerIndent) {
        String header = stripComment(lines[headerEnd]).trim();
        if (!header.endsWith(":")) {
            return headerEnd;
        }
        int end = headerEnd;
        for (int j = headerEnd + 1; j < lines.length; j++) {
            if (isBlankOrComment(lines[j])) {
                continue;
            }
            if (indentOf(lines[j]) <= headerIndent) {
                break;
            }
            end = j;
        }
        return end;
    }

    private static String signature(String[] lines, int start, int end) {
        StringBuilder signature = new StringBuilder();
        for (int j = start; j <= end; j++) {
            signature.append(stripComment(lines[j]).trim()).append(' ');
        }
        String result = signature.toString().replaceAll("\\s+", " ").trim();
        return result.endsWith(":") ? result.substring(0, result.length() - 1).trim() : result;
    }

    private static boolean isDunder(String name) {
        return name.length() > 4 && name.startsWith("__") && name.endsWith("__");
    }

    private static boolean isBlankOrComment(String line) {
        String trimmed = line.trim();
        return trimmed.isEmpty() || trimmed.startsWith("#");
    }

    static int indentOf(String line) {
        int width = 0;
        for (char c : line.toCharArray()) {
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width += 4 - (width % 4);
            } else {
                break;
            }
        }
        return width;
    }

    /**
     * Drops a trailing {@code #} comment, ignoring hashes inside string literals.
     */
    private static String stripComment(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '#') {
                return line.substring(0, i);
            }
        }
        return line;
    }

    private record ClassScope(String name, int indent) {
    }
}
