package com.purchasingpower.memory.indexing.extract;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural extractor for C-like languages.
 *
 * <p>A function runs from the line matching a signature pattern to the line where the brace
 * balance, counted from its first body brace, returns to zero. Class scope is tracked the
 * same way so that functions declared directly inside a class body are reported as methods.
 * String literals and comments are blanked before counting.
 *
 * <p>This is a heuristic scanner, not a parser: type literals in return positions or
 * braces inside multi-line template strings can end a function early.
 *
 * @since 1.0.0
 */
public abstract class BraceScopedExtractor implements LanguageExtractor {

    static final int SIGNATURE_LOOKAHEAD = 15;

    private static final Pattern ASYNC = Pattern.compile("\\basync\\b");

    protected static final Set<String> CONTROL_KEYWORDS = Set.of(
            "if", "else", "for", "foreach", "while", "do", "switch", "case", "catch", "try",
            "finally", "return", "throw", "new", "synchronized", "using", "lock", "match",
            "loop", "with", "function", "typeof", "sizeof", "await", "delete", "yield", "super", "this");

    /**
     * Declaration of a class-like scope; group {@code name} is the class name. Null when the
     * language has none.
     */
    protected abstract Pattern classPattern();

    /**
     * Signatures valid at any scope; group {@code name} is the function name.
     */
    protected abstract List<Pattern> functionPatterns();

    /**
     * Signatures only valid directly inside a class body.
     */
    protected List<Pattern> methodPatterns() {
        return List.of();
    }

    /**
     * Whether a signature may end at {@code ;} without a brace body, e.g. {@code x => x + 1;}.
     */
    protected boolean allowsExpressionBody(String signatureLine) {
        return false;
    }

    /**
     * Whether {@code '...'} delimits general strings (true) or only character literals.
     */
    protected boolean singleQuotedStrings() {
        return false;
    }

    protected String resolveClassName(Matcher matcher, String enclosingClass) {
        return enclosingClass;
    }

    protected boolean isAsync(String signature) {
        return ASYNC.matcher(signature).find();
    }

    @Override
    public List<ExtractedFunction> extract(String source, ExtractionOptions options) {
        String[] lines = source.split("\\r?\\n", -1);
        String[] code = stripLiteralsAndComments(lines);

        List<ExtractedFunction> functions = new ArrayList<>();
        Deque<ClassScope> classes = new ArrayDeque<>();
        int depth = 0;
        int i = 0;

        while (i < lines.length) {
            String line = code[i];
            ClassScope enclosing = directlyInside(classes, depth);

            Matcher signature = matchSignature(line, enclosing != null);
            if (signature != null) {
                int end = findBodyEnd(code, i, allowsExpressionBody(line));
                if (end >= 0) {
                    String enclosingName = enclosing != null ? enclosing.name : null;
                    String className = resolveClassName(signature, enclosingName);
                    functions.add(ExtractedFunction.builder()
                            .name(signature.group("name"))
                            .body(String.join("\n", Arrays.copyOfRange(lines, i, end + 1)))
                            .startLine(i + 1)
                            .endLine(end + 1)
                            .signature(buildSignature(lines, code, i, end))
                            .async(isAsync(line))
                            .method(className != null)
                            .className(className)
                            .build());
                    for (int j = i; j <= end; j++) {
                        depth += braceDelta(code[j]);
                    }
                    depth = Math.max(depth, 0);
                    closeScopes(classes, depth);
                    i = end + 1;
                    continue;
                }
            }

            Pattern classPattern = classPattern();
            if (classPattern != null) {
                Matcher declaration = classPattern.matcher(line);
                if (declaration.find()) {
                    classes.push(new ClassScope(declaration.group("name"), depth));
                }
            }

            depth = Math.max(depth + braceDelta(line), 0);
            ClassScope top = classes.peek();
            if (top != null && !top.opened) {
                if (depth > top.depth) {
                    top.opened = true;
                } else if (line.contains(";")) {
                    classes.pop();
                }
            }
            closeScopes(classes, depth);
            i++;
        }
        return functions;
    }

    private Matcher matchSignature(String line, boolean inClassBody) {
        if (inClassBody) {
            Matcher method = firstMatch(methodPatterns(), line);
            if (method != null) {
                return method;
            }
        }
        return firstMatch(functionPatterns(), line);
    }

    private static Matcher firstMatch(List<Pattern> patterns, String line) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(line);
            if (matcher.find() && !CONTROL_KEYWORDS.contains(matcher.group("name"))) {
                return matcher;
            }
        }
        return null;
    }

    /**
     * Last line of the body starting at {@code start}, or -1 when the signature turns out to
     * be a bodiless declaration.
     */
    static int findBodyEnd(String[] code, int start, boolean expressionBody) {
        int parens = 0;
        int balance = 0;
        boolean opened = false;
        int limit = Math.min(code.length, start + SIGNATURE_LOOKAHEAD);

        for (int j = start; j < code.length; j++) {
            if (!opened && j >= limit) {
                return expressionBody ? start : -1;
            }
            for (char c : code[j].toCharArray()) {
                if (!opened) {
                    if (c == '(') {
                        parens++;
                    } else if (c == ')') {
                        parens = Math.max(parens - 1, 0);
                    } else if (c == '{' && parens == 0) {
                        opened = true;
                        balance = 1;
                    } else if (c == ';' && parens == 0) {
                        return expressionBody ? j : -1;
                    }
                } else if (c == '{') {
                    balance++;
                } else if (c == '}') {
                    balance--;
                    if (balance == 0) {
                        return j;
                    }
                }
            }
            if (expressionBody && j == start && !opened && parens == 0 && !code[j].trim().endsWith("=>")) {
                // single-line expression body without a terminating semicolon
                return start;
            }
        }
        if (opened) {
            return code.length - 1;
        }
        return expressionBody ? start : -1;
    }

    private static String buildSignature(String[] lines, String[] code, int start, int end) {
        StringBuilder signature = new StringBuilder();
        for (int j = start; j <= end; j++) {
            int brace = code[j].indexOf('{');
            String part = brace >= 0 ? lines[j].substring(0, Math.min(brace, lines[j].length())) : lines[j];
            signature.append(part.trim()).append(' ');
            if (brace >= 0) {
                break;
            }
        }
        String result = signature.toString().replaceAll("\\s+", " ").trim();
        return result.endsWith(";") ? result.substring(0, result.length() - 1) : result;
    }

    private static ClassScope directlyInside(Deque<ClassScope> classes, int depth) {
        ClassScope top = classes.peek();
        if (top != null && top.opened && depth == top.depth + 1) {
            return top;
        }
        return null;
    }

    private static void closeScopes(Deque<ClassScope> classes, int depth) {
        while (!classes.isEmpty() && classes.peek().opened && depth <= classes.peek().depth) {
            classes.pop();
        }
    }

    static int braceDelta(String line) {
        int delta = 0;
        for (char c : line.toCharArray()) {
            if (c == '{') {
                delta++;
            } else if (c == '}') {
                delta--;
            }
        }
        return delta;
    }

    /**
     * Blanks the contents of string and character literals and removes comments, keeping
     * line count and column positions of code intact.
     */
    String[] stripLiteralsAndComments(String[] lines) {
        String[] result = new String[lines.length];
        boolean inBlockComment = false;

        for (int n = 0; n < lines.length; n++) {
            String line = lines[n];
            StringBuilder out = new StringBuilder(line.length());
            int i = 0;
            while (i < line.length()) {
                char c = line.charAt(i);
                if (inBlockComment) {
                    if (c == '*' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                        inBlockComment = false;
                        out.append("  ");
                        i += 2;
                    } else {
                        out.append(' ');
                        i++;
                    }
                    continue;
                }
                if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '/') {
                    break;
                }
                if (c == '/' && i + 1 < line.length() && line.charAt(i + 1) == '*') {
                    inBlockComment = true;
                    out.append("  ");
                    i += 2;
                    continue;
                }
                if (c == '"' || c == '`' || (c == '\'' && singleQuotedStrings())) {
                    int close = closingQuote(line, i + 1, c);
                    out.append(c).append(" ".repeat(Math.max(close - i - 1, 0)));
                    if (close < line.length()) {
                        out.append(c);
                    }
                    i = close + 1;
                    continue;
                }
                if (c == '\'') {
                    int close = charLiteralEnd(line, i);
                    if (close > 0) {
                        out.append('\'').append(" ".repeat(close - i - 1)).append('\'');
                        i = close + 1;
                        continue;
                    }
                }
                out.append(c);
                i++;
            }
            result[n] = out.toString();
        }
        return result;
    }

    private static int closingQuote(String line, int from, char quote) {
        int i = from;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i;
            }
            i++;
        }
        return line.length();
    }

    /**
     * End index of a character literal such as {@code '{'} or {@code '\n'} starting at
     * {@code start}, or -1 when the quote is something else (e.g. a Rust lifetime).
     */
    private static int charLiteralEnd(String line, int start) {
        if (start + 2 < line.length() && line.charAt(start + 1) != '\\' && line.charAt(start + 2) == '\'') {
            return start + 2;
        }
        if (start + 3 < line.length() && line.charAt(start + 1) == '\\' && line.charAt(start + 3) == '\'') {
            return start + 3;
        }
        return -1;
    }

    private static final class ClassScope {
        private final String name;
        private final int depth;
        private boolean opened;

        private ClassScope(String name, int depth) {
            this.name = name;
            this.depth = depth;
        }
    }
}
