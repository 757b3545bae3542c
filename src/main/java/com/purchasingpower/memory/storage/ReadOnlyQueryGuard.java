package com.purchasingpower.memory.storage;

import com.purchasingpower.memory.exception.QueryRejectedException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical screen for caller-supplied Cypher.
 *
 * <p>Statements must begin with {@code MATCH} or {@code OPTIONAL MATCH} and may not use any
 * mutating keyword. Keywords are matched as whole words so property names such as
 * {@code created_at} or {@code deleted} pass. This screen is best-effort: the store also
 * runs these statements in a READ access-mode session.
 */
public final class ReadOnlyQueryGuard {

    private static final Pattern WRITE_KEYWORD =
            Pattern.compile("\\b(create|delete|remove|set|merge|detach|drop|load\\s+csv|call)\\b");

    private ReadOnlyQueryGuard() {
    }

    public static String check(String cypher) {
        if (cypher == null || cypher.isBlank()) {
            throw new QueryRejectedException("Query must not be empty");
        }
        String normalized = cypher.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        if (!normalized.startsWith("match") && !normalized.startsWith("optional match")) {
            throw new QueryRejectedException("Only MATCH queries are allowed");
        }
        Matcher matcher = WRITE_KEYWORD.matcher(stripStringLiterals(normalized));
        if (matcher.find()) {
            throw new QueryRejectedException("Write operation not allowed in query: " + matcher.group(1));
        }
        return cypher;
    }

    private static String stripStringLiterals(String cypher) {
        return cypher.replaceAll("'[^']*'|\"[^\"]*\"", "''");
    }
}
