package com.purchasingpower.memory.indexing;

import java.util.List;

/**
 * Minimal glob matching for include/exclude lists.
 *
 * <p>{@code *.ext} matches by suffix, a leading {@code **}{@code /} is ignored, and anything
 * else matches as a substring of the relative path. {@code node_modules} therefore excludes
 * every path that passes through a {@code node_modules} directory.
 */
public final class PathPatterns {

    private PathPatterns() {
    }

    public static boolean matches(String relativePath, String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return false;
        }
        String path = relativePath.replace('\\', '/');
        String normalized = pattern.trim();
        while (normalized.startsWith("**/")) {
            normalized = normalized.substring(3);
        }
        if (normalized.endsWith("/**")) {
            normalized = normalized.substring(0, normalized.length() - 3);
        }
        if (normalized.startsWith("*.")) {
            return path.endsWith(normalized.substring(1));
        }
        return path.contains(normalized.replace("*", ""));
    }

    public static boolean matchesAny(String relativePath, List<String> patterns) {
        if (patterns == null) {
            return false;
        }
        for (String pattern : patterns) {
            if (matches(relativePath, pattern)) {
                return true;
            }
        }
        return false;
    }
}
