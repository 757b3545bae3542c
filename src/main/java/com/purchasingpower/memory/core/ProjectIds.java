package com.purchasingpower.memory.core;

import com.purchasingpower.memory.exception.MemoryValidationException;

import java.util.regex.Pattern;

/**
 * Project id validation. Ids become part of collection names, so they are kept to a
 * lower-case identifier alphabet.
 */
public final class ProjectIds {

    private static final Pattern PROJECT_ID = Pattern.compile("^[a-z][a-z0-9_-]{0,63}$");

    private ProjectIds() {
    }

    public static String requireValid(String projectId) {
        if (projectId == null || !PROJECT_ID.matcher(projectId).matches()) {
            throw new MemoryValidationException(
                    "Invalid project id '" + projectId + "': expected ^[a-z][a-z0-9_-]{0,63}$");
        }
        return projectId;
    }

    public static boolean isValid(String projectId) {
        return projectId != null && PROJECT_ID.matcher(projectId).matches();
    }
}
