package com.purchasingpower.memory.indexing.extract;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Go functions and methods. Methods are attributed to their receiver type.
 */
@Component
public class GoExtractor extends BraceScopedExtractor {

    private static final Pattern FUNC = Pattern.compile(
            "^\\s*func\\s+(?:\\((?<receiver>[^)]*)\\)\\s*)?(?<name>[A-Za-z_]\\w*)\\s*(?:\\[[^\\]]*\\])?\\s*\\(");

    @Override
    public Set<String> languages() {
        return Set.of("go");
    }

    @Override
    protected Pattern classPattern() {
        return null;
    }

    @Override
    protected List<Pattern> functionPatterns() {
        return List.of(FUNC);
    }

    @Override
    protected String resolveClassName(Matcher matcher, String enclosingClass) {
        String receiver = matcher.group("receiver");
        if (receiver == null || receiver.isBlank()) {
            return null;
        }
        // "s *Service" -> "Service", "*Service" -> "Service"
        String[] parts = receiver.trim().split("\\s+");
        String type = parts[parts.length - 1].replace("*", "");
        int generic = type.indexOf('[');
        return generic > 0 ? type.substring(0, generic) : type;
    }

    @Override
    protected boolean isAsync(String signature) {
        return false;
    }
}
