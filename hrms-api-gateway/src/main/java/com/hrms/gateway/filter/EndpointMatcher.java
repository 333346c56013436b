package com.hrms.gateway.filter;

import java.util.List;

/**
 * Endpoint pattern matching shared by the gateway filters.
 *
 * Patterns ending with {@code /**} match the prefix and everything below it;
 * any other pattern matches the exact path or a sub-path.
 */
public final class EndpointMatcher {

    private EndpointMatcher() {
    }

    public static boolean matchesAny(String path, List<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            return false;
        }
        return patterns.stream().anyMatch(pattern -> matches(path, pattern));
    }

    public static boolean matches(String path, String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            return false;
        }
        if (pattern.endsWith("/**")) {
            String prefix = pattern.substring(0, pattern.length() - 3);
            return path.equals(prefix) || path.startsWith(prefix + "/");
        }
        return path.equals(pattern) || path.startsWith(pattern + "/");
    }
}
