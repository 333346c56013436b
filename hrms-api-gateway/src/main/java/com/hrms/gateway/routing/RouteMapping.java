package com.hrms.gateway.routing;

/**
 * One entry of the path-prefix table: requests under {@code prefix} go to
 * {@code service}, with {@code prefix} replaced by {@code targetPrefix}.
 */
public record RouteMapping(String prefix, String service, String targetPrefix) {

    public RouteMapping {
        if (prefix == null || !prefix.startsWith("/")) {
            throw new IllegalArgumentException("Route prefix must start with '/': " + prefix);
        }
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("Route " + prefix + " has no service");
        }
        prefix = trimSlash(prefix);
        targetPrefix = targetPrefix == null ? "" : trimSlash(targetPrefix);
    }

    public boolean matches(String path) {
        return prefix.isEmpty() || path.equals(prefix) || path.startsWith(prefix + "/");
    }

    /**
     * Upstream path for an inbound path this mapping matches.
     */
    public String rewrite(String path) {
        String remainder = path.substring(prefix.length());
        String rewritten = targetPrefix + remainder;
        return rewritten.isEmpty() ? "/" : rewritten;
    }

    private static String trimSlash(String value) {
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }
}
