package com.hrms.gateway.routing;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Static path-prefix to logical-service table. The longest matching prefix wins.
 */
public class RouteTable {

    private final List<RouteMapping> mappings;

    public RouteTable(List<RouteMapping> mappings) {
        this.mappings = mappings.stream()
                .sorted(Comparator.comparingInt((RouteMapping m) -> m.prefix().length()).reversed())
                .toList();
    }

    public Optional<RouteMapping> resolve(String path) {
        return mappings.stream().filter(mapping -> mapping.matches(path)).findFirst();
    }

    public List<RouteMapping> mappings() {
        return mappings;
    }
}
