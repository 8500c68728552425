package com.cdnarchiver.channel.routing;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable route configuration: default routes by (kind, visibility) plus
 * per-tenant overrides of the same shape.
 */
public final class RouteTable {

    private final Map<String, Map<String, RouteDecision>> routes;
    private final Map<String, Map<String, Map<String, RouteDecision>>> tenantOverrides;

    public RouteTable(Map<String, Map<String, RouteDecision>> routes,
            Map<String, Map<String, Map<String, RouteDecision>>> tenantOverrides) {
        this.routes = deepCopy(routes);
        this.tenantOverrides = tenantOverrides == null ? Map.of() : tenantOverrides.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey, e -> deepCopy(e.getValue())));
    }

    public Optional<RouteDecision> defaultRoute(String kind, String visibility) {
        return find(routes, kind, visibility);
    }

    public Optional<RouteDecision> tenantRoute(String tenant, String kind, String visibility) {
        if (tenant == null) {
            return Optional.empty();
        }
        return find(tenantOverrides.getOrDefault(tenant, Map.of()), kind, visibility);
    }

    public int size() {
        return routes.values().stream().mapToInt(Map::size).sum();
    }

    private static Optional<RouteDecision> find(Map<String, Map<String, RouteDecision>> table,
            String kind, String visibility) {
        Map<String, RouteDecision> byVisibility = table.get(kind);
        if (byVisibility == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byVisibility.get(visibility));
    }

    private static Map<String, Map<String, RouteDecision>> deepCopy(Map<String, Map<String, RouteDecision>> source) {
        if (source == null) {
            return Map.of();
        }
        return source.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(
                        Map.Entry::getKey, e -> Map.copyOf(e.getValue())));
    }
}
