package io.loremesh.core.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingState(
    @JsonProperty("last_updated") Instant lastUpdated,
    @JsonProperty("total_routed") long totalRouted,
    List<RoutingRecord> routings
) {
    public RoutingState {
        totalRouted = Math.max(0, totalRouted);
        routings = routings == null ? List.of() : List.copyOf(routings);
    }

    public static RoutingState empty() {
        return new RoutingState(null, 0, List.of());
    }
}
