package io.loremesh.core.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingStats(
    @JsonProperty("total_routed") int totalRouted,
    @JsonProperty("by_agent") Map<String, Integer> byAgent,
    @JsonProperty("by_problem_type") Map<String, Integer> byProblemType,
    @JsonProperty("last_routing") RoutingRecord lastRouting
) {
    public RoutingStats {
        byAgent = byAgent == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byAgent));
        byProblemType = byProblemType == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(byProblemType));
    }

    public static RoutingStats empty() {
        return new RoutingStats(0, Map.of(), Map.of(), null);
    }
}
