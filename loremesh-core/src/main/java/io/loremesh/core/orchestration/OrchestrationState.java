package io.loremesh.core.orchestration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.loremesh.core.routing.RoutingStats;
import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record OrchestrationState(
    @JsonProperty("last_updated") Instant lastUpdated,
    @JsonProperty("total_solutions") long totalSolutions,
    @JsonProperty("router_stats") RoutingStats routerStats,
    List<SolutionRecord> solutions
) {
    public OrchestrationState {
        totalSolutions = Math.max(0, totalSolutions);
        routerStats = routerStats == null ? RoutingStats.empty() : routerStats;
        solutions = solutions == null ? List.of() : List.copyOf(solutions);
    }

    public static OrchestrationState empty() {
        return new OrchestrationState(null, 0, RoutingStats.empty(), List.of());
    }
}
