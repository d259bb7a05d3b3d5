package io.loremesh.core.orchestration;

import io.loremesh.core.routing.RoutingStats;
import java.time.Instant;

public record OrchestrationStats(int totalSolved, double successRate, RoutingStats routingStats, Instant lastSolution) {
}
