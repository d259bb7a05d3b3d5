package io.loremesh.core.routing;

import java.time.Instant;

public record RoutingReport(Instant generatedAt, RoutingStats stats, String insights) {
}
