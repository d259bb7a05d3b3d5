package io.loremesh.cli;

import io.loremesh.core.federation.SyncStats;
import io.loremesh.core.orchestration.OrchestrationStats;
import io.loremesh.core.routing.RoutingStats;
import io.loremesh.core.runtime.LoremeshRuntime;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "stats", description = "Show federation, routing and orchestration statistics")
public final class StatsCommand implements Callable<Integer> {
    private final CliContext context;

    public StatsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try (LoremeshRuntime runtime = context.openRuntime()) {
            SyncStats sync = runtime.ledger().stats();
            System.out.println("Total syncs: " + sync.total());
            System.out.println("A → B: " + sync.aToB());
            System.out.println("B → A: " + sync.bToA());
            System.out.println("Last sync: " + (sync.lastSync() == null ? "never" : sync.lastSync()));

            OrchestrationStats orchestration = runtime.orchestrator().stats();
            RoutingStats routing = orchestration.routingStats();
            System.out.println("Total solved: " + orchestration.totalSolved());
            System.out.println("Success rate: " + String.format(Locale.ROOT, "%.2f", orchestration.successRate()));
            System.out.println("Total routed: " + routing.totalRouted());
            routing.byAgent().forEach((agent, count) -> System.out.println("  " + agent + ": " + count));
            System.out.println("Last solution: " + (orchestration.lastSolution() == null ? "never" : orchestration.lastSolution()));
            return 0;
        } catch (Exception e) {
            System.err.println("Stats command failed: " + e.getMessage());
            return 1;
        }
    }
}
