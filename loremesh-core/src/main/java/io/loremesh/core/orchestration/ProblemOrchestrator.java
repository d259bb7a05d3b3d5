package io.loremesh.core.orchestration;

import io.loremesh.core.routing.AgentRouter;
import io.loremesh.core.routing.NoAgentAvailableException;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for problems: routes each one through the {@link AgentRouter} and keeps a
 * persisted ledger of the outcomes.
 */
public final class ProblemOrchestrator {
    public static final String DEFAULT_PROBLEM_TYPE = "general";
    public static final int DEFAULT_RETENTION = 100;

    private static final Logger LOG = LoggerFactory.getLogger(ProblemOrchestrator.class);

    private final AgentRouter router;
    private final OrchestrationStore store;
    private final Clock clock;
    private final int retention;
    private final List<SolutionRecord> solutions;
    private long totalSolutions;

    public ProblemOrchestrator(AgentRouter router, OrchestrationStore store, Clock clock) throws IOException {
        this(router, store, clock, DEFAULT_RETENTION);
    }

    public ProblemOrchestrator(AgentRouter router, OrchestrationStore store, Clock clock, int retention) throws IOException {
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.retention = Math.max(1, retention);
        OrchestrationState state = store.load();
        List<SolutionRecord> loaded = state.solutions();
        int from = Math.max(0, loaded.size() - this.retention);
        this.solutions = new ArrayList<>(loaded.subList(from, loaded.size()));
        this.totalSolutions = Math.max(state.totalSolutions(), loaded.size());
    }

    public SolutionRecord solve(String problem) throws IOException {
        return solve(problem, DEFAULT_PROBLEM_TYPE);
    }

    public SolutionRecord solve(String problem, String problemType) throws IOException {
        if (problem == null || problem.isBlank()) {
            throw new IllegalArgumentException("problem must not be blank");
        }
        String type = problemType == null || problemType.isBlank() ? DEFAULT_PROBLEM_TYPE : problemType.trim();

        String agent;
        try {
            agent = router.selectAgent(type, problem, false);
        } catch (NoAgentAvailableException e) {
            try {
                append(problem, type, "", SolutionStatus.FAILED);
            } catch (IOException persistFailure) {
                e.addSuppressed(persistFailure);
            }
            LOG.warn("Could not route {} problem: {}", type, e.getMessage());
            throw e;
        }
        SolutionRecord record = append(problem, type, agent, SolutionStatus.SOLVED);
        LOG.debug("Recorded {} problem as solved by {}", type, agent);
        return record;
    }

    public OrchestrationStats stats() {
        List<SolutionRecord> snapshot = solutions();
        int solved = (int) snapshot.stream().filter(record -> record.status() == SolutionStatus.SOLVED).count();
        double successRate = snapshot.isEmpty() ? 0.0 : (double) solved / snapshot.size();
        Instant last = snapshot.isEmpty() ? null : snapshot.get(snapshot.size() - 1).timestamp();
        return new OrchestrationStats(solved, successRate, router.stats(), last);
    }

    public synchronized List<SolutionRecord> solutions() {
        return List.copyOf(solutions);
    }

    public synchronized long totalSolutions() {
        return totalSolutions;
    }

    private synchronized SolutionRecord append(String problem, String type, String agent, SolutionStatus status) throws IOException {
        Instant now = clock.instant();
        SolutionRecord record = new SolutionRecord(now, problem, type, agent, status);
        solutions.add(record);
        totalSolutions++;
        if (solutions.size() > retention) {
            solutions.subList(0, solutions.size() - retention).clear();
        }
        store.save(new OrchestrationState(now, totalSolutions, router.stats(), List.copyOf(solutions)));
        return record;
    }
}
