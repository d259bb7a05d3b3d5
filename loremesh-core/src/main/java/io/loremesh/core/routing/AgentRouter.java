package io.loremesh.core.routing;

import io.loremesh.core.advisor.KnowledgeAdvisor;
import io.loremesh.core.advisor.LearningNotifier;
import io.loremesh.core.advisor.LearningRecord;
import io.loremesh.core.advisor.NoopKnowledgeAdvisor;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns problems to agents and keeps a persisted history of its decisions.
 *
 * <p>Load balancing picks the available agent with the lowest load, first-registered on
 * ties. When several agents tie, the advisor's pick is kept in the rationale only.
 * Advisor calls happen before the history lock is taken.
 */
public final class AgentRouter {
    private static final Logger LOG = LoggerFactory.getLogger(AgentRouter.class);

    private final AgentPool pool;
    private final RoutingStore store;
    private final Clock clock;
    private final RouterSettings settings;
    private final KnowledgeAdvisor advisor;
    private final LearningNotifier notifier;
    private final List<RoutingRecord> history;
    private long totalRouted;

    public AgentRouter(AgentPool pool, RoutingStore store, Clock clock, RouterSettings settings) throws IOException {
        this(pool, store, clock, settings, new NoopKnowledgeAdvisor(), null);
    }

    public AgentRouter(
        AgentPool pool,
        RoutingStore store,
        Clock clock,
        RouterSettings settings,
        KnowledgeAdvisor advisor,
        LearningNotifier notifier
    ) throws IOException {
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.advisor = advisor == null ? new NoopKnowledgeAdvisor() : advisor;
        this.notifier = notifier;
        RoutingState state = store.load();
        List<RoutingRecord> loaded = state.routings();
        int from = Math.max(0, loaded.size() - settings.retention());
        this.history = new ArrayList<>(loaded.subList(from, loaded.size()));
        this.totalRouted = Math.max(state.totalRouted(), loaded.size());
    }

    public String selectAgent(String problemType, boolean preferLocal) throws IOException {
        return selectAgent(problemType, "", preferLocal);
    }

    public String selectAgent(String problemType, String problemDescription, boolean preferLocal) throws IOException {
        String type = normalizeType(problemType);
        List<AgentDescriptor> available = pool.snapshot().stream()
            .filter(AgentDescriptor::available)
            .toList();

        Selection selection;
        if (available.isEmpty()) {
            selection = fallback(type);
        } else if (preferLocal) {
            selection = selectLocal(available);
        } else {
            selection = selectLeastLoaded(type, problemDescription, available);
        }

        RoutingRecord record = append(type, selection.agent(), selection.rationale());
        LOG.info("Routed {} problem to {} ({})", type, record.selectedAgent(), record.rationale());
        learn(type, selection);
        return record.selectedAgent();
    }

    public synchronized RoutingStats stats() {
        if (history.isEmpty()) {
            return RoutingStats.empty();
        }
        Map<String, Integer> byAgent = new LinkedHashMap<>();
        Map<String, Integer> byProblemType = new LinkedHashMap<>();
        for (RoutingRecord record : history) {
            byAgent.merge(record.selectedAgent(), 1, Integer::sum);
            byProblemType.merge(record.problemType(), 1, Integer::sum);
        }
        return new RoutingStats(history.size(), byAgent, byProblemType, history.get(history.size() - 1));
    }

    public synchronized List<RoutingRecord> history() {
        return List.copyOf(history);
    }

    public synchronized long totalRouted() {
        return totalRouted;
    }

    public RoutingReport report() {
        RoutingStats stats = stats();
        String insights = ask(() -> advisor.query("What patterns do you see in this routing data: " + describe(stats) + "?"));
        return new RoutingReport(clock.instant(), stats, insights);
    }

    private Selection selectLocal(List<AgentDescriptor> available) {
        if (!settings.localAgent().isEmpty()) {
            for (AgentDescriptor agent : available) {
                if (agent.name().equalsIgnoreCase(settings.localAgent())) {
                    return new Selection(agent.name(), "local agent preferred");
                }
            }
        }
        AgentDescriptor first = available.get(0);
        return new Selection(first.name(), "local agent unavailable, first available agent");
    }

    private Selection selectLeastLoaded(String type, String description, List<AgentDescriptor> available) {
        int minLoad = available.stream().mapToInt(AgentDescriptor::currentLoad).min().orElse(0);
        List<AgentDescriptor> leastLoaded = available.stream()
            .filter(agent -> agent.currentLoad() == minLoad)
            .toList();
        String rationale = "lowest load (" + minLoad + ")";
        if (leastLoaded.size() > 1) {
            Optional<AgentDescriptor> advised = advisedAgent(type, description, leastLoaded);
            if (advised.isPresent()) {
                rationale += ", advisor suggested " + advised.get().name();
            }
        }
        return new Selection(leastLoaded.get(0).name(), rationale);
    }

    private Selection fallback(String type) {
        if (settings.hasFallback()) {
            LOG.warn("No agent available for {} problem, using configured fallback {}", type, settings.fallbackAgent());
            return new Selection(settings.fallbackAgent(), "configured fallback");
        }
        String reason = pool.isEmpty() ? "agent pool is empty" : "all agents are unavailable";
        throw new NoAgentAvailableException("Cannot route " + type + " problem: " + reason);
    }

    private Optional<AgentDescriptor> advisedAgent(String type, String description, List<AgentDescriptor> candidates) {
        String names = candidates.stream().map(AgentDescriptor::name).collect(Collectors.joining(", "));
        String guidance = ask(() -> advisor.query("How do I route a " + type + " problem to the best agent?"));
        String prompt = """
            Problem Type: %s
            Description: %s

            Guidance from shared knowledge: %s

            Answer with exactly one agent name from: %s
            """.formatted(type, description == null ? "" : description, guidance, names);
        String answer = ask(() -> advisor.chat(prompt)).trim().toLowerCase(Locale.ROOT);
        if (answer.isEmpty()) {
            return Optional.empty();
        }
        Optional<AgentDescriptor> match = candidates.stream()
            .filter(agent -> agent.name().toLowerCase(Locale.ROOT).equals(answer))
            .findFirst();
        if (match.isEmpty()) {
            LOG.debug("Ignoring advisor answer that names no candidate agent: {}", truncate(answer, 80));
        }
        return match;
    }

    private synchronized RoutingRecord append(String type, String agent, String rationale) throws IOException {
        Instant now = clock.instant();
        RoutingRecord record = new RoutingRecord(now, type, agent, rationale);
        history.add(record);
        totalRouted++;
        if (history.size() > settings.retention()) {
            history.subList(0, history.size() - settings.retention()).clear();
        }
        store.save(new RoutingState(now, totalRouted, List.copyOf(history)));
        return record;
    }

    private void learn(String type, Selection selection) {
        if (notifier == null) {
            return;
        }
        notifier.submit(LearningRecord.permanent(
            "How do I route a " + type + " problem to the best agent?",
            "Route to " + selection.agent() + " because: " + selection.rationale(),
            "routing_decision"
        ));
    }

    private String ask(AdvisorCall call) {
        try {
            String answer = call.get();
            return answer == null ? "" : answer;
        } catch (Exception e) {
            LOG.warn("Knowledge advisor unavailable, continuing without guidance: {}", e.getMessage());
            return "";
        }
    }

    private String describe(RoutingStats stats) {
        return "total_routed=" + stats.totalRouted()
            + ", by_agent=" + stats.byAgent()
            + ", by_problem_type=" + stats.byProblemType();
    }

    private String normalizeType(String problemType) {
        return problemType == null || problemType.isBlank() ? "general" : problemType.trim();
    }

    private String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }

    @FunctionalInterface
    private interface AdvisorCall {
        String get() throws IOException;
    }

    private record Selection(String agent, String rationale) {
    }
}
