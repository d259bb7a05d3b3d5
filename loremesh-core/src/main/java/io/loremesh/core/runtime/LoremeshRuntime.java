package io.loremesh.core.runtime;

import io.loremesh.core.advisor.HttpKnowledgeAdvisor;
import io.loremesh.core.advisor.KnowledgeAdvisor;
import io.loremesh.core.advisor.LearningNotifier;
import io.loremesh.core.advisor.NoopKnowledgeAdvisor;
import io.loremesh.core.config.ConfigPaths;
import io.loremesh.core.config.model.AdvisorConfig;
import io.loremesh.core.config.model.AgentConfig;
import io.loremesh.core.config.model.LoremeshConfig;
import io.loremesh.core.config.model.RoutingConfig;
import io.loremesh.core.federation.ConflictResolver;
import io.loremesh.core.federation.FederationService;
import io.loremesh.core.federation.FileSyncStore;
import io.loremesh.core.federation.SyncLedger;
import io.loremesh.core.orchestration.FileOrchestrationStore;
import io.loremesh.core.orchestration.ProblemOrchestrator;
import io.loremesh.core.routing.AgentDescriptor;
import io.loremesh.core.routing.AgentPool;
import io.loremesh.core.routing.AgentRouter;
import io.loremesh.core.routing.FileRoutingStore;
import io.loremesh.core.routing.RouterSettings;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoremeshRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LoremeshRuntime.class);

    private final SyncLedger ledger;
    private final FederationService federation;
    private final AgentRouter router;
    private final ProblemOrchestrator orchestrator;
    private final LearningNotifier notifier;

    private LoremeshRuntime(
        SyncLedger ledger,
        ConflictResolver resolver,
        AgentRouter router,
        ProblemOrchestrator orchestrator,
        LearningNotifier notifier
    ) {
        this.ledger = ledger;
        this.federation = new FederationService(ledger, resolver);
        this.router = router;
        this.orchestrator = orchestrator;
        this.notifier = notifier;
    }

    public static LoremeshRuntime create(LoremeshConfig config, Clock clock) throws IOException {
        return create(config, clock, advisorFor(config.advisor()));
    }

    public static LoremeshRuntime create(LoremeshConfig config, Clock clock, KnowledgeAdvisor advisor) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        KnowledgeAdvisor effectiveAdvisor = advisor == null ? new NoopKnowledgeAdvisor() : advisor;
        LearningNotifier notifier = new LearningNotifier(effectiveAdvisor, config.advisor().queueCapacity());
        try {
            SyncLedger ledger = new SyncLedger(
                new FileSyncStore(ConfigPaths.resolve(config.federation().stateFile(), "sync_state.json")),
                clock,
                config.federation().retention()
            );
            ConflictResolver resolver = new ConflictResolver(config.federation().confidenceMargin(), notifier);

            RoutingConfig routing = config.routing();
            AgentRouter router = new AgentRouter(
                poolFor(routing),
                new FileRoutingStore(ConfigPaths.resolve(routing.stateFile(), "routing_state.json")),
                clock,
                new RouterSettings(routing.localAgent(), routing.fallbackAgent(), routing.retention()),
                effectiveAdvisor,
                notifier
            );
            ProblemOrchestrator orchestrator = new ProblemOrchestrator(
                router,
                new FileOrchestrationStore(ConfigPaths.resolve(routing.orchestrationStateFile(), "orchestration_state.json")),
                clock,
                routing.retention()
            );
            LOG.debug("Runtime ready with {} agents, advisor {}", routing.agents().size(), effectiveAdvisor.getClass().getSimpleName());
            return new LoremeshRuntime(ledger, resolver, router, orchestrator, notifier);
        } catch (IOException | RuntimeException e) {
            notifier.close();
            throw e;
        }
    }

    public static AgentPool poolFor(RoutingConfig routing) {
        AgentPool pool = new AgentPool();
        for (AgentConfig agent : routing.agents()) {
            pool.register(new AgentDescriptor(agent.name(), agent.available(), agent.load()));
        }
        return pool;
    }

    static KnowledgeAdvisor advisorFor(AdvisorConfig config) {
        if (config == null || !config.configured()) {
            return new NoopKnowledgeAdvisor();
        }
        return new HttpKnowledgeAdvisor(config.apiBase(), Duration.ofSeconds(Math.max(1, config.timeoutSeconds())));
    }

    public SyncLedger ledger() {
        return ledger;
    }

    public FederationService federation() {
        return federation;
    }

    public AgentRouter router() {
        return router;
    }

    public ProblemOrchestrator orchestrator() {
        return orchestrator;
    }

    @Override
    public void close() {
        notifier.close();
    }
}
