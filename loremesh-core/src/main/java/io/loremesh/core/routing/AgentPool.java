package io.loremesh.core.routing;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

public final class AgentPool {
    private final Map<String, AgentDescriptor> agents = new LinkedHashMap<>();

    public static AgentPool of(AgentDescriptor... descriptors) {
        AgentPool pool = new AgentPool();
        for (AgentDescriptor descriptor : descriptors) {
            pool.register(descriptor);
        }
        return pool;
    }

    public synchronized void register(AgentDescriptor descriptor) {
        agents.put(normalize(descriptor.name()), descriptor);
    }

    public synchronized Optional<AgentDescriptor> find(String name) {
        return Optional.ofNullable(agents.get(normalize(name)));
    }

    public synchronized AgentDescriptor updateLoad(String name, int load) {
        return replace(name, existing -> existing.withLoad(load));
    }

    public synchronized AgentDescriptor setAvailability(String name, boolean available) {
        return replace(name, existing -> existing.withAvailability(available));
    }

    public synchronized List<AgentDescriptor> snapshot() {
        return List.copyOf(agents.values());
    }

    public synchronized boolean isEmpty() {
        return agents.isEmpty();
    }

    private AgentDescriptor replace(String name, UnaryOperator<AgentDescriptor> change) {
        String key = normalize(name);
        AgentDescriptor existing = agents.get(key);
        if (existing == null) {
            throw new IllegalArgumentException("Unknown agent: " + name);
        }
        AgentDescriptor updated = change.apply(existing);
        agents.put(key, updated);
        return updated;
    }

    private String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
