package io.loremesh.core.routing;

import java.util.Objects;

public record AgentDescriptor(String name, boolean available, int currentLoad) {
    public AgentDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        name = name.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("agent name must not be blank");
        }
        if (currentLoad < 0) {
            throw new IllegalArgumentException("currentLoad must be >= 0 for agent " + name);
        }
    }

    public AgentDescriptor withLoad(int load) {
        return new AgentDescriptor(name, available, load);
    }

    public AgentDescriptor withAvailability(boolean value) {
        return new AgentDescriptor(name, value, currentLoad);
    }
}
