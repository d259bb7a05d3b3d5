package io.loremesh.core.routing;

public record RouterSettings(String localAgent, String fallbackAgent, int retention) {
    public RouterSettings {
        localAgent = localAgent == null ? "" : localAgent.trim();
        fallbackAgent = fallbackAgent == null ? "" : fallbackAgent.trim();
        retention = retention <= 0 ? 100 : retention;
    }

    public static RouterSettings defaults(String localAgent) {
        return new RouterSettings(localAgent, "", 100);
    }

    public boolean hasFallback() {
        return !fallbackAgent.isEmpty();
    }
}
