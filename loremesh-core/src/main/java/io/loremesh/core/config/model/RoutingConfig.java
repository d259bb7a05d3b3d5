package io.loremesh.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingConfig(
    @JsonAlias({"state_file"}) String stateFile,
    @JsonAlias({"orchestration_state_file"}) String orchestrationStateFile,
    int retention,
    @JsonAlias({"local_agent"}) String localAgent,
    @JsonAlias({"fallback_agent"}) String fallbackAgent,
    List<AgentConfig> agents
) {

    public RoutingConfig {
        agents = agents == null ? List.of() : List.copyOf(agents);
    }

    public static RoutingConfig defaults() {
        return new RoutingConfig(
            "~/.loremesh/state/routing_state.json",
            "~/.loremesh/state/orchestration_state.json",
            100,
            "local",
            "",
            List.of(
                new AgentConfig("local", true, 0),
                new AgentConfig("remote", true, 0)
            )
        );
    }
}
