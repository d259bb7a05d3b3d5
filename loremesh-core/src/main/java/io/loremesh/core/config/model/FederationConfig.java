package io.loremesh.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FederationConfig(
    @JsonAlias({"state_file"}) String stateFile,
    int retention,
    @JsonAlias({"confidence_margin"}) double confidenceMargin
) {

    public static FederationConfig defaults() {
        return new FederationConfig("~/.loremesh/state/sync_state.json", 100, 0.1);
    }
}
