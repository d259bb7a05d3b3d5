package io.loremesh.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LoremeshConfig(
    FederationConfig federation,
    RoutingConfig routing,
    AdvisorConfig advisor
) {

    public static LoremeshConfig defaults() {
        return new LoremeshConfig(
            FederationConfig.defaults(),
            RoutingConfig.defaults(),
            AdvisorConfig.defaults()
        );
    }
}
