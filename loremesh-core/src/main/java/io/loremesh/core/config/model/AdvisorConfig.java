package io.loremesh.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AdvisorConfig(
    boolean enabled,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds,
    @JsonAlias({"queue_capacity"}) int queueCapacity
) {

    public static AdvisorConfig defaults() {
        return new AdvisorConfig(false, "http://127.0.0.1:8420", 30, 256);
    }

    public boolean configured() {
        return enabled && apiBase != null && !apiBase.isBlank();
    }
}
