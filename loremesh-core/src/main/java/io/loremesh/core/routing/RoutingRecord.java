package io.loremesh.core.routing;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RoutingRecord(
    Instant timestamp,
    @JsonProperty("problem_type") String problemType,
    @JsonProperty("selected_agent") String selectedAgent,
    String rationale
) {
    public RoutingRecord {
        problemType = problemType == null ? "" : problemType;
        selectedAgent = selectedAgent == null ? "" : selectedAgent;
        rationale = rationale == null ? "" : rationale;
    }
}
