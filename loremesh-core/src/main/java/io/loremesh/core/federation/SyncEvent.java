package io.loremesh.core.federation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncEvent(
    Instant timestamp,
    @JsonProperty("entry_id") String entryId,
    SyncDirection direction
) {
}
