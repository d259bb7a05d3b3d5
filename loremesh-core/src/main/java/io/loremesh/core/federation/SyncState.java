package io.loremesh.core.federation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SyncState(
    @JsonProperty("last_sync") Instant lastSync,
    @JsonProperty("sync_count") long syncCount,
    List<SyncEvent> syncs
) {
    public SyncState {
        syncCount = Math.max(0, syncCount);
        syncs = syncs == null ? List.of() : List.copyOf(syncs);
    }

    public static SyncState empty() {
        return new SyncState(null, 0, List.of());
    }
}
