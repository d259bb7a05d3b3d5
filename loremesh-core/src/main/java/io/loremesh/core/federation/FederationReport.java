package io.loremesh.core.federation;

import java.util.List;

public record FederationReport(
    SyncResult aToB,
    SyncResult bToA,
    int conflicts,
    List<ConflictResolution> resolutions
) {
    public FederationReport {
        resolutions = resolutions == null ? List.of() : List.copyOf(resolutions);
    }

    public int synced() {
        return aToB.synced() + bToA.synced();
    }

    public int errors() {
        return aToB.errors() + bToA.errors();
    }
}
