package io.loremesh.core.federation;

import java.time.Instant;

public record SyncStats(int total, int aToB, int bToA, Instant lastSync) {

    public static SyncStats empty() {
        return new SyncStats(0, 0, 0, null);
    }
}
