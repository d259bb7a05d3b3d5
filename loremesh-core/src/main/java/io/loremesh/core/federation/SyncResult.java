package io.loremesh.core.federation;

import java.time.Instant;

public record SyncResult(int synced, int conflicts, int errors, SyncDirection direction, Instant timestamp) {
}
