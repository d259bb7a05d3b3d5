package io.loremesh.core.federation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Objects;

public record SyncDirection(RepoId from, RepoId to) {
    public static final SyncDirection A_TO_B = new SyncDirection(RepoId.A, RepoId.B);
    public static final SyncDirection B_TO_A = new SyncDirection(RepoId.B, RepoId.A);

    public SyncDirection {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (from == to) {
            throw new IllegalArgumentException("source and target repository must differ: " + from);
        }
    }

    public static SyncDirection of(RepoId source, RepoId target) {
        return new SyncDirection(source, target);
    }

    @JsonIgnore
    public String label() {
        return from + " → " + to;
    }
}
