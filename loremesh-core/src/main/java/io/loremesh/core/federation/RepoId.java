package io.loremesh.core.federation;

public enum RepoId {
    A,
    B;

    public RepoId opposite() {
        return this == A ? B : A;
    }
}
