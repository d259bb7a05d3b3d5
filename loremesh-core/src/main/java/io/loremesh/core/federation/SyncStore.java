package io.loremesh.core.federation;

import java.io.IOException;

public interface SyncStore {
    SyncState load() throws IOException;

    void save(SyncState state) throws IOException;
}
