package io.loremesh.core.federation;

import io.loremesh.core.persistence.JsonStateFile;
import java.io.IOException;
import java.nio.file.Path;

public final class FileSyncStore implements SyncStore {
    private final JsonStateFile<SyncState> file;

    public FileSyncStore(Path path) {
        this.file = new JsonStateFile<>(path, SyncState.class);
    }

    @Override
    public SyncState load() throws IOException {
        return file.read(SyncState::empty);
    }

    @Override
    public void save(SyncState state) throws IOException {
        file.write(state);
    }
}
