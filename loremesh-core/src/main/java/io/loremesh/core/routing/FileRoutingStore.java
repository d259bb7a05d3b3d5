package io.loremesh.core.routing;

import io.loremesh.core.persistence.JsonStateFile;
import java.io.IOException;
import java.nio.file.Path;

public final class FileRoutingStore implements RoutingStore {
    private final JsonStateFile<RoutingState> file;

    public FileRoutingStore(Path path) {
        this.file = new JsonStateFile<>(path, RoutingState.class);
    }

    @Override
    public RoutingState load() throws IOException {
        return file.read(RoutingState::empty);
    }

    @Override
    public void save(RoutingState state) throws IOException {
        file.write(state);
    }
}
