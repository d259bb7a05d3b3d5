package io.loremesh.core.orchestration;

import io.loremesh.core.persistence.JsonStateFile;
import java.io.IOException;
import java.nio.file.Path;

public final class FileOrchestrationStore implements OrchestrationStore {
    private final JsonStateFile<OrchestrationState> file;

    public FileOrchestrationStore(Path path) {
        this.file = new JsonStateFile<>(path, OrchestrationState.class);
    }

    @Override
    public OrchestrationState load() throws IOException {
        return file.read(OrchestrationState::empty);
    }

    @Override
    public void save(OrchestrationState state) throws IOException {
        file.write(state);
    }
}
