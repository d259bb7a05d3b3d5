package io.loremesh.core.orchestration;

import java.io.IOException;

public interface OrchestrationStore {
    OrchestrationState load() throws IOException;

    void save(OrchestrationState state) throws IOException;
}
