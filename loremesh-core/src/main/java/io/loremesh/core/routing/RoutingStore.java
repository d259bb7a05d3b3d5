package io.loremesh.core.routing;

import java.io.IOException;

public interface RoutingStore {
    RoutingState load() throws IOException;

    void save(RoutingState state) throws IOException;
}
