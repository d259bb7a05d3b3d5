package io.loremesh.cli;

import io.loremesh.core.config.model.LoremeshConfig;
import io.loremesh.core.runtime.LoremeshRuntime;
import java.io.IOException;

@FunctionalInterface
public interface RuntimeFactory {
    LoremeshRuntime open(LoremeshConfig config) throws IOException;
}
