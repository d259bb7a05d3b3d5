package io.loremesh.cli;

import io.loremesh.core.config.ConfigService;
import io.loremesh.core.runtime.LoremeshRuntime;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RuntimeFactory runtimeFactory
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, config -> LoremeshRuntime.create(config, Clock.systemUTC()));
    }

    public LoremeshRuntime openRuntime() throws Exception {
        return runtimeFactory.open(configService.load(configPath));
    }
}
