package io.loremesh.app;

import io.loremesh.cli.CliContext;
import io.loremesh.cli.FederateCommand;
import io.loremesh.cli.InitCommand;
import io.loremesh.cli.LoremeshCliCommand;
import io.loremesh.cli.SolveCommand;
import io.loremesh.cli.StatsCommand;
import io.loremesh.cli.StatusCommand;
import io.loremesh.cli.SyncCommand;
import io.loremesh.core.config.ConfigPaths;
import io.loremesh.core.config.ConfigService;
import io.loremesh.core.runtime.LoremeshRuntime;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class LoremeshApplication {
    private static final Logger LOG = LoggerFactory.getLogger(LoremeshApplication.class);

    private LoremeshApplication() {
    }

    public static void main(String[] args) {
        Path configPath = resolveConfigPath();
        LOG.debug("Using config {}", configPath);

        CliContext context = new CliContext(
            new ConfigService(),
            configPath,
            config -> LoremeshRuntime.create(config, Clock.systemUTC())
        );

        CommandLine commandLine = new CommandLine(new LoremeshCliCommand());
        commandLine.addSubcommand("init", new InitCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("sync", new SyncCommand(context));
        commandLine.addSubcommand("federate", new FederateCommand(context));
        commandLine.addSubcommand("solve", new SolveCommand(context));
        commandLine.addSubcommand("stats", new StatsCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static Path resolveConfigPath() {
        String override = System.getenv("LOREMESH_CONFIG");
        if (override != null && !override.isBlank()) {
            return ConfigPaths.resolve(override.trim(), "config.json");
        }
        return ConfigPaths.defaultConfigPath();
    }
}
