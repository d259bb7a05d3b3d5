package io.loremesh.cli;

import io.loremesh.core.config.ConfigPaths;
import io.loremesh.core.config.model.AgentConfig;
import io.loremesh.core.config.model.LoremeshConfig;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            LoremeshConfig config = context.configService().load(context.configPath());
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Sync state: " + ConfigPaths.resolve(config.federation().stateFile(), "sync_state.json"));
            System.out.println("Routing state: " + ConfigPaths.resolve(config.routing().stateFile(), "routing_state.json"));
            System.out.println("Local agent: " + config.routing().localAgent());
            System.out.println("Fallback agent: " + (config.routing().fallbackAgent().isBlank() ? "(none)" : config.routing().fallbackAgent()));
            for (AgentConfig agent : config.routing().agents()) {
                System.out.println("Agent " + agent.name() + ": available=" + agent.available() + " load=" + agent.load());
            }
            System.out.println("Advisor configured: " + config.advisor().configured());
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
