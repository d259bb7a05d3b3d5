package io.loremesh.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.loremesh.core.config.model.AgentConfig;
import io.loremesh.core.config.model.LoremeshConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnDefaultsWhenFileIsMissing() throws Exception {
        LoremeshConfig config = new ConfigService().load(tempDir.resolve("missing.json"));

        assertThat(config).isEqualTo(LoremeshConfig.defaults());
        assertThat(config.routing().agents()).extracting(AgentConfig::name).containsExactly("local", "remote");
        assertThat(config.advisor().configured()).isFalse();
    }

    @Test
    void shouldMergeFileOverDefaults() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "federation": { "confidence_margin": 0.25 },
              "routing": {
                "local_agent": "workstation",
                "agents": [
                  { "name": "workstation", "available": true, "load": 2 },
                  { "name": "cluster", "available": false, "load": 0 }
                ]
              },
              "advisor": { "enabled": true, "apiBase": "http://knowledge.internal:9000" }
            }
            """);

        LoremeshConfig config = new ConfigService().load(configPath);

        assertThat(config.federation().confidenceMargin()).isEqualTo(0.25);
        assertThat(config.federation().retention()).isEqualTo(100);
        assertThat(config.federation().stateFile()).isEqualTo("~/.loremesh/state/sync_state.json");
        assertThat(config.routing().localAgent()).isEqualTo("workstation");
        assertThat(config.routing().fallbackAgent()).isEmpty();
        assertThat(config.routing().agents()).extracting(AgentConfig::name).containsExactly("workstation", "cluster");
        assertThat(config.routing().agents().get(0).load()).isEqualTo(2);
        assertThat(config.advisor().configured()).isTrue();
        assertThat(config.advisor().timeoutSeconds()).isEqualTo(30);
    }

    @Test
    void shouldRejectInvalidAgentSection() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "routing": {
                "agents": [
                  { "name": "gpu", "available": true, "load": 1 },
                  { "name": "GPU", "available": true, "load": 0 },
                  { "name": "cpu", "available": true, "load": -2 },
                  { "available": true, "load": 0 }
                ]
              },
              "advisor": { "queue_capacity": 0 }
            }
            """);

        assertThatThrownBy(() -> new ConfigService().load(configPath))
            .isInstanceOfSatisfying(InvalidConfigException.class, e -> assertThat(e.problems()).containsExactly(
                "routing.agents[1] repeats agent name GPU",
                "routing.agents[2] (cpu) has negative load -2",
                "routing.agents[3] has no name",
                "advisor.queueCapacity must be positive, was 0"
            ))
            .hasMessageContaining("config.json");
    }

    @Test
    void shouldRejectOutOfRangeMargin() throws Exception {
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, "{\"federation\": {\"confidence_margin\": 1.5, \"retention\": 0}}");

        assertThatThrownBy(() -> new ConfigService().load(configPath))
            .isInstanceOf(InvalidConfigException.class)
            .hasMessageContaining("federation.retention must be positive")
            .hasMessageContaining("federation.confidenceMargin must be within [0, 1]");
    }

    @Test
    void initShouldCreateThenKeepExistingValues() throws Exception {
        Path configPath = tempDir.resolve("nested").resolve("config.json");
        ConfigService service = new ConfigService();

        InitResult created = service.init(configPath, false);
        assertThat(created.createdConfig()).isTrue();
        assertThat(created.overwrittenConfig()).isFalse();
        assertThat(Files.readString(configPath)).contains("\"federation\"").contains("\"agents\"");

        Files.writeString(configPath, "{\"routing\":{\"fallback_agent\":\"standby\"}}");
        InitResult kept = service.init(configPath, false);
        assertThat(kept.createdConfig()).isFalse();
        assertThat(service.load(configPath).routing().fallbackAgent()).isEqualTo("standby");

        InitResult overwritten = service.init(configPath, true);
        assertThat(overwritten.overwrittenConfig()).isTrue();
        assertThat(service.load(configPath)).isEqualTo(LoremeshConfig.defaults());
    }

    @Test
    void shouldExpandHomeRelativePaths() {
        String home = System.getProperty("user.home");

        assertThat(ConfigPaths.resolve("~/.loremesh/state/x.json", "fallback.json"))
            .isEqualTo(Path.of(home, ".loremesh", "state", "x.json"));
        assertThat(ConfigPaths.resolve("", "fallback.json"))
            .isEqualTo(Path.of(home, ".loremesh", "state", "fallback.json"));
        assertThat(ConfigPaths.resolve("/var/lib/loremesh/x.json", "fallback.json"))
            .isEqualTo(Path.of("/var/lib/loremesh/x.json"));
    }
}
