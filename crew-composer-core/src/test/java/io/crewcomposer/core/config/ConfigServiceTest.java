package io.crewcomposer.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.crewcomposer.core.config.model.ComposerConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    private final ConfigService configService = new ConfigService();

    @Test
    void shouldReturnDefaultsWhenConfigIsMissing() throws Exception {
        ComposerConfig config = configService.load(tempDir.resolve("config/crew-composer.json"));

        assertThat(config).isEqualTo(ComposerConfig.defaults());
        assertThat(config.scheduler().storePath()).isEqualTo("db/schedules.json");
        assertThat(config.scheduler().pollSeconds()).isEqualTo(5);
        assertThat(config.scheduler().misfireGraceSeconds()).isEqualTo(60);
        assertThat(config.scheduler().zone()).isEqualTo(ZoneId.systemDefault());
    }

    @Test
    void shouldMergePartialConfigWithDefaults() throws Exception {
        Path configPath = tempDir.resolve("config/crew-composer.json");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, """
            {
              "scheduler": {
                "pollSeconds": 10,
                "timezone": "Europe/Berlin"
              },
              "execution": {
                "command": ["python", "-m", "crew_composer", "{job}"]
              },
              "ui": {"port": 8501}
            }
            """);

        ComposerConfig config = configService.load(configPath);

        assertThat(config.scheduler().pollSeconds()).isEqualTo(10);
        assertThat(config.scheduler().storePath()).isEqualTo("db/schedules.json");
        assertThat(config.scheduler().workerThreads()).isEqualTo(4);
        assertThat(config.scheduler().zone()).isEqualTo(ZoneId.of("Europe/Berlin"));
        assertThat(config.execution().command()).containsExactly("python", "-m", "crew_composer", "{job}");
        assertThat(config.execution().timeoutSeconds()).isEqualTo(3600);
    }

    @Test
    void shouldRejectNonPositiveSchedulerSettings() throws Exception {
        Path configPath = tempDir.resolve("config/crew-composer.json");
        Files.createDirectories(configPath.getParent());
        Files.writeString(configPath, "{\"scheduler\": {\"misfireGraceSeconds\": 0}}");

        assertThatThrownBy(() -> configService.load(configPath))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("misfireGraceSeconds must be positive");

        Files.writeString(configPath, "{\"scheduler\": {\"pollSeconds\": -1}}");

        assertThatThrownBy(() -> configService.load(configPath))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("pollSeconds must be positive");
    }

    @Test
    void shouldResolveProjectRootFromEnvironment() {
        Path root = ConfigPaths.resolveProjectRoot(Map.of(ConfigPaths.ROOT_ENV, tempDir.toString()));

        assertThat(root).isEqualTo(tempDir.toAbsolutePath().normalize());
        assertThat(ConfigPaths.resolveProjectRoot(Map.of()))
            .isEqualTo(Path.of(System.getProperty("user.dir")).toAbsolutePath().normalize());
    }

    @Test
    void shouldResolveRelativePathsAgainstProjectRoot() {
        Path absolute = tempDir.resolve("elsewhere/schedules.json");

        assertThat(ConfigPaths.configPath(tempDir)).isEqualTo(tempDir.resolve("config/crew-composer.json"));
        assertThat(ConfigPaths.resolve(tempDir, "db/schedules.json")).isEqualTo(tempDir.resolve("db/schedules.json"));
        assertThat(ConfigPaths.resolve(tempDir, absolute.toString())).isEqualTo(absolute);
    }
}
