package io.cortex.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.cortex.core.config.model.CortexConfig;
import io.cortex.core.storage.StorageOptions;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService();

        CortexConfig config = service.load(tempDir.resolve("config.json"));

        assertThat(config.store().path()).isEqualTo("~/.cortex/memory");
        assertThat(config.store().memoryExtension()).isEqualTo(".md");
        assertThat(config.store().reindexTimeoutSeconds()).isEqualTo(60);
    }

    @Test
    void shouldMergeDefaultsWithExistingValues() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "store": {
                "path": "/var/lib/cortex",
                "indexExtension": "yml"
              },
              "legacy": true
            }
            """);

        CortexConfig config = service.load(configPath);

        assertThat(config.store().path()).isEqualTo("/var/lib/cortex");
        assertThat(config.store().indexExtension()).isEqualTo("yml");
        assertThat(config.store().memoryExtension()).isEqualTo(".md");
        assertThat(config.store().reindexTimeoutSeconds()).isEqualTo(60);
    }

    @Test
    void shouldApplyStorePathFromEnvironment() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve("config.json");

        CortexConfig config = service.load(configPath, Map.of(ConfigPaths.STORE_PATH_ENV, " /data/memory "));

        assertThat(config.store().path()).isEqualTo("/data/memory");
        assertThat(service.load(configPath, Map.of()).store().path()).isEqualTo("~/.cortex/memory");
    }

    @Test
    void initShouldKeepExistingValuesAndCreateStoreDirectory() throws Exception {
        ConfigService service = new ConfigService();
        Path configPath = tempDir.resolve(".cortex/config.json");
        Path store = tempDir.resolve("memory");
        service.save(configPath, CortexConfig.defaults().withStore(CortexConfig.defaults().store().withPath(store.toString())));

        InitResult result = service.init(configPath, false);

        assertThat(result.createdConfig()).isFalse();
        assertThat(result.overwrittenConfig()).isFalse();
        assertThat(result.storePath()).isEqualTo(store);
        assertThat(Files.isDirectory(store)).isTrue();
        assertThat(service.load(configPath).store().path()).isEqualTo(store.toString());
    }

    @Test
    void shouldBuildStorageOptionsFromConfig() {
        ConfigService service = new ConfigService();
        CortexConfig config = CortexConfig.defaults()
            .withStore(CortexConfig.defaults().store().withPath(tempDir.resolve("memory").toString()));

        StorageOptions options = service.storageOptions(config, Clock.systemUTC());

        assertThat(options.root()).isEqualTo(tempDir.resolve("memory").toAbsolutePath().normalize());
        assertThat(options.memoryExtension()).isEqualTo(".md");
        assertThat(options.indexExtension()).isEqualTo(".yaml");
        assertThat(options.reindexTimeout()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void shouldExpandHomeInStorePath() {
        String home = System.getProperty("user.home");

        assertThat(ConfigPaths.resolveStorePath("~/notes")).isEqualTo(Path.of(home, "notes"));
        assertThat(ConfigPaths.resolveStorePath("~")).isEqualTo(Path.of(home));
        assertThat(ConfigPaths.resolveStorePath("/abs/path")).isEqualTo(Path.of("/abs/path"));
    }
}
