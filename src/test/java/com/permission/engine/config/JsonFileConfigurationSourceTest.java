package com.permission.engine.config;

import com.permission.engine.core.error.ConfigurationInvalidException;
import com.permission.engine.core.error.ConfigurationLoadException;
import com.permission.engine.core.model.PermissionConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JsonFileConfigurationSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void loadsFile() throws IOException {
        Path file = tempDir.resolve("permissions.json");
        Files.writeString(file, "{\"roles\": {\"viewer\": {\"permissions\": [\"read:articles\"]}}}");

        PermissionConfiguration configuration = new JsonFileConfigurationSource(file).load();

        assertEquals(List.of("viewer"), configuration.roleNames());
    }

    @Test
    void loadsAsynchronously() throws Exception {
        Path file = tempDir.resolve("permissions.json");
        Files.writeString(file, "{\"roles\": {}}");

        PermissionConfiguration configuration = new JsonFileConfigurationSource(file)
                .loadAsync().get(5, TimeUnit.SECONDS);

        assertTrue(configuration.getRoles().isEmpty());
    }

    @Test
    void missingFileIsALoadFailure() {
        JsonFileConfigurationSource source = new JsonFileConfigurationSource(tempDir.resolve("absent.json"));
        ConfigurationLoadException e = assertThrows(ConfigurationLoadException.class, source::load);
        assertTrue(e.getSource().startsWith("file:"));
    }

    @Test
    void malformedFileIsInvalid() throws IOException {
        Path file = tempDir.resolve("permissions.json");
        Files.writeString(file, "{\"roles\": []}");
        assertThrows(ConfigurationInvalidException.class, () -> new JsonFileConfigurationSource(file).load());
    }

    @Test
    void saveThenLoad() {
        Path file = tempDir.resolve("nested").resolve("permissions.json");
        PermissionConfiguration configuration = PermissionConfiguration.builder()
                .role("viewer", List.of("read"))
                .role("editor", List.of("write"), List.of("viewer"))
                .build();
        JsonFileConfigurationSource source = new JsonFileConfigurationSource(file);

        source.save(configuration);

        assertEquals(configuration, source.load());
    }

    @Test
    void defaultFileName() {
        assertEquals(Path.of(".permissionless.json"), JsonFileConfigurationSource.defaultFile().getPath());
    }
}
