package com.permission.engine.config;

import com.permission.engine.core.error.ConfigurationLoadException;
import com.permission.engine.core.model.PermissionConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads the configuration from a JSON file.
 */
public class JsonFileConfigurationSource implements ConfigurationSource {
    private static final Logger log = LoggerFactory.getLogger(JsonFileConfigurationSource.class);

    public static final String DEFAULT_FILE_NAME = ".permissionless.json";

    private final Path path;
    private final JsonConfigurationCodec codec;

    public JsonFileConfigurationSource(Path path) {
        this(path, new JsonConfigurationCodec());
    }

    public JsonFileConfigurationSource(Path path, JsonConfigurationCodec codec) {
        this.path = path;
        this.codec = codec;
    }

    /**
     * Source for {@value #DEFAULT_FILE_NAME} in the working directory.
     */
    public static JsonFileConfigurationSource defaultFile() {
        return new JsonFileConfigurationSource(Path.of(DEFAULT_FILE_NAME));
    }

    @Override
    public PermissionConfiguration load() {
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ConfigurationLoadException(describe(), "Configuration file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationLoadException(describe(), "Failed to read configuration file " + path, e);
        }
        PermissionConfiguration configuration = codec.parse(json);
        log.debug("Loaded {} roles and {} users from {}",
                configuration.getRoles().size(), configuration.getUsers().size(), path);
        return configuration;
    }

    /**
     * Writes a configuration to the file, replacing its content.
     */
    public void save(PermissionConfiguration configuration) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, codec.write(configuration), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationLoadException(describe(), "Failed to write configuration file " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String describe() {
        return "file:" + path;
    }
}
