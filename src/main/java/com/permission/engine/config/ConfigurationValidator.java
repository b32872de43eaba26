package com.permission.engine.config;

import com.permission.engine.core.error.ConfigurationInvalidException;
import com.permission.engine.core.model.PermissionConfiguration;

/**
 * Checks run before a configuration replaces the engine's current one.
 * Document shape (object roles, array permissions and inherits, string items) is checked
 * by {@link JsonConfigurationCodec} while parsing, and the model records reject null
 * entries. Empty strings are legal permission and role names. Reference integrity of
 * {@code inherits} is not checked here; a missing parent surfaces as {@code RoleNotFound}
 * when the role is resolved.
 */
public final class ConfigurationValidator {

    private ConfigurationValidator() {
    }

    /**
     * @throws ConfigurationInvalidException if there is no configuration
     */
    public static PermissionConfiguration validate(PermissionConfiguration configuration) {
        if (configuration == null) {
            throw new ConfigurationInvalidException("$", "Configuration must not be null");
        }
        return configuration;
    }
}
