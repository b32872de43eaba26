package com.permission.engine.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.permission.engine.core.error.ConfigurationInvalidException;
import com.permission.engine.core.model.PermissionConfiguration;
import com.permission.engine.core.model.Role;
import com.permission.engine.core.model.UserOverride;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the JSON configuration document:
 *
 * <pre>
 * { "roles": { "&lt;name&gt;": { "permissions": [...], "inherits": [...] } },
 *   "users": { "&lt;id&gt;":   { "permissions": [...], "denies": [...] } } }
 * </pre>
 *
 * <p>{@code roles} is required; {@code users}, {@code inherits}, {@code denies} and the user
 * {@code permissions} are optional. Unknown fields are ignored. Every structural violation
 * raises {@link ConfigurationInvalidException} with the JSON path of the offending node.</p>
 */
public class JsonConfigurationCodec {

    private final ObjectMapper objectMapper;

    public JsonConfigurationCodec() {
        this(new ObjectMapper());
    }

    public JsonConfigurationCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PermissionConfiguration parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationInvalidException("$", "Malformed JSON: " + e.getOriginalMessage(), e);
        }
        return fromTree(root);
    }

    public PermissionConfiguration fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ConfigurationInvalidException("$", "Configuration must be a JSON object");
        }
        JsonNode roles = root.get("roles");
        if (roles == null || !roles.isObject()) {
            throw new ConfigurationInvalidException("roles", "Configuration must contain a 'roles' object");
        }

        PermissionConfiguration.Builder builder = PermissionConfiguration.builder();
        Iterator<Map.Entry<String, JsonNode>> roleFields = roles.fields();
        while (roleFields.hasNext()) {
            Map.Entry<String, JsonNode> field = roleFields.next();
            String path = "roles." + field.getKey();
            JsonNode roleNode = field.getValue();
            if (!roleNode.isObject()) {
                throw new ConfigurationInvalidException(path, "Role '" + field.getKey() + "' must be an object");
            }
            JsonNode permissions = roleNode.get("permissions");
            if (permissions == null) {
                throw new ConfigurationInvalidException(path + ".permissions",
                        "Role '" + field.getKey() + "' must declare a 'permissions' array");
            }
            builder.role(field.getKey(),
                    stringArray(permissions, path + ".permissions"),
                    optionalStringArray(roleNode.get("inherits"), path + ".inherits"));
        }

        JsonNode users = root.get("users");
        if (users != null && !users.isNull()) {
            if (!users.isObject()) {
                throw new ConfigurationInvalidException("users", "'users' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> userFields = users.fields();
            while (userFields.hasNext()) {
                Map.Entry<String, JsonNode> field = userFields.next();
                String path = "users." + field.getKey();
                JsonNode userNode = field.getValue();
                if (!userNode.isObject()) {
                    throw new ConfigurationInvalidException(path, "User '" + field.getKey() + "' must be an object");
                }
                builder.user(field.getKey(),
                        optionalStringArray(userNode.get("permissions"), path + ".permissions"),
                        optionalStringArray(userNode.get("denies"), path + ".denies"));
            }
        }
        return ConfigurationValidator.validate(builder.build());
    }

    /**
     * Serializes a configuration; empty {@code inherits} and override lists are omitted.
     */
    public String write(PermissionConfiguration configuration) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode roles = root.putObject("roles");
        for (Role role : configuration.getRoles().values()) {
            ObjectNode roleNode = roles.putObject(role.name());
            putArray(roleNode, "permissions", role.permissions());
            if (!role.inherits().isEmpty()) {
                putArray(roleNode, "inherits", role.inherits());
            }
        }
        if (!configuration.getUsers().isEmpty()) {
            ObjectNode users = root.putObject("users");
            for (Map.Entry<String, UserOverride> entry : configuration.getUsers().entrySet()) {
                ObjectNode userNode = users.putObject(entry.getKey());
                if (!entry.getValue().permissions().isEmpty()) {
                    putArray(userNode, "permissions", entry.getValue().permissions());
                }
                if (!entry.getValue().denies().isEmpty()) {
                    putArray(userNode, "denies", entry.getValue().denies());
                }
            }
        }
        try {
            return objectMapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize configuration", e);
        }
    }

    private static void putArray(ObjectNode node, String field, List<String> values) {
        ArrayNode array = node.putArray(field);
        values.forEach(array::add);
    }

    private static List<String> optionalStringArray(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        return stringArray(node, path);
    }

    private static List<String> stringArray(JsonNode node, String path) {
        if (!node.isArray()) {
            throw new ConfigurationInvalidException(path, "'" + path + "' must be an array");
        }
        List<String> values = new ArrayList<>(node.size());
        for (int i = 0; i < node.size(); i++) {
            JsonNode item = node.get(i);
            if (!item.isTextual()) {
                throw new ConfigurationInvalidException(path + "[" + i + "]", "'" + path + "' must only contain strings");
            }
            values.add(item.asText());
        }
        return values;
    }
}
