package io.loremesh.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.loremesh.core.config.model.LoremeshConfig;
import io.loremesh.core.persistence.JsonStateFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the JSON config file on top of {@link LoremeshConfig#defaults()}. Keys present in
 * the file win and arrays are replaced whole. The merged result is checked by
 * {@link ConfigValidator} before it is handed out.
 */
public final class ConfigService {
    private final ObjectMapper mapper = JsonStateFile.mapper();
    private final ConfigValidator validator = new ConfigValidator();

    public LoremeshConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (Files.notExists(configPath)) {
            return LoremeshConfig.defaults();
        }
        ObjectNode tree = mapper.valueToTree(LoremeshConfig.defaults());
        JsonNode fromFile = mapper.readTree(configPath.toFile());
        if (fromFile != null && fromFile.isObject()) {
            overlay(tree, (ObjectNode) fromFile);
        } else if (fromFile != null && !fromFile.isMissingNode()) {
            throw new InvalidConfigException(configPath, List.of("top level must be a JSON object"));
        }
        LoremeshConfig config = mapper.treeToValue(tree, LoremeshConfig.class);
        List<String> problems = validator.problems(config);
        if (!problems.isEmpty()) {
            throw new InvalidConfigException(configPath, problems);
        }
        return config;
    }

    public void save(Path configPath, LoremeshConfig config) throws IOException {
        Objects.requireNonNull(config, "config must not be null");
        new JsonStateFile<>(Objects.requireNonNull(configPath, "configPath must not be null"), LoremeshConfig.class)
            .write(config);
    }

    public InitResult init(Path configPath, boolean overwrite) throws IOException {
        boolean exists = Files.exists(configPath);
        LoremeshConfig config = exists && !overwrite ? load(configPath) : LoremeshConfig.defaults();
        save(configPath, config);
        return new InitResult(configPath, !exists, exists && overwrite);
    }

    // objects merge key by key, anything else from the file replaces the default
    private void overlay(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = propertyName(target, field.getKey());
            JsonNode current = target.get(key);
            if (current instanceof ObjectNode currentObject && field.getValue().isObject()) {
                overlay(currentObject, (ObjectNode) field.getValue());
            } else {
                target.set(key, field.getValue());
            }
        }
    }

    // lets snake_case keys in the file override the camelCase defaults they alias
    private String propertyName(ObjectNode node, String key) {
        if (node.has(key) || key.indexOf('_') < 0) {
            return key;
        }
        StringBuilder camel = new StringBuilder(key.length());
        boolean upper = false;
        for (char c : key.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                camel.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        String candidate = camel.toString();
        return node.has(candidate) ? candidate : key;
    }
}
