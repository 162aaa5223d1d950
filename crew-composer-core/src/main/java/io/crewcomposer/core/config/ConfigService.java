package io.crewcomposer.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.crewcomposer.core.config.model.ComposerConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

public final class ConfigService {
    private final ObjectMapper mapper = new ObjectMapper();

    public ComposerConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return ComposerConfig.defaults();
        }

        JsonNode defaultsNode = mapper.valueToTree(ComposerConfig.defaults());
        String raw = Files.readString(configPath);
        if (raw.isBlank()) {
            return ComposerConfig.defaults();
        }
        JsonNode merged = deepMerge(defaultsNode, mapper.readTree(raw));
        return mapper.treeToValue(merged, ComposerConfig.class);
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null || override.isNull()) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
