package work.mdflow.expand.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads template variables from a YAML or JSON mapping. Nested values are passed on as JSON text.
 */
final class VariablesFile {
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private VariablesFile() {}

    static Map<String, String> load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Variables file not found: " + file);
        }
        Map<String, Object> raw;
        try {
            raw = YAML.readValue(file.toFile(), MAP_TYPE);
        } catch (IOException ex) {
            throw new IllegalArgumentException("Invalid variables file " + file + ": " + ex.getMessage(), ex);
        }
        var variables = new LinkedHashMap<String, String>();
        if (raw == null) {
            return variables;
        }
        raw.forEach((key, value) -> variables.put(key, stringify(value)));
        return variables;
    }

    private static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
            try {
                return JSON.writeValueAsString(value);
            } catch (JsonProcessingException ex) {
                throw new IllegalArgumentException("Unable to serialize variable value: " + ex.getOriginalMessage(), ex);
            }
        }
        return String.valueOf(value);
    }
}
