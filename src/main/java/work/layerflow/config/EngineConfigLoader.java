package work.layerflow.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.layerflow.registry.EngineRegistry;
import work.layerflow.spec.CsvDialect;
import work.layerflow.spec.FieldType;
import work.layerflow.spec.FileFlag;
import work.layerflow.spec.FileSpec;
import work.layerflow.spec.SchemaField;
import work.layerflow.spec.TableSchema;
import work.layerflow.task.TaskCatalog;

/**
 * Reads the YAML engine configuration (specs, tasks, workflows) into an {@link EngineRegistry}.
 */
public final class EngineConfigLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_EXTENSION = "csv";

    private final TaskCatalog catalog;

    public EngineConfigLoader(TaskCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public EngineRegistry load(Path path) {
        return loadInto(new EngineRegistry(), path);
    }

    public EngineRegistry loadInto(EngineRegistry registry, Path path) {
        try (var in = Files.newInputStream(path)) {
            return loadInto(registry, in, path.toString());
        } catch (IOException ex) {
            throw new EngineConfigException("Failed to read engine configuration: " + path, ex);
        }
    }

    public EngineRegistry loadInto(EngineRegistry registry, InputStream in, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException ex) {
            throw new EngineConfigException(source + ": invalid YAML: " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new EngineConfigException(source + ": engine configuration must be a mapping");
        }

        for (var specNode : requireArray(root, "specs", source)) {
            registry.registerFileSpec(toSpec(specNode, source));
        }

        for (var taskNode : requireArray(root, "tasks", source)) {
            var name = requireText(taskNode, "task", source);
            try {
                registry.registerTask(catalog.create(name));
            } catch (IllegalArgumentException ex) {
                throw new EngineConfigException(source + ": " + ex.getMessage(), ex);
            }
        }

        var workflows = root.get("workflows");
        if (workflows != null && !workflows.isNull()) {
            if (!workflows.isObject()) {
                throw new EngineConfigException(source + ": workflows must be a mapping of name to codes");
            }
            var fields = workflows.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                if (!entry.getValue().isArray()) {
                    throw new EngineConfigException(source + ": workflow " + entry.getKey() + " must list codes");
                }
                List<Integer> codes = new ArrayList<>();
                for (var codeNode : entry.getValue()) {
                    codes.add(toCode(codeNode, "workflow " + entry.getKey(), source));
                }
                registry.registerWorkflow(entry.getKey(), codes);
            }
        }
        return registry;
    }

    private static FileSpec toSpec(JsonNode node, String source) {
        if (!node.isObject()) {
            throw new EngineConfigException(source + ": spec entry must be a mapping: " + node);
        }
        var codeNode = node.get("code");
        if (codeNode == null) {
            throw new EngineConfigException(source + ": spec entry without code: " + node);
        }
        int code = toCode(codeNode, "spec", source);
        var name = requireText(node, "name", source);
        var extension = node.hasNonNull("extension") ? node.get("extension").asText() : DEFAULT_EXTENSION;

        Set<FileFlag> flags = EnumSet.noneOf(FileFlag.class);
        var flagsNode = node.get("flags");
        if (flagsNode != null && !flagsNode.isNull()) {
            if (!flagsNode.isArray()) {
                throw new EngineConfigException(source + ": flags of spec " + code + " must be a list");
            }
            for (var flag : flagsNode) {
                try {
                    flags.add(FileFlag.from(flag.asText()));
                } catch (IllegalArgumentException ex) {
                    throw new EngineConfigException(source + ": spec " + code + ": " + ex.getMessage(), ex);
                }
            }
        }

        Optional<TableSchema> schema = Optional.empty();
        if (node.has("schema")) {
            schema = Optional.of(new TableSchema(toFields(node.get("schema"), code, source), toDialect(node.get("dialect"), code, source)));
        }
        return new FileSpec(code, name, extension, flags, schema);
    }

    private static List<SchemaField> toFields(JsonNode schemaNode, int code, String source) {
        if (schemaNode == null || !schemaNode.isArray()) {
            throw new EngineConfigException(source + ": schema of spec " + code + " must be a list");
        }
        List<SchemaField> fields = new ArrayList<>();
        for (var item : schemaNode) {
            var fieldName = requireText(item, "name", source);
            try {
                fields.add(new SchemaField(fieldName, FieldType.from(requireText(item, "type", source))));
            } catch (IllegalArgumentException ex) {
                throw new EngineConfigException(source + ": spec " + code + ", field " + fieldName + ": " + ex.getMessage(), ex);
            }
        }
        return fields;
    }

    private static CsvDialect toDialect(JsonNode dialectNode, int code, String source) {
        if (dialectNode == null || dialectNode.isNull()) {
            return CsvDialect.DEFAULT;
        }
        if (!dialectNode.isObject()) {
            throw new EngineConfigException(source + ": dialect of spec " + code + " must be a mapping");
        }
        char delimiter = toChar(dialectNode.get("delimiter"), CsvDialect.DEFAULT.delimiter(), "delimiter", code, source);
        char quote = toChar(dialectNode.get("quotechar"), CsvDialect.DEFAULT.quoteChar(), "quotechar", code, source);
        return new CsvDialect(delimiter, quote);
    }

    private static char toChar(JsonNode node, char fallback, String key, int code, String source) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        var text = node.asText();
        if (text.length() != 1) {
            throw new EngineConfigException(source + ": " + key + " of spec " + code + " must be a single character");
        }
        return text.charAt(0);
    }

    private static int toCode(JsonNode node, String owner, String source) {
        if (node.canConvertToInt() && node.isIntegralNumber()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException ex) {
                throw new EngineConfigException(source + ": " + owner + " has non-numeric code " + node.asText(), ex);
            }
        }
        throw new EngineConfigException(source + ": " + owner + " has invalid code " + node);
    }

    private static Iterable<JsonNode> requireArray(JsonNode root, String key, String source) {
        var node = root.get(key);
        if (node == null || !node.isArray()) {
            throw new EngineConfigException(source + ": '" + key + "' must be a list");
        }
        return node;
    }

    private static String requireText(JsonNode node, String key, String source) {
        var value = node.get(key);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new EngineConfigException(source + ": missing '" + key + "' in " + node);
        }
        return value.asText();
    }
}
