package work.layerflow.config;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * Builds the run context from TOML parameter files and {@code key=value} command-line parameters.
 * Every entry is keyed {@code section.key}; keys outside a section land in {@code default}.
 */
public final class ContextLoader {
    static final String DEFAULT_SECTION = "default";

    private ContextLoader() {}

    public static Map<String, Object> load(List<Path> parameterFiles, List<String> parameters) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (parameterFiles != null) {
            for (Path file : parameterFiles) {
                if (file != null) {
                    readParameterFile(file, context);
                }
            }
        }
        if (parameters != null) {
            for (String parameter : parameters) {
                applyParameter(parameter, context);
            }
        }
        return context;
    }

    static void readParameterFile(Path file, Map<String, Object> context) {
        TomlParseResult result;
        try {
            result = Toml.parse(file);
        } catch (IOException ex) {
            throw new EngineConfigException("Unable to read parameter file " + file, ex);
        }
        if (result.hasErrors()) {
            throw new EngineConfigException("Invalid parameter file " + file + ": " + result.errors().get(0));
        }
        for (String key : result.keySet()) {
            Object value = result.get(List.of(key));
            if (value instanceof TomlTable section) {
                for (String option : section.keySet()) {
                    context.put(key + "." + option.toLowerCase(Locale.ROOT), convertValue(section.get(List.of(option))));
                }
            } else {
                context.put(DEFAULT_SECTION + "." + key.toLowerCase(Locale.ROOT), convertValue(value));
            }
        }
    }

    static void applyParameter(String parameter, Map<String, Object> context) {
        if (parameter == null) {
            return;
        }
        int eq = parameter.indexOf('=');
        if (eq < 0) {
            return;
        }
        String key = parameter.substring(0, eq);
        String value = parameter.substring(eq + 1);
        String section = DEFAULT_SECTION;
        int dot = key.indexOf('.');
        if (dot >= 0) {
            section = key.substring(0, dot);
            key = key.substring(dot + 1);
        }
        context.put(section + "." + key.toLowerCase(Locale.ROOT), value);
    }

    private static Object convertValue(Object value) {
        if (value instanceof TomlArray array) {
            List<Object> list = new ArrayList<>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(convertValue(array.get(i)));
            }
            return list;
        }
        if (value instanceof TomlTable table) {
            Map<String, Object> map = new LinkedHashMap<>();
            for (String key : table.keySet()) {
                map.put(key, convertValue(table.get(List.of(key))));
            }
            return map;
        }
        return value == null ? null : String.valueOf(value);
    }
}
