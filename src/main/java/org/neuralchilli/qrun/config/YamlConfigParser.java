package org.neuralchilli.qrun.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.qrun.domain.Task;
import org.neuralchilli.qrun.domain.TaskConfiguration;
import org.neuralchilli.qrun.util.DurationParser;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses a YAML task file into a {@link TaskConfiguration}.
 * <p>
 * Tasks keep the order in which they are declared. Variables are substituted
 * into {@code command}, {@code inputs} and {@code outputs}; nothing else is rewritten.
 */
@ApplicationScoped
public class YamlConfigParser {

    /**
     * Parse configuration content.
     *
     * @param configFile  the file the content came from; its directory anchors relative paths
     * @param environment environment variables exposed as {@code ENV_<NAME>}
     * @throws ConfigException on malformed YAML, wrong field types, or missing required fields
     */
    public TaskConfiguration parse(String yamlContent, Path configFile, Map<String, String> environment) {
        Map<String, Object> root = load(yamlContent);

        Map<String, Object> config = getMap(root, "config", "config");
        Map<String, String> variables = getStringMap(root, "variables");
        Map<String, Object> tasksSection = getMap(root, "tasks", "tasks");

        Path configDirectory = configDirectory(configFile);
        VariableSubstitutor substitutor = VariableSubstitutor.forConfig(configDirectory, variables, environment);

        List<Task> tasks = new ArrayList<>();
        for (Map.Entry<String, Object> entry : tasksSection.entrySet()) {
            tasks.add(parseTask(entry.getKey(), entry.getValue(), substitutor));
        }

        Integer workers = getInteger(config, "workers", "config");
        if (workers != null && workers < 1) {
            throw new ConfigException("config.workers must be at least 1, got: " + workers);
        }

        return new TaskConfiguration(
                configFile,
                tasks,
                getString(config, "default", false, "config"),
                getString(config, "cache_dir", false, "config"),
                workers,
                getDuration(config, "default_timeout", "config")
        );
    }

    private Map<String, Object> load(String yamlContent) {
        Object document;
        try {
            document = new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlContent);
        } catch (YAMLException e) {
            throw new ConfigException("Invalid YAML: " + e.getMessage(), e);
        }

        if (document == null) {
            return Map.of();
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new ConfigException("Configuration must be a YAML mapping");
        }
        return stringKeys(map, "configuration");
    }

    private Task parseTask(String key, Object value, VariableSubstitutor substitutor) {
        String where = "tasks." + key;
        if (!(value instanceof Map<?, ?> raw)) {
            throw new ConfigException(where + " must be a mapping");
        }
        Map<String, Object> data = stringKeys(raw, where);

        String id = getString(data, "id", false, where);
        String command = getString(data, "command", true, where);

        try {
            return Task.builder(id != null ? id : key)
                    .command(substitutor.substitute(command))
                    .dependencies(getStringList(data, "dependencies", where))
                    .aliases(getStringList(data, "aliases", where))
                    .inputs(substitutor.substituteAll(getStringList(data, "inputs", where)))
                    .outputs(substitutor.substituteAll(getStringList(data, "outputs", where)))
                    .autoRemove(getBoolean(data, "auto_remove", false, where))
                    .timeout(getDuration(data, "timeout", where))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ConfigException(where + ": " + e.getMessage(), e);
        }
    }

    private static Path configDirectory(Path configFile) {
        Path parent = configFile.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of("").toAbsolutePath();
    }

    // Helper methods for type-safe extraction

    private Map<String, Object> stringKeys(Map<?, ?> map, String where) {
        Map<String, Object> result = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (k == null) {
                throw new ConfigException(where + " contains a null key");
            }
            result.put(k.toString(), v);
        });
        return result;
    }

    private Map<String, Object> getMap(Map<String, Object> map, String key, String where) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> nested)) {
            throw new ConfigException(where + " must be a mapping");
        }
        return stringKeys(nested, where);
    }

    private String getString(Map<String, Object> map, String key, boolean required, String where) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new ConfigException(where + ": missing required field '" + key + "'");
            }
            return null;
        }
        if (value instanceof Map || value instanceof List) {
            throw new ConfigException(where + "." + key + " must be a string");
        }
        return value.toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue, String where) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new ConfigException(where + "." + key + " must be true or false, got: " + value);
    }

    private Integer getInteger(Map<String, Object> map, String key, String where) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer number) {
            return number;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigException(where + "." + key + " must be an integer, got: " + value, e);
        }
    }

    private Duration getDuration(Map<String, Object> map, String key, String where) {
        try {
            return DurationParser.parse(map.get(key));
        } catch (IllegalArgumentException e) {
            throw new ConfigException(where + "." + key + ": " + e.getMessage(), e);
        }
    }

    private List<String> getStringList(Map<String, Object> map, String key, String where) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream()
                    .map(item -> {
                        if (item == null || item instanceof Map || item instanceof List) {
                            throw new ConfigException(where + "." + key + " must be a list of strings");
                        }
                        return item.toString();
                    })
                    .collect(Collectors.toList());
        }
        if (value instanceof Map) {
            throw new ConfigException(where + "." + key + " must be a list of strings");
        }
        // A single scalar is shorthand for a one-element list
        return List.of(value.toString());
    }

    private Map<String, String> getStringMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> nested)) {
            throw new ConfigException(key + " must be a mapping");
        }
        Map<String, String> result = new HashMap<>();
        nested.forEach((k, v) -> result.put(String.valueOf(k), v != null ? v.toString() : null));
        return result;
    }
}
