package org.neuralchilli.qrun.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.qrun.core.TaskGraphService;
import org.neuralchilli.qrun.domain.TaskConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads a task file from disk, parses it and validates the resulting graph.
 */
@ApplicationScoped
public class TaskConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(TaskConfigLoader.class);

    @Inject
    YamlConfigParser yamlParser;

    @Inject
    TaskGraphService graphService;

    public TaskConfigLoader() {
    }

    public TaskConfigLoader(YamlConfigParser yamlParser, TaskGraphService graphService) {
        this.yamlParser = yamlParser;
        this.graphService = graphService;
    }

    /**
     * Load with the process environment.
     *
     * @throws ConfigException if the file cannot be read or parsed
     * @throws org.neuralchilli.qrun.core.DependencyException if the task graph is invalid
     */
    public TaskConfiguration load(Path configFile) {
        return load(configFile, System.getenv());
    }

    public TaskConfiguration load(Path configFile, Map<String, String> environment) {
        log.debug("Loading task configuration from: {}", configFile);

        String content;
        try {
            content = Files.readString(configFile, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ConfigException("Configuration file not found: " + configFile, e);
        } catch (IOException e) {
            throw new ConfigException("Failed to read configuration file " + configFile + ": " + e.getMessage(), e);
        }

        TaskConfiguration configuration = yamlParser.parse(content, configFile, environment);
        graphService.validate(configuration.tasks());

        log.debug("Loaded {} task(s) from {}", configuration.tasks().size(), configFile);
        return configuration;
    }
}
