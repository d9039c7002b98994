package com.tactics.config;

import com.tactics.exception.ConfigurationException;
import com.tactics.model.Scenario;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Loads all available scenarios at startup.
 * <p>
 * Scenarios are loaded from two locations (in order):
 * <ol>
 *   <li>Classpath: {@code classpath:scenarios/*.json} – built-in scenarios</li>
 *   <li>External folder: {@code ./scenarios/} next to the running jar – custom scenarios</li>
 * </ol>
 * If a custom scenario has the same {@code id} as a built-in one, the custom one wins.
 * A file that fails to parse or validate aborts loading with a {@link ConfigurationException}.
 */
@Component
@Slf4j
public class ScenarioLoader {

    private final ObjectMapper objectMapper;
    private final ScenarioAssembler assembler;
    private final Path externalDir;

    /** All loaded scenarios keyed by their id. */
    @Getter
    private final Map<String, Scenario> scenarios = new LinkedHashMap<>();

    @Autowired
    public ScenarioLoader(ObjectMapper objectMapper, ScenarioAssembler assembler) {
        this(objectMapper, assembler, Paths.get("scenarios"));
    }

    ScenarioLoader(ObjectMapper objectMapper, ScenarioAssembler assembler, Path externalDir) {
        this.objectMapper = objectMapper;
        this.assembler = assembler;
        this.externalDir = externalDir;
    }

    @PostConstruct
    public void loadScenarios() {
        loadClasspathScenarios();
        loadExternalScenarios();

        if (scenarios.isEmpty()) {
            log.warn("No scenario definitions found! Episodes can only be started from explicit definitions.");
        } else {
            log.info("Loaded {} scenario(s): {}", scenarios.size(), scenarios.keySet());
        }
    }

    public List<Scenario> getAvailableScenarios() {
        return List.copyOf(scenarios.values());
    }

    /**
     * Get a specific scenario by its id.
     *
     * @throws ConfigurationException if the id is unknown
     */
    public Scenario getScenario(String scenarioId) {
        Scenario scenario = scenarios.get(scenarioId);
        if (scenario == null) {
            throw new ConfigurationException("Unknown scenario: " + scenarioId
                    + ". Available scenarios: " + scenarios.keySet());
        }
        return scenario;
    }

    /**
     * Parse and validate a scenario JSON document without registering it.
     */
    public Scenario parse(String json) {
        try {
            return assembler.assemble(objectMapper.readValue(json, ScenarioDefinition.class));
        } catch (JacksonException e) {
            throw new ConfigurationException("Malformed scenario JSON: " + e.getMessage(), e);
        }
    }

    // ── classpath scenarios ─────────────────────────────────────────────

    private void loadClasspathScenarios() {
        try {
            var resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources("classpath:scenarios/*.json");

            for (Resource resource : resources) {
                try (InputStream is = resource.getInputStream()) {
                    Scenario scenario = assembler.assemble(objectMapper.readValue(is, ScenarioDefinition.class));
                    scenarios.put(scenario.id(), scenario);
                    log.info("Loaded built-in scenario '{}' ({}) from classpath", scenario.name(), scenario.id());
                } catch (JacksonException | ConfigurationException e) {
                    log.error("Failed to load classpath scenario: {}", resource.getFilename());
                    throw new ConfigurationException("Invalid scenario file " + resource.getFilename()
                            + ": " + e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Could not read classpath scenarios", e);
        }
    }

    // ── external scenarios (./scenarios/ folder) ────────────────────────

    private void loadExternalScenarios() {
        if (!Files.isDirectory(externalDir)) {
            log.debug("No external scenarios directory found at '{}'", externalDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> files = Files.list(externalDir)) {
            files.filter(p -> p.toString().endsWith(".json"))
                 .sorted()
                 .forEach(this::loadExternalScenarioFile);
        } catch (IOException e) {
            throw new ConfigurationException("Could not read external scenarios directory " + externalDir, e);
        }
    }

    private void loadExternalScenarioFile(Path path) {
        try {
            Scenario scenario = assembler.assemble(objectMapper.readValue(path.toFile(), ScenarioDefinition.class));
            scenarios.put(scenario.id(), scenario);
            log.info("Loaded custom scenario '{}' ({}) from {}", scenario.name(), scenario.id(), path);
        } catch (JacksonException | ConfigurationException e) {
            log.error("Failed to load custom scenario: {}", path);
            throw new ConfigurationException("Invalid scenario file " + path + ": " + e.getMessage(), e);
        }
    }
}
