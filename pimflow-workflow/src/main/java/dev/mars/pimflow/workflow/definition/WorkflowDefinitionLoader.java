/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.pimflow.workflow.definition;

import dev.mars.pimflow.core.exceptions.InvalidDefinitionException;
import dev.mars.pimflow.core.exceptions.NotFoundException;
import dev.mars.pimflow.core.exceptions.PimflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads workflow definitions from classpath resources and definition directories into a registry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class WorkflowDefinitionLoader {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowDefinitionLoader.class);

    private final WorkflowDefinitionParser parser;
    private final WorkflowDefinitionRegistry registry;
    private final ClassLoader classLoader;

    public WorkflowDefinitionLoader(WorkflowDefinitionParser parser, WorkflowDefinitionRegistry registry) {
        this(parser, registry, WorkflowDefinitionLoader.class.getClassLoader());
    }

    public WorkflowDefinitionLoader(WorkflowDefinitionParser parser, WorkflowDefinitionRegistry registry,
                                    ClassLoader classLoader) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    /**
     * Parses and registers a single classpath resource such as {@code workflows/import-review.yaml}.
     *
     * @throws NotFoundException if the resource does not exist
     * @throws InvalidDefinitionException if the document cannot be parsed or fails graph validation
     */
    public WorkflowDefinition loadResource(String resourceName) throws PimflowException {
        String content;
        try (InputStream input = classLoader.getResourceAsStream(resourceName)) {
            if (input == null) {
                throw new NotFoundException("WorkflowResource", resourceName);
            }
            content = new String(input.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PimflowException("Failed to read workflow resource " + resourceName, e);
        }

        try {
            return registry.register(parser.parseFromString(content));
        } catch (WorkflowParseException e) {
            throw new InvalidDefinitionException(resourceName, e.withSource(resourceName).getMessage());
        }
    }

    public List<WorkflowDefinition> loadResources(List<String> resourceNames) throws PimflowException {
        List<WorkflowDefinition> loaded = new ArrayList<>();
        for (String resourceName : resourceNames) {
            loaded.add(loadResource(resourceName));
        }
        logger.info("Loaded {} built-in workflow definitions", loaded.size());
        return loaded;
    }

    public WorkflowDefinition loadFile(Path file) throws InvalidDefinitionException {
        try {
            return registry.register(parser.parse(file));
        } catch (WorkflowParseException e) {
            throw new InvalidDefinitionException(file.getFileName().toString(), e.getMessage());
        }
    }

    /**
     * Registers every {@code *.yaml} and {@code *.yml} file of a directory, in file name order.
     * A missing directory is logged and treated as empty.
     */
    public List<WorkflowDefinition> loadDirectory(Path directory) throws PimflowException {
        if (directory == null || !Files.isDirectory(directory)) {
            logger.warn("Workflow definitions directory {} does not exist, skipping", directory);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(WorkflowDefinitionLoader::isYamlFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new PimflowException("Failed to list workflow definitions in " + directory, e);
        }

        List<WorkflowDefinition> loaded = new ArrayList<>();
        for (Path file : files) {
            loaded.add(loadFile(file));
            logger.debug("Loaded workflow definition from {}", file);
        }
        logger.info("Loaded {} workflow definitions from {}", loaded.size(), directory);
        return loaded;
    }

    private static boolean isYamlFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
