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

import dev.mars.pimflow.core.RoleCatalog;
import dev.mars.pimflow.core.exceptions.InvalidDefinitionException;
import dev.mars.pimflow.core.exceptions.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for WorkflowDefinitionLoader with classpath resources and definition directories.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
class WorkflowDefinitionLoaderTest {

    private static final String TEMPLATE = """
            metadata:
              name: %s
            spec:
              stages:
                - id: review
                  role: Marketing
                  transitions:
                    approve: done
                - id: done
                  kind: terminal
            """;

    @TempDir
    Path tempDir;

    private InMemoryWorkflowDefinitionRegistry registry;
    private WorkflowDefinitionLoader loader;

    @BeforeEach
    void setUp() {
        registry = new InMemoryWorkflowDefinitionRegistry(RoleCatalog.defaults());
        loader = new WorkflowDefinitionLoader(new YamlWorkflowDefinitionParser(), registry);
    }

    @Test
    void testLoadBuiltinResources() throws Exception {
        List<WorkflowDefinition> loaded = loader.loadResources(
                List.of("workflows/import-review.yaml", "workflows/asset-approval.yaml"));

        assertEquals(2, loaded.size());
        assertTrue(registry.contains("import-review"));
        assertTrue(registry.contains("asset-approval"));
    }

    @Test
    void testLoadingSameResourceTwiceIsHarmless() throws Exception {
        loader.loadResource("workflows/import-review.yaml");
        loader.loadResource("workflows/import-review.yaml");

        assertEquals(1, registry.list().size());
    }

    @Test
    void testMissingResource() {
        NotFoundException e = assertThrows(NotFoundException.class,
                () -> loader.loadResource("workflows/does-not-exist.yaml"));
        assertTrue(e.getMessage().contains("does-not-exist"));
    }

    @Test
    void testLoadDirectoryInFileNameOrder() throws Exception {
        Files.writeString(tempDir.resolve("b-second.yml"), String.format(TEMPLATE, "second"));
        Files.writeString(tempDir.resolve("a-first.yaml"), String.format(TEMPLATE, "first"));
        Files.writeString(tempDir.resolve("notes.txt"), "not a workflow");

        List<String> ids = loader.loadDirectory(tempDir).stream()
                .map(WorkflowDefinition::getId)
                .collect(Collectors.toList());

        assertEquals(List.of("first", "second"), ids);
    }

    @Test
    void testMissingDirectoryIsEmpty() throws Exception {
        assertTrue(loader.loadDirectory(tempDir.resolve("absent")).isEmpty());
        assertTrue(loader.loadDirectory(null).isEmpty());
    }

    @Test
    void testBrokenFileReportsFileName() throws Exception {
        Path file = tempDir.resolve("broken.yaml");
        Files.writeString(file, "metadata:\n  name: broken\n");

        InvalidDefinitionException e = assertThrows(InvalidDefinitionException.class, () -> loader.loadFile(file));

        assertEquals("broken.yaml", e.getDefinitionId());
        assertFalse(registry.contains("broken"));
    }

    @Test
    void testGraphErrorsSurfaceAsInvalidDefinition() throws Exception {
        Path file = tempDir.resolve("dangling.yaml");
        Files.writeString(file, String.format(TEMPLATE, "dangling").replace("approve: done", "approve: nowhere"));

        InvalidDefinitionException e = assertThrows(InvalidDefinitionException.class, () -> loader.loadFile(file));

        assertEquals("dangling", e.getDefinitionId());
        assertTrue(e.getProblems().stream().anyMatch(p -> p.contains("nowhere")));
    }
}
