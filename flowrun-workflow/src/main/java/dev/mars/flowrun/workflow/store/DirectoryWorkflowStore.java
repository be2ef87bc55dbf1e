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

package dev.mars.flowrun.workflow.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.core.exceptions.InvalidWorkflowFormatException;
import dev.mars.flowrun.core.exceptions.WorkflowNotFoundException;
import dev.mars.flowrun.storage.WorkflowStore;
import dev.mars.flowrun.workflow.WorkflowDefinitionParser;
import dev.mars.flowrun.workflow.WorkflowDocumentParser;
import dev.mars.flowrun.workflow.WorkflowIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link WorkflowStore} backed by a directory of workflow documents.
 *
 * <p>Layout:</p>
 * <ul>
 *   <li>{@code <dir>/<id>.json}, {@code <dir>/<id>.yaml} or {@code <dir>/<id>.yml}: one workflow per file</li>
 *   <li>{@code <dir>/credentials.json}: array of {@code {"name", "type", "data"}} entries</li>
 * </ul>
 *
 * <p>A stored workflow that carries no id of its own gets the id of its file name.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class DirectoryWorkflowStore implements WorkflowStore {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryWorkflowStore.class);

    static final String CREDENTIALS_FILE = "credentials.json";
    private static final List<String> WORKFLOW_EXTENSIONS = List.of(".json", ".yaml", ".yml");

    private final Path directory;
    private final WorkflowDefinitionParser parser;
    private final ObjectMapper objectMapper;
    private volatile boolean initialized = false;

    public DirectoryWorkflowStore(Path directory) {
        this(directory, new WorkflowDocumentParser(), new ObjectMapper());
    }

    public DirectoryWorkflowStore(Path directory, WorkflowDefinitionParser parser, ObjectMapper objectMapper) {
        this.directory = Objects.requireNonNull(directory, "Storage directory cannot be null");
        this.parser = Objects.requireNonNull(parser, "Workflow parser cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "Object mapper cannot be null");
    }

    @Override
    public void init() throws IOException {
        Files.createDirectories(directory);
        if (!Files.isReadable(directory)) {
            throw new IOException("Storage directory is not readable: " + directory);
        }
        initialized = true;
        logger.debug("Workflow storage ready at {}", directory);
    }

    @Override
    public Optional<WorkflowDefinition> findWorkflowById(String id) throws IOException, InvalidWorkflowFormatException {
        checkInitialized();
        // ids are numeric; anything else could escape the storage directory
        if (!WorkflowIds.isValid(id)) {
            logger.debug("Rejecting lookup of invalid workflow id {}", id);
            return Optional.empty();
        }

        for (String extension : WORKFLOW_EXTENSIONS) {
            Path file = directory.resolve(id.trim() + extension);
            if (Files.isRegularFile(file)) {
                WorkflowDefinition definition;
                try {
                    definition = parser.parse(file);
                } catch (WorkflowNotFoundException e) {
                    logger.debug("Workflow file {} disappeared during lookup", file);
                    return Optional.empty();
                }
                return Optional.of(definition.getId() != null ? definition : withId(definition, id.trim()));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Map<String, Object>> findCredentials(String type, String name) throws IOException {
        checkInitialized();
        Path file = directory.resolve(CREDENTIALS_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }

        List<StoredCredentials> entries = objectMapper.readValue(file.toFile(),
                new TypeReference<List<StoredCredentials>>() {});
        return entries.stream()
                .filter(entry -> Objects.equals(type, entry.type) && Objects.equals(name, entry.name))
                .findFirst()
                .map(entry -> entry.data != null ? entry.data : Map.<String, Object>of());
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Workflow storage has not been initialized");
        }
    }

    private static WorkflowDefinition withId(WorkflowDefinition definition, String id) {
        return new WorkflowDefinition(id, definition.getName(), definition.getNodes(),
                definition.getConnections(), definition.getMetadata());
    }

    static final class StoredCredentials {
        public String name;
        public String type;
        public Map<String, Object> data;
    }
}
