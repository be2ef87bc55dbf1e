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

package dev.mars.flowrun.workflow;

import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.core.exceptions.UsageException;
import dev.mars.flowrun.core.exceptions.WorkflowNotFoundException;
import dev.mars.flowrun.storage.WorkflowStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Obtains the workflow definition from exactly one source: a file or a stored id.
 *
 * <p>Both sources set, or none, is a usage error detected before any I/O. A file is read and parsed
 * without waiting for storage. A stored id is looked up only after the storage readiness point has
 * resolved.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class WorkflowSourceResolver {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowSourceResolver.class);

    static final String MISSING_SOURCE_MESSAGE = "Either option \"--id\" or \"--file\" have to be set!";
    static final String CONFLICTING_SOURCE_MESSAGE = "Either \"id\" or \"file\" can be set never both!";

    private final WorkflowDefinitionParser parser;
    private final WorkflowStore store;

    public WorkflowSourceResolver(WorkflowDefinitionParser parser, WorkflowStore store) {
        this.parser = Objects.requireNonNull(parser, "Workflow parser cannot be null");
        this.store = Objects.requireNonNull(store, "Workflow store cannot be null");
    }

    /**
     * Resolves the workflow definition.
     *
     * @param filePath path of a workflow file, or {@code null}
     * @param workflowId stored workflow id, or {@code null}
     * @param storageReady readiness point awaited before a storage lookup
     * @return the resolved workflow
     * @throws UsageException if not exactly one of the sources is given
     * @throws WorkflowNotFoundException if the file or the stored workflow does not exist
     * @throws Exception any failure of parsing, storage or storage initialization
     */
    public ResolvedWorkflow resolve(String filePath, String workflowId, Readiness<?> storageReady) throws Exception {
        boolean hasFile = !isEmpty(filePath);
        boolean hasId = !isEmpty(workflowId);

        if (!hasFile && !hasId) {
            throw new UsageException(MISSING_SOURCE_MESSAGE);
        }
        if (hasFile && hasId) {
            throw new UsageException(CONFLICTING_SOURCE_MESSAGE);
        }

        if (hasFile) {
            logger.debug("Resolving workflow from file {}", filePath);
            WorkflowDefinition definition = parser.parse(Path.of(filePath));
            return new ResolvedWorkflow(definition, WorkflowNotFoundException.SourceKind.FILE, filePath);
        }

        storageReady.await();
        logger.debug("Resolving workflow {} from storage", workflowId);
        Optional<WorkflowDefinition> definition = store.findWorkflowById(workflowId);
        if (definition.isEmpty()) {
            throw WorkflowNotFoundException.forId(workflowId);
        }
        return new ResolvedWorkflow(definition.get(), WorkflowNotFoundException.SourceKind.STORAGE, workflowId);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
