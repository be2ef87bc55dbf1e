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

import dev.mars.flowrun.core.CredentialsSnapshot;
import dev.mars.flowrun.core.ExecutionHandle;
import dev.mars.flowrun.core.ExecutionRequest;
import dev.mars.flowrun.core.Node;
import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.credentials.CredentialsResolver;
import dev.mars.flowrun.engine.ExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds the {@link ExecutionRequest} of a run and submits it to the engine. Returns as soon as the
 * engine has accepted the request.
 */
public class ExecutionDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionDispatcher.class);

    private final CredentialsResolver credentialsResolver;
    private final ExecutionEngine engine;

    public ExecutionDispatcher(CredentialsResolver credentialsResolver, ExecutionEngine engine) {
        this.credentialsResolver = Objects.requireNonNull(credentialsResolver, "Credentials resolver cannot be null");
        this.engine = Objects.requireNonNull(engine, "Execution engine cannot be null");
    }

    /**
     * Dispatches the workflow starting at the given node.
     *
     * @param definition the validated workflow
     * @param startNode the entry node found by the {@link StartNodeValidator}
     * @return the handle of the dispatched execution
     * @throws Exception if credentials cannot be resolved or the engine refuses the request
     */
    public ExecutionHandle dispatch(WorkflowDefinition definition, Node startNode) throws Exception {
        CredentialsSnapshot credentials = credentialsResolver.resolve(definition.getNodes());
        ExecutionRequest request = ExecutionRequest.forCli(credentials, startNode, definition);

        ExecutionHandle handle = engine.dispatch(request);
        if (handle == null) {
            throw new IllegalStateException("Execution engine did not return an execution handle");
        }
        logger.debug("Dispatched workflow {} as execution {}", definition.getName(), handle);
        return handle;
    }
}
