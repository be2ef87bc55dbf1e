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

package dev.mars.flowrun.core;

import java.util.List;
import java.util.Objects;

/**
 * Immutable request handed to the {@code ExecutionEngine}. Built once per run and never
 * changed afterwards.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public final class ExecutionRequest {

    private final CredentialsSnapshot credentials;
    private final ExecutionMode executionMode;
    private final List<String> startNodes;
    private final WorkflowDefinition workflow;

    public ExecutionRequest(CredentialsSnapshot credentials, ExecutionMode executionMode,
                            List<String> startNodes, WorkflowDefinition workflow) {
        this.credentials = Objects.requireNonNull(credentials, "Credentials cannot be null");
        this.executionMode = Objects.requireNonNull(executionMode, "Execution mode cannot be null");
        this.startNodes = List.copyOf(Objects.requireNonNull(startNodes, "Start nodes cannot be null"));
        this.workflow = Objects.requireNonNull(workflow, "Workflow cannot be null");
        if (this.startNodes.isEmpty()) {
            throw new IllegalArgumentException("At least one start node is required");
        }
    }

    /**
     * Creates the request for a headless run: mode {@link ExecutionMode#CLI} and the entry node
     * as the only start node.
     */
    public static ExecutionRequest forCli(CredentialsSnapshot credentials, Node startNode, WorkflowDefinition workflow) {
        Objects.requireNonNull(startNode, "Start node cannot be null");
        return new ExecutionRequest(credentials, ExecutionMode.CLI, List.of(startNode.getName()), workflow);
    }

    public CredentialsSnapshot getCredentials() {
        return credentials;
    }

    public ExecutionMode getExecutionMode() {
        return executionMode;
    }

    public List<String> getStartNodes() {
        return startNodes;
    }

    public WorkflowDefinition getWorkflow() {
        return workflow;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionRequest that = (ExecutionRequest) o;
        return Objects.equals(credentials, that.credentials) &&
               executionMode == that.executionMode &&
               Objects.equals(startNodes, that.startNodes) &&
               Objects.equals(workflow, that.workflow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(credentials, executionMode, startNodes, workflow);
    }

    @Override
    public String toString() {
        return "ExecutionRequest{" +
               "executionMode=" + executionMode +
               ", startNodes=" + startNodes +
               ", workflow=" + workflow +
               ", credentials=" + credentials +
               '}';
    }
}
