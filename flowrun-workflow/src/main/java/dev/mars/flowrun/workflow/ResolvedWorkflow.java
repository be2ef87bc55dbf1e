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
import dev.mars.flowrun.core.exceptions.WorkflowNotFoundException;

import java.util.Objects;

/**
 * A workflow definition together with where it was obtained from.
 */
public final class ResolvedWorkflow {

    private final WorkflowDefinition definition;
    private final WorkflowNotFoundException.SourceKind sourceKind;
    private final String reference;

    public ResolvedWorkflow(WorkflowDefinition definition, WorkflowNotFoundException.SourceKind sourceKind,
                            String reference) {
        this.definition = Objects.requireNonNull(definition, "Workflow definition cannot be null");
        this.sourceKind = Objects.requireNonNull(sourceKind, "Source kind cannot be null");
        this.reference = Objects.requireNonNull(reference, "Reference cannot be null");
    }

    public WorkflowDefinition getDefinition() {
        return definition;
    }

    public WorkflowNotFoundException.SourceKind getSourceKind() {
        return sourceKind;
    }

    /**
     * The file path or stored id the definition was resolved from.
     */
    public String getReference() {
        return reference;
    }

    /**
     * The workflow id: the stored id for storage lookups, otherwise the id found in the file (may be {@code null}).
     */
    public String getWorkflowId() {
        return sourceKind == WorkflowNotFoundException.SourceKind.STORAGE ? reference : definition.getId();
    }

    @Override
    public String toString() {
        return "ResolvedWorkflow{" +
               "sourceKind=" + sourceKind +
               ", reference='" + reference + '\'' +
               ", workflow=" + definition.getName() +
               '}';
    }
}
