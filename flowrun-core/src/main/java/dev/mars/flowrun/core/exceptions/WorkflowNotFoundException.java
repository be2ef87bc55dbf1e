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

package dev.mars.flowrun.core.exceptions;

/**
 * Exception thrown when the requested workflow does not exist, either because the workflow
 * file is missing or because storage holds no workflow with the requested id.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class WorkflowNotFoundException extends FlowrunException {

    public enum SourceKind {
        FILE, STORAGE
    }

    private final SourceKind sourceKind;
    private final String reference;

    private WorkflowNotFoundException(SourceKind sourceKind, String reference, String message, Throwable cause) {
        super(message, cause);
        this.sourceKind = sourceKind;
        this.reference = reference;
    }

    public static WorkflowNotFoundException forFile(String path, Throwable cause) {
        return new WorkflowNotFoundException(SourceKind.FILE, path,
                "The file \"" + path + "\" could not be found.", cause);
    }

    public static WorkflowNotFoundException forId(String id) {
        return new WorkflowNotFoundException(SourceKind.STORAGE, id,
                "The workflow with the id \"" + id + "\" does not exist.", null);
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    /**
     * The file path or workflow id that could not be resolved.
     */
    public String getReference() {
        return reference;
    }
}
