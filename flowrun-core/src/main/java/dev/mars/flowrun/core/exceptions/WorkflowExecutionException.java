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
 * Exception raised from an engine-reported failure. The engine delivered a result, but the
 * result embeds an error; this exception re-raises that error with the engine's original
 * message and stack.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class WorkflowExecutionException extends FlowrunException {

    private final String executionId;
    private final String engineStack;

    public WorkflowExecutionException(String executionId, String message, String engineStack) {
        super(message);
        this.executionId = executionId;
        this.engineStack = engineStack;
    }

    public String getExecutionId() {
        return executionId;
    }

    /**
     * The stack as rendered by the engine, or {@code null} if the engine did not supply one.
     */
    public String getEngineStack() {
        return engineStack;
    }
}
