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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * Opaque identifier of a dispatched execution. Each handle correlates with exactly one
 * eventual {@link ExecutionResult}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public final class ExecutionHandle {

    private final String executionId;

    private ExecutionHandle(String executionId) {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId cannot be null or blank");
        }
        this.executionId = executionId;
    }

    public static ExecutionHandle of(String executionId) {
        return new ExecutionHandle(executionId);
    }

    @JsonValue
    public String getExecutionId() {
        return executionId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionHandle that = (ExecutionHandle) o;
        return executionId.equals(that.executionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId);
    }

    @Override
    public String toString() {
        return "ExecutionHandle{executionId='" + executionId + "'}";
    }
}
