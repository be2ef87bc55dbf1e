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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable value object representing what the engine delivered for one execution handle.
 *
 * <p>A result is delivered exactly once per {@link ExecutionHandle}. It always arrives as a value,
 * even when the workflow failed: a failure inside the workflow is embedded as an
 * {@link ExecutionError} rather than thrown. Only a failure of the engine itself surfaces as a
 * rejected future.</p>
 *
 * <h3>Key Information Captured:</h3>
 * <ul>
 *   <li><strong>Outcome:</strong> the embedded error, absent on success</li>
 *   <li><strong>Payload:</strong> arbitrary engine data (run data per node, last node executed)</li>
 *   <li><strong>Timing:</strong> start and stop instants of the execution</li>
 * </ul>
 *
 * <p>The class is serialized with Jackson for the structured result dump, so the field names
 * below are part of the log format.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * ExecutionResult result = ExecutionResult.builder()
 *     .executionId("42")
 *     .mode(ExecutionMode.CLI)
 *     .startedAt(start)
 *     .stoppedAt(Instant.now())
 *     .data(Map.of("lastNodeExecuted", "Start"))
 *     .build();
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 * @see ExecutionHandle
 * @see ExecutionError
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"executionId", "mode", "finished", "successful", "startedAt", "stoppedAt", "error", "data"})
public final class ExecutionResult {

    @JsonProperty("executionId")
    private final String executionId;

    @JsonProperty("mode")
    private final ExecutionMode mode;

    /**
     * Whether the engine ran the workflow to its end. A run that stopped at a failing node
     * is not finished.
     */
    @JsonProperty("finished")
    private final boolean finished;

    @JsonProperty("startedAt")
    private final Instant startedAt;

    @JsonProperty("stoppedAt")
    private final Instant stoppedAt;

    @JsonProperty("error")
    private final ExecutionError error;

    @JsonProperty("data")
    private final Map<String, Object> data;

    private ExecutionResult(Builder builder) {
        this.executionId = Objects.requireNonNull(builder.executionId, "Execution ID cannot be null");
        this.mode = Objects.requireNonNull(builder.mode, "Execution mode cannot be null");
        this.finished = builder.finished;
        this.startedAt = builder.startedAt;
        this.stoppedAt = builder.stoppedAt;
        this.error = builder.error;
        this.data = builder.data != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.data))
                : Map.of();
    }

    public String getExecutionId() {
        return executionId;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public boolean isFinished() {
        return finished;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getStoppedAt() {
        return stoppedAt;
    }

    /**
     * Returns the embedded error.
     *
     * @return the error, or {@code null} if the execution succeeded
     */
    public ExecutionError getError() {
        return error;
    }

    public Map<String, Object> getData() {
        return data;
    }

    /**
     * The success indicator: a result is successful exactly when no error is embedded.
     */
    @JsonProperty("successful")
    public boolean isSuccessful() {
        return error == null;
    }

    @JsonIgnore
    public Duration getDuration() {
        if (startedAt != null && stoppedAt != null) {
            return Duration.between(startedAt, stoppedAt);
        }
        return Duration.ZERO;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionResult that = (ExecutionResult) o;
        return finished == that.finished &&
               Objects.equals(executionId, that.executionId) &&
               mode == that.mode &&
               Objects.equals(startedAt, that.startedAt) &&
               Objects.equals(stoppedAt, that.stoppedAt) &&
               Objects.equals(error, that.error) &&
               Objects.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return Objects.hash(executionId, mode, finished, startedAt, stoppedAt, error, data);
    }

    @Override
    public String toString() {
        return "ExecutionResult{" +
               "executionId='" + executionId + '\'' +
               ", mode=" + mode +
               ", finished=" + finished +
               ", successful=" + isSuccessful() +
               ", error=" + error +
               '}';
    }

    /**
     * Builder for ExecutionResult.
     */
    public static class Builder {
        private String executionId;
        private ExecutionMode mode = ExecutionMode.CLI;
        private boolean finished;
        private Instant startedAt;
        private Instant stoppedAt;
        private ExecutionError error;
        private Map<String, Object> data;

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder mode(ExecutionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder finished(boolean finished) {
            this.finished = finished;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder stoppedAt(Instant stoppedAt) {
            this.stoppedAt = stoppedAt;
            return this;
        }

        public Builder error(ExecutionError error) {
            this.error = error;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public ExecutionResult build() {
            return new ExecutionResult(this);
        }
    }
}
