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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Error embedded by the engine in an otherwise delivered {@link ExecutionResult}.
 * The stack is kept as the engine rendered it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionError {

    @JsonProperty("message")
    private final String message;

    @JsonProperty("stack")
    private final String stack;

    @JsonProperty("node")
    private final String node;

    public ExecutionError(String message, String stack) {
        this(message, stack, null);
    }

    public ExecutionError(String message, String stack, String node) {
        this.message = Objects.requireNonNull(message, "Error message cannot be null");
        this.stack = stack;
        this.node = node;
    }

    public static ExecutionError fromThrowable(Throwable throwable, String node) {
        StringWriter stack = new StringWriter();
        throwable.printStackTrace(new PrintWriter(stack));
        String message = throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getName();
        return new ExecutionError(message, stack.toString(), node);
    }

    public String getMessage() {
        return message;
    }

    public String getStack() {
        return stack;
    }

    /**
     * Name of the node that failed, if the engine attributed the error to one.
     */
    public String getNode() {
        return node;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionError that = (ExecutionError) o;
        return Objects.equals(message, that.message) &&
               Objects.equals(stack, that.stack) &&
               Objects.equals(node, that.node);
    }

    @Override
    public int hashCode() {
        return Objects.hash(message, stack, node);
    }

    @Override
    public String toString() {
        return "ExecutionError{message='" + message + "', node='" + node + "'}";
    }
}
