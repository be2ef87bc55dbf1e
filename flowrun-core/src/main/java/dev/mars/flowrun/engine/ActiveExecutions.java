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

package dev.mars.flowrun.engine;

import dev.mars.flowrun.core.ExecutionRequest;
import dev.mars.flowrun.core.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Table of executions that have been dispatched and whose result has not been handed out yet.
 *
 * <p>Each entry owns the future its result is delivered through. The future can be claimed exactly
 * once through {@link #awaitCompletion(String)}; the entry is dropped when it is both claimed and
 * completed.</p>
 */
public class ActiveExecutions {

    private static final Logger logger = LoggerFactory.getLogger(ActiveExecutions.class);

    private final Map<String, ActiveExecution> executions = new ConcurrentHashMap<>();

    /**
     * Registers a new execution and returns its generated id.
     */
    public String add(ExecutionRequest request) {
        Objects.requireNonNull(request, "Execution request cannot be null");
        String executionId = UUID.randomUUID().toString();
        executions.put(executionId, new ActiveExecution(request, Instant.now()));
        logger.debug("Registered execution {} for workflow {}", executionId, request.getWorkflow().getName());
        return executionId;
    }

    public void complete(String executionId, ExecutionResult result) {
        ActiveExecution execution = executions.get(executionId);
        if (execution == null) {
            logger.warn("Result for unknown execution {} dropped", executionId);
            return;
        }
        execution.future.complete(result);
    }

    public void fail(String executionId, Throwable cause) {
        ActiveExecution execution = executions.get(executionId);
        if (execution == null) {
            logger.warn("Failure of unknown execution {} dropped", executionId, cause);
            return;
        }
        execution.future.completeExceptionally(cause);
    }

    /**
     * Claims the result future of an execution. A second claim for the same id, or a claim for an id
     * that was never registered, yields a failed future.
     */
    public CompletableFuture<ExecutionResult> awaitCompletion(String executionId) {
        ActiveExecution execution = executions.get(executionId);
        if (execution == null) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "The execution id \"" + executionId + "\" could not be found."));
        }
        if (!execution.claimed.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(new IllegalStateException(
                    "The result of execution \"" + executionId + "\" has already been claimed."));
        }
        execution.future.whenComplete((result, error) -> executions.remove(executionId));
        return execution.future;
    }

    public boolean isActive(String executionId) {
        ActiveExecution execution = executions.get(executionId);
        return execution != null && !execution.future.isDone();
    }

    public int size() {
        return executions.size();
    }

    private static final class ActiveExecution {
        private final ExecutionRequest request;
        private final Instant startedAt;
        private final CompletableFuture<ExecutionResult> future = new CompletableFuture<>();
        private final AtomicBoolean claimed = new AtomicBoolean();

        private ActiveExecution(ExecutionRequest request, Instant startedAt) {
            this.request = request;
            this.startedAt = startedAt;
        }

        @Override
        public String toString() {
            return "ActiveExecution{workflow=" + request.getWorkflow().getName() + ", startedAt=" + startedAt + '}';
        }
    }
}
