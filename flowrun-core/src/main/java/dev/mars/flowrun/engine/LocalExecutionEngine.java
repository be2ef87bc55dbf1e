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

import dev.mars.flowrun.core.ExecutionError;
import dev.mars.flowrun.core.ExecutionHandle;
import dev.mars.flowrun.core.ExecutionRequest;
import dev.mars.flowrun.core.ExecutionResult;
import dev.mars.flowrun.core.Node;
import dev.mars.flowrun.core.WorkflowDefinition;
import dev.mars.flowrun.hooks.ExternalHooks;
import dev.mars.flowrun.types.NodeTypeRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process {@link ExecutionEngine} that walks the workflow graph without implementing any node
 * semantics.
 *
 * <p>A run visits the nodes reachable from the start nodes breadth-first, following the
 * connection graph. Disabled nodes are skipped together with everything only reachable through
 * them. For every visited node the engine records one run-data entry. The run stops with an
 * embedded error at the first node whose type is not registered.</p>
 *
 * <p>The {@code workflow.preExecute} hook runs synchronously inside {@link #dispatch}, so a failing
 * hook prevents the execution. The {@code workflow.postExecute} hook runs on the worker after the
 * walk; if it fails the result future is completed exceptionally.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class LocalExecutionEngine implements ExecutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(LocalExecutionEngine.class);

    private final NodeTypeRegistry nodeTypes;
    private final ExternalHooks hooks;
    private final ActiveExecutions activeExecutions;
    private final ExecutorService executorService;
    private volatile boolean shutdown = false;

    public LocalExecutionEngine(NodeTypeRegistry nodeTypes, ExternalHooks hooks, int threads) {
        this(nodeTypes, hooks, new ActiveExecutions(), threads);
    }

    public LocalExecutionEngine(NodeTypeRegistry nodeTypes, ExternalHooks hooks,
                                ActiveExecutions activeExecutions, int threads) {
        this.nodeTypes = Objects.requireNonNull(nodeTypes, "Node type registry cannot be null");
        this.hooks = Objects.requireNonNull(hooks, "External hooks cannot be null");
        this.activeExecutions = Objects.requireNonNull(activeExecutions, "Active executions cannot be null");
        if (threads <= 0) {
            throw new IllegalArgumentException("Engine threads must be positive: " + threads);
        }
        this.executorService = Executors.newFixedThreadPool(threads, new EngineThreadFactory());
    }

    @Override
    public ExecutionHandle dispatch(ExecutionRequest request) throws Exception {
        Objects.requireNonNull(request, "Execution request cannot be null");
        if (shutdown) {
            throw new IllegalStateException("Execution engine is shutdown");
        }

        hooks.run(ExternalHooks.WORKFLOW_PRE_EXECUTE, request.getWorkflow(), request.getExecutionMode());

        String executionId = activeExecutions.add(request);
        try {
            executorService.execute(() -> runExecution(executionId, request));
        } catch (RejectedExecutionException e) {
            activeExecutions.fail(executionId, e);
            throw new IllegalStateException("Execution engine rejected execution " + executionId, e);
        }

        logger.info("Dispatched execution {} of workflow {} starting at {}",
                executionId, request.getWorkflow().getName(), request.getStartNodes());
        return ExecutionHandle.of(executionId);
    }

    @Override
    public CompletableFuture<ExecutionResult> awaitResult(ExecutionHandle handle) {
        Objects.requireNonNull(handle, "Execution handle cannot be null");
        return activeExecutions.awaitCompletion(handle.getExecutionId());
    }

    @Override
    public void shutdown() {
        shutdown = true;
        executorService.shutdown();
        logger.debug("LocalExecutionEngine shutdown initiated");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private void runExecution(String executionId, ExecutionRequest request) {
        try {
            ExecutionResult result = walk(executionId, request);
            hooks.run(ExternalHooks.WORKFLOW_POST_EXECUTE, result, request.getWorkflow());
            activeExecutions.complete(executionId, result);
            logger.debug("Execution {} finished, successful={}", executionId, result.isSuccessful());
        } catch (Exception e) {
            logger.error("Execution {} failed: {}", executionId, e.getMessage());
            activeExecutions.fail(executionId, e);
        }
    }

    private ExecutionResult walk(String executionId, ExecutionRequest request) {
        WorkflowDefinition workflow = request.getWorkflow();
        Instant startedAt = Instant.now();

        Map<String, Object> runData = new LinkedHashMap<>();
        Deque<String> queue = new ArrayDeque<>(request.getStartNodes());
        Set<String> visited = new HashSet<>();
        String lastNodeExecuted = null;
        ExecutionError error = null;

        while (!queue.isEmpty()) {
            String nodeName = queue.poll();
            if (!visited.add(nodeName)) {
                continue;
            }

            Optional<Node> node = workflow.getNode(nodeName);
            if (node.isEmpty()) {
                error = ExecutionError.fromThrowable(new IllegalStateException(
                        "Node \"" + nodeName + "\" does not exist in the workflow."), nodeName);
                break;
            }
            if (node.get().isDisabled()) {
                logger.debug("Skipping disabled node {}", nodeName);
                continue;
            }
            if (!nodeTypes.isKnown(node.get().getType())) {
                error = ExecutionError.fromThrowable(new IllegalStateException(
                        "Node type \"" + node.get().getType() + "\" is not known."), nodeName);
                break;
            }

            runData.put(nodeName, List.of(runEntry(node.get())));
            lastNodeExecuted = nodeName;
            queue.addAll(workflow.getChildNodes(nodeName));
        }

        Map<String, Object> resultData = new LinkedHashMap<>();
        resultData.put("runData", runData);
        if (lastNodeExecuted != null) {
            resultData.put("lastNodeExecuted", lastNodeExecuted);
        }

        return ExecutionResult.builder()
                .executionId(executionId)
                .mode(request.getExecutionMode())
                .finished(error == null)
                .startedAt(startedAt)
                .stoppedAt(Instant.now())
                .error(error)
                .data(Map.of("resultData", resultData))
                .build();
    }

    private static Map<String, Object> runEntry(Node node) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("startTime", System.currentTimeMillis());
        entry.put("type", node.getType());
        List<Object> items = new ArrayList<>();
        items.add(node.getParameters());
        entry.put("data", items);
        return entry;
    }

    private static final class EngineThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "flowrun-engine-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
