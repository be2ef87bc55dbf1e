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

import dev.mars.flowrun.core.ExecutionHandle;
import dev.mars.flowrun.core.ExecutionResult;
import dev.mars.flowrun.engine.ExecutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Waits for the single result of a dispatched execution. There is no timeout.
 *
 * <p>Each handle can be waited on once. A rejected result future is rethrown as its cause; a
 * {@code null} result is an error of its own.</p>
 */
public class CompletionWaiter {

    private static final Logger logger = LoggerFactory.getLogger(CompletionWaiter.class);

    static final String NO_DATA_MESSAGE = "Workflow did not return any data!";

    private final ExecutionEngine engine;
    private final Set<ExecutionHandle> consumed = ConcurrentHashMap.newKeySet();

    public CompletionWaiter(ExecutionEngine engine) {
        this.engine = Objects.requireNonNull(engine, "Execution engine cannot be null");
    }

    public ExecutionResult await(ExecutionHandle handle) throws Exception {
        Objects.requireNonNull(handle, "Execution handle cannot be null");
        if (!consumed.add(handle)) {
            throw new IllegalStateException("Execution " + handle + " has already been waited on");
        }

        logger.debug("Waiting for execution {}", handle);
        ExecutionResult result;
        try {
            result = engine.awaitResult(handle).get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw new IllegalStateException("Execution " + handle + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }

        if (result == null) {
            throw new IllegalStateException(NO_DATA_MESSAGE);
        }
        return result;
    }
}
