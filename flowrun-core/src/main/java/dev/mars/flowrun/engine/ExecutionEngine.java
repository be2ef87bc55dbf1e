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

import dev.mars.flowrun.core.ExecutionHandle;
import dev.mars.flowrun.core.ExecutionRequest;
import dev.mars.flowrun.core.ExecutionResult;

import java.util.concurrent.CompletableFuture;

/**
 * Engine that runs dispatched workflow executions.
 *
 * <p>{@link #dispatch(ExecutionRequest)} returns as soon as the execution is registered. The result
 * is obtained separately through {@link #awaitResult(ExecutionHandle)}, which may be called at most
 * once per handle. Failures inside the workflow are embedded in the delivered
 * {@link ExecutionResult}; a failure of the engine itself completes the future exceptionally.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public interface ExecutionEngine {

    /**
     * Submits an execution.
     *
     * @param request the execution request
     * @return the handle correlating with the eventual result
     * @throws Exception if the execution could not be started
     */
    ExecutionHandle dispatch(ExecutionRequest request) throws Exception;

    /**
     * Returns the future completed with the result of the given execution.
     *
     * @param handle a handle previously returned by {@link #dispatch(ExecutionRequest)}
     * @return the result future
     */
    CompletableFuture<ExecutionResult> awaitResult(ExecutionHandle handle);

    /**
     * Releases engine resources. Executions still running are not interrupted.
     */
    void shutdown();
}
