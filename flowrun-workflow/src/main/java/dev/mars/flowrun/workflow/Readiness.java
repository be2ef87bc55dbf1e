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

import dev.mars.flowrun.core.exceptions.InitializationException;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Named readiness point of one initialization operation started by an {@link InitBarrier}.
 *
 * @param <T> the value the operation produces
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public final class Readiness<T> {

    private final String name;
    private final CompletableFuture<T> future;

    Readiness(String name, CompletableFuture<T> future) {
        this.name = Objects.requireNonNull(name, "Readiness name cannot be null");
        this.future = Objects.requireNonNull(future, "Readiness future cannot be null");
    }

    /**
     * Blocks until the operation has resolved.
     *
     * @return the value produced by the operation
     * @throws InitializationException if the operation failed, was cancelled or the wait was interrupted
     */
    public T await() throws InitializationException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new InitializationException(name, e.getCause() != null ? e.getCause() : e);
        } catch (CancellationException e) {
            throw new InitializationException(name, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InitializationException(name, e);
        }
    }

    public String getName() {
        return name;
    }

    public boolean isDone() {
        return future.isDone();
    }

    boolean cancel() {
        return future.cancel(false);
    }

    @Override
    public String toString() {
        return "Readiness{name='" + name + "', done=" + future.isDone() + '}';
    }
}
