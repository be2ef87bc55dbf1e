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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Starts independent initialization operations eagerly and hands out a {@link Readiness} point for
 * each of them. Nothing blocks until a readiness point is awaited.
 *
 * <p>The barrier owns its worker pool. Closing it cancels the operations that have not finished
 * yet and stops the pool.</p>
 *
 * <h3>Usage Example:</h3>
 * <pre>{@code
 * try (InitBarrier barrier = new InitBarrier(4)) {
 *     Readiness<Void> storage = barrier.start("storage", () -> { store.init(); return null; });
 *     // ... work that does not need storage ...
 *     storage.await();
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-16
 */
public class InitBarrier implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(InitBarrier.class);

    private final ExecutorService executorService;
    private final List<Readiness<?>> started = new CopyOnWriteArrayList<>();
    private volatile boolean closed = false;

    public InitBarrier(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Init threads must be positive: " + threads);
        }
        this.executorService = Executors.newFixedThreadPool(threads, new InitThreadFactory());
    }

    /**
     * Starts an initialization operation.
     *
     * @param name the readiness point name, used in failure messages
     * @param task the operation
     * @return the readiness point to await later
     */
    public <T> Readiness<T> start(String name, Callable<T> task) {
        Objects.requireNonNull(task, "Initialization task cannot be null");
        if (closed) {
            throw new IllegalStateException("Init barrier is closed");
        }

        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            logger.debug("Initializing {}", name);
            try {
                T value = task.call();
                logger.debug("{} ready", name);
                return value;
            } catch (Exception e) {
                logger.debug("Initialization of {} failed: {}", name, e.getMessage());
                throw new CompletionException(e);
            }
        }, executorService);

        Readiness<T> readiness = new Readiness<>(name, future);
        started.add(readiness);
        return readiness;
    }

    @Override
    public void close() {
        closed = true;
        for (Readiness<?> readiness : started) {
            if (!readiness.isDone() && readiness.cancel()) {
                logger.debug("Cancelled initialization of {}", readiness.getName());
            }
        }
        executorService.shutdownNow();
    }

    private static final class InitThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "flowrun-init-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
