/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gnuhpc.cape.runtime.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Races a phase against a deadline.
 *
 * <p>The phase body runs on a daemon worker thread while the caller waits for either the body
 * or the derived context to finish. When the context wins the caller gets a
 * {@link PhaseTimeoutException} (or {@link PhaseCancelledException}) and the body is abandoned,
 * not interrupted: it keeps running until its hook actions return.
 */
public final class Deadlines {

    private static final Logger LOG = LoggerFactory.getLogger(Deadlines.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ExecutorService PHASE_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "cape-lifecycle-phase-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    /**
     * Body of a phase, typically {@code lifecycleManager::start} or {@code lifecycleManager::stop}.
     */
    @FunctionalInterface
    public interface PhaseBody {
        void run(HookContext ctx) throws LifecycleException;
    }

    private Deadlines() {
    }

    public static void withDeadline(HookContext ctx, Duration timeout, Phase phase, PhaseBody body)
            throws LifecycleException {
        HookContext child = ctx.withTimeout(timeout);
        CompletableFuture<Void> completion = new CompletableFuture<>();

        PHASE_EXECUTOR.execute(() -> {
            try {
                body.run(child);
                completion.complete(null);
            } catch (Throwable t) {
                completion.completeExceptionally(t);
            }
        });

        try {
            awaitEither(completion, child.doneFuture());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            child.cancel();
            throw new PhaseCancelledException(phase);
        }

        if (completion.isDone()) {
            try {
                completion.join();
                return;
            } catch (CompletionException e) {
                throw rethrow(e.getCause());
            } finally {
                child.cancel();
            }
        }

        if (child.doneReason() == HookContext.DoneReason.DEADLINE_EXCEEDED) {
            LOG.warn("The {} phase did not finish within {} ms, abandoning it", phase, timeout.toMillis());
            throw new PhaseTimeoutException(phase, timeout);
        }
        LOG.warn("The {} phase was cancelled before it finished", phase);
        throw new PhaseCancelledException(phase);
    }

    private static void awaitEither(CompletableFuture<?> first, CompletableFuture<?> second)
            throws InterruptedException {
        CountDownLatch settled = new CountDownLatch(1);
        first.whenComplete((value, error) -> settled.countDown());
        second.whenComplete((value, error) -> settled.countDown());
        settled.await();
    }

    private static LifecycleException rethrow(Throwable failure) {
        if (failure instanceof LifecycleException) {
            return (LifecycleException) failure;
        }
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        return new LifecycleException("Phase failed: " + failure, failure);
    }
}
