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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered hook registry and phase executor.
 *
 * <p>Hooks are started in registration order and stopped in reverse order. Only hooks whose
 * start succeeded (or that have no start action) are stopped, so a stop pass after a partial
 * start unwinds exactly what came up, and a second stop pass does nothing.
 *
 * <p>Hooks are appended while the object graph is built. {@link #start} and {@link #stop} hold a
 * phase lock, so a stop issued while an abandoned start is still inside a hook waits for that
 * start to return before unwinding.
 */
public class LifecycleManager implements Lifecycle {
    private static final Logger LOG = LoggerFactory.getLogger(LifecycleManager.class);

    private final List<Hook> hooks = new ArrayList<>();
    private final ReentrantLock phaseLock = new ReentrantLock();

    // Number of hooks, from the front, whose start succeeded.
    private volatile int numStarted;

    /**
     * Register a hook. Its origin is the calling frame unless the hook already carries one.
     */
    @Override
    public void append(Hook hook) {
        Objects.requireNonNull(hook, "hook");
        Hook registered = hook.getOrigin() != null ? hook : hook.withOrigin(Callers.caller());
        hooks.add(registered);
        LOG.debug("Registered hook: {}", registered.getOrigin());
    }

    /**
     * Run start actions front to back, stopping at the first failure. The walk also ends once
     * {@code ctx} is done, so a start abandoned by its deadline attempts no further hooks.
     *
     * @throws HookFailedException for the failing hook; hooks after it were not attempted
     * @throws PhaseCancelledException if {@code ctx} was done before every hook started
     */
    public void start(HookContext ctx) throws LifecycleException {
        phaseLock.lock();
        try {
            LOG.info("Starting {} hooks...", hooks.size() - numStarted);
            while (numStarted < hooks.size()) {
                if (ctx.isDone()) {
                    LOG.warn("Start context is done ({}), not starting the remaining {} hooks",
                            ctx.doneReason(), hooks.size() - numStarted);
                    throw new PhaseCancelledException(Phase.START, ctx.doneReason());
                }
                Hook hook = hooks.get(numStarted);
                if (hook.hasOnStart()) {
                    LOG.info("START\t\t{}", hook.getOrigin());
                    try {
                        hook.getOnStart().run(ctx);
                    } catch (Exception e) {
                        restoreInterrupt(e);
                        LOG.error("Failed to start hook: {}", hook.getOrigin(), e);
                        throw new HookFailedException(Phase.START, hook.getOrigin(), e);
                    }
                }
                numStarted++;
            }
            LOG.info("All hooks started successfully");
        } finally {
            phaseLock.unlock();
        }
    }

    /**
     * Run stop actions for every started hook, last started first. Failures are collected and
     * the remaining hooks are still stopped.
     *
     * @throws StopException listing every stop action that failed
     */
    public void stop(HookContext ctx) throws StopException {
        phaseLock.lock();
        try {
            if (numStarted == 0) {
                LOG.debug("No started hooks to stop");
                return;
            }
            LOG.info("Stopping {} hooks...", numStarted);

            List<HookFailedException> failures = new ArrayList<>();
            for (; numStarted > 0; numStarted--) {
                Hook hook = hooks.get(numStarted - 1);
                if (!hook.hasOnStop()) {
                    continue;
                }
                LOG.info("STOP\t\t{}", hook.getOrigin());
                try {
                    hook.getOnStop().run(ctx);
                } catch (Exception e) {
                    restoreInterrupt(e);
                    LOG.error("Failed to stop hook: {}", hook.getOrigin(), e);
                    // Continue stopping other hooks
                    failures.add(new HookFailedException(Phase.STOP, hook.getOrigin(), e));
                }
            }

            if (!failures.isEmpty()) {
                throw new StopException(failures);
            }
            LOG.info("All hooks stopped");
        } finally {
            phaseLock.unlock();
        }
    }

    public int size() {
        return hooks.size();
    }

    public int startedCount() {
        return numStarted;
    }

    public List<Hook> hooks() {
        return Collections.unmodifiableList(new ArrayList<>(hooks));
    }

    private static void restoreInterrupt(Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
    }
}
