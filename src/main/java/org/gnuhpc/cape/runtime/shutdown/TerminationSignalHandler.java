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

package org.gnuhpc.cape.runtime.shutdown;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns JVM termination (SIGINT, SIGTERM, Ctrl-C) into a broadcast, exactly like
 * {@link Shutdowner#requestShutdown()}.
 *
 * <p>The JVM halts once its shutdown hooks return, so the hook keeps the JVM alive until the
 * running application has finished stopping, bounded by {@code waitTimeout}. A signal can
 * arrive while the application is still starting, so callers pass the start and stop budgets
 * combined.
 */
public class TerminationSignalHandler {

    private static final Logger LOG = LoggerFactory.getLogger(TerminationSignalHandler.class);

    private final ShutdownBroadcaster broadcaster;
    private final Duration waitTimeout;
    private final AtomicBoolean installed = new AtomicBoolean(false);
    private final Thread hookThread;

    private volatile CountDownLatch runFinished;

    public TerminationSignalHandler(ShutdownBroadcaster broadcaster, Duration waitTimeout) {
        this.broadcaster = broadcaster;
        this.waitTimeout = waitTimeout;
        this.hookThread = new Thread(this::onTermination, "cape-shutdown-hook");
    }

    /**
     * Registers the JVM shutdown hook. Idempotent.
     */
    public void install() {
        if (installed.compareAndSet(false, true)) {
            Runtime.getRuntime().addShutdownHook(hookThread);
            LOG.debug("Installed termination signal handler");
        }
    }

    /**
     * Removes the JVM shutdown hook if it is installed and not already running.
     */
    public void uninstall() {
        if (installed.compareAndSet(true, false)) {
            try {
                Runtime.getRuntime().removeShutdownHook(hookThread);
            } catch (IllegalStateException e) {
                LOG.debug("JVM is already shutting down, leaving the termination handler in place");
            }
        }
    }

    public Duration waitTimeout() {
        return waitTimeout;
    }

    public boolean isInstalled() {
        return installed.get();
    }

    /**
     * Marks an application run as in progress; a termination waits for {@link #endRun()}.
     */
    public void beginRun() {
        runFinished = new CountDownLatch(1);
    }

    public void endRun() {
        CountDownLatch latch = runFinished;
        if (latch != null) {
            latch.countDown();
        }
    }

    void onTermination() {
        LOG.info("Received shutdown signal");
        try {
            broadcaster.broadcast(ShutdownSignal.TERMINATE);
        } catch (BroadcastException e) {
            LOG.warn("Termination signal not delivered everywhere: {}", e.getMessage());
        }

        CountDownLatch latch = runFinished;
        if (latch == null) {
            return;
        }
        try {
            if (!latch.await(waitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Application did not stop within {} ms, exiting anyway", waitTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the application to stop");
        }
    }
}
