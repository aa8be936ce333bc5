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

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cancellable, deadline-bearing context passed to every hook action.
 *
 * <p>A context is done once it is cancelled, its deadline passes, or its parent is done.
 * Children never outlive their parent's deadline. Hook actions that block should poll
 * {@link #isDone()} or wait with {@link #awaitDone(Duration)} and return promptly once done.
 */
public final class HookContext {

    /**
     * Why a context finished.
     */
    public enum DoneReason {
        CANCELLED,
        DEADLINE_EXCEEDED
    }

    private static final ScheduledThreadPoolExecutor DEADLINE_TIMER = createTimer();

    private final HookContext parent;
    private final boolean hasDeadline;
    private final long deadlineNanos;
    private final CompletableFuture<DoneReason> done = new CompletableFuture<>();
    // Live children only; a child removes itself once done.
    private final Set<HookContext> children = ConcurrentHashMap.newKeySet();

    private volatile ScheduledFuture<?> deadlineTimer;

    private HookContext(HookContext parent, boolean hasDeadline, long deadlineNanos) {
        this.parent = parent;
        this.hasDeadline = hasDeadline;
        this.deadlineNanos = deadlineNanos;
    }

    private static ScheduledThreadPoolExecutor createTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "cape-lifecycle-deadline-timer");
            thread.setDaemon(true);
            return thread;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    /**
     * Returns a new root context without a deadline. It is only done once cancelled.
     */
    public static HookContext background() {
        return new HookContext(null, false, 0L);
    }

    /**
     * Derives a child that is done after {@code timeout}, when cancelled, or when this
     * context is done, whichever comes first.
     */
    public HookContext withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        long now = System.nanoTime();
        long candidate = now + Math.max(0L, timeout.toNanos());
        long childDeadline = hasDeadline && deadlineNanos - candidate < 0 ? deadlineNanos : candidate;

        HookContext child = new HookContext(this, true, childDeadline);
        children.add(child);
        DoneReason parentReason = doneReason();
        if (parentReason != null) {
            child.finish(parentReason);
            return child;
        }

        long delay = childDeadline - now;
        if (delay <= 0) {
            child.finish(DoneReason.DEADLINE_EXCEEDED);
        } else {
            child.deadlineTimer = DEADLINE_TIMER.schedule(
                    () -> child.finish(DoneReason.DEADLINE_EXCEEDED), delay, TimeUnit.NANOSECONDS);
            if (child.isDone()) {
                child.deadlineTimer.cancel(false);
            }
        }
        return child;
    }

    /**
     * Cancels this context and every context derived from it. No-op once done.
     */
    public void cancel() {
        finish(DoneReason.CANCELLED);
    }

    public boolean isDone() {
        return done.isDone();
    }

    /**
     * @return the reason this context finished, or null while it is still live
     */
    public DoneReason doneReason() {
        return done.getNow(null);
    }

    public boolean hasDeadline() {
        return hasDeadline;
    }

    /**
     * @return time left until the deadline (zero once passed), empty without a deadline
     */
    public Optional<Duration> remaining() {
        if (!hasDeadline) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime())));
    }

    /**
     * Blocks until this context is done or {@code timeout} elapses.
     *
     * @return true if the context is done
     */
    public boolean awaitDone(Duration timeout) throws InterruptedException {
        try {
            done.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Context completed exceptionally", e.getCause());
        }
    }

    /**
     * Runs {@code callback} once this context is done, immediately if it already is.
     */
    public void onDone(Runnable callback) {
        done.thenRun(callback);
    }

    CompletableFuture<DoneReason> doneFuture() {
        return done;
    }

    int liveChildCount() {
        return children.size();
    }

    private void finish(DoneReason reason) {
        if (!done.complete(reason)) {
            return;
        }
        ScheduledFuture<?> timer = deadlineTimer;
        if (timer != null) {
            timer.cancel(false);
        }
        if (parent != null) {
            parent.children.remove(this);
        }
        for (HookContext child : children) {
            child.finish(reason);
        }
        children.clear();
    }

    @Override
    public String toString() {
        DoneReason reason = doneReason();
        return "HookContext{" + (reason == null ? "live" : reason)
                + remaining().map(r -> ", remaining=" + r.toMillis() + "ms").orElse("") + "}";
    }
}
