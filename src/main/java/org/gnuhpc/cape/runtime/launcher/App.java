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

package org.gnuhpc.cape.runtime.launcher;

import org.gnuhpc.cape.runtime.common.configuration.LifecycleConfig;
import org.gnuhpc.cape.runtime.container.ConstructionException;
import org.gnuhpc.cape.runtime.container.Container;
import org.gnuhpc.cape.runtime.container.DefaultContainer;
import org.gnuhpc.cape.runtime.container.DotGraph;
import org.gnuhpc.cape.runtime.container.Invocation;
import org.gnuhpc.cape.runtime.container.Key;
import org.gnuhpc.cape.runtime.container.ObjectGraph;
import org.gnuhpc.cape.runtime.container.Provider;
import org.gnuhpc.cape.runtime.lifecycle.Callers;
import org.gnuhpc.cape.runtime.lifecycle.Deadlines;
import org.gnuhpc.cape.runtime.lifecycle.HookContext;
import org.gnuhpc.cape.runtime.lifecycle.Lifecycle;
import org.gnuhpc.cape.runtime.lifecycle.LifecycleException;
import org.gnuhpc.cape.runtime.lifecycle.LifecycleManager;
import org.gnuhpc.cape.runtime.lifecycle.Phase;
import org.gnuhpc.cape.runtime.lifecycle.PhaseCancelledException;
import org.gnuhpc.cape.runtime.lifecycle.RollbackFailedException;
import org.gnuhpc.cape.runtime.shutdown.ShutdownBroadcaster;
import org.gnuhpc.cape.runtime.shutdown.ShutdownListener;
import org.gnuhpc.cape.runtime.shutdown.ShutdownSignal;
import org.gnuhpc.cape.runtime.shutdown.Shutdowner;
import org.gnuhpc.cape.runtime.shutdown.TerminationSignalHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A modular application: components are provided to a container, invocations pull them in and
 * append lifecycle hooks, and the app drives those hooks through start, run and stop.
 *
 * <pre>{@code
 * App app = App.builder()
 *         .provide(Server.class, r -> {
 *             Server server = new Server();
 *             r.get(Lifecycle.class).append(Hook.of(server::start, server::stop));
 *             return server;
 *         })
 *         .invoke(r -> r.get(Server.class))
 *         .build();
 * app.run();
 * }</pre>
 *
 * <p>If building the object graph fails, the first error is kept and every later
 * {@link #start} or {@link #stop} rethrows it without touching any hook.
 */
public final class App {

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    private static final String RUNTIME_ORIGIN = "cape-runtime";

    private final LifecycleManager lifecycle = new LifecycleManager();
    private final ShutdownBroadcaster broadcaster = new ShutdownBroadcaster();
    private final Container container;
    private final List<ErrorHandler> errorHandlers;
    private final Duration startTimeout;
    private final Duration stopTimeout;
    private final boolean handleSignals;
    private final TerminationSignalHandler signalHandler;

    private volatile ConstructionException constructionError;
    private volatile ObjectGraph graph;

    private App(Builder builder) {
        this.container = builder.container != null ? builder.container : new DefaultContainer();
        this.errorHandlers = Collections.unmodifiableList(new ArrayList<>(builder.errorHandlers));
        this.startTimeout = builder.startTimeout;
        this.stopTimeout = builder.stopTimeout;
        this.handleSignals = builder.handleSignals;
        // A signal may land while run() is still starting, so the JVM waits out both phases.
        this.signalHandler = new TerminationSignalHandler(broadcaster, startTimeout.plus(stopTimeout));
        initialize(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A reusable piece of builder configuration, letting a component ship its provides,
     * invokes, timeouts and error handlers as one unit.
     *
     * <pre>{@code
     * App.Option httpModule = App.options(
     *         b -> b.provide(HttpServer.class, r -> new HttpServer(r.get(Config.class))),
     *         b -> b.invoke(r -> r.get(HttpServer.class)));
     * App app = App.builder().apply(httpModule).build();
     * }</pre>
     */
    @FunctionalInterface
    public interface Option {
        void applyTo(Builder builder);
    }

    /**
     * Groups {@code options} into one, applied in the given order. Groups may be nested.
     */
    public static Option options(Option... options) {
        List<Option> bundle = new ArrayList<>(options.length);
        for (Option option : options) {
            bundle.add(Objects.requireNonNull(option, "option"));
        }
        return builder -> {
            for (Option option : bundle) {
                option.applyTo(builder);
            }
        };
    }

    private void initialize(Builder builder) {
        try {
            if (!builder.optionErrors.isEmpty()) {
                throw combine(builder.optionErrors);
            }
            for (Provision<?> provision : builder.provisions) {
                provision.applyTo(container);
            }
            container.provide(Key.of(Lifecycle.class), r -> lifecycle, RUNTIME_ORIGIN);
            container.provide(Key.of(Shutdowner.class), r -> broadcaster, RUNTIME_ORIGIN);
            container.provide(Key.of(DotGraph.class), r -> new DotGraph(container.visualize()), RUNTIME_ORIGIN);
            for (InvocationEntry entry : builder.invocations) {
                container.invoke(entry.invocation, entry.origin);
            }
            graph = container.build();
        } catch (ConstructionException e) {
            recordConstructionError(e);
        }
    }

    private void recordConstructionError(ConstructionException e) {
        if (constructionError != null) {
            return;
        }
        Optional<String> dot = container.visualize(e);
        ConstructionException error = dot.isPresent()
                ? new GraphAttachedException(e, new DotGraph(dot.get()))
                : e;
        constructionError = error;
        LOG.error("Failed to build the application: {}", e.getMessage());
        notifyErrorHandlers(error);
    }

    private static ConstructionException combine(List<Throwable> errors) {
        Throwable first = errors.get(0);
        if (errors.size() == 1 && first instanceof ConstructionException) {
            return (ConstructionException) first;
        }
        StringBuilder message = new StringBuilder();
        for (Throwable error : errors) {
            if (message.length() > 0) {
                message.append("; ");
            }
            message.append(error.getMessage());
        }
        ConstructionException combined = new ConstructionException(message.toString(), first);
        for (int i = 1; i < errors.size(); i++) {
            combined.addSuppressed(errors.get(i));
        }
        return combined;
    }

    private void notifyErrorHandlers(Throwable error) {
        for (ErrorHandler handler : errorHandlers) {
            handler.handleError(error);
        }
    }

    /**
     * Runs every start hook in registration order within {@link #startTimeout()}. On failure
     * the hooks that did start are stopped again, in reverse, before the error is thrown.
     *
     * <p>Rollback runs in the same unit of work as the start walk, once the walk has returned.
     * When the deadline wins, the caller gets a {@link
     * org.gnuhpc.cape.runtime.lifecycle.PhaseTimeoutException} right away while the abandoned
     * walk finishes its current hook, stops there, and rolls back in the background.
     *
     * @throws RollbackFailedException if stopping the started hooks failed as well
     */
    public void start(HookContext ctx) throws LifecycleException {
        ConstructionException sticky = constructionError;
        if (sticky != null) {
            throw sticky;
        }

        LOG.info("Starting application, {} hooks registered", lifecycle.size());
        try {
            Deadlines.withDeadline(ctx, startTimeout, Phase.START, this::startOrRollback);
        } catch (LifecycleException failure) {
            notifyErrorHandlers(failure);
            throw failure;
        }
        LOG.info("RUNNING");
    }

    private void startOrRollback(HookContext ctx) throws LifecycleException {
        try {
            lifecycle.start(ctx);
        } catch (LifecycleException startFailure) {
            LOG.error("Start failed, rolling back: {}", startFailure.getMessage());
            throw rollback(startFailure);
        }
        if (ctx.isDone()) {
            // The last hook came up after the caller was already told the start failed.
            LOG.warn("Start finished after its context was done ({}), rolling back", ctx.doneReason());
            throw rollback(new PhaseCancelledException(Phase.START, ctx.doneReason()));
        }
    }

    private LifecycleException rollback(LifecycleException startFailure) {
        // The start context is done or about to be; cleanup gets its own budget.
        try {
            Deadlines.withDeadline(HookContext.background(), stopTimeout, Phase.STOP, lifecycle::stop);
            LOG.info("Rolled back the hooks that had started");
            return startFailure;
        } catch (LifecycleException rollbackFailure) {
            LOG.error("Rollback failed: {}", rollbackFailure.getMessage());
            return new RollbackFailedException(startFailure, rollbackFailure);
        }
    }

    /**
     * Runs the stop hook of every started hook in reverse order within {@link #stopTimeout()}.
     * Calling it again, or without a prior start, does nothing.
     */
    public void stop(HookContext ctx) throws LifecycleException {
        ConstructionException sticky = constructionError;
        if (sticky != null) {
            throw sticky;
        }

        LOG.info("Stopping application");
        Deadlines.withDeadline(ctx, stopTimeout, Phase.STOP, lifecycle::stop);
        LOG.info("Application stopped");
    }

    /**
     * Starts the application, blocks until a shutdown signal arrives, then stops it.
     *
     * @throws LifecycleException if start or stop failed; nothing is left running after a
     *     failed start
     */
    public void run() throws LifecycleException {
        ShutdownListener listener = done();
        if (handleSignals) {
            signalHandler.beginRun();
        }
        boolean interrupted = false;
        try {
            start(HookContext.background());

            try {
                ShutdownSignal signal = listener.await();
                LOG.info("Received {}, shutting down", signal);
            } catch (InterruptedException e) {
                LOG.info("Interrupted while waiting for a shutdown signal, shutting down");
                interrupted = true;
            }

            stop(HookContext.background());
        } finally {
            if (handleSignals) {
                signalHandler.endRun();
                signalHandler.uninstall();
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Returns a fresh listener that receives the next shutdown signal. The first call installs
     * the JVM termination handler when signal handling is enabled.
     */
    public ShutdownListener done() {
        if (handleSignals) {
            signalHandler.install();
        }
        return broadcaster.listen();
    }

    /**
     * @return the error that stopped the object graph from being built, or null
     */
    public ConstructionException err() {
        return constructionError;
    }

    /**
     * @return the built object graph, empty if construction failed
     */
    public Optional<ObjectGraph> graph() {
        return Optional.ofNullable(graph);
    }

    public Shutdowner shutdowner() {
        return broadcaster;
    }

    public Duration startTimeout() {
        return startTimeout;
    }

    public Duration stopTimeout() {
        return stopTimeout;
    }

    TerminationSignalHandler signalHandler() {
        return signalHandler;
    }

    /**
     * Returns the DOT graph attached to {@code error} or any of its causes.
     *
     * @throws IllegalArgumentException if no graph is attached
     */
    public static String visualizeError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof GraphAttachedException) {
                DotGraph dot = ((GraphAttachedException) t).getGraph();
                if (dot != null && !dot.isEmpty()) {
                    return dot.getSource();
                }
            }
        }
        throw new IllegalArgumentException("unable to visualize error");
    }

    private static final class Provision<T> {
        private final Key<T> key;
        private final Provider<? extends T> provider;
        private final String origin;

        Provision(Key<T> key, Provider<? extends T> provider, String origin) {
            this.key = key;
            this.provider = provider;
            this.origin = origin;
        }

        void applyTo(Container container) throws ConstructionException {
            container.provide(key, provider, origin);
        }
    }

    private static final class InvocationEntry {
        private final Invocation invocation;
        private final String origin;

        InvocationEntry(Invocation invocation, String origin) {
            this.invocation = invocation;
            this.origin = origin;
        }
    }

    /**
     * Collects options for an {@link App}. Later calls override earlier ones for single-valued
     * options; provides, invokes and error handlers accumulate in call order.
     */
    public static final class Builder {
        private final List<Provision<?>> provisions = new ArrayList<>();
        private final List<InvocationEntry> invocations = new ArrayList<>();
        private final List<Throwable> optionErrors = new ArrayList<>();
        private final List<ErrorHandler> errorHandlers = new ArrayList<>();
        private Duration startTimeout = DEFAULT_TIMEOUT;
        private Duration stopTimeout = DEFAULT_TIMEOUT;
        private boolean handleSignals = true;
        private Container container;

        private Builder() {
        }

        /**
         * Applies each option in order, as if its builder calls were made here.
         */
        public Builder apply(Option... options) {
            for (Option option : options) {
                Objects.requireNonNull(option, "option").applyTo(this);
            }
            return this;
        }

        public <T> Builder provide(Class<T> type, Provider<? extends T> provider) {
            return provide(Key.of(type), provider);
        }

        public <T> Builder provide(Key<T> key, Provider<? extends T> provider) {
            provisions.add(new Provision<>(key, provider, Callers.caller()));
            return this;
        }

        /**
         * Registers an invocation, run eagerly in registration order while the app is built.
         */
        public Builder invoke(Invocation invocation) {
            invocations.add(new InvocationEntry(invocation, Callers.caller()));
            return this;
        }

        /**
         * Fails construction with the given errors; provides and invokes are skipped.
         */
        public Builder error(Throwable... errors) {
            for (Throwable error : errors) {
                if (error != null) {
                    optionErrors.add(error);
                }
            }
            return this;
        }

        public Builder startTimeout(Duration timeout) {
            this.startTimeout = requirePositive(timeout, "startTimeout");
            return this;
        }

        public Builder stopTimeout(Duration timeout) {
            this.stopTimeout = requirePositive(timeout, "stopTimeout");
            return this;
        }

        public Builder errorHandler(ErrorHandler... handlers) {
            errorHandlers.addAll(Arrays.asList(handlers));
            return this;
        }

        /**
         * Takes timeouts and signal handling from {@code config}.
         */
        public Builder config(LifecycleConfig config) {
            this.startTimeout = requirePositive(config.getStartTimeout(), "startTimeout");
            this.stopTimeout = requirePositive(config.getStopTimeout(), "stopTimeout");
            this.handleSignals = config.isSignalHandlingEnabled();
            return this;
        }

        public Builder handleSignals(boolean enabled) {
            this.handleSignals = enabled;
            return this;
        }

        /**
         * Replaces the construction mechanism; defaults to {@link DefaultContainer}.
         */
        public Builder container(Container replacement) {
            this.container = Objects.requireNonNull(replacement, "container");
            return this;
        }

        public App build() {
            return new App(this);
        }

        private static Duration requirePositive(Duration timeout, String what) {
            Objects.requireNonNull(timeout, what);
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException(what + " must be positive: " + timeout);
            }
            return timeout;
        }
    }
}
