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

import org.gnuhpc.cape.runtime.container.ConstructionException;
import org.gnuhpc.cape.runtime.container.DotGraph;
import org.gnuhpc.cape.runtime.container.InvalidBindingException;
import org.gnuhpc.cape.runtime.container.MissingProviderException;
import org.gnuhpc.cape.runtime.container.ObjectGraph;
import org.gnuhpc.cape.runtime.lifecycle.Hook;
import org.gnuhpc.cape.runtime.lifecycle.HookAction;
import org.gnuhpc.cape.runtime.lifecycle.HookContext;
import org.gnuhpc.cape.runtime.lifecycle.HookFailedException;
import org.gnuhpc.cape.runtime.lifecycle.Lifecycle;
import org.gnuhpc.cape.runtime.lifecycle.LifecycleException;
import org.gnuhpc.cape.runtime.lifecycle.Phase;
import org.gnuhpc.cape.runtime.lifecycle.PhaseTimeoutException;
import org.gnuhpc.cape.runtime.lifecycle.RollbackFailedException;
import org.gnuhpc.cape.runtime.lifecycle.StopException;
import org.gnuhpc.cape.runtime.shutdown.ShutdownListener;
import org.gnuhpc.cape.runtime.shutdown.ShutdownSignal;
import org.gnuhpc.cape.runtime.shutdown.Shutdowner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@DisplayName("App Tests - start, run, stop and construction failures")
class AppTest {

    @Mock
    private ErrorHandler firstHandler;
    @Mock
    private ErrorHandler secondHandler;

    private final List<String> events = Collections.synchronizedList(new ArrayList<>());
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterEach
    void tearDown() throws Exception {
        mocks.close();
    }

    private HookAction record(String event) {
        return ctx -> events.add(event);
    }

    private HookAction fail(String event, Exception error) {
        return ctx -> {
            events.add(event);
            throw error;
        };
    }

    private App.Builder builder() {
        return App.builder().handleSignals(false);
    }

    @Test
    @DisplayName("hooks start in append order and stop in reverse")
    void testStartStopOrder() throws Exception {
        App app = builder()
                .invoke(r -> {
                    Lifecycle lifecycle = r.get(Lifecycle.class);
                    lifecycle.append(Hook.of(record("start-A"), record("stop-A")));
                    lifecycle.append(Hook.of(record("start-B"), record("stop-B")));
                    lifecycle.append(Hook.of(record("start-C"), record("stop-C")));
                })
                .build();

        app.start(HookContext.background());
        app.stop(HookContext.background());

        assertThat(events).containsExactly(
                "start-A", "start-B", "start-C", "stop-C", "stop-B", "stop-A");
    }

    @Test
    @DisplayName("a failing start rolls back only the hooks that started")
    void testRollbackOnStartFailure() {
        IOException cause = new IOException("B cannot bind");
        App app = builder()
                .errorHandler(firstHandler)
                .invoke(r -> {
                    Lifecycle lifecycle = r.get(Lifecycle.class);
                    lifecycle.append(Hook.of(record("start-A"), record("stop-A")));
                    lifecycle.append(Hook.of(fail("start-B", cause), record("stop-B")));
                    lifecycle.append(Hook.of(record("start-C"), record("stop-C")));
                })
                .build();

        assertThatThrownBy(() -> app.start(HookContext.background()))
                .isInstanceOf(HookFailedException.class)
                .hasCause(cause)
                .satisfies(e -> {
                    assertThat(((HookFailedException) e).getPhase()).isEqualTo(Phase.START);
                    assertThat(((HookFailedException) e).getOrigin()).contains(AppTest.class.getName());
                    verify(firstHandler).handleError(e);
                });

        assertThat(events).containsExactly("start-A", "start-B", "stop-A");
    }

    @Test
    @DisplayName("a failing rollback reports both the start and the rollback failure")
    void testRollbackFailure() {
        IOException startCause = new IOException("B failed");
        IllegalStateException stopCause = new IllegalStateException("A failed to stop");
        App app = builder()
                .invoke(r -> {
                    Lifecycle lifecycle = r.get(Lifecycle.class);
                    lifecycle.append(Hook.of(record("start-A"), fail("stop-A", stopCause)));
                    lifecycle.append(Hook.of(fail("start-B", startCause), record("stop-B")));
                })
                .build();

        assertThatThrownBy(() -> app.start(HookContext.background()))
                .isInstanceOf(RollbackFailedException.class)
                .hasMessageContaining("B failed")
                .hasMessageContaining("A failed to stop")
                .satisfies(e -> {
                    RollbackFailedException rollback = (RollbackFailedException) e;
                    assertThat(rollback.getStartFailure()).hasCause(startCause);
                    assertThat(rollback.getRollbackFailure()).isInstanceOf(StopException.class);
                    assertThat(((StopException) rollback.getRollbackFailure()).getFailures())
                            .singleElement()
                            .satisfies(f -> assertThat(f.getCause()).isSameAs(stopCause));
                });
        assertThat(events).containsExactly("start-A", "start-B", "stop-A");
    }

    @Test
    @DisplayName("start gives up once the start timeout passes")
    void testStartTimeout() {
        CountDownLatch release = new CountDownLatch(1);
        App app = builder()
                .startTimeout(Duration.ofMillis(100))
                .invoke(r -> r.get(Lifecycle.class).append(Hook.onStart(ctx -> {
                    release.await(500, TimeUnit.MILLISECONDS);
                })))
                .build();

        long started = System.nanoTime();
        assertThatThrownBy(() -> app.start(HookContext.background()))
                .isInstanceOf(PhaseTimeoutException.class)
                .hasMessageContaining("100 ms");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofMillis(450));
        release.countDown();
    }

    @Test
    @DisplayName("a timed-out start attempts no later hooks and rolls back each started hook once")
    void testTimedOutStartRollsBackOnce() throws Exception {
        App app = builder()
                .startTimeout(Duration.ofMillis(100))
                .invoke(r -> {
                    Lifecycle lifecycle = r.get(Lifecycle.class);
                    lifecycle.append(Hook.of(record("start-A"), record("stop-A")));
                    lifecycle.append(Hook.of(ctx -> {
                        Thread.sleep(300);
                        events.add("start-B");
                    }, record("stop-B")));
                    lifecycle.append(Hook.of(record("start-C"), record("stop-C")));
                })
                .build();

        assertThatThrownBy(() -> app.start(HookContext.background()))
                .isInstanceOf(PhaseTimeoutException.class);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (events.size() < 4 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        Thread.sleep(200);
        assertThat(events).containsExactly("start-A", "start-B", "stop-B", "stop-A");

        app.stop(HookContext.background());
        assertThat(events).containsExactly("start-A", "start-B", "stop-B", "stop-A");
    }

    @Test
    @DisplayName("a last hook that comes up after the start deadline is rolled back")
    void testLateLastHookIsRolledBack() throws Exception {
        App app = builder()
                .startTimeout(Duration.ofMillis(100))
                .invoke(r -> r.get(Lifecycle.class).append(Hook.of(ctx -> {
                    Thread.sleep(300);
                    events.add("start-A");
                }, record("stop-A"))))
                .build();

        assertThatThrownBy(() -> app.start(HookContext.background()))
                .isInstanceOf(PhaseTimeoutException.class);
        app.stop(HookContext.background());

        assertThat(events).containsExactly("start-A", "stop-A");
    }

    @Test
    @DisplayName("stop after a timed-out start waits for the hook still starting")
    void testStopWaitsForAbandonedStart() throws Exception {
        App app = builder()
                .startTimeout(Duration.ofMillis(100))
                .invoke(r -> {
                    Lifecycle lifecycle = r.get(Lifecycle.class);
                    lifecycle.append(Hook.of(record("start-A"), record("stop-A")));
                    lifecycle.append(Hook.of(ctx -> {
                        Thread.sleep(300);
                        events.add("start-B");
                    }, record("stop-B")));
                    lifecycle.append(Hook.of(record("start-C"), record("stop-C")));
                })
                .build();

        assertThatThrownBy(() -> app.start(HookContext.background()))
                .isInstanceOf(PhaseTimeoutException.class);
        app.stop(HookContext.background());

        assertThat(events).containsExactly("start-A", "start-B", "stop-B", "stop-A");
    }

    @Test
    @DisplayName("grouped options apply in order, including nested groups")
    void testOptionsApplyInOrder() throws Exception {
        App.Option first = b -> b.invoke(r -> events.add("invoke-1"));
        App.Option second = b -> b.invoke(r -> events.add("invoke-2"));
        App.Option third = b -> b.invoke(r -> events.add("invoke-3"));

        App app = builder()
                .invoke(r -> events.add("invoke-0"))
                .apply(App.options(App.options(first, second), third))
                .invoke(r -> events.add("invoke-4"))
                .build();

        assertThat(app.err()).isNull();
        assertThat(events).containsExactly("invoke-0", "invoke-1", "invoke-2", "invoke-3", "invoke-4");
    }

    @Test
    @DisplayName("a module option carries provides, invokes, timeouts and error handlers as one unit")
    void testModuleOption() throws Exception {
        App.Option module = App.options(
                b -> b.provide(String.class, r -> "greeting"),
                b -> b.invoke(r -> r.get(Lifecycle.class).append(
                        Hook.onStart(record("start-" + r.get(String.class))))),
                b -> b.stopTimeout(Duration.ofSeconds(3)),
                b -> b.errorHandler(firstHandler));

        App app = builder().apply(module).build();
        app.start(HookContext.background());
        app.stop(HookContext.background());

        assertThat(app.stopTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(app.graph().orElseThrow().get(String.class)).isEqualTo("greeting");
        assertThat(events).containsExactly("start-greeting");
        verifyNoInteractions(firstHandler);
    }

    @Test
    @DisplayName("an error inside an option group fails construction")
    void testErrorInsideOptionGroup() {
        IllegalStateException bad = new IllegalStateException("bad module");
        App app = builder()
                .apply(App.options(b -> b.error(bad)))
                .errorHandler(firstHandler)
                .build();

        assertThat(app.err()).hasCause(bad);
        verify(firstHandler).handleError(app.err());
    }

    @Test
    @DisplayName("the termination handler waits out both the start and the stop budget")
    void testSignalHandlerWaitCoversStartAndStop() {
        App app = builder()
                .startTimeout(Duration.ofSeconds(3))
                .stopTimeout(Duration.ofSeconds(4))
                .build();

        assertThat(app.signalHandler().waitTimeout()).isEqualTo(Duration.ofSeconds(7));
    }

    @Test
    @DisplayName("stop is idempotent")
    void testStopIsIdempotent() throws Exception {
        App app = builder()
                .invoke(r -> r.get(Lifecycle.class).append(Hook.onStop(record("stop"))))
                .build();

        app.start(HookContext.background());
        app.stop(HookContext.background());
        app.stop(HookContext.background());

        assertThat(events).containsExactly("stop");
    }

    @Test
    @DisplayName("stop without a prior start does nothing")
    void testStopWithoutStart() throws Exception {
        App app = builder()
                .invoke(r -> r.get(Lifecycle.class).append(Hook.of(record("start"), record("stop"))))
                .build();

        app.stop(HookContext.background());

        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("a construction error is sticky and blocks start and stop")
    void testStickyConstructionError() {
        AtomicBoolean invoked = new AtomicBoolean();
        App app = builder()
                .provide(String.class, r -> "needs " + r.get(Integer.class))
                .invoke(r -> r.get(String.class))
                .invoke(r -> {
                    invoked.set(true);
                    r.get(Lifecycle.class).append(Hook.of(record("start"), record("stop")));
                })
                .build();

        ConstructionException error = app.err();
        assertThat(error).isInstanceOf(GraphAttachedException.class);
        assertThat(error).hasCauseInstanceOf(MissingProviderException.class);
        assertThat(app.graph()).isEmpty();
        assertThat(invoked).isFalse();

        assertThatThrownBy(() -> app.start(HookContext.background())).isSameAs(error);
        assertThatThrownBy(() -> app.stop(HookContext.background())).isSameAs(error);
        assertThatThrownBy(app::run).isSameAs(error);
        assertThat(events).isEmpty();
    }

    @Test
    @DisplayName("visualizeError returns the graph attached to a construction error")
    void testVisualizeError() {
        App app = builder()
                .provide(String.class, r -> "needs " + r.get(Integer.class))
                .invoke(r -> r.get(String.class))
                .build();

        String dot = App.visualizeError(app.err());

        assertThat(dot).startsWith("digraph {");
        assertThat(dot).contains("\"java.lang.Integer\" [color=red]");
        assertThat(dot).contains("\"java.lang.String\" -> \"java.lang.Integer\"");
    }

    @Test
    @DisplayName("visualizeError rejects errors without a graph")
    void testVisualizeErrorWithoutGraph() {
        assertThatThrownBy(() -> App.visualizeError(new IllegalStateException("plain")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("unable to visualize error");
    }

    @Test
    @DisplayName("error options fail construction and skip provides and invokes")
    void testErrorOption() {
        IllegalArgumentException bad = new IllegalArgumentException("bad option");
        IllegalStateException worse = new IllegalStateException("worse option");
        AtomicBoolean invoked = new AtomicBoolean();
        App app = builder()
                .error(bad, worse)
                .invoke(r -> invoked.set(true))
                .build();

        assertThat(app.err())
                .hasMessage("bad option; worse option")
                .hasCause(bad);
        assertThat(app.err().getSuppressed()).containsExactly(worse);
        assertThat(invoked).isFalse();
        assertThatThrownBy(() -> App.visualizeError(app.err()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("error handlers are called once each, in registration order")
    void testErrorHandlersInOrder() {
        App app = builder()
                .errorHandler(firstHandler, secondHandler)
                .provide(String.class, r -> "a")
                .provide(String.class, r -> "b")
                .build();

        ConstructionException error = app.err();
        assertThat(error).isInstanceOf(InvalidBindingException.class);

        InOrder order = inOrder(firstHandler, secondHandler);
        order.verify(firstHandler).handleError(error);
        order.verify(secondHandler).handleError(error);
        verify(firstHandler, times(1)).handleError(any());
        verify(secondHandler, times(1)).handleError(any());
    }

    @Test
    @DisplayName("error handlers are not called when everything succeeds")
    void testErrorHandlersNotCalledOnSuccess() throws Exception {
        App app = builder().errorHandler(firstHandler).build();

        app.start(HookContext.background());
        app.stop(HookContext.background());

        verifyNoInteractions(firstHandler);
        assertThat(app.err()).isNull();
    }

    @Test
    @DisplayName("the runtime provides Lifecycle, Shutdowner and DotGraph")
    void testBuiltInProvides() throws Exception {
        App app = builder().build();

        ObjectGraph graph = app.graph().orElseThrow();
        assertThat(graph.get(Lifecycle.class)).isNotNull();
        assertThat(graph.get(Shutdowner.class)).isSameAs(app.shutdowner());
        assertThat(graph.get(DotGraph.class).getSource()).startsWith("digraph {");
    }

    @Test
    @DisplayName("timeouts default to 15 seconds and can be overridden")
    void testTimeouts() {
        App defaults = builder().build();
        App custom = builder()
                .startTimeout(Duration.ofSeconds(3))
                .stopTimeout(Duration.ofSeconds(4))
                .build();

        assertThat(defaults.startTimeout()).isEqualTo(App.DEFAULT_TIMEOUT);
        assertThat(defaults.stopTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(custom.startTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(custom.stopTimeout()).isEqualTo(Duration.ofSeconds(4));
        assertThatThrownBy(() -> builder().startTimeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("run returns after an in-process shutdown request")
    void testRunUntilShutdownRequested() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        App app = builder()
                .invoke(r -> r.get(Lifecycle.class).append(Hook.of(
                        ctx -> {
                            events.add("start");
                            started.countDown();
                        },
                        record("stop"))))
                .build();

        CompletableFuture<Void> running = CompletableFuture.runAsync(() -> {
            try {
                app.run();
            } catch (LifecycleException e) {
                throw new CompletionException(e);
            }
        });

        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(running).isNotDone();
        app.shutdowner().requestShutdown();

        running.get(5, TimeUnit.SECONDS);
        assertThat(events).containsExactly("start", "stop");
    }

    @Test
    @DisplayName("run rethrows a start failure after rolling back")
    void testRunStartFailure() {
        IOException cause = new IOException("boom");
        App app = builder()
                .invoke(r -> {
                    Lifecycle lifecycle = r.get(Lifecycle.class);
                    lifecycle.append(Hook.of(record("start-A"), record("stop-A")));
                    lifecycle.append(Hook.onStart(fail("start-B", cause)));
                })
                .build();

        assertThatThrownBy(app::run)
                .isInstanceOf(HookFailedException.class)
                .hasCause(cause);
        assertThat(events).containsExactly("start-A", "start-B", "stop-A");
    }

    @Test
    @DisplayName("every done listener receives the shutdown signal")
    void testDoneListeners() throws Exception {
        App app = builder().build();
        ShutdownListener first = app.done();
        ShutdownListener second = app.done();

        app.shutdowner().requestShutdown();

        assertThat(first.poll()).contains(ShutdownSignal.TERMINATE);
        assertThat(second.poll()).contains(ShutdownSignal.TERMINATE);
        verify(firstHandler, never()).handleError(any());
    }
}
