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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Termination Signal Handler Tests")
class TerminationSignalHandlerTest {

    @Test
    @DisplayName("termination broadcasts TERMINATE like requestShutdown")
    void testTerminationBroadcasts() {
        ShutdownBroadcaster broadcaster = new ShutdownBroadcaster();
        ShutdownListener listener = broadcaster.listen();
        TerminationSignalHandler handler = new TerminationSignalHandler(broadcaster, Duration.ofSeconds(1));

        handler.onTermination();

        assertThat(listener.poll()).contains(ShutdownSignal.TERMINATE);
    }

    @Test
    @DisplayName("termination waits for the running application to finish stopping")
    void testTerminationWaitsForRun() throws Exception {
        ShutdownBroadcaster broadcaster = new ShutdownBroadcaster();
        ShutdownListener listener = broadcaster.listen();
        TerminationSignalHandler handler = new TerminationSignalHandler(broadcaster, Duration.ofSeconds(5));
        handler.beginRun();

        CompletableFuture<Void> termination = CompletableFuture.runAsync(handler::onTermination);

        assertThat(listener.await(Duration.ofSeconds(5))).contains(ShutdownSignal.TERMINATE);
        assertThat(termination).isNotDone();

        handler.endRun();
        termination.get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("termination gives up waiting after the stop timeout")
    void testTerminationWaitIsBounded() throws Exception {
        ShutdownBroadcaster broadcaster = new ShutdownBroadcaster();
        TerminationSignalHandler handler = new TerminationSignalHandler(broadcaster, Duration.ofMillis(50));
        handler.beginRun();

        CompletableFuture.runAsync(handler::onTermination).get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("a full listener does not stop termination")
    void testTerminationWithFullListener() {
        ShutdownBroadcaster broadcaster = new ShutdownBroadcaster();
        ShutdownListener listener = broadcaster.listen();
        TerminationSignalHandler handler = new TerminationSignalHandler(broadcaster, Duration.ofSeconds(1));

        handler.onTermination();
        handler.onTermination();

        assertThat(listener.poll()).contains(ShutdownSignal.TERMINATE);
        assertThat(listener.poll()).isEmpty();
    }

    @Test
    @DisplayName("install and uninstall are idempotent")
    void testInstallUninstall() {
        TerminationSignalHandler handler =
                new TerminationSignalHandler(new ShutdownBroadcaster(), Duration.ofSeconds(1));

        handler.install();
        handler.install();
        assertThat(handler.isInstalled()).isTrue();

        handler.uninstall();
        handler.uninstall();
        assertThat(handler.isInstalled()).isFalse();
    }
}
