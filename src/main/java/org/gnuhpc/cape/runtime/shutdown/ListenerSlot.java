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

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Holds at most one undelivered signal.
 */
final class ListenerSlot implements ShutdownListener {

    private final BlockingQueue<ShutdownSignal> pending = new ArrayBlockingQueue<>(1);

    /**
     * @return false if the slot still holds an undelivered signal
     */
    boolean offer(ShutdownSignal signal) {
        return pending.offer(signal);
    }

    @Override
    public ShutdownSignal await() throws InterruptedException {
        return pending.take();
    }

    @Override
    public Optional<ShutdownSignal> await(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(pending.poll(timeout.toNanos(), TimeUnit.NANOSECONDS));
    }

    @Override
    public Optional<ShutdownSignal> poll() {
        return Optional.ofNullable(pending.poll());
    }
}
