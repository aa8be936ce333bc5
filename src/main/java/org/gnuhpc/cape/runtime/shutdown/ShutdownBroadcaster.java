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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fans termination signals out to every listener slot without blocking.
 *
 * <p>Registration takes the write lock. Broadcasts take the read lock since they only change
 * slot contents, so concurrent broadcasts may interleave. Slots are never removed.
 */
public class ShutdownBroadcaster implements Shutdowner {

    private static final Logger LOG = LoggerFactory.getLogger(ShutdownBroadcaster.class);

    private final List<ListenerSlot> slots = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ShutdownListener listen() {
        ListenerSlot slot = new ListenerSlot();
        lock.writeLock().lock();
        try {
            slots.add(slot);
        } finally {
            lock.writeLock().unlock();
        }
        return slot;
    }

    /**
     * Offers {@code signal} to every slot. A slot still holding an undelivered signal is
     * counted and skipped.
     *
     * @throws BroadcastException if any slot could not take the signal
     */
    public void broadcast(ShutdownSignal signal) throws BroadcastException {
        int unsent = 0;
        int total;
        lock.readLock().lock();
        try {
            total = slots.size();
            for (ListenerSlot slot : slots) {
                if (!slot.offer(signal)) {
                    unsent++;
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        LOG.info("Broadcast {} to {} listeners", signal, total - unsent);
        if (unsent != 0) {
            throw new BroadcastException(signal, unsent, total);
        }
    }

    @Override
    public void requestShutdown() throws BroadcastException {
        broadcast(ShutdownSignal.TERMINATE);
    }

    public int listenerCount() {
        lock.readLock().lock();
        try {
            return slots.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
