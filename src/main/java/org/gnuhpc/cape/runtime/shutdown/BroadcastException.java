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

import org.gnuhpc.cape.runtime.lifecycle.LifecycleException;

/**
 * Some listeners could not be signalled because they still held an earlier, unconsumed signal.
 * Every other listener was signalled.
 */
public class BroadcastException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    private final ShutdownSignal signal;
    private final int unsent;
    private final int total;

    public BroadcastException(ShutdownSignal signal, int unsent, int total) {
        super(String.format("failed to send %s signal to %d out of %d listeners", signal, unsent, total));
        this.signal = signal;
        this.unsent = unsent;
        this.total = total;
    }

    public ShutdownSignal getSignal() {
        return signal;
    }

    public int getUnsent() {
        return unsent;
    }

    public int getTotal() {
        return total;
    }
}
