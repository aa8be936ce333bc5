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

/**
 * Termination signals delivered to shutdown listeners.
 *
 * <p>The JVM does not tell SIGINT and SIGTERM apart, so both the termination handler and
 * {@link Shutdowner#requestShutdown()} send {@link #TERMINATE}. {@link #INTERRUPT} is only ever
 * sent by code calling {@link ShutdownBroadcaster#broadcast(ShutdownSignal)} directly.
 */
public enum ShutdownSignal {
    /** Sent only through an explicit {@link ShutdownBroadcaster#broadcast(ShutdownSignal)}. */
    INTERRUPT("SIGINT"),
    TERMINATE("SIGTERM");

    private final String signalName;

    ShutdownSignal(String signalName) {
        this.signalName = signalName;
    }

    public String signalName() {
        return signalName;
    }

    @Override
    public String toString() {
        return signalName;
    }
}
