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
 * Lets a component ask the application to shut down. Provided to every application's
 * object graph; equivalent to the process receiving SIGTERM.
 */
@FunctionalInterface
public interface Shutdowner {

    /**
     * Broadcasts {@link ShutdownSignal#TERMINATE} to every shutdown listener.
     *
     * @throws BroadcastException if some listeners still held an unconsumed signal
     */
    void requestShutdown() throws BroadcastException;
}
