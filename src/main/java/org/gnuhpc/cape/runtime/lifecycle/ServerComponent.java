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

/**
 * A component with its own start/stop pair, e.g. a network server.
 * Register it with {@code lifecycle.append(Hook.forComponent(component))}.
 */
public interface ServerComponent {

    /**
     * Start the component. Must return once the component is serving; background loops
     * belong on their own threads.
     * @throws Exception if startup fails
     */
    void start(HookContext ctx) throws Exception;

    /**
     * Stop the component gracefully, giving up when {@code ctx} is done.
     * @throws Exception if shutdown fails
     */
    void stop(HookContext ctx) throws Exception;

    /**
     * Get the component name for logging.
     * @return component name
     */
    String getName();

    boolean isRunning();
}
