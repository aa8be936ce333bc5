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

package org.gnuhpc.cape.runtime.container;

import java.util.Optional;

/**
 * Construction mechanism the application builds its object graph with.
 *
 * <p>Implementations cache one instance per binding, detect dependency cycles and report the
 * first failure as a {@link ConstructionException}.
 */
public interface Container {

    /**
     * Registers a provider for {@code key}.
     *
     * @param origin call site that registered it, for diagnostics
     */
    <T> void provide(Key<T> key, Provider<? extends T> provider, String origin) throws ConstructionException;

    /**
     * Runs {@code invocation} now, resolving whatever it asks for.
     */
    void invoke(Invocation invocation, String origin) throws ConstructionException;

    /**
     * Freezes registration and returns the graph.
     */
    ObjectGraph build() throws ConstructionException;

    /**
     * @return true if {@link #visualize(Throwable)} can render something useful for {@code error}
     */
    boolean canVisualize(Throwable error);

    /**
     * Renders the whole graph as DOT.
     */
    String visualize();

    /**
     * Renders the graph with the failure behind {@code error} highlighted, if supported.
     */
    Optional<String> visualize(Throwable error);
}
