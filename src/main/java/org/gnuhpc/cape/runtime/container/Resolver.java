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

import java.util.List;
import java.util.Optional;

/**
 * Typed access to values in the object graph.
 */
public interface Resolver {

    /**
     * @throws MissingProviderException if nothing provides {@code key}
     * @throws IllegalArgumentException for group keys
     */
    <T> T get(Key<T> key) throws ConstructionException;

    default <T> T get(Class<T> type) throws ConstructionException {
        return get(Key.of(type));
    }

    /**
     * @return the value, or empty if nothing provides {@code key}; provider failures still throw
     */
    <T> Optional<T> find(Key<T> key) throws ConstructionException;

    /**
     * @return every value provided to the group, in registration order; empty if none
     */
    <T> List<T> getGroup(Class<T> type, String group) throws ConstructionException;
}
