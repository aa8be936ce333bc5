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

import java.util.Objects;

/**
 * DOT-language rendering of an application's dependency graph. Available from every
 * application's object graph, and attached to construction errors that can be visualized.
 */
public final class DotGraph {

    private final String source;

    public DotGraph(String source) {
        this.source = Objects.requireNonNull(source, "source");
    }

    public String getSource() {
        return source;
    }

    public boolean isEmpty() {
        return source.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DotGraph && source.equals(((DotGraph) o).source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
