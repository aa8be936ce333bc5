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

package org.gnuhpc.cape.runtime.launcher;

import org.gnuhpc.cape.runtime.container.ConstructionException;
import org.gnuhpc.cape.runtime.container.DotGraph;

/**
 * A construction failure together with a DOT rendering of the object graph at the time it
 * happened. See {@link App#visualizeError(Throwable)}.
 */
public class GraphAttachedException extends ConstructionException {

    private static final long serialVersionUID = 1L;

    private final transient DotGraph graph;

    public GraphAttachedException(ConstructionException cause, DotGraph graph) {
        super(cause.getMessage(), cause);
        this.graph = graph;
    }

    public DotGraph getGraph() {
        return graph;
    }
}
