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

/**
 * Something asked for a key that no provider produces.
 */
public class MissingProviderException extends ConstructionException {

    private static final long serialVersionUID = 1L;

    private final transient Key<?> key;
    private final transient Key<?> requestedBy;

    public MissingProviderException(Key<?> key, Key<?> requestedBy) {
        super("missing provider for " + key
                + (requestedBy != null ? " (required by " + requestedBy + ")" : ""));
        this.key = key;
        this.requestedBy = requestedBy;
    }

    public Key<?> getKey() {
        return key;
    }

    /** @return the key whose provider asked, or null for an invocation */
    public Key<?> getRequestedBy() {
        return requestedBy;
    }
}
