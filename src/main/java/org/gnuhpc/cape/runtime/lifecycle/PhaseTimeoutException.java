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

import java.time.Duration;

/**
 * A phase produced no result before its deadline. The phase may still be running.
 */
public class PhaseTimeoutException extends LifecycleException {

    private static final long serialVersionUID = 1L;

    private final Phase phase;
    private final Duration timeout;

    public PhaseTimeoutException(Phase phase, Duration timeout) {
        super(String.format("%s phase exceeded its deadline of %d ms", phase, timeout.toMillis()));
        this.phase = phase;
        this.timeout = timeout;
    }

    public Phase getPhase() {
        return phase;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
