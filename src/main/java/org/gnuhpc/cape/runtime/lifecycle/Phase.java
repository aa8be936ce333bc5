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
 * The two passes over the registered hooks.
 * START walks forward and fails fast, STOP walks backward and is best-effort.
 */
public enum Phase {
    START("OnStart"),
    STOP("OnStop");

    private final String hookName;

    Phase(String hookName) {
        this.hookName = hookName;
    }

    /**
     * Name of the hook callback run during this phase, used in error messages.
     */
    public String hookName() {
        return hookName;
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
