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

import java.util.Objects;

/**
 * A pair of start and stop callbacks, either of which may be absent, plus a label identifying
 * who registered it. Immutable.
 */
public final class Hook {

    private final HookAction onStart;
    private final HookAction onStop;
    private final String origin;

    private Hook(HookAction onStart, HookAction onStop, String origin) {
        this.onStart = onStart;
        this.onStop = onStop;
        this.origin = origin;
    }

    public static Hook of(HookAction onStart, HookAction onStop) {
        return new Hook(onStart, onStop, null);
    }

    public static Hook onStart(HookAction onStart) {
        return new Hook(Objects.requireNonNull(onStart, "onStart"), null, null);
    }

    public static Hook onStop(HookAction onStop) {
        return new Hook(null, Objects.requireNonNull(onStop, "onStop"), null);
    }

    /**
     * Adapts a {@link ServerComponent}; the component name becomes the hook origin.
     */
    public static Hook forComponent(ServerComponent component) {
        Objects.requireNonNull(component, "component");
        return new Hook(component::start, component::stop, component.getName());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasOnStart() {
        return onStart != null;
    }

    public boolean hasOnStop() {
        return onStop != null;
    }

    /** @return the start callback, or null */
    public HookAction getOnStart() {
        return onStart;
    }

    /** @return the stop callback, or null */
    public HookAction getOnStop() {
        return onStop;
    }

    /** @return the registering call site or explicit label, null until appended */
    public String getOrigin() {
        return origin;
    }

    Hook withOrigin(String newOrigin) {
        return new Hook(onStart, onStop, newOrigin);
    }

    @Override
    public String toString() {
        return "Hook{origin=" + origin
                + ", onStart=" + (onStart != null)
                + ", onStop=" + (onStop != null) + "}";
    }

    public static final class Builder {
        private HookAction onStart;
        private HookAction onStop;
        private String origin;

        private Builder() {
        }

        public Builder onStart(HookAction action) {
            this.onStart = action;
            return this;
        }

        public Builder onStop(HookAction action) {
            this.onStop = action;
            return this;
        }

        /**
         * Overrides the call site that {@link Lifecycle#append(Hook)} would otherwise record.
         */
        public Builder origin(String label) {
            this.origin = label;
            return this;
        }

        public Hook build() {
            return new Hook(onStart, onStop, origin);
        }
    }
}
