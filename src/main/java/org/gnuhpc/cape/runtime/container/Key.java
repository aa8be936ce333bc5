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
 * Identifies a value in the object graph: its type plus an optional name or group.
 *
 * <p>A plain or named key has exactly one provider. A group key collects the values of any
 * number of providers and is read with {@link Resolver#getGroup(Class, String)}.
 */
public final class Key<T> {

    private final Class<T> type;
    private final String name;
    private final String group;

    private Key(Class<T> type, String name, String group) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
        this.group = group;
    }

    public static <T> Key<T> of(Class<T> type) {
        return new Key<>(type, null, null);
    }

    public static <T> Key<T> named(Class<T> type, String name) {
        return new Key<>(type, requireLabel(name, "name"), null);
    }

    public static <T> Key<T> group(Class<T> type, String group) {
        return new Key<>(type, null, requireLabel(group, "group"));
    }

    /**
     * Builds a key from optional annotations, rejecting a name combined with a group.
     */
    public static <T> Key<T> annotated(Class<T> type, String name, String group)
            throws InvalidBindingException {
        boolean hasName = name != null && !name.isEmpty();
        boolean hasGroup = group != null && !group.isEmpty();
        if (hasName && hasGroup) {
            throw new InvalidBindingException(
                    "a binding may not specify both name and group for " + type.getName());
        }
        if (hasName) {
            return named(type, name);
        }
        return hasGroup ? group(type, group) : of(type);
    }

    public Class<T> getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getGroup() {
        return group;
    }

    public boolean isGroup() {
        return group != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Key)) {
            return false;
        }
        Key<?> other = (Key<?>) o;
        return type.equals(other.type)
                && Objects.equals(name, other.name)
                && Objects.equals(group, other.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, name, group);
    }

    @Override
    public String toString() {
        if (name != null) {
            return type.getName() + "[name=" + name + "]";
        }
        if (group != null) {
            return type.getName() + "[group=" + group + "]";
        }
        return type.getName();
    }

    private static String requireLabel(String label, String what) {
        if (label == null || label.isEmpty()) {
            throw new IllegalArgumentException(what + " must not be empty");
        }
        return label;
    }
}
