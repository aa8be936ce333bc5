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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Typed provider registry with lazy, cached resolution.
 *
 * <p>Providers run the first time their key is requested and their value is reused
 * afterwards. Dependency edges are recorded as providers resolve each other, which is what
 * {@link #visualize()} renders. Access is serialized on the container's monitor.
 */
public class DefaultContainer implements Container {

    private static final Logger LOG = LoggerFactory.getLogger(DefaultContainer.class);

    private final Map<Key<?>, List<Binding<?>>> bindings = new LinkedHashMap<>();
    private final Map<Key<?>, Set<Key<?>>> edges = new LinkedHashMap<>();
    private final Set<Key<?>> failed = new LinkedHashSet<>();
    private final List<Binding<?>> resolving = new ArrayList<>();
    private boolean frozen;

    @Override
    public synchronized <T> void provide(Key<T> key, Provider<? extends T> provider, String origin)
            throws ConstructionException {
        Objects.requireNonNull(key, "key");
        if (provider == null) {
            throw new InvalidBindingException("null provider for " + key + " registered by " + origin);
        }
        if (frozen) {
            throw new InvalidBindingException("cannot provide " + key + " after the graph was built");
        }
        List<Binding<?>> existing = bindings.computeIfAbsent(key, k -> new ArrayList<>());
        if (!key.isGroup() && !existing.isEmpty()) {
            throw new InvalidBindingException(key + " is already provided by " + existing.get(0).origin
                    + ", cannot provide it again from " + origin);
        }
        existing.add(new Binding<>(key, provider, origin));
        LOG.debug("PROVIDE\t{} <= {}", key, origin);
    }

    @Override
    public synchronized void invoke(Invocation invocation, String origin) throws ConstructionException {
        Objects.requireNonNull(invocation, "invocation");
        LOG.debug("INVOKE\t\t{}", origin);
        try {
            invocation.invoke(new ScopedResolver(null));
        } catch (ConstructionException e) {
            LOG.error("Error during invoke registered by {}: {}", origin, e.getMessage());
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            LOG.error("Error during invoke registered by {}: {}", origin, e.getMessage());
            throw new InvocationFailedException(origin, e);
        }
    }

    @Override
    public synchronized ObjectGraph build() {
        frozen = true;
        return new Graph();
    }

    @Override
    public boolean canVisualize(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof MissingProviderException
                    || t instanceof DependencyCycleException
                    || t instanceof ProviderFailedException) {
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized String visualize() {
        Set<Key<?>> nodes = new LinkedHashSet<>(bindings.keySet());
        nodes.addAll(failed);
        for (Set<Key<?>> targets : edges.values()) {
            nodes.addAll(targets);
        }

        StringBuilder dot = new StringBuilder();
        dot.append("digraph {\n");
        dot.append("\trankdir=RL;\n");
        for (Key<?> node : nodes) {
            dot.append('\t').append(quote(node));
            if (failed.contains(node)) {
                dot.append(" [color=red]");
            }
            dot.append(";\n");
        }
        for (Map.Entry<Key<?>, Set<Key<?>>> entry : edges.entrySet()) {
            for (Key<?> target : entry.getValue()) {
                dot.append('\t').append(quote(entry.getKey())).append(" -> ").append(quote(target));
                if (failed.contains(target)) {
                    dot.append(" [color=red]");
                }
                dot.append(";\n");
            }
        }
        dot.append("}\n");
        return dot.toString();
    }

    @Override
    public Optional<String> visualize(Throwable error) {
        return canVisualize(error) ? Optional.of(visualize()) : Optional.empty();
    }

    private <T> T resolve(Key<T> key, Key<?> requester) throws ConstructionException {
        if (key.isGroup()) {
            throw new IllegalArgumentException(key + " is a group key, use getGroup");
        }
        recordEdge(requester, key);
        List<Binding<?>> candidates = bindings.get(key);
        if (candidates == null || candidates.isEmpty()) {
            failed.add(key);
            throw new MissingProviderException(key, requester);
        }
        return key.getType().cast(instantiate(candidates.get(0)));
    }

    private <T> List<T> resolveGroup(Key<T> key, Key<?> requester) throws ConstructionException {
        recordEdge(requester, key);
        List<Binding<?>> candidates = bindings.getOrDefault(key, Collections.emptyList());
        List<T> values = new ArrayList<>(candidates.size());
        for (Binding<?> binding : candidates) {
            values.add(key.getType().cast(instantiate(binding)));
        }
        return values;
    }

    private Object instantiate(Binding<?> binding) throws ConstructionException {
        if (binding.resolved) {
            return binding.instance;
        }
        int index = resolving.indexOf(binding);
        if (index >= 0) {
            List<Key<?>> path = new ArrayList<>();
            for (int i = index; i < resolving.size(); i++) {
                path.add(resolving.get(i).key);
            }
            path.add(binding.key);
            failed.add(binding.key);
            throw new DependencyCycleException(path);
        }

        resolving.add(binding);
        try {
            Object value = binding.provider.create(new ScopedResolver(binding.key));
            if (value == null) {
                throw new NullPointerException("provider returned null");
            }
            binding.instance = value;
            binding.resolved = true;
            return value;
        } catch (ConstructionException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            failed.add(binding.key);
            throw new ProviderFailedException(binding.key, binding.origin, e);
        } finally {
            resolving.remove(resolving.size() - 1);
        }
    }

    private void recordEdge(Key<?> from, Key<?> to) {
        if (from != null) {
            edges.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
        }
    }

    private static String quote(Key<?> key) {
        return '"' + key.toString().replace("\"", "\\\"") + '"';
    }

    private static final class Binding<T> {
        private final Key<T> key;
        private final Provider<? extends T> provider;
        private final String origin;
        private Object instance;
        private boolean resolved;

        Binding(Key<T> key, Provider<? extends T> provider, String origin) {
            this.key = key;
            this.provider = provider;
            this.origin = origin;
        }
    }

    /**
     * Resolver handed to a provider or invocation; records which key is asking.
     */
    private class ScopedResolver implements Resolver {
        private final Key<?> requester;

        ScopedResolver(Key<?> requester) {
            this.requester = requester;
        }

        @Override
        public <T> T get(Key<T> key) throws ConstructionException {
            synchronized (DefaultContainer.this) {
                return resolve(key, requester);
            }
        }

        @Override
        public <T> Optional<T> find(Key<T> key) throws ConstructionException {
            synchronized (DefaultContainer.this) {
                List<Binding<?>> candidates = bindings.get(key);
                if (candidates == null || candidates.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(resolve(key, requester));
            }
        }

        @Override
        public <T> List<T> getGroup(Class<T> type, String group) throws ConstructionException {
            synchronized (DefaultContainer.this) {
                return resolveGroup(Key.group(type, group), requester);
            }
        }
    }

    private final class Graph extends ScopedResolver implements ObjectGraph {
        Graph() {
            super(null);
        }

        @Override
        public Set<Key<?>> keys() {
            synchronized (DefaultContainer.this) {
                return Collections.unmodifiableSet(new LinkedHashSet<>(bindings.keySet()));
            }
        }
    }
}
