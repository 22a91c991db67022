/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.aggregates.domain;

import org.elasticsoftware.aggregates.scope.DependencyScope;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scope that hands out fixed instances and remembers its children so tests can check they were closed.
 */
public class FixedDependencyScope implements DependencyScope {
    private final Map<Class<?>, Object> instances;
    private final List<FixedDependencyScope> children = new ArrayList<>();
    private boolean closed = false;

    public FixedDependencyScope(Map<Class<?>, Object> instances) {
        this.instances = instances;
    }

    @Override
    public synchronized DependencyScope createChildScope() {
        FixedDependencyScope child = new FixedDependencyScope(instances);
        children.add(child);
        return child;
    }

    @Override
    public <T> T build(Class<T> type) {
        Object instance = instances.get(type);
        if (instance == null) {
            throw new IllegalStateException("No instance of " + type.getName());
        }
        return type.cast(instance);
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    public synchronized List<FixedDependencyScope> getChildren() {
        return List.copyOf(children);
    }
}
