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

package org.elasticsoftware.aggregates.aggregate;

import jakarta.validation.constraints.NotNull;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Describes how to produce bare instances of an entity type and which capabilities they need injected.
 *
 * @param typeName     name used in log messages
 * @param typeClass    the entity class
 * @param factory      returns a new, unwired instance on every call
 * @param capabilities what the repository injects after construction
 */
public record EntityType<T extends Entity>(@NotNull String typeName,
                                           @NotNull Class<T> typeClass,
                                           @NotNull Supplier<? extends T> factory,
                                           @NotNull Set<Capability> capabilities) {
    public EntityType {
        capabilities = Collections.unmodifiableSet(capabilities.isEmpty() ? EnumSet.noneOf(Capability.class) : EnumSet.copyOf(capabilities));
        if (capabilities.contains(Capability.REPOSITORY_FACTORY) && !Aggregate.class.isAssignableFrom(typeClass)) {
            throw new IllegalArgumentException(typeClass.getName() + " is not an Aggregate and cannot require " + Capability.REPOSITORY_FACTORY);
        }
    }

    /**
     * Declares every capability that applies to the type: all of them for aggregates, all but
     * {@link Capability#REPOSITORY_FACTORY} for child entities.
     */
    public static <T extends Entity> EntityType<T> of(Class<T> typeClass, Supplier<? extends T> factory) {
        Set<Capability> capabilities = EnumSet.allOf(Capability.class);
        if (!Aggregate.class.isAssignableFrom(typeClass)) {
            capabilities.remove(Capability.REPOSITORY_FACTORY);
        }
        return new EntityType<>(typeClass.getSimpleName(), typeClass, factory, capabilities);
    }

    public static <T extends Entity> EntityType<T> of(Class<T> typeClass, Supplier<? extends T> factory, Capability first, Capability... rest) {
        return new EntityType<>(typeClass.getSimpleName(), typeClass, factory, EnumSet.of(first, rest));
    }

    public boolean supportsSnapshots() {
        return Snapshotting.class.isAssignableFrom(typeClass);
    }

    public boolean requires(Capability capability) {
        return capabilities.contains(capability);
    }

    public T newInstance() {
        T instance = factory.get();
        if (!typeClass.isInstance(instance)) {
            throw new IllegalStateException("Factory for " + typeName + " returned " + instance);
        }
        return instance;
    }
}
