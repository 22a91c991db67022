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

package org.elasticsoftware.aggregates.registry;

import org.elasticsoftware.aggregates.PersistenceException;
import org.elasticsoftware.aggregates.annotations.DomainEventInfo;
import org.elasticsoftware.aggregates.annotations.MementoInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Names types after their {@link DomainEventInfo} or {@link MementoInfo} annotation, as {@code <type>.v<version>}.
 */
public class AnnotationVersionRegistrar implements VersionRegistrar {
    private static final Logger logger = LoggerFactory.getLogger(AnnotationVersionRegistrar.class);
    private final Map<Class<?>, String> namesByType = new ConcurrentHashMap<>();
    private final Map<String, Class<?>> typesByName = new ConcurrentHashMap<>();

    @Override
    public void load(Collection<Class<?>> types) {
        for (Class<?> type : types) {
            String name = versionedName(type);
            Class<?> existing = typesByName.putIfAbsent(name, type);
            if (existing != null && !existing.equals(type)) {
                throw new IllegalStateException("Both " + existing.getName() + " and " + type.getName() + " are registered as " + name);
            }
            namesByType.put(type, name);
            logger.debug("Registered {} as {}", type.getName(), name);
        }
    }

    @Override
    public String getVersionedName(Class<?> versionedType) {
        String name = namesByType.get(versionedType);
        if (name == null) {
            throw new PersistenceException("Type " + versionedType.getName() + " was not registered");
        }
        return name;
    }

    @Override
    public Class<?> getNamedType(String versionedName) {
        Class<?> type = typesByName.get(versionedName);
        if (type == null) {
            throw new PersistenceException("No type registered as " + versionedName);
        }
        return type;
    }

    static String versionedName(Class<?> type) {
        DomainEventInfo eventInfo = type.getAnnotation(DomainEventInfo.class);
        if (eventInfo != null) {
            return eventInfo.type() + ".v" + eventInfo.version();
        }
        MementoInfo mementoInfo = type.getAnnotation(MementoInfo.class);
        if (mementoInfo != null) {
            return mementoInfo.type() + ".v" + mementoInfo.version();
        }
        throw new IllegalArgumentException(type.getName() + " is not annotated with @DomainEventInfo or @MementoInfo");
    }
}
