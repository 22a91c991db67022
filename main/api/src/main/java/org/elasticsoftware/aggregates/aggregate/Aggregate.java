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
import org.elasticsoftware.aggregates.repository.EntityRepository;
import org.elasticsoftware.aggregates.repository.RepositoryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Consistency boundary. Next to its own stream an aggregate can own child entities, each type with its own
 * {@link EntityRepository}. The {@link RepositoryFactory} hands every instance of the same aggregate the same
 * entity repository.
 */
public abstract class Aggregate extends Entity {
    private static final Logger logger = LoggerFactory.getLogger(Aggregate.class);
    private final Map<Class<?>, EntityRepository<?>> repositories = new ConcurrentHashMap<>();
    private RepositoryFactory repositoryFactory;

    public final void setRepositoryFactory(@NotNull RepositoryFactory repositoryFactory) {
        if (this.repositoryFactory != null) {
            throw new IllegalStateException("The repository factory of " + getClass().getSimpleName() + " can only be set once");
        }
        this.repositoryFactory = repositoryFactory;
    }

    @SuppressWarnings("unchecked")
    public <E extends Entity> EntityRepository<E> entity(EntityType<E> entityType) {
        if (repositoryFactory == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " does not have a repository factory");
        }
        logger.debug("Retrieving entity repository for type {}", entityType.typeName());
        return (EntityRepository<E>) repositories.computeIfAbsent(entityType.typeClass(),
                typeClass -> repositoryFactory.forEntity(this, entityType));
    }
}
