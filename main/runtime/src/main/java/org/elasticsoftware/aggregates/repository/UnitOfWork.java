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

package org.elasticsoftware.aggregates.repository;

import org.elasticsoftware.aggregates.Bucket;
import org.elasticsoftware.aggregates.ConflictingCommandException;
import org.elasticsoftware.aggregates.aggregate.Aggregate;
import org.elasticsoftware.aggregates.aggregate.Entity;
import org.elasticsoftware.aggregates.aggregate.EntityType;
import org.elasticsoftware.aggregates.scope.DependencyScope;
import org.elasticsoftware.aggregates.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The repositories, and through them the stream and snapshot caches, of one inbound message. Nothing is shared
 * with other units of work. Repositories are committed in the order they were created; streams of different
 * repositories are committed independently and a failure does not undo what was already committed.
 */
public class UnitOfWork implements RepositoryFactory, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(UnitOfWork.class);
    private final EventStore eventStore;
    private final DependencyScope scope;
    private final String defaultBucket;
    private final Map<Class<?>, Repository<?>> aggregateRepositories = new ConcurrentHashMap<>();
    private final Map<EntityRepositoryKey, EntityRepository<?>> entityRepositories = new ConcurrentHashMap<>();
    private final List<AbstractRepository<?>> repositories = new CopyOnWriteArrayList<>();
    private volatile boolean closed = false;

    public UnitOfWork(EventStore eventStore, DependencyScope scope, String defaultBucket) {
        this.eventStore = eventStore;
        this.scope = scope;
        this.defaultBucket = defaultBucket;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <A extends Aggregate> Repository<A> forAggregate(EntityType<A> aggregateType) {
        ensureOpen();
        return (Repository<A>) aggregateRepositories.computeIfAbsent(aggregateType.typeClass(), typeClass -> {
            DefaultRepository<A> repository = new DefaultRepository<>(aggregateType, eventStore, scope, this, defaultBucket);
            repositories.add(repository);
            return repository;
        });
    }

    /**
     * Returns the entity repository for the aggregate identified by {@code parent}. Every instance of that
     * aggregate loaded in this unit of work gets the same repository, so a child stream is loaded only once.
     */
    @Override
    @SuppressWarnings("unchecked")
    public <E extends Entity> EntityRepository<E> forEntity(Aggregate parent, EntityType<E> entityType) {
        ensureOpen();
        EntityRepositoryKey key = new EntityRepositoryKey(Bucket.key(parent.getBucketId(), parent.getId()), entityType.typeClass());
        return (EntityRepository<E>) entityRepositories.computeIfAbsent(key, k -> {
            DefaultEntityRepository<E> repository = new DefaultEntityRepository<>(parent, entityType, eventStore, scope, this);
            repositories.add(repository);
            return repository;
        });
    }

    public void commit(UUID commitId, Map<String, Object> headers) {
        ensureOpen();
        logger.debug("Committing {} repositories with commit id {}", repositories.size(), commitId);
        ConflictingCommandException conflict = null;
        for (AbstractRepository<?> repository : repositories) {
            try {
                repository.commit(commitId, headers);
            } catch (ConflictingCommandException e) {
                if (conflict == null) {
                    conflict = e;
                } else {
                    conflict.addSuppressed(e);
                }
            }
        }
        if (conflict != null) {
            throw conflict;
        }
    }

    /**
     * Closes all repositories and the scope of this unit of work. Safe to call more than once.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        repositories.forEach(AbstractRepository::close);
        repositories.clear();
        aggregateRepositories.clear();
        entityRepositories.clear();
        try {
            scope.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing unit of work scope. Exception: '{}', message: '{}'", e.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Unit of work was closed");
        }
    }

    private record EntityRepositoryKey(String parentKey, Class<?> typeClass) {
    }
}
