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

import org.elasticsoftware.aggregates.NotFoundException;
import org.elasticsoftware.aggregates.aggregate.Aggregate;
import org.elasticsoftware.aggregates.aggregate.Entity;
import org.elasticsoftware.aggregates.aggregate.EntityType;
import org.elasticsoftware.aggregates.scope.DependencyScope;
import org.elasticsoftware.aggregates.store.EventStore;

/**
 * Repository for the entities of one parent aggregate. Entity streams are stored in the parent's bucket under
 * {@code <parentId>.<entityId>}.
 */
public class DefaultEntityRepository<E extends Entity> extends AbstractRepository<E> implements EntityRepository<E> {
    private final Aggregate parent;

    public DefaultEntityRepository(Aggregate parent,
                                   EntityType<E> entityType,
                                   EventStore eventStore,
                                   DependencyScope scope,
                                   RepositoryFactory repositoryFactory) {
        super(entityType, eventStore, scope, repositoryFactory);
        this.parent = parent;
    }

    @Override
    public E get(Object id) {
        return get(id, Integer.MAX_VALUE);
    }

    @Override
    public E get(Object id, int version) {
        String entityId = toId(id);
        return load(parent.getBucketId(), streamId(entityId), entityId, version);
    }

    @Override
    public E require(Object id) {
        E entity = get(id);
        if (entity == null) {
            throw new NotFoundException(parent.getBucketId(), streamId(toId(id)));
        }
        return entity;
    }

    @Override
    public E create(Object id) {
        String entityId = toId(id);
        return prepare(parent.getBucketId(), streamId(entityId), entityId);
    }

    private String streamId(String entityId) {
        return parent.getId() + "." + entityId;
    }
}
