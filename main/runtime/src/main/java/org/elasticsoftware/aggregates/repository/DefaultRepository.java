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
import org.elasticsoftware.aggregates.aggregate.EntityType;
import org.elasticsoftware.aggregates.scope.DependencyScope;
import org.elasticsoftware.aggregates.store.EventStore;

public class DefaultRepository<A extends Aggregate> extends AbstractRepository<A> implements Repository<A> {
    private final String defaultBucket;

    public DefaultRepository(EntityType<A> aggregateType,
                             EventStore eventStore,
                             DependencyScope scope,
                             RepositoryFactory repositoryFactory,
                             String defaultBucket) {
        super(aggregateType, eventStore, scope, repositoryFactory);
        this.defaultBucket = defaultBucket;
    }

    @Override
    public A get(Object id) {
        return get(defaultBucket, id, Integer.MAX_VALUE);
    }

    @Override
    public A get(Object id, int version) {
        return get(defaultBucket, id, version);
    }

    @Override
    public A get(String bucketId, Object id) {
        return get(bucketId, id, Integer.MAX_VALUE);
    }

    @Override
    public A get(String bucketId, Object id, int version) {
        String streamId = toId(id);
        return load(bucketId, streamId, streamId, version);
    }

    @Override
    public A require(Object id) {
        return require(defaultBucket, id);
    }

    @Override
    public A require(String bucketId, Object id) {
        A aggregate = get(bucketId, id);
        if (aggregate == null) {
            throw new NotFoundException(bucketId, toId(id));
        }
        return aggregate;
    }

    @Override
    public A create(Object id) {
        return create(defaultBucket, id);
    }

    @Override
    public A create(String bucketId, Object id) {
        String streamId = toId(id);
        return prepare(bucketId, streamId, streamId);
    }
}
