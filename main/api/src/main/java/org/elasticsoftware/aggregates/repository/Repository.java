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

import jakarta.annotation.Nullable;
import org.elasticsoftware.aggregates.NotFoundException;
import org.elasticsoftware.aggregates.aggregate.Aggregate;

import java.io.Closeable;
import java.util.Map;
import java.util.UUID;

/**
 * Loads, creates and commits aggregates of one type within a single unit of work. Streams and snapshots are
 * cached per {@code bucketId/id}, so every call for the same key sees the same stream.
 */
public interface Repository<A extends Aggregate> extends Closeable {
    @Nullable
    A get(Object id);

    @Nullable
    A get(Object id, int version);

    @Nullable
    A get(String bucketId, Object id);

    /**
     * @return the aggregate hydrated up to {@code version}, or {@code null} when neither a stream nor a
     * snapshot exists
     */
    @Nullable
    A get(String bucketId, Object id, int version);

    /**
     * @throws NotFoundException when the aggregate does not exist
     */
    A require(Object id);

    A require(String bucketId, Object id);

    A create(Object id);

    A create(String bucketId, Object id);

    void commit(UUID commitId, Map<String, Object> headers);

    @Override
    void close();
}
