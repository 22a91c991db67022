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

package org.elasticsoftware.aggregates.stream;

import org.elasticsoftware.aggregates.ConflictingCommandException;
import org.elasticsoftware.aggregates.DuplicateCommitException;
import org.elasticsoftware.aggregates.events.DomainEvent;
import org.elasticsoftware.aggregates.snapshot.Snapshot;

import java.io.Closeable;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Ordered, versioned event log of a single aggregate (or entity) instance.
 * <p>
 * {@link #getStreamVersion()} counts committed plus pending events, {@link #getCommitVersion()} only the
 * persisted ones. Both only grow during the lifetime of an instance.
 */
public interface EventStream extends Closeable {
    String getBucketId();

    String getStreamId();

    int getStreamVersion();

    int getCommitVersion();

    List<EventMessage> getCommittedEvents();

    List<EventMessage> getUncommittedEvents();

    /**
     * Mutable headers that will be attached to the next commit.
     */
    Map<String, Object> getUncommittedHeaders();

    void add(DomainEvent event, Map<String, Object> headers);

    /**
     * Appends a snapshot marker to the pending buffer, stamped with the version of the snapshot and the current
     * commit version.
     */
    void add(Snapshot snapshot, Map<String, Object> headers);

    /**
     * Persists the pending buffer as the revisions directly following {@link #getCommitVersion()}.
     *
     * @throws ConflictingCommandException when the stream was advanced by another writer
     * @throws DuplicateCommitException    when {@code commitId} was already applied to this stream
     */
    void commit(UUID commitId, Map<String, Object> commitHeaders);

    void clearChanges();

    @Override
    void close();
}
