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

package org.elasticsoftware.aggregates.store;

import jakarta.annotation.Nullable;
import org.elasticsoftware.aggregates.snapshot.Snapshot;

import java.io.Closeable;
import java.util.List;

/**
 * Storage engine underneath the {@link OptimisticEventStore}. Implementations must make the duplicate and
 * revision checks of {@link #commit(CommitAttempt)} atomic per stream.
 */
public interface EventPersistence extends Closeable {
    /**
     * @return the commits, in order, that contain at least one revision between {@code minRevision} and
     * {@code maxRevision}
     */
    List<Commit> getFrom(String bucketId, String streamId, int minRevision, int maxRevision);

    /**
     * @throws DuplicateCommitAttemptException when the commit id was already persisted for the stream
     * @throws ConcurrencyException            when the stream is no longer at the expected revision
     */
    Commit commit(CommitAttempt attempt);

    @Nullable
    Snapshot getSnapshot(String bucketId, String streamId, int maxRevision);

    boolean addSnapshot(Snapshot snapshot);

    @Override
    void close();
}
