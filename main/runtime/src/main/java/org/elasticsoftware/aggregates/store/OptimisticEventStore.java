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

import org.elasticsoftware.aggregates.snapshot.Snapshot;
import org.elasticsoftware.aggregates.stream.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class OptimisticEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(OptimisticEventStore.class);
    private final EventPersistence persistence;

    public OptimisticEventStore(EventPersistence persistence) {
        this.persistence = persistence;
    }

    @Override
    public EventStream openStream(String bucketId, String streamId, int minVersion, int maxVersion) {
        List<Commit> commits = persistence.getFrom(bucketId, streamId, minVersion, maxVersion);
        if (commits.isEmpty()) {
            log.trace("No commits found for {}/{}", bucketId, streamId);
            return null;
        }
        return OptimisticEventStream.open(bucketId, streamId, persistence, commits, minVersion, maxVersion);
    }

    @Override
    public EventStream openStream(Snapshot snapshot, int maxVersion) {
        List<Commit> commits = persistence.getFrom(snapshot.bucketId(), snapshot.streamId(), snapshot.version() + 1, maxVersion);
        return OptimisticEventStream.open(snapshot.bucketId(), snapshot.streamId(), persistence, commits,
                snapshot.version() + 1, maxVersion);
    }

    @Override
    public EventStream createStream(String bucketId, String streamId) {
        log.trace("Creating stream {}/{}", bucketId, streamId);
        return new OptimisticEventStream(bucketId, streamId, persistence);
    }

    @Override
    public Snapshot getSnapshot(String bucketId, String streamId, int maxVersion) {
        return persistence.getSnapshot(bucketId, streamId, maxVersion);
    }

    @Override
    public boolean addSnapshot(Snapshot snapshot) {
        boolean added = persistence.addSnapshot(snapshot);
        if (added) {
            log.debug("Stored snapshot of {}/{} at version {}", snapshot.bucketId(), snapshot.streamId(), snapshot.version());
        }
        return added;
    }
}
