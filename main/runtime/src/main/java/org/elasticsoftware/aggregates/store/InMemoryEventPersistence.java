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

import org.elasticsoftware.aggregates.Bucket;
import org.elasticsoftware.aggregates.snapshot.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryEventPersistence implements EventPersistence {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventPersistence.class);
    private final Map<String, StreamData> streams = new ConcurrentHashMap<>();

    @Override
    public List<Commit> getFrom(String bucketId, String streamId, int minRevision, int maxRevision) {
        StreamData stream = streams.get(Bucket.key(bucketId, streamId));
        if (stream == null) {
            return List.of();
        }
        synchronized (stream) {
            List<Commit> result = new ArrayList<>();
            for (Commit commit : stream.commits) {
                if (commit.streamRevision() >= minRevision && commit.previousRevision() < maxRevision) {
                    result.add(commit);
                }
            }
            return result;
        }
    }

    @Override
    public Commit commit(CommitAttempt attempt) {
        StreamData stream = streams.computeIfAbsent(Bucket.key(attempt.bucketId(), attempt.streamId()), key -> new StreamData());
        synchronized (stream) {
            if (stream.commitIds.contains(attempt.commitId())) {
                throw new DuplicateCommitAttemptException(attempt.bucketId(), attempt.streamId(), attempt.commitId());
            }
            if (stream.revision != attempt.expectedRevision()) {
                throw new ConcurrencyException(attempt.bucketId(), attempt.streamId(), attempt.expectedRevision(), stream.revision);
            }
            Commit commit = new Commit(attempt.bucketId(), attempt.streamId(), attempt.streamRevision(), attempt.commitId(),
                    stream.commits.size() + 1, attempt.commitStamp(), attempt.headers(), attempt.events());
            stream.commits.add(commit);
            stream.commitIds.add(commit.commitId());
            stream.revision = commit.streamRevision();
            log.trace("Committed {} to {}/{} at revision {}", commit.commitId(), commit.bucketId(), commit.streamId(), commit.streamRevision());
            return commit;
        }
    }

    @Override
    public Snapshot getSnapshot(String bucketId, String streamId, int maxRevision) {
        StreamData stream = streams.get(Bucket.key(bucketId, streamId));
        if (stream == null) {
            return null;
        }
        synchronized (stream) {
            Map.Entry<Integer, Snapshot> entry = stream.snapshots.floorEntry(maxRevision);
            return entry != null ? entry.getValue() : null;
        }
    }

    @Override
    public boolean addSnapshot(Snapshot snapshot) {
        StreamData stream = streams.computeIfAbsent(Bucket.key(snapshot.bucketId(), snapshot.streamId()), key -> new StreamData());
        synchronized (stream) {
            if (!stream.snapshots.isEmpty() && stream.snapshots.lastKey() >= snapshot.version()) {
                return false;
            }
            stream.snapshots.put(snapshot.version(), snapshot);
            return true;
        }
    }

    @Override
    public void close() {
        streams.clear();
    }

    private static final class StreamData {
        private final List<Commit> commits = new ArrayList<>();
        private final Set<UUID> commitIds = new HashSet<>();
        private final TreeMap<Integer, Snapshot> snapshots = new TreeMap<>();
        private int revision = 0;
    }
}
