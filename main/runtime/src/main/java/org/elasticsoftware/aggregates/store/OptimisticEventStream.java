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

import org.elasticsoftware.aggregates.ConflictingCommandException;
import org.elasticsoftware.aggregates.DuplicateCommitException;
import org.elasticsoftware.aggregates.events.DomainEvent;
import org.elasticsoftware.aggregates.snapshot.Snapshot;
import org.elasticsoftware.aggregates.stream.EventMessage;
import org.elasticsoftware.aggregates.stream.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * {@link EventStream} that detects concurrent writers by the revision it last observed. Not thread-safe, a stream
 * belongs to a single unit of work.
 */
public class OptimisticEventStream implements EventStream {
    private static final Logger log = LoggerFactory.getLogger(OptimisticEventStream.class);
    private final String bucketId;
    private final String streamId;
    private final EventPersistence persistence;
    private final List<EventMessage> committed = new ArrayList<>();
    private final List<EventMessage> uncommitted = new ArrayList<>();
    private final Map<String, Object> uncommittedHeaders = new LinkedHashMap<>();
    private final Set<UUID> commitIds = new HashSet<>();
    private int commitVersion;
    private int commitSequence;

    public OptimisticEventStream(String bucketId, String streamId, EventPersistence persistence) {
        this(bucketId, streamId, persistence, 0);
    }

    OptimisticEventStream(String bucketId, String streamId, EventPersistence persistence, int baseRevision) {
        this.bucketId = bucketId;
        this.streamId = streamId;
        this.persistence = persistence;
        this.commitVersion = baseRevision;
    }

    /**
     * Loads the stream from {@code commits}, keeping the events with a revision between {@code minRevision} and
     * {@code maxRevision}. Events before {@code minRevision} are assumed to be covered by a snapshot.
     */
    static OptimisticEventStream open(String bucketId,
                                      String streamId,
                                      EventPersistence persistence,
                                      List<Commit> commits,
                                      int minRevision,
                                      int maxRevision) {
        OptimisticEventStream stream = new OptimisticEventStream(bucketId, streamId, persistence, Math.max(minRevision - 1, 0));
        for (Commit commit : commits) {
            stream.populate(commit, minRevision, maxRevision);
        }
        log.trace("Opened {}/{} at revision {} with {} committed events", bucketId, streamId, stream.commitVersion, stream.committed.size());
        return stream;
    }

    @Override
    public String getBucketId() {
        return bucketId;
    }

    @Override
    public String getStreamId() {
        return streamId;
    }

    @Override
    public int getStreamVersion() {
        return commitVersion + Commit.countEvents(uncommitted);
    }

    @Override
    public int getCommitVersion() {
        return commitVersion;
    }

    @Override
    public List<EventMessage> getCommittedEvents() {
        return Collections.unmodifiableList(committed);
    }

    @Override
    public List<EventMessage> getUncommittedEvents() {
        return Collections.unmodifiableList(uncommitted);
    }

    @Override
    public Map<String, Object> getUncommittedHeaders() {
        return uncommittedHeaders;
    }

    @Override
    public void add(DomainEvent event, Map<String, Object> headers) {
        if (event == null) {
            throw new IllegalArgumentException("Cannot add a null event to " + bucketId + "/" + streamId);
        }
        uncommitted.add(new EventMessage(event, headers));
    }

    @Override
    public void add(Snapshot snapshot, Map<String, Object> headers) {
        Map<String, Object> markerHeaders = new LinkedHashMap<>(headers);
        markerHeaders.put(EventMessage.STREAM_VERSION_HEADER, snapshot.version());
        markerHeaders.put(EventMessage.COMMIT_VERSION_HEADER, getCommitVersion());
        uncommitted.add(new EventMessage(snapshot.payload(), markerHeaders));
    }

    @Override
    public void commit(UUID commitId, Map<String, Object> commitHeaders) {
        if (commitIds.contains(commitId)) {
            throw new DuplicateCommitException(bucketId, streamId, commitId);
        }
        if (uncommitted.isEmpty()) {
            log.trace("Nothing to commit for {}/{}", bucketId, streamId);
            return;
        }
        uncommittedHeaders.putAll(commitHeaders);
        CommitAttempt attempt = new CommitAttempt(bucketId, streamId, getStreamVersion(), commitId, commitSequence + 1,
                Instant.now(), uncommittedHeaders, uncommitted);
        try {
            Commit commit = persistence.commit(attempt);
            populate(commit, commitVersion, Integer.MAX_VALUE);
            clearChanges();
            log.debug("Committed {} events to {}/{}, now at revision {}", attempt.events().size(), bucketId, streamId, commitVersion);
        } catch (ConcurrencyException e) {
            throw new ConflictingCommandException("Stream " + bucketId + "/" + streamId + " was changed by another writer",
                    bucketId, streamId, e);
        } catch (DuplicateCommitAttemptException e) {
            commitIds.add(commitId);
            throw new DuplicateCommitException(bucketId, streamId, commitId, e);
        }
    }

    @Override
    public void clearChanges() {
        uncommitted.clear();
        uncommittedHeaders.clear();
    }

    @Override
    public void close() {
        committed.clear();
        clearChanges();
        commitIds.clear();
    }

    private void populate(Commit commit, int minRevision, int maxRevision) {
        int revision = commit.previousRevision();
        for (EventMessage message : commit.events()) {
            if (!message.isSnapshotMarker()) {
                revision++;
            }
            if (revision >= minRevision && revision <= maxRevision) {
                committed.add(message);
                commitVersion = Math.max(commitVersion, revision);
            }
        }
        commitSequence = commit.commitSequence();
        commitIds.add(commit.commitId());
    }
}
