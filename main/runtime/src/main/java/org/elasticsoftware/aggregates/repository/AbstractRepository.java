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
import org.elasticsoftware.aggregates.DuplicateCommitException;
import org.elasticsoftware.aggregates.aggregate.Capability;
import org.elasticsoftware.aggregates.aggregate.CapabilityContext;
import org.elasticsoftware.aggregates.aggregate.Entity;
import org.elasticsoftware.aggregates.aggregate.EntityType;
import org.elasticsoftware.aggregates.aggregate.Snapshotting;
import org.elasticsoftware.aggregates.scope.DependencyScope;
import org.elasticsoftware.aggregates.snapshot.Snapshot;
import org.elasticsoftware.aggregates.store.EventStore;
import org.elasticsoftware.aggregates.stream.EventMessage;
import org.elasticsoftware.aggregates.stream.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Stream and snapshot caching, instance wiring, hydration and commit shared by the aggregate and entity
 * repositories. Both caches are keyed by {@code bucketId/streamId} and live as long as the repository.
 */
public abstract class AbstractRepository<T extends Entity> {
    private static final Logger logger = LoggerFactory.getLogger(AbstractRepository.class);
    protected final EntityType<T> entityType;
    private final EventStore eventStore;
    private final DependencyScope scope;
    private final RepositoryFactory repositoryFactory;
    private final Map<String, EventStream> streams = new ConcurrentHashMap<>();
    private final Queue<String> commitOrder = new ConcurrentLinkedQueue<>();
    private final Map<String, Optional<Snapshot>> snapshots = new ConcurrentHashMap<>();
    private final Queue<DependencyScope> childScopes = new ConcurrentLinkedQueue<>();
    private volatile boolean closed = false;

    protected AbstractRepository(EntityType<T> entityType,
                                 EventStore eventStore,
                                 DependencyScope scope,
                                 RepositoryFactory repositoryFactory) {
        this.entityType = entityType;
        this.eventStore = eventStore;
        this.scope = scope;
        this.repositoryFactory = repositoryFactory;
    }

    protected T load(String bucketId, String streamId, String id, int version) {
        ensureOpen();
        String key = Bucket.key(bucketId, streamId);
        Snapshot snapshot = entityType.supportsSnapshots() ? getSnapshot(key, bucketId, streamId) : null;
        if (snapshot != null && snapshot.version() > version) {
            return loadHistorical(bucketId, streamId, id, version);
        }
        EventStream stream = streams.get(key);
        if (stream == null) {
            stream = openStream(key, bucketId, streamId, snapshot);
            if (stream == null) {
                logger.debug("No stream or snapshot found for {} {}", entityType.typeName(), key);
                return null;
            }
        }
        T instance = newInstance(bucketId, id, stream);
        if (snapshot != null && instance instanceof Snapshotting snapshotting) {
            logger.trace("Restoring {} {} from snapshot version {}", entityType.typeName(), key, snapshot.version());
            snapshotting.restoreSnapshot(snapshot);
        }
        if (instance.getVersion() < version) {
            instance.hydrate(eventsToReplay(stream, version - instance.getVersion()));
        }
        logger.debug("Loaded {} {} at version {}", entityType.typeName(), key, instance.getVersion());
        return instance;
    }

    protected T prepare(String bucketId, String streamId, String id) {
        ensureOpen();
        String key = Bucket.key(bucketId, streamId);
        EventStream stream = streams.computeIfAbsent(key, k -> {
            commitOrder.add(k);
            return eventStore.createStream(bucketId, streamId);
        });
        logger.debug("Created {} {}", entityType.typeName(), key);
        return newInstance(bucketId, id, stream);
    }

    /**
     * Commits every cached stream in the order it entered the cache. A conflict does not stop the remaining
     * streams from being committed, the first one is rethrown afterwards with any later ones suppressed.
     */
    public void commit(UUID commitId, Map<String, Object> headers) {
        ensureOpen();
        ConflictingCommandException conflict = null;
        for (String key : commitOrder) {
            EventStream stream = streams.get(key);
            try {
                stream.commit(commitId, headers);
            } catch (DuplicateCommitException e) {
                logger.debug("Commit {} was already applied to {}, discarding changes", commitId, key);
                stream.clearChanges();
            } catch (ConflictingCommandException e) {
                logger.debug("Commit {} conflicts with a concurrent change to {}, discarding changes", commitId, key);
                stream.clearChanges();
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

    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        streams.values().forEach(EventStream::close);
        streams.clear();
        commitOrder.clear();
        snapshots.clear();
        for (DependencyScope childScope : childScopes) {
            try {
                childScope.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing dependency scope of {}. Exception: '{}', message: '{}'",
                        entityType.typeName(), e.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        childScopes.clear();
    }

    protected static String toId(Object id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return id.toString();
    }

    private Snapshot getSnapshot(String key, String bucketId, String streamId) {
        return snapshots
                .computeIfAbsent(key, k -> Optional.ofNullable(eventStore.getSnapshot(bucketId, streamId, Integer.MAX_VALUE)))
                .orElse(null);
    }

    /**
     * Loads a version older than the cached snapshot from a stream of its own. That stream is not cached, so
     * changes made to the returned instance are never committed.
     */
    private T loadHistorical(String bucketId, String streamId, String id, int version) {
        EventStream stream = eventStore.openStream(bucketId, streamId, 0, version);
        if (stream == null) {
            return null;
        }
        T instance = newInstance(bucketId, id, stream);
        instance.hydrate(eventsToReplay(stream, version));
        logger.debug("Loaded {} {}/{} at historical version {}", entityType.typeName(), bucketId, streamId, instance.getVersion());
        return instance;
    }

    private EventStream openStream(String key, String bucketId, String streamId, Snapshot snapshot) {
        return streams.computeIfAbsent(key, k -> {
            EventStream opened = snapshot == null
                    ? eventStore.openStream(bucketId, streamId, 0, Integer.MAX_VALUE)
                    : eventStore.openStream(snapshot, Integer.MAX_VALUE);
            if (opened != null) {
                commitOrder.add(k);
            }
            return opened;
        });
    }

    private T newInstance(String bucketId, String id, EventStream stream) {
        T instance = entityType.newInstance();
        instance.initialize(bucketId, id);
        DependencyScope childScope = scope.createChildScope();
        childScopes.add(childScope);
        CapabilityContext context = new CapabilityContext(stream, childScope, repositoryFactory);
        for (Capability capability : entityType.capabilities()) {
            capability.inject(instance, context);
        }
        return instance;
    }

    private static List<Object> eventsToReplay(EventStream stream, int count) {
        List<Object> events = new ArrayList<>();
        appendEvents(stream.getCommittedEvents(), events, count);
        appendEvents(stream.getUncommittedEvents(), events, count);
        return events;
    }

    private static void appendEvents(List<EventMessage> messages, List<Object> events, int count) {
        for (EventMessage message : messages) {
            if (events.size() >= count) {
                return;
            }
            if (!message.isSnapshotMarker()) {
                events.add(message.body());
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Repository for " + entityType.typeName() + " was closed");
        }
    }
}
