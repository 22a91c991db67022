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
import org.elasticsoftware.aggregates.domain.ItemAdded;
import org.elasticsoftware.aggregates.domain.OrderCreated;
import org.elasticsoftware.aggregates.domain.OrderMemento;
import org.elasticsoftware.aggregates.snapshot.Snapshot;
import org.elasticsoftware.aggregates.stream.EventMessage;
import org.elasticsoftware.aggregates.stream.EventStream;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class OptimisticEventStreamTests {
    private final InMemoryEventPersistence persistence = new InMemoryEventPersistence();
    private final OptimisticEventStore eventStore = new OptimisticEventStore(persistence);

    @Test
    public void testAddDoesNotMoveCommitVersion() {
        EventStream stream = eventStore.createStream("default", "42");
        stream.add(new OrderCreated("42", "acme"), Map.of());
        stream.add(new ItemAdded("sku-1", 1), Map.of());

        assertEquals(2, stream.getStreamVersion());
        assertEquals(0, stream.getCommitVersion());
        assertEquals(2, stream.getUncommittedEvents().size());
        assertTrue(stream.getCommittedEvents().isEmpty());
    }

    @Test
    public void testCommitMovesPendingToCommitted() {
        EventStream stream = eventStore.createStream("default", "42");
        stream.add(new OrderCreated("42", "acme"), Map.of("source", "test"));
        stream.add(new ItemAdded("sku-1", 1), Map.of());
        stream.commit(UUID.randomUUID(), Map.of("user", "alice"));

        assertEquals(2, stream.getStreamVersion());
        assertEquals(2, stream.getCommitVersion());
        assertTrue(stream.getUncommittedEvents().isEmpty());
        assertTrue(stream.getUncommittedHeaders().isEmpty());
        assertEquals(List.of(new OrderCreated("42", "acme"), new ItemAdded("sku-1", 1)),
                stream.getCommittedEvents().stream().map(EventMessage::body).toList());
        assertEquals("test", stream.getCommittedEvents().get(0).headers().get("source"));

        List<Commit> commits = persistence.getFrom("default", "42", 0, Integer.MAX_VALUE);
        assertEquals(1, commits.size());
        assertEquals("alice", commits.get(0).headers().get("user"));
        assertEquals(1, commits.get(0).commitSequence());
    }

    @Test
    public void testEmptyCommitIsNoop() {
        EventPersistence mockPersistence = mock(EventPersistence.class);
        EventStream stream = new OptimisticEventStream("default", "42", mockPersistence);
        stream.commit(UUID.randomUUID(), Map.of());
        verify(mockPersistence, never()).commit(any());
        assertEquals(0, stream.getCommitVersion());
    }

    @Test
    public void testSnapshotMarkerCarriesTheSnapshotVersion() {
        EventStream stream = eventStore.createStream("default", "42");
        stream.add(new OrderCreated("42", "acme"), Map.of());
        stream.add(new ItemAdded("sku-1", 1), Map.of());
        stream.add(new ItemAdded("sku-2", 1), Map.of());
        stream.add(new Snapshot("default", "42", 1, new OrderMemento("acme", List.of())), Map.of());

        assertEquals(3, stream.getStreamVersion());
        EventMessage marker = stream.getUncommittedEvents().get(3);
        assertEquals(1, marker.headers().get(EventMessage.STREAM_VERSION_HEADER));
        assertEquals(0, marker.headers().get(EventMessage.COMMIT_VERSION_HEADER));
    }

    @Test
    public void testSnapshotMarkerIsStampedAndDoesNotCount() {
        EventStream stream = eventStore.createStream("default", "42");
        stream.add(new OrderCreated("42", "acme"), Map.of());
        stream.commit(UUID.randomUUID(), Map.of());
        stream.add(new ItemAdded("sku-1", 1), Map.of());
        stream.add(new Snapshot("default", "42", 2, new OrderMemento("acme", List.of("sku-1"))), Map.of());

        assertEquals(2, stream.getStreamVersion());
        EventMessage marker = stream.getUncommittedEvents().get(1);
        assertTrue(marker.isSnapshotMarker());
        assertEquals(2, marker.headers().get(EventMessage.STREAM_VERSION_HEADER));
        assertEquals(1, marker.headers().get(EventMessage.COMMIT_VERSION_HEADER));

        stream.commit(UUID.randomUUID(), Map.of());
        assertEquals(2, stream.getCommitVersion());
        assertEquals(3, stream.getCommittedEvents().size());
    }

    @Test
    public void testOpenStreamReturnsNullWhenNothingCommitted() {
        assertNull(eventStore.openStream("default", "unknown", 0, Integer.MAX_VALUE));
    }

    @Test
    public void testOpenStreamRespectsVersionRange() {
        EventStream stream = eventStore.createStream("default", "42");
        stream.add(new OrderCreated("42", "acme"), Map.of());
        stream.add(new ItemAdded("sku-1", 1), Map.of());
        stream.commit(UUID.randomUUID(), Map.of());
        stream.add(new ItemAdded("sku-2", 1), Map.of());
        stream.commit(UUID.randomUUID(), Map.of());

        EventStream partial = eventStore.openStream("default", "42", 0, 2);
        assertNotNull(partial);
        assertEquals(2, partial.getCommitVersion());
        assertEquals(2, partial.getCommittedEvents().size());

        EventStream fromSnapshot = eventStore.openStream(new Snapshot("default", "42", 2, new OrderMemento("acme", List.of("sku-1"))), Integer.MAX_VALUE);
        assertEquals(3, fromSnapshot.getCommitVersion());
        assertEquals(List.of(new ItemAdded("sku-2", 1)), fromSnapshot.getCommittedEvents().stream().map(EventMessage::body).toList());
    }

    @Test
    public void testConcurrentWriterCausesConflict() {
        EventStream first = eventStore.createStream("default", "42");
        first.add(new OrderCreated("42", "acme"), Map.of());
        first.commit(UUID.randomUUID(), Map.of());

        EventStream writerA = eventStore.openStream("default", "42", 0, Integer.MAX_VALUE);
        EventStream writerB = eventStore.openStream("default", "42", 0, Integer.MAX_VALUE);
        writerA.add(new ItemAdded("sku-1", 1), Map.of());
        writerA.commit(UUID.randomUUID(), Map.of());
        writerB.add(new ItemAdded("sku-2", 1), Map.of());

        ConflictingCommandException exception = assertThrows(ConflictingCommandException.class,
                () -> writerB.commit(UUID.randomUUID(), Map.of()));
        ConcurrencyException cause = assertInstanceOf(ConcurrencyException.class, exception.getCause());
        assertEquals(1, cause.getExpectedRevision());
        assertEquals(2, cause.getActualRevision());
        assertEquals("42", exception.getStreamId());
        // pending changes are left for the caller to discard
        assertEquals(1, writerB.getUncommittedEvents().size());
    }

    @Test
    public void testDuplicateCommitIsDetectedLocallyAndByTheStore() {
        UUID commitId = UUID.randomUUID();
        EventStream stream = eventStore.createStream("default", "42");
        stream.add(new OrderCreated("42", "acme"), Map.of());
        stream.commit(commitId, Map.of());

        stream.add(new ItemAdded("sku-1", 1), Map.of());
        DuplicateCommitException local = assertThrows(DuplicateCommitException.class, () -> stream.commit(commitId, Map.of()));
        assertNull(local.getCause());
        assertEquals(commitId, local.getCommitId());

        EventStream other = eventStore.createStream("default", "42");
        other.add(new OrderCreated("42", "acme"), Map.of());
        DuplicateCommitException remote = assertThrows(DuplicateCommitException.class, () -> other.commit(commitId, Map.of()));
        assertInstanceOf(DuplicateCommitAttemptException.class, remote.getCause());
    }

    @Test
    public void testClearChangesAndClose() {
        EventStream stream = eventStore.createStream("default", "42");
        stream.add(new OrderCreated("42", "acme"), Map.of());
        stream.getUncommittedHeaders().put("key", "value");
        stream.clearChanges();
        assertTrue(stream.getUncommittedEvents().isEmpty());
        assertTrue(stream.getUncommittedHeaders().isEmpty());
        assertEquals(0, stream.getStreamVersion());

        stream.add(new OrderCreated("42", "acme"), Map.of());
        stream.commit(UUID.randomUUID(), Map.of());
        stream.close();
        assertTrue(stream.getCommittedEvents().isEmpty());
    }
}
