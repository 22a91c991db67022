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

package org.elasticsoftware.aggregates.store.rocksdb;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.aggregates.PersistenceException;
import org.elasticsoftware.aggregates.domain.ItemAdded;
import org.elasticsoftware.aggregates.domain.OrderCreated;
import org.elasticsoftware.aggregates.domain.OrderMemento;
import org.elasticsoftware.aggregates.registry.AnnotationVersionRegistrar;
import org.elasticsoftware.aggregates.snapshot.Snapshot;
import org.elasticsoftware.aggregates.store.Commit;
import org.elasticsoftware.aggregates.store.ConcurrencyException;
import org.elasticsoftware.aggregates.store.DuplicateCommitAttemptException;
import org.elasticsoftware.aggregates.store.OptimisticEventStore;
import org.elasticsoftware.aggregates.stream.EventMessage;
import org.elasticsoftware.aggregates.stream.EventStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class RocksDBEventPersistenceTests {
    @TempDir
    Path baseDir;
    private CommitSerde serde;

    @BeforeEach
    public void setUp() {
        AnnotationVersionRegistrar registrar = new AnnotationVersionRegistrar();
        registrar.load(List.of(OrderCreated.class, ItemAdded.class, OrderMemento.class));
        serde = new CommitSerde(new ObjectMapper(), registrar);
    }

    @Test
    public void testEmptyStore() {
        try (RocksDBEventPersistence persistence = new RocksDBEventPersistence(baseDir.toString(), "events", serde)) {
            assertTrue(persistence.getFrom("default", "42", 0, Integer.MAX_VALUE).isEmpty());
            assertNull(persistence.getSnapshot("default", "42", Integer.MAX_VALUE));
        }
    }

    @Test
    public void testCommitsSurviveReopen() {
        UUID commitId = UUID.randomUUID();
        try (RocksDBEventPersistence persistence = new RocksDBEventPersistence(baseDir.toString(), "events", serde)) {
            OptimisticEventStore eventStore = new OptimisticEventStore(persistence);
            EventStream stream = eventStore.createStream("default", "42");
            stream.add(new OrderCreated("42", "acme"), Map.of("source", "test"));
            stream.add(new ItemAdded("sku-1", 2), Map.of());
            stream.commit(commitId, Map.of("user", "alice"));
            stream.add(new ItemAdded("sku-2", 1), Map.of());
            stream.commit(UUID.randomUUID(), Map.of());
        }
        try (RocksDBEventPersistence persistence = new RocksDBEventPersistence(baseDir.toString(), "events", serde)) {
            List<Commit> commits = persistence.getFrom("default", "42", 0, Integer.MAX_VALUE);
            assertEquals(2, commits.size());
            Commit first = commits.get(0);
            assertEquals(commitId, first.commitId());
            assertEquals(2, first.streamRevision());
            assertEquals(1, first.commitSequence());
            assertEquals("alice", first.headers().get("user"));
            assertEquals(List.of(new OrderCreated("42", "acme"), new ItemAdded("sku-1", 2)),
                    first.events().stream().map(EventMessage::body).toList());
            assertEquals("test", first.events().get(0).headers().get("source"));

            assertEquals(1, persistence.getFrom("default", "42", 3, Integer.MAX_VALUE).size());
            assertEquals(1, persistence.getFrom("default", "42", 0, 2).size());

            EventStream reopened = new OptimisticEventStore(persistence).openStream("default", "42", 0, Integer.MAX_VALUE);
            assertNotNull(reopened);
            assertEquals(3, reopened.getCommitVersion());
        }
    }

    @Test
    public void testStreamKeysDoNotOverlap() {
        try (RocksDBEventPersistence persistence = new RocksDBEventPersistence(baseDir.toString(), "events", serde)) {
            OptimisticEventStore eventStore = new OptimisticEventStore(persistence);
            EventStream stream = eventStore.createStream("default", "4");
            stream.add(new OrderCreated("4", "acme"), Map.of());
            stream.commit(UUID.randomUUID(), Map.of());
            EventStream other = eventStore.createStream("default", "42");
            other.add(new OrderCreated("42", "acme"), Map.of());
            other.commit(UUID.randomUUID(), Map.of());

            assertEquals(1, persistence.getFrom("default", "4", 0, Integer.MAX_VALUE).size());
            assertEquals(1, persistence.getFrom("default", "42", 0, Integer.MAX_VALUE).size());
        }
    }

    @Test
    public void testConflictAndDuplicate() {
        UUID commitId = UUID.randomUUID();
        try (RocksDBEventPersistence persistence = new RocksDBEventPersistence(baseDir.toString(), "events", serde)) {
            OptimisticEventStore eventStore = new OptimisticEventStore(persistence);
            EventStream stream = eventStore.createStream("default", "42");
            stream.add(new OrderCreated("42", "acme"), Map.of());
            stream.commit(commitId, Map.of());

            EventStream stale = eventStore.createStream("default", "42");
            stale.add(new OrderCreated("42", "other"), Map.of());
            assertInstanceOf(ConcurrencyException.class,
                    assertThrows(RuntimeException.class, () -> stale.commit(UUID.randomUUID(), Map.of())).getCause());
            assertInstanceOf(DuplicateCommitAttemptException.class,
                    assertThrows(RuntimeException.class, () -> stale.commit(commitId, Map.of())).getCause());
        }
    }

    @Test
    public void testSnapshots() {
        try (RocksDBEventPersistence persistence = new RocksDBEventPersistence(baseDir.toString(), "events", serde)) {
            assertTrue(persistence.addSnapshot(new Snapshot("default", "42", 2, new OrderMemento("acme", List.of("sku-1")), Map.of("taken-by", "test"))));
            assertTrue(persistence.addSnapshot(new Snapshot("default", "42", 10, new OrderMemento("acme", List.of("sku-1", "sku-2")))));
            assertFalse(persistence.addSnapshot(new Snapshot("default", "42", 10, new OrderMemento("acme", List.of()))));

            Snapshot latest = persistence.getSnapshot("default", "42", Integer.MAX_VALUE);
            assertEquals(10, latest.version());
            assertEquals(new OrderMemento("acme", List.of("sku-1", "sku-2")), latest.payload());

            Snapshot older = persistence.getSnapshot("default", "42", 9);
            assertEquals(2, older.version());
            assertEquals("test", older.headers().get("taken-by"));
            assertNull(persistence.getSnapshot("default", "42", 1));
            assertNull(persistence.getSnapshot("default", "4", Integer.MAX_VALUE));
        }
    }

    @Test
    public void testUnregisteredTypeFails() {
        CommitSerde emptySerde = new CommitSerde(new ObjectMapper(), new AnnotationVersionRegistrar());
        try (RocksDBEventPersistence persistence = new RocksDBEventPersistence(baseDir.toString(), "events", emptySerde)) {
            EventStream stream = new OptimisticEventStore(persistence).createStream("default", "42");
            stream.add(new OrderCreated("42", "acme"), Map.of());
            assertThrows(PersistenceException.class, () -> stream.commit(UUID.randomUUID(), Map.of()));
        }
    }
}
