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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.aggregates.PersistenceException;
import org.elasticsoftware.aggregates.registry.VersionRegistrar;
import org.elasticsoftware.aggregates.snapshot.Memento;
import org.elasticsoftware.aggregates.snapshot.Snapshot;
import org.elasticsoftware.aggregates.store.Commit;
import org.elasticsoftware.aggregates.stream.EventMessage;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JSON encoding of commits and snapshots. Payloads are stored under their versioned type name, header values
 * should therefore be plain JSON values (strings, numbers, booleans).
 */
public final class CommitSerde {
    private final ObjectMapper objectMapper;
    private final VersionRegistrar versionRegistrar;

    public CommitSerde(ObjectMapper objectMapper, VersionRegistrar versionRegistrar) {
        this.objectMapper = objectMapper;
        this.versionRegistrar = versionRegistrar;
    }

    public byte[] serialize(Commit commit) {
        List<StoredMessage> events = new ArrayList<>(commit.events().size());
        for (EventMessage message : commit.events()) {
            events.add(new StoredMessage(versionRegistrar.getVersionedName(message.body().getClass()),
                    message.headers(),
                    objectMapper.valueToTree(message.body())));
        }
        return write(new StoredCommit(commit.bucketId(), commit.streamId(), commit.streamRevision(), commit.commitId(),
                commit.commitSequence(), commit.commitStamp().toEpochMilli(), commit.headers(), events));
    }

    public Commit deserializeCommit(byte[] data) {
        StoredCommit stored = read(data, StoredCommit.class);
        List<EventMessage> events = new ArrayList<>(stored.events().size());
        for (StoredMessage message : stored.events()) {
            events.add(new EventMessage(convert(message.payload(), message.type()), message.headers()));
        }
        return new Commit(stored.bucketId(), stored.streamId(), stored.streamRevision(), stored.commitId(),
                stored.commitSequence(), Instant.ofEpochMilli(stored.commitStamp()), stored.headers(), events);
    }

    public byte[] serialize(Snapshot snapshot) {
        return write(new StoredSnapshot(snapshot.bucketId(), snapshot.streamId(), snapshot.version(),
                versionRegistrar.getVersionedName(snapshot.payload().getClass()),
                snapshot.headers(),
                objectMapper.valueToTree(snapshot.payload())));
    }

    public Snapshot deserializeSnapshot(byte[] data) {
        StoredSnapshot stored = read(data, StoredSnapshot.class);
        Object payload = convert(stored.payload(), stored.type());
        if (!(payload instanceof Memento memento)) {
            throw new PersistenceException("Snapshot type " + stored.type() + " is not a Memento", stored.bucketId(), stored.streamId(), null);
        }
        return new Snapshot(stored.bucketId(), stored.streamId(), stored.version(), memento, stored.headers());
    }

    private Object convert(JsonNode payload, String type) {
        Class<?> payloadClass = versionRegistrar.getNamedType(type);
        try {
            return objectMapper.treeToValue(payload, payloadClass);
        } catch (IOException | IllegalArgumentException e) {
            throw new PersistenceException("Unable to deserialize payload of type " + type, e);
        }
    }

    private byte[] write(Object value) {
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new PersistenceException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(byte[] data, Class<T> type) {
        try {
            return objectMapper.readValue(data, type);
        } catch (IOException e) {
            throw new PersistenceException("Unable to deserialize " + type.getSimpleName(), e);
        }
    }

    record StoredMessage(String type, Map<String, Object> headers, JsonNode payload) {
    }

    record StoredCommit(String bucketId,
                        String streamId,
                        int streamRevision,
                        UUID commitId,
                        int commitSequence,
                        long commitStamp,
                        Map<String, Object> headers,
                        List<StoredMessage> events) {
    }

    record StoredSnapshot(String bucketId,
                          String streamId,
                          int version,
                          String type,
                          Map<String, Object> headers,
                          JsonNode payload) {
    }
}
