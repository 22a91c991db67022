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

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;
import com.google.common.util.concurrent.Striped;
import org.elasticsoftware.aggregates.Bucket;
import org.elasticsoftware.aggregates.PersistenceException;
import org.elasticsoftware.aggregates.snapshot.Snapshot;
import org.elasticsoftware.aggregates.store.Commit;
import org.elasticsoftware.aggregates.store.CommitAttempt;
import org.elasticsoftware.aggregates.store.ConcurrencyException;
import org.elasticsoftware.aggregates.store.DuplicateCommitAttemptException;
import org.elasticsoftware.aggregates.store.EventPersistence;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Transaction;
import org.rocksdb.TransactionDB;
import org.rocksdb.TransactionDBOptions;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.Lock;

/**
 * Stores commits, commit ids, stream heads and snapshots in a single RocksDB keyspace, each kind under its own
 * one byte prefix followed by the stream key.
 */
public class RocksDBEventPersistence implements EventPersistence {
    private static final Logger log = LoggerFactory.getLogger(RocksDBEventPersistence.class);
    private static final byte HEAD = 'h';
    private static final byte COMMIT = 'c';
    private static final byte COMMIT_ID = 'i';
    private static final byte SNAPSHOT = 's';
    private static final byte SEPARATOR = 0x00;
    private final TransactionDB db;
    private final File baseDir;
    private final CommitSerde serde;
    private final Striped<Lock> streamLocks = Striped.lock(64);

    public RocksDBEventPersistence(String baseDir, String name, CommitSerde serde) {
        this.serde = serde;
        RocksDB.loadLibrary();
        final Options options = new Options();
        final TransactionDBOptions transactionDBOptions = new TransactionDBOptions();
        options.setCreateIfMissing(true);
        this.baseDir = new File(baseDir, name);
        try {
            Files.createDirectories(this.baseDir.getAbsoluteFile().toPath());
            db = TransactionDB.open(options, transactionDBOptions, this.baseDir.getAbsolutePath());
            log.info("RocksDB event store {} initialized in folder {}", name, this.baseDir.getAbsolutePath());
        } catch (IOException | RocksDBException e) {
            throw new PersistenceException("Error initializing RocksDB", e);
        }
    }

    @Override
    public List<Commit> getFrom(String bucketId, String streamId, int minRevision, int maxRevision) {
        byte[] prefix = prefix(COMMIT, bucketId, streamId);
        List<Commit> commits = new ArrayList<>();
        try (RocksIterator iterator = db.newIterator()) {
            for (iterator.seek(prefix); iterator.isValid() && startsWith(iterator.key(), prefix); iterator.next()) {
                Commit commit = serde.deserializeCommit(iterator.value());
                if (commit.previousRevision() >= maxRevision) {
                    break;
                }
                if (commit.streamRevision() >= minRevision) {
                    commits.add(commit);
                }
            }
        }
        return commits;
    }

    @Override
    public Commit commit(CommitAttempt attempt) {
        String bucketId = attempt.bucketId();
        String streamId = attempt.streamId();
        Lock lock = streamLocks.get(Bucket.key(bucketId, streamId));
        lock.lock();
        try {
            byte[] commitIdKey = Bytes.concat(prefix(COMMIT_ID, bucketId, streamId), uuidBytes(attempt.commitId()));
            if (db.get(commitIdKey) != null) {
                throw new DuplicateCommitAttemptException(bucketId, streamId, attempt.commitId());
            }
            byte[] headKey = prefix(HEAD, bucketId, streamId);
            byte[] head = db.get(headKey);
            int revision = head != null ? Ints.fromBytes(head[0], head[1], head[2], head[3]) : 0;
            int sequence = head != null ? Ints.fromBytes(head[4], head[5], head[6], head[7]) : 0;
            if (revision != attempt.expectedRevision()) {
                throw new ConcurrencyException(bucketId, streamId, attempt.expectedRevision(), revision);
            }
            Commit commit = new Commit(bucketId, streamId, attempt.streamRevision(), attempt.commitId(), sequence + 1,
                    attempt.commitStamp(), attempt.headers(), attempt.events());
            try (Transaction transaction = db.beginTransaction(new WriteOptions())) {
                transaction.put(Bytes.concat(prefix(COMMIT, bucketId, streamId), Ints.toByteArray(commit.commitSequence())), serde.serialize(commit));
                transaction.put(commitIdKey, Ints.toByteArray(commit.commitSequence()));
                transaction.put(headKey, Bytes.concat(Ints.toByteArray(commit.streamRevision()), Ints.toByteArray(commit.commitSequence())));
                transaction.commit();
            }
            log.trace("Committed {} to {}/{} at revision {}", commit.commitId(), bucketId, streamId, commit.streamRevision());
            return commit;
        } catch (RocksDBException e) {
            throw new PersistenceException("Error committing " + attempt.commitId(), bucketId, streamId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Snapshot getSnapshot(String bucketId, String streamId, int maxRevision) {
        byte[] prefix = prefix(SNAPSHOT, bucketId, streamId);
        try (RocksIterator iterator = db.newIterator()) {
            iterator.seekForPrev(Bytes.concat(prefix, Ints.toByteArray(maxRevision)));
            if (iterator.isValid() && startsWith(iterator.key(), prefix)) {
                return serde.deserializeSnapshot(iterator.value());
            }
            return null;
        }
    }

    @Override
    public boolean addSnapshot(Snapshot snapshot) {
        Lock lock = streamLocks.get(Bucket.key(snapshot.bucketId(), snapshot.streamId()));
        lock.lock();
        try {
            Snapshot latest = getSnapshot(snapshot.bucketId(), snapshot.streamId(), Integer.MAX_VALUE);
            if (latest != null && latest.version() >= snapshot.version()) {
                return false;
            }
            db.put(Bytes.concat(prefix(SNAPSHOT, snapshot.bucketId(), snapshot.streamId()), Ints.toByteArray(snapshot.version())),
                    serde.serialize(snapshot));
            return true;
        } catch (RocksDBException e) {
            throw new PersistenceException("Error storing snapshot", snapshot.bucketId(), snapshot.streamId(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        try {
            db.syncWal();
        } catch (RocksDBException e) {
            log.error("Error syncing WAL. Exception: '{}', message: '{}'", e.getCause(), e.getMessage(), e);
        }
        db.close();
    }

    private static byte[] prefix(byte kind, String bucketId, String streamId) {
        return Bytes.concat(new byte[]{kind}, Bucket.key(bucketId, streamId).getBytes(StandardCharsets.UTF_8), new byte[]{SEPARATOR});
    }

    private static byte[] uuidBytes(UUID uuid) {
        return ByteBuffer.wrap(new byte[16]).putLong(uuid.getMostSignificantBits()).putLong(uuid.getLeastSignificantBits()).array();
    }

    private static boolean startsWith(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (key[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
