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
import org.elasticsoftware.aggregates.snapshot.SnapshotReader;
import org.elasticsoftware.aggregates.stream.EventStream;

public interface EventStore extends SnapshotReader {
    /**
     * Opens the stream with the events between {@code minVersion} and {@code maxVersion} (inclusive).
     *
     * @return the stream, or {@code null} when nothing was ever committed to it
     */
    @Nullable
    EventStream openStream(String bucketId, String streamId, int minVersion, int maxVersion);

    /**
     * Opens the stream using {@code snapshot} as its base, only loading the events after the snapshot.
     */
    EventStream openStream(Snapshot snapshot, int maxVersion);

    EventStream createStream(String bucketId, String streamId);

    /**
     * @return {@code false} when a snapshot with the same or a higher version is already stored
     */
    boolean addSnapshot(Snapshot snapshot);
}
