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

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.aggregates.stream.EventMessage;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record CommitAttempt(@NotNull String bucketId,
                            @NotNull String streamId,
                            int streamRevision,
                            @NotNull UUID commitId,
                            int commitSequence,
                            @NotNull Instant commitStamp,
                            @NotNull Map<String, Object> headers,
                            @NotNull List<EventMessage> events) {
    public CommitAttempt {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        events = List.copyOf(events);
    }

    /**
     * The revision the writer observed, a store accepts the attempt only when its head is still there.
     */
    public int expectedRevision() {
        return streamRevision - Commit.countEvents(events);
    }

    public Commit toCommit() {
        return new Commit(bucketId, streamId, streamRevision, commitId, commitSequence, commitStamp, headers, events);
    }
}
