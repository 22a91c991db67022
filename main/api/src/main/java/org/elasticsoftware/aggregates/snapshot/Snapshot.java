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

package org.elasticsoftware.aggregates.snapshot;

import jakarta.validation.constraints.NotNull;

import java.util.Map;

public record Snapshot(@NotNull String bucketId,
                       @NotNull String streamId,
                       int version,
                       @NotNull Memento payload,
                       @NotNull Map<String, Object> headers) {
    public Snapshot {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public Snapshot(String bucketId, String streamId, int version, Memento payload) {
        this(bucketId, streamId, version, payload, Map.of());
    }
}
