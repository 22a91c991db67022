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

package org.elasticsoftware.aggregates.stream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.aggregates.snapshot.Memento;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record EventMessage(@NotNull Object body, @NotNull Map<String, Object> headers) {
    public static final String STREAM_VERSION_HEADER = "StreamVersion";
    public static final String COMMIT_VERSION_HEADER = "CommitVersion";

    public EventMessage {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Snapshot markers travel in the same buffer as events but don't count as a stream version and are
     * never replayed.
     */
    @JsonIgnore
    public boolean isSnapshotMarker() {
        return body instanceof Memento;
    }
}
