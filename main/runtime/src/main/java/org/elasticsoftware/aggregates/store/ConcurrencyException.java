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

import org.elasticsoftware.aggregates.AggregatesException;

/**
 * Raised by an {@link EventPersistence} when the stream head moved past the revision a commit attempt was
 * based on.
 */
public class ConcurrencyException extends AggregatesException {
    private final int expectedRevision;
    private final int actualRevision;

    public ConcurrencyException(String bucketId, String streamId, int expectedRevision, int actualRevision) {
        super("Expected " + bucketId + "/" + streamId + " at revision " + expectedRevision + " but it is at " + actualRevision,
                bucketId, streamId);
        this.expectedRevision = expectedRevision;
        this.actualRevision = actualRevision;
    }

    public int getExpectedRevision() {
        return expectedRevision;
    }

    public int getActualRevision() {
        return actualRevision;
    }
}
