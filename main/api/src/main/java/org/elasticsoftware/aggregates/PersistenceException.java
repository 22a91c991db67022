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

package org.elasticsoftware.aggregates;

/**
 * Raised when the underlying store fails: I/O errors, (de)serialization problems or a stored type name
 * that cannot be resolved to a class.
 */
public class PersistenceException extends AggregatesException {
    public PersistenceException(String message) {
        super(message, null, null);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, null, null, cause);
    }

    public PersistenceException(String message, String bucketId, String streamId, Throwable cause) {
        super(message, bucketId, streamId, cause);
    }
}
