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

package org.elasticsoftware.aggregates.pipeline;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The message being handled plus whatever the behaviors in the chain attach to it, keyed by type.
 */
public class IncomingContext {
    private final IncomingMessage message;
    private final Map<Class<?>, Object> extensions = new ConcurrentHashMap<>();

    public IncomingContext(IncomingMessage message) {
        this.message = message;
    }

    public IncomingMessage getMessage() {
        return message;
    }

    public <T> void set(Class<T> type, T value) {
        extensions.put(type, value);
    }

    public <T> Optional<T> get(Class<T> type) {
        return Optional.ofNullable(type.cast(extensions.get(type)));
    }

    public <T> T require(Class<T> type) {
        return get(type).orElseThrow(() -> new IllegalStateException("No " + type.getSimpleName() + " in context of message " + message.getId()));
    }

    public void remove(Class<?> type) {
        extensions.remove(type);
    }
}
