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

package org.elasticsoftware.aggregates.events;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Builds events from a property map by letting Jackson bind the map onto the event type.
 */
public class JacksonEventFactory implements EventFactory {
    private final ObjectMapper objectMapper;

    public JacksonEventFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public <E extends DomainEvent> E create(Class<E> eventType, Map<String, ?> properties) {
        try {
            return objectMapper.convertValue(properties, eventType);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unable to create " + eventType.getSimpleName() + " from " + properties.keySet(), e);
        }
    }
}
