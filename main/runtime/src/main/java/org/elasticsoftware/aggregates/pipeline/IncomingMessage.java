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

import jakarta.validation.constraints.NotNull;

import java.util.Map;

public class IncomingMessage {
    private final String id;
    private final String correlationId;
    private final Map<String, Object> headers;
    private final Object body;
    private MessageIntent intent;

    public IncomingMessage(@NotNull String id,
                           String correlationId,
                           Map<String, Object> headers,
                           Object body,
                           @NotNull MessageIntent intent) {
        this.id = id;
        this.correlationId = correlationId != null ? correlationId : id;
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.body = body;
        this.intent = intent;
    }

    public IncomingMessage(String id, Object body) {
        this(id, id, Map.of(), body, MessageIntent.SEND);
    }

    public String getId() {
        return id;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Map<String, Object> getHeaders() {
        return headers;
    }

    public Object getBody() {
        return body;
    }

    public MessageIntent getIntent() {
        return intent;
    }

    public void setIntent(MessageIntent intent) {
        this.intent = intent;
    }
}
