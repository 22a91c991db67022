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

import org.elasticsoftware.aggregates.repository.UnitOfWork;
import org.elasticsoftware.aggregates.repository.UnitOfWorkFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * Runs the rest of the pipeline inside a fresh {@link UnitOfWork} and commits it. The commit id is derived from the
 * message id, a redelivered message therefore results in a duplicate commit that is ignored.
 */
public class UnitOfWorkBehavior implements Behavior {
    public static final String MESSAGE_ID_HEADER = "MessageId";
    public static final String CORRELATION_ID_HEADER = "CorrelationId";
    private final UnitOfWorkFactory unitOfWorkFactory;

    public UnitOfWorkBehavior(UnitOfWorkFactory unitOfWorkFactory) {
        this.unitOfWorkFactory = unitOfWorkFactory;
    }

    @Override
    public void invoke(IncomingContext context, Runnable next) {
        IncomingMessage message = context.getMessage();
        try (UnitOfWork unitOfWork = unitOfWorkFactory.begin()) {
            context.set(UnitOfWork.class, unitOfWork);
            next.run();
            unitOfWork.commit(commitId(message.getId()), Map.of(
                    MESSAGE_ID_HEADER, message.getId(),
                    CORRELATION_ID_HEADER, message.getCorrelationId()));
        } finally {
            context.remove(UnitOfWork.class);
        }
    }

    static UUID commitId(String messageId) {
        try {
            return UUID.fromString(messageId);
        } catch (IllegalArgumentException e) {
            return UUID.nameUUIDFromBytes(messageId.getBytes(StandardCharsets.UTF_8));
        }
    }
}
