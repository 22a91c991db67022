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

import org.elasticsoftware.aggregates.AggregateException;
import org.elasticsoftware.aggregates.ConflictingCommandException;
import org.elasticsoftware.aggregates.NotFoundException;
import org.elasticsoftware.aggregates.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Re-runs the rest of the pipeline when it fails with a recoverable error. With {@code maxRetries} set to N the
 * pipeline runs at most N + 1 times, -1 retries until it succeeds or fails with an error that is not recoverable.
 * The current {@link RetryState} is kept in the context.
 */
public class SafetyNet implements Behavior {
    private static final Logger logger = LoggerFactory.getLogger(SafetyNet.class);
    private static final List<Class<? extends RuntimeException>> RECOVERABLE = List.of(
            NotFoundException.class,
            PersistenceException.class,
            AggregateException.class,
            ConflictingCommandException.class);
    private final int maxRetries;
    private final Duration retryDelay;

    public SafetyNet(int maxRetries, Duration retryDelay) {
        if (maxRetries < -1) {
            throw new IllegalArgumentException("maxRetries must be -1 (unlimited) or at least 0, was " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.retryDelay = retryDelay;
    }

    @Override
    public void invoke(IncomingContext context, Runnable next) {
        IncomingMessage message = context.getMessage();
        if (!Objects.equals(message.getId(), message.getCorrelationId())) {
            message.setIntent(MessageIntent.REPLY);
        }
        int retries = 0;
        context.set(RetryState.class, RetryState.RUNNING);
        while (true) {
            try {
                next.run();
                context.set(RetryState.class, RetryState.SUCCEEDED);
                return;
            } catch (RuntimeException e) {
                if (!isRecoverable(e)) {
                    context.set(RetryState.class, RetryState.FATAL);
                    throw e;
                }
                if (maxRetries != -1 && retries >= maxRetries) {
                    context.set(RetryState.class, RetryState.EXHAUSTED);
                    logger.warn("Message {} failed after {} retries, giving up", message.getId(), retries);
                    throw e;
                }
                retries++;
                context.set(RetryState.class, RetryState.RETRYING);
                if (maxRetries == -1 || retries > maxRetries / 2) {
                    logger.info("Message {} failed with {}: '{}', retry {}/{}", message.getId(), e.getClass().getSimpleName(),
                            e.getMessage(), retries, maxRetries == -1 ? "unlimited" : maxRetries);
                } else {
                    logger.debug("Message {} failed with {}: '{}', retry {}/{}", message.getId(), e.getClass().getSimpleName(),
                            e.getMessage(), retries, maxRetries);
                }
                try {
                    Thread.sleep(retryDelay.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    context.set(RetryState.class, RetryState.FATAL);
                    throw e;
                }
            }
        }
    }

    static boolean isRecoverable(Throwable error) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            for (Class<? extends RuntimeException> type : RECOVERABLE) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
        }
        return false;
    }
}
