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

package org.elasticsoftware.aggregates.aggregate;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.aggregates.AggregateException;
import org.elasticsoftware.aggregates.events.DomainEvent;
import org.elasticsoftware.aggregates.events.EventFactory;
import org.elasticsoftware.aggregates.routing.EventRoute;
import org.elasticsoftware.aggregates.routing.RouteResolver;
import org.elasticsoftware.aggregates.scope.DependencyScope;
import org.elasticsoftware.aggregates.stream.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Base class of everything whose state is derived from an {@link EventStream}.
 * <p>
 * Instances are produced by an {@link EntityType} factory and then wired by the repository: identity first,
 * then the {@link Capability capabilities} declared on the type. Each of these is set exactly once.
 */
public abstract class Entity {
    private static final Logger logger = LoggerFactory.getLogger(Entity.class);
    private String bucketId;
    private String id;
    private EventStream stream;
    private DependencyScope scope;
    private EventFactory eventFactory;
    private RouteResolver routeResolver;
    private int version;

    public final void initialize(@NotNull String bucketId, @NotNull String id) {
        if (this.id != null) {
            throw new IllegalStateException("Identity of " + getClass().getSimpleName() + " was already set to " + this.bucketId + "/" + this.id);
        }
        this.bucketId = bucketId;
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public String getBucketId() {
        return bucketId;
    }

    /**
     * Number of events applied to this instance, including the ones summarized by a restored snapshot.
     */
    public int getVersion() {
        return version;
    }

    public int getCommitVersion() {
        return stream != null ? stream.getCommitVersion() : 0;
    }

    public final void setStream(@NotNull EventStream stream) {
        this.stream = assignOnce(this.stream, stream, "stream");
    }

    public final void setScope(@NotNull DependencyScope scope) {
        this.scope = assignOnce(this.scope, scope, "scope");
    }

    public final void setEventFactory(@NotNull EventFactory eventFactory) {
        this.eventFactory = assignOnce(this.eventFactory, eventFactory, "event factory");
    }

    public final void setRouteResolver(@NotNull RouteResolver routeResolver) {
        this.routeResolver = assignOnce(this.routeResolver, routeResolver, "route resolver");
    }

    protected EventStream getStream() {
        if (stream == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " was not bound to a stream");
        }
        return stream;
    }

    protected DependencyScope getScope() {
        if (scope == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " does not have a dependency scope");
        }
        return scope;
    }

    /**
     * Replays historical events, nothing is added to the stream.
     */
    public final void hydrate(Iterable<?> events) {
        for (Object event : events) {
            route(event);
            version++;
        }
    }

    protected final void apply(@NotNull DomainEvent event) {
        route(event);
        version++;
        getStream().add(event, Map.of());
        afterApply();
    }

    protected final <E extends DomainEvent> void apply(Class<E> eventType, Map<String, ?> properties) {
        if (eventFactory == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " does not have an event factory");
        }
        apply(eventFactory.create(eventType, properties));
    }

    /**
     * Called after every applied (not replayed) event.
     */
    protected void afterApply() {
    }

    protected final void restoreVersion(int version) {
        this.version = version;
    }

    private void route(Object event) {
        if (routeResolver == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " does not have a route resolver");
        }
        EventRoute route = routeResolver.resolve(getClass(), event.getClass());
        if (route == null) {
            throw new AggregateException("No handler for " + event.getClass().getName() + " on " + getClass().getSimpleName(), bucketId, id);
        }
        logger.trace("Applying {} to {} {}/{}", event.getClass().getSimpleName(), getClass().getSimpleName(), bucketId, id);
        route.apply(this, event);
    }

    private <T> T assignOnce(T current, T value, String name) {
        if (current != null) {
            throw new IllegalStateException("The " + name + " of " + getClass().getSimpleName() + " can only be set once");
        }
        return value;
    }
}
