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

import org.elasticsoftware.aggregates.events.EventFactory;
import org.elasticsoftware.aggregates.routing.RouteResolver;

/**
 * Something an {@link Entity} needs to have injected after construction. The set an entity needs is declared
 * once on its {@link EntityType}.
 */
public enum Capability {
    STREAM {
        @Override
        public void inject(Entity target, CapabilityContext context) {
            target.setStream(context.stream());
        }
    },
    SCOPE {
        @Override
        public void inject(Entity target, CapabilityContext context) {
            target.setScope(context.scope());
        }
    },
    EVENT_FACTORY {
        @Override
        public void inject(Entity target, CapabilityContext context) {
            target.setEventFactory(context.scope().build(EventFactory.class));
        }
    },
    ROUTE_RESOLVER {
        @Override
        public void inject(Entity target, CapabilityContext context) {
            target.setRouteResolver(context.scope().build(RouteResolver.class));
        }
    },
    REPOSITORY_FACTORY {
        @Override
        public void inject(Entity target, CapabilityContext context) {
            if (!(target instanceof Aggregate aggregate)) {
                throw new IllegalArgumentException(target.getClass().getSimpleName() + " is not an Aggregate and cannot own entities");
            }
            aggregate.setRepositoryFactory(context.repositoryFactory());
        }
    };

    public abstract void inject(Entity target, CapabilityContext context);
}
