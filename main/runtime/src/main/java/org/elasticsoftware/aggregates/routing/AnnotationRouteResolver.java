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

package org.elasticsoftware.aggregates.routing;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.elasticsoftware.aggregates.aggregate.Entity;
import org.elasticsoftware.aggregates.annotations.EventSourcingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.HashMap;
import java.util.Map;

/**
 * Routes events to the single argument methods annotated with {@link EventSourcingHandler}. The handler table of an
 * entity class is built once, on first use, and includes the handlers declared on its superclasses. When no handler
 * matches the exact event class a handler for one of its supertypes is used.
 */
public class AnnotationRouteResolver implements RouteResolver {
    private static final Logger logger = LoggerFactory.getLogger(AnnotationRouteResolver.class);
    private final LoadingCache<Class<? extends Entity>, Map<Class<?>, EventRoute>> routeTables = Caffeine.newBuilder()
            .maximumSize(1024)
            .build(AnnotationRouteResolver::scan);

    @Override
    public EventRoute resolve(Class<? extends Entity> entityType, Class<?> eventType) {
        Map<Class<?>, EventRoute> routes = routeTables.get(entityType);
        EventRoute route = routes.get(eventType);
        if (route != null) {
            return route;
        }
        for (Map.Entry<Class<?>, EventRoute> entry : routes.entrySet()) {
            if (entry.getKey().isAssignableFrom(eventType)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static Map<Class<?>, EventRoute> scan(Class<? extends Entity> entityType) {
        Map<Class<?>, EventRoute> routes = new HashMap<>();
        for (Class<?> current = entityType; current != null && current != Entity.class; current = current.getSuperclass()) {
            for (Method method : current.getDeclaredMethods()) {
                if (method.isAnnotationPresent(EventSourcingHandler.class)) {
                    if (method.getParameterCount() != 1 || Modifier.isStatic(method.getModifiers())) {
                        throw new IllegalStateException("@EventSourcingHandler " + current.getName() + "." + method.getName()
                                + " must be an instance method with exactly one parameter");
                    }
                    method.setAccessible(true);
                    // handlers declared on a subclass take precedence
                    routes.putIfAbsent(method.getParameterTypes()[0], (target, event) -> invoke(method, target, event));
                }
            }
        }
        logger.debug("Found {} event sourcing handlers on {}", routes.size(), entityType.getName());
        return Map.copyOf(routes);
    }

    private static void invoke(Method method, Entity target, Object event) {
        try {
            method.invoke(target, event);
        } catch (IllegalAccessException e) {
            throw new RuntimeException(e);
        } catch (InvocationTargetException e) {
            if (e.getCause() != null) {
                if (e.getCause() instanceof RuntimeException) {
                    throw (RuntimeException) e.getCause();
                } else {
                    throw new RuntimeException(e.getCause());
                }
            } else {
                throw new RuntimeException(e);
            }
        }
    }
}
