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

import org.elasticsoftware.aggregates.AggregateException;
import org.elasticsoftware.aggregates.aggregate.Entity;
import org.elasticsoftware.aggregates.annotations.EventSourcingHandler;
import org.elasticsoftware.aggregates.domain.ItemAdded;
import org.elasticsoftware.aggregates.domain.Order;
import org.elasticsoftware.aggregates.domain.OrderCreated;
import org.elasticsoftware.aggregates.domain.QuantityChanged;
import org.elasticsoftware.aggregates.events.DomainEvent;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AnnotationRouteResolverTests {
    private final AnnotationRouteResolver resolver = new AnnotationRouteResolver();

    interface Audited extends DomainEvent {
    }

    record Checked(String by) implements Audited {
    }

    static class Base extends Entity {
        final List<String> handled = new ArrayList<>();

        @EventSourcingHandler
        void onCreated(OrderCreated event) {
            handled.add("base:" + event.customer());
        }

        @EventSourcingHandler
        void onAudited(Audited event) {
            handled.add("audited");
        }
    }

    static class Derived extends Base {
        @EventSourcingHandler
        void onCreatedAgain(OrderCreated event) {
            handled.add("derived:" + event.customer());
        }

        @EventSourcingHandler
        void onItem(ItemAdded event) throws IOException {
            throw new IOException("cannot add " + event.sku());
        }

        @EventSourcingHandler
        void onQuantity(QuantityChanged event) {
            throw new AggregateException("negative quantity");
        }
    }

    static class Invalid extends Entity {
        @EventSourcingHandler
        void on(OrderCreated event, String extra) {
        }
    }

    @Test
    public void testRoutesToAnnotatedMethods() {
        Order order = new Order();
        EventRoute route = resolver.resolve(Order.class, OrderCreated.class);
        assertNotNull(route);
        route.apply(order, new OrderCreated("42", "acme"));
        assertEquals("acme", order.getCustomer());
        assertNull(resolver.resolve(Order.class, QuantityChanged.class));
    }

    @Test
    public void testSubclassHandlersWinAndSupertypesMatch() {
        Derived derived = new Derived();
        resolver.resolve(Derived.class, OrderCreated.class).apply(derived, new OrderCreated("42", "acme"));
        resolver.resolve(Derived.class, Checked.class).apply(derived, new Checked("bob"));
        assertEquals(List.of("derived:acme", "audited"), derived.handled);
    }

    @Test
    public void testHandlerExceptionsAreUnwrapped() {
        Derived derived = new Derived();
        AggregateException aggregateException = assertThrows(AggregateException.class,
                () -> resolver.resolve(Derived.class, QuantityChanged.class).apply(derived, new QuantityChanged(-1)));
        assertEquals("negative quantity", aggregateException.getMessage());

        RuntimeException wrapped = assertThrows(RuntimeException.class,
                () -> resolver.resolve(Derived.class, ItemAdded.class).apply(derived, new ItemAdded("sku-1", 1)));
        assertInstanceOf(IOException.class, wrapped.getCause());
    }

    @Test
    public void testInvalidHandlerSignature() {
        assertThrows(IllegalStateException.class, () -> resolver.resolve(Invalid.class, OrderCreated.class));
    }
}
