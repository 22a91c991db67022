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

package org.elasticsoftware.aggregates.domain;

import org.elasticsoftware.aggregates.aggregate.Entity;
import org.elasticsoftware.aggregates.aggregate.EntityType;
import org.elasticsoftware.aggregates.annotations.EventSourcingHandler;

import java.util.Map;

public class OrderLine extends Entity {
    public static final EntityType<OrderLine> TYPE = EntityType.of(OrderLine.class, OrderLine::new);
    private int quantity;

    public void changeQuantity(int quantity) {
        apply(QuantityChanged.class, Map.of("quantity", quantity));
    }

    public int getQuantity() {
        return quantity;
    }

    @EventSourcingHandler
    void on(QuantityChanged event) {
        this.quantity = event.quantity();
    }
}
