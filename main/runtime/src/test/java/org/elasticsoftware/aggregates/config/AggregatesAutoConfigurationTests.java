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

package org.elasticsoftware.aggregates.config;

import org.elasticsoftware.aggregates.Bucket;
import org.elasticsoftware.aggregates.domain.ItemAdded;
import org.elasticsoftware.aggregates.domain.Order;
import org.elasticsoftware.aggregates.domain.OrderCreated;
import org.elasticsoftware.aggregates.domain.OrderMemento;
import org.elasticsoftware.aggregates.domain.QuantityChanged;
import org.elasticsoftware.aggregates.pipeline.BehaviorChain;
import org.elasticsoftware.aggregates.pipeline.IncomingContext;
import org.elasticsoftware.aggregates.pipeline.IncomingMessage;
import org.elasticsoftware.aggregates.registry.VersionRegistrar;
import org.elasticsoftware.aggregates.repository.UnitOfWork;
import org.elasticsoftware.aggregates.repository.UnitOfWorkFactory;
import org.elasticsoftware.aggregates.store.EventPersistence;
import org.elasticsoftware.aggregates.store.InMemoryEventPersistence;
import org.elasticsoftware.aggregates.store.rocksdb.RocksDBEventPersistence;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class AggregatesAutoConfigurationTests {
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AggregatesAutoConfiguration.class))
            .withPropertyValues("aggregates.events-packages=org.elasticsoftware.aggregates.domain");

    @Test
    public void testDefaults() {
        contextRunner.run(context -> {
            AggregatesProperties properties = context.getBean(AggregatesProperties.class);
            assertEquals(5, properties.getMaxRetries());
            assertEquals(Duration.ofMillis(50), properties.getRetryDelay());
            assertEquals(Bucket.DEFAULT, properties.getDefaultBucket());
            assertEquals(AggregatesProperties.StoreType.IN_MEMORY, properties.getStore().getType());
            assertInstanceOf(InMemoryEventPersistence.class, context.getBean(EventPersistence.class));
            assertNotNull(context.getBean(BehaviorChain.class));
        });
    }

    @Test
    public void testEventTypesAreRegistered() {
        contextRunner.run(context -> {
            VersionRegistrar registrar = context.getBean(VersionRegistrar.class);
            assertEquals("OrderCreated.v1", registrar.getVersionedName(OrderCreated.class));
            assertEquals("ItemAdded.v2", registrar.getVersionedName(ItemAdded.class));
            assertEquals("QuantityChanged.v1", registrar.getVersionedName(QuantityChanged.class));
            assertEquals(OrderMemento.class, registrar.getNamedType("OrderMemento.v1"));
        });
    }

    @Test
    public void testPipelineHandlesMessages() {
        contextRunner.withPropertyValues("aggregates.default-bucket=orders", "aggregates.max-retries=0").run(context -> {
            BehaviorChain chain = context.getBean(BehaviorChain.class);
            chain.invoke(new IncomingContext(new IncomingMessage(UUID.randomUUID().toString(), "create")), ctx -> {
                Order order = ctx.require(UnitOfWork.class).forAggregate(Order.TYPE).create("42");
                order.create("acme");
            });
            try (UnitOfWork unitOfWork = context.getBean(UnitOfWorkFactory.class).begin()) {
                Order order = unitOfWork.forAggregate(Order.TYPE).require("orders", "42");
                assertEquals("acme", order.getCustomer());
                assertEquals(1, order.getCommitVersion());
            }
        });
    }

    @Test
    public void testRocksDBStore(@TempDir Path baseDir) {
        contextRunner.withPropertyValues("aggregates.store.type=ROCKSDB", "aggregates.store.rocksdb-dir=" + baseDir)
                .run(context -> {
                    assertInstanceOf(RocksDBEventPersistence.class, context.getBean(EventPersistence.class));
                    try (UnitOfWork unitOfWork = context.getBean(UnitOfWorkFactory.class).begin()) {
                        Order order = unitOfWork.forAggregate(Order.TYPE).create("42");
                        order.create("acme");
                        order.addItem("sku-1", 2);
                        unitOfWork.commit(UUID.randomUUID(), Map.of());
                    }
                    try (UnitOfWork unitOfWork = context.getBean(UnitOfWorkFactory.class).begin()) {
                        assertEquals(2, unitOfWork.forAggregate(Order.TYPE).require("42").getVersion());
                    }
                });
    }
}
