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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.aggregates.annotations.DomainEventInfo;
import org.elasticsoftware.aggregates.annotations.MementoInfo;
import org.elasticsoftware.aggregates.events.EventFactory;
import org.elasticsoftware.aggregates.events.JacksonEventFactory;
import org.elasticsoftware.aggregates.pipeline.BehaviorChain;
import org.elasticsoftware.aggregates.pipeline.SafetyNet;
import org.elasticsoftware.aggregates.pipeline.UnitOfWorkBehavior;
import org.elasticsoftware.aggregates.registry.AnnotationVersionRegistrar;
import org.elasticsoftware.aggregates.registry.VersionRegistrar;
import org.elasticsoftware.aggregates.repository.UnitOfWorkFactory;
import org.elasticsoftware.aggregates.routing.AnnotationRouteResolver;
import org.elasticsoftware.aggregates.routing.RouteResolver;
import org.elasticsoftware.aggregates.scope.DependencyScope;
import org.elasticsoftware.aggregates.spring.SpringDependencyScope;
import org.elasticsoftware.aggregates.store.EventPersistence;
import org.elasticsoftware.aggregates.store.EventStore;
import org.elasticsoftware.aggregates.store.InMemoryEventPersistence;
import org.elasticsoftware.aggregates.store.OptimisticEventStore;
import org.elasticsoftware.aggregates.store.rocksdb.CommitSerde;
import org.elasticsoftware.aggregates.store.rocksdb.RocksDBEventPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.env.Environment;
import org.springframework.core.type.filter.AnnotationTypeFilter;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.List;

@AutoConfiguration
@EnableConfigurationProperties(AggregatesProperties.class)
public class AggregatesAutoConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(AggregatesAutoConfiguration.class);

    @Bean(name = "aggregatesDomainEventScanner")
    public ClassPathScanningCandidateComponentProvider domainEventScanner(Environment environment) {
        ClassPathScanningCandidateComponentProvider provider = new ClassPathScanningCandidateComponentProvider(false);
        provider.addIncludeFilter(new AnnotationTypeFilter(DomainEventInfo.class));
        provider.addIncludeFilter(new AnnotationTypeFilter(MementoInfo.class));
        provider.setEnvironment(environment);
        return provider;
    }

    @Bean(name = "aggregatesVersionRegistrar")
    @ConditionalOnMissingBean(VersionRegistrar.class)
    public VersionRegistrar versionRegistrar(AggregatesProperties properties,
                                             @Qualifier("aggregatesDomainEventScanner") ClassPathScanningCandidateComponentProvider domainEventScanner) {
        List<Class<?>> types = new ArrayList<>();
        for (String eventsPackage : properties.getEventsPackages()) {
            for (BeanDefinition candidate : domainEventScanner.findCandidateComponents(eventsPackage)) {
                types.add(ClassUtils.resolveClassName(candidate.getBeanClassName(), getClass().getClassLoader()));
            }
        }
        logger.info("Registering {} versioned types from {}", types.size(), properties.getEventsPackages());
        AnnotationVersionRegistrar registrar = new AnnotationVersionRegistrar();
        registrar.load(types);
        return registrar;
    }

    @Bean(name = "aggregatesEventPersistence", destroyMethod = "close")
    @ConditionalOnMissingBean(EventPersistence.class)
    public EventPersistence eventPersistence(AggregatesProperties properties,
                                             VersionRegistrar versionRegistrar,
                                             ObjectProvider<ObjectMapper> objectMapper) {
        return switch (properties.getStore().getType()) {
            case IN_MEMORY -> new InMemoryEventPersistence();
            case ROCKSDB -> new RocksDBEventPersistence(properties.getStore().getRocksdbDir(), "events",
                    new CommitSerde(objectMapper.getIfAvailable(ObjectMapper::new), versionRegistrar));
        };
    }

    @Bean(name = "aggregatesEventStore")
    @ConditionalOnMissingBean(EventStore.class)
    public EventStore eventStore(EventPersistence eventPersistence) {
        return new OptimisticEventStore(eventPersistence);
    }

    @Bean(name = "aggregatesEventFactory")
    @ConditionalOnMissingBean(EventFactory.class)
    public EventFactory eventFactory(ObjectProvider<ObjectMapper> objectMapper) {
        return new JacksonEventFactory(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean(name = "aggregatesRouteResolver")
    @ConditionalOnMissingBean(RouteResolver.class)
    public RouteResolver routeResolver() {
        return new AnnotationRouteResolver();
    }

    @Bean(name = "aggregatesDependencyScope")
    @ConditionalOnMissingBean(DependencyScope.class)
    public DependencyScope dependencyScope(ApplicationContext applicationContext) {
        return new SpringDependencyScope(applicationContext);
    }

    @Bean(name = "aggregatesUnitOfWorkFactory")
    @ConditionalOnMissingBean(UnitOfWorkFactory.class)
    public UnitOfWorkFactory unitOfWorkFactory(EventStore eventStore,
                                               DependencyScope dependencyScope,
                                               AggregatesProperties properties) {
        return new UnitOfWorkFactory(eventStore, dependencyScope, properties.getDefaultBucket());
    }

    @Bean(name = "aggregatesSafetyNet")
    public SafetyNet safetyNet(AggregatesProperties properties) {
        return new SafetyNet(properties.getMaxRetries(), properties.getRetryDelay());
    }

    @Bean(name = "aggregatesUnitOfWorkBehavior")
    public UnitOfWorkBehavior unitOfWorkBehavior(UnitOfWorkFactory unitOfWorkFactory) {
        return new UnitOfWorkBehavior(unitOfWorkFactory);
    }

    @Bean(name = "aggregatesBehaviorChain")
    @ConditionalOnMissingBean(BehaviorChain.class)
    public BehaviorChain behaviorChain(SafetyNet safetyNet, UnitOfWorkBehavior unitOfWorkBehavior) {
        return new BehaviorChain(List.of(safetyNet, unitOfWorkBehavior));
    }
}
