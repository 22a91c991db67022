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

package org.elasticsoftware.aggregates.spring;

import org.elasticsoftware.aggregates.scope.DependencyScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.support.GenericApplicationContext;

/**
 * {@link DependencyScope} backed by an {@link ApplicationContext}. Child scopes are empty contexts that delegate
 * to their parent, so prototype beans are created per child while singletons are shared.
 */
public class SpringDependencyScope implements DependencyScope {
    private static final Logger logger = LoggerFactory.getLogger(SpringDependencyScope.class);
    private final ApplicationContext applicationContext;
    private final boolean owned;

    public SpringDependencyScope(ApplicationContext applicationContext) {
        this(applicationContext, false);
    }

    private SpringDependencyScope(ApplicationContext applicationContext, boolean owned) {
        this.applicationContext = applicationContext;
        this.owned = owned;
    }

    @Override
    public DependencyScope createChildScope() {
        GenericApplicationContext child = new GenericApplicationContext();
        child.setParent(applicationContext);
        child.refresh();
        logger.trace("Created child scope {}", child.getId());
        return new SpringDependencyScope(child, true);
    }

    @Override
    public <T> T build(Class<T> type) {
        return applicationContext.getBean(type);
    }

    @Override
    public void close() {
        // the root context belongs to the application
        if (owned && applicationContext instanceof ConfigurableApplicationContext configurable) {
            configurable.close();
        }
    }
}
