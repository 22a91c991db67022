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
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "aggregates")
public class AggregatesProperties {

    /**
     * Number of times a message is retried after a recoverable failure, -1 retries without limit.
     */
    private int maxRetries = 5;

    /**
     * Pause between two attempts.
     */
    private Duration retryDelay = Duration.ofMillis(50);

    /**
     * Bucket used when none is given.
     */
    private String defaultBucket = Bucket.DEFAULT;

    /**
     * Packages scanned for @DomainEventInfo and @MementoInfo types.
     */
    private List<String> eventsPackages = new ArrayList<>();

    private final Store store = new Store();

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public String getDefaultBucket() {
        return defaultBucket;
    }

    public void setDefaultBucket(String defaultBucket) {
        this.defaultBucket = defaultBucket;
    }

    public List<String> getEventsPackages() {
        return eventsPackages;
    }

    public void setEventsPackages(List<String> eventsPackages) {
        this.eventsPackages = eventsPackages;
    }

    public Store getStore() {
        return store;
    }

    public enum StoreType {
        IN_MEMORY,
        ROCKSDB
    }

    public static class Store {
        private StoreType type = StoreType.IN_MEMORY;
        private String rocksdbDir = System.getProperty("java.io.tmpdir") + "/aggregates";

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public String getRocksdbDir() {
            return rocksdbDir;
        }

        public void setRocksdbDir(String rocksdbDir) {
            this.rocksdbDir = rocksdbDir;
        }
    }
}
