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

import org.elasticsoftware.aggregates.snapshot.Memento;
import org.elasticsoftware.aggregates.snapshot.Snapshot;

import java.util.Map;

/**
 * Aggregate that can be restored from, and periodically captures, a memento of its state.
 *
 * @param <M> the memento type
 */
public abstract class AggregateWithMemento<M extends Memento> extends Aggregate implements Snapshotting {

    @Override
    @SuppressWarnings("unchecked")
    public final void restoreSnapshot(Snapshot snapshot) {
        restoreMemento((M) snapshot.payload());
        restoreVersion(snapshot.version());
    }

    @Override
    public final Snapshot takeSnapshot() {
        return new Snapshot(getBucketId(), getId(), getVersion(), createMemento());
    }

    /**
     * Decides, after every applied event, whether a snapshot marker should be appended. Never by default.
     */
    @Override
    public boolean shouldTakeSnapshot() {
        return false;
    }

    @Override
    protected void afterApply() {
        if (shouldTakeSnapshot()) {
            getStream().add(takeSnapshot(), Map.of());
        }
    }

    protected abstract M createMemento();

    protected abstract void restoreMemento(M memento);
}
