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
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class EntityTypeTests {
    record Counted(int count) implements Memento {
    }

    static class Account extends Aggregate {
    }

    static class Ledger extends AggregateWithMemento<Counted> {
        @Override
        protected Counted createMemento() {
            return new Counted(getVersion());
        }

        @Override
        protected void restoreMemento(Counted memento) {
        }
    }

    static class Line extends Entity {
    }

    @Test
    public void testDefaultCapabilities() {
        assertEquals(EnumSet.allOf(Capability.class), EntityType.of(Account.class, Account::new).capabilities());
        Set<Capability> lineCapabilities = EntityType.of(Line.class, Line::new).capabilities();
        assertFalse(lineCapabilities.contains(Capability.REPOSITORY_FACTORY));
        assertEquals(4, lineCapabilities.size());
        assertEquals("Line", EntityType.of(Line.class, Line::new).typeName());
    }

    @Test
    public void testExplicitCapabilities() {
        EntityType<Account> type = EntityType.of(Account.class, Account::new, Capability.STREAM);
        assertTrue(type.requires(Capability.STREAM));
        assertFalse(type.requires(Capability.SCOPE));
        assertThrows(UnsupportedOperationException.class, () -> type.capabilities().add(Capability.SCOPE));
        assertThrows(IllegalArgumentException.class,
                () -> EntityType.of(Line.class, Line::new, Capability.STREAM, Capability.REPOSITORY_FACTORY));
    }

    @Test
    public void testSnapshotSupport() {
        assertTrue(EntityType.of(Ledger.class, Ledger::new).supportsSnapshots());
        assertFalse(EntityType.of(Account.class, Account::new).supportsSnapshots());
    }

    @Test
    public void testNewInstanceReturnsFreshInstances() {
        EntityType<Account> type = EntityType.of(Account.class, Account::new);
        assertNotSame(type.newInstance(), type.newInstance());
        EntityType<Account> broken = EntityType.of(Account.class, () -> null);
        assertThrows(IllegalStateException.class, broken::newInstance);
    }
}
