/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.trapfeed.rest;

import dev.mars.trapfeed.api.store.EventStore;
import dev.mars.trapfeed.api.store.InventoryStore;
import dev.mars.trapfeed.api.store.LookupStore;
import dev.mars.trapfeed.db.TrapFeedDefaults;
import dev.mars.trapfeed.db.connection.PgConnectionManager;
import dev.mars.trapfeed.db.store.PgEventStore;
import dev.mars.trapfeed.db.store.PgInventoryStore;
import dev.mars.trapfeed.db.store.PgLookupStore;
import dev.mars.trapfeed.rest.config.FeedServerConfig;
import io.vertx.core.Future;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * The store ports the server runs against, with a reachability check per backing store.
 *
 * @param events       event log
 * @param inventory    device inventory
 * @param lookups      reference tables
 * @param healthChecks named reachability checks reported by {@code /health}
 */
public record FeedStores(
        EventStore events,
        InventoryStore inventory,
        LookupStore lookups,
        Map<String, Supplier<Future<Boolean>>> healthChecks) {

    public FeedStores {
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(inventory, "inventory");
        Objects.requireNonNull(lookups, "lookups");
        healthChecks = Map.copyOf(healthChecks);
    }

    /**
     * PostgreSQL stores over two named pools of the given manager.
     */
    public static FeedStores postgres(PgConnectionManager connectionManager, FeedServerConfig config) {
        connectionManager.getOrCreatePool(TrapFeedDefaults.EVENT_STORE_POOL_ID,
            config.eventStore().toConnectionConfig());
        connectionManager.getOrCreatePool(TrapFeedDefaults.INVENTORY_POOL_ID,
            config.inventoryStore().toConnectionConfig());

        Map<String, Supplier<Future<Boolean>>> checks = new LinkedHashMap<>();
        checks.put("events", () -> connectionManager.checkHealth(TrapFeedDefaults.EVENT_STORE_POOL_ID));
        checks.put("inventory", () -> connectionManager.checkHealth(TrapFeedDefaults.INVENTORY_POOL_ID));

        return new FeedStores(
            new PgEventStore(connectionManager),
            new PgInventoryStore(connectionManager),
            new PgLookupStore(connectionManager),
            checks);
    }
}
