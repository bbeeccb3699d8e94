package dev.mars.trapfeed.db.store;

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

import dev.mars.trapfeed.api.store.InventoryStore;
import dev.mars.trapfeed.db.TrapFeedDefaults;
import dev.mars.trapfeed.db.connection.PgConnectionManager;
import io.vertx.core.Future;
import io.vertx.sqlclient.Tuple;

import java.util.Collection;
import java.util.Objects;

/**
 * {@link InventoryStore} over the DCIM {@code dcim_device} table.
 *
 * <p>{@code node_state} is patched into {@code custom_field_data} with {@code jsonb_set},
 * so the other custom fields of a device survive the update. A device without any custom
 * field data starts from an empty document.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-13
 * @version 1.0
 */
public class PgInventoryStore implements InventoryStore {

    private static final String CLEAR_NODE_STATE =
        "UPDATE dcim_device "
            + "SET custom_field_data = jsonb_set(COALESCE(custom_field_data, '{}'::jsonb), '{node_state}', to_jsonb(0)) "
            + "WHERE id = ANY($1)";

    private final PgConnectionManager connectionManager;
    private final String storeId;

    public PgInventoryStore(PgConnectionManager connectionManager) {
        this(connectionManager, TrapFeedDefaults.INVENTORY_POOL_ID);
    }

    public PgInventoryStore(PgConnectionManager connectionManager, String storeId) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.storeId = Objects.requireNonNull(storeId, "storeId");
    }

    @Override
    public Future<Integer> clearNodeState(Collection<Long> nodeIds) {
        if (nodeIds == null || nodeIds.isEmpty()) {
            return Future.succeededFuture(0);
        }
        Long[] ids = nodeIds.toArray(new Long[0]);
        return connectionManager.withConnection(storeId, conn ->
            conn.preparedQuery(CLEAR_NODE_STATE)
                .execute(Tuple.of(ids))
                .map(rows -> rows.rowCount()));
    }
}
