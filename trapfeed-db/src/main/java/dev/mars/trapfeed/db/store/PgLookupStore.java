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

import dev.mars.trapfeed.api.store.LookupStore;
import dev.mars.trapfeed.db.TrapFeedDefaults;
import dev.mars.trapfeed.db.connection.PgConnectionManager;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;

import java.util.Objects;

/**
 * {@link LookupStore} reading the reference tables that live next to {@code rcv_log}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-14
 * @version 1.0
 */
public class PgLookupStore implements LookupStore {

    private static final String SELECT_MIB_OBJECTS = "SELECT * FROM mib_oid";

    private static final String SELECT_NODES =
        "SELECT node_name, target, site, node_type, node_model, poll_interval, poll_retry, poll_timeout FROM nodes";

    private final PgConnectionManager connectionManager;
    private final String storeId;

    public PgLookupStore(PgConnectionManager connectionManager) {
        this(connectionManager, TrapFeedDefaults.EVENT_STORE_POOL_ID);
    }

    public PgLookupStore(PgConnectionManager connectionManager, String storeId) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.storeId = Objects.requireNonNull(storeId, "storeId");
    }

    @Override
    public Future<JsonArray> listMibObjects() {
        return query(SELECT_MIB_OBJECTS);
    }

    @Override
    public Future<JsonArray> listNodes() {
        return query(SELECT_NODES);
    }

    private Future<JsonArray> query(String sql) {
        return connectionManager.withConnection(storeId, conn ->
            conn.query(sql).execute().map(PgLookupStore::toJson));
    }

    private static JsonArray toJson(RowSet<Row> rows) {
        JsonArray array = new JsonArray();
        for (Row row : rows) {
            array.add(row.toJson());
        }
        return array;
    }
}
