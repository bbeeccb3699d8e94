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

import dev.mars.trapfeed.api.event.CheckpointSnapshot;
import dev.mars.trapfeed.api.event.EventRecord;
import dev.mars.trapfeed.api.event.PageFilter;
import dev.mars.trapfeed.api.store.EventStore;
import dev.mars.trapfeed.db.TrapFeedDefaults;
import dev.mars.trapfeed.db.connection.PgConnectionManager;
import io.vertx.core.Future;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowIterator;
import io.vertx.sqlclient.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * {@link EventStore} over the {@code rcv_log} table using the Vert.x reactive PostgreSQL client.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-12
 * @version 1.0
 */
public class PgEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(PgEventStore.class);

    private static final String SELECT_CHECKPOINT =
        "SELECT MAX(id) AS max_id, MAX(updatetime) AS max_updatetime FROM rcv_log";

    private static final String SELECT_NEW_ROWS =
        "SELECT " + EventRowMapper.COLUMNS + " FROM rcv_log WHERE id > $1 ORDER BY id ASC LIMIT $2";

    private static final String SELECT_UPDATED_ROWS =
        "SELECT " + EventRowMapper.COLUMNS + " FROM rcv_log WHERE updated = TRUE ORDER BY id ASC LIMIT $1";

    private static final String CLEAR_UPDATED =
        "UPDATE rcv_log SET updated = FALSE WHERE id = ANY($1)";

    private static final String RESOLVE_ROWS =
        "UPDATE rcv_log SET active = FALSE, updated = TRUE WHERE id = ANY($1)";

    private final PgConnectionManager connectionManager;
    private final String storeId;

    public PgEventStore(PgConnectionManager connectionManager) {
        this(connectionManager, TrapFeedDefaults.EVENT_STORE_POOL_ID);
    }

    public PgEventStore(PgConnectionManager connectionManager, String storeId) {
        this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager");
        this.storeId = Objects.requireNonNull(storeId, "storeId");
    }

    @Override
    public Future<CheckpointSnapshot> fetchCheckpoint() {
        return connectionManager.withConnection(storeId, conn ->
            conn.query(SELECT_CHECKPOINT).execute().map(rows -> {
                RowIterator<Row> it = rows.iterator();
                if (!it.hasNext()) {
                    return CheckpointSnapshot.EMPTY;
                }
                Row row = it.next();
                Long maxId = row.getLong("max_id");
                LocalDateTime maxUpdateTime = row.getLocalDateTime("max_updatetime");
                return new CheckpointSnapshot(maxId == null ? 0L : maxId, maxUpdateTime);
            }));
    }

    @Override
    public Future<List<EventRecord>> fetchNewRows(long afterId, int limit) {
        return connectionManager.withConnection(storeId, conn ->
            conn.preparedQuery(SELECT_NEW_ROWS)
                .execute(Tuple.of(afterId, (long) limit))
                .map(EventRowMapper::mapAll));
    }

    @Override
    public Future<List<EventRecord>> fetchUpdatedRows(int limit) {
        return connectionManager.withConnection(storeId, conn ->
            conn.preparedQuery(SELECT_UPDATED_ROWS)
                .execute(Tuple.of((long) limit))
                .map(EventRowMapper::mapAll));
    }

    @Override
    public Future<Integer> clearUpdatedFlags(Collection<Long> ids) {
        return updateByIds(CLEAR_UPDATED, ids);
    }

    @Override
    public Future<List<EventRecord>> fetchPage(PageFilter filter, int offset, int limit) {
        PageQuery query = PageQuery.of(filter, offset, limit);
        logger.debug("Page query: {} with {} parameters", query.sql(), query.params().size());
        return connectionManager.withConnection(storeId, conn ->
            conn.preparedQuery(query.sql())
                .execute(query.params())
                .map(EventRowMapper::mapAll));
    }

    @Override
    public Future<Integer> resolveRows(Collection<Long> ids) {
        return updateByIds(RESOLVE_ROWS, ids);
    }

    private Future<Integer> updateByIds(String sql, Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return Future.succeededFuture(0);
        }
        Long[] idArray = ids.toArray(new Long[0]);
        return connectionManager.withConnection(storeId, conn ->
            conn.preparedQuery(sql)
                .execute(Tuple.of(idArray))
                .map(rows -> rows.rowCount()));
    }
}
