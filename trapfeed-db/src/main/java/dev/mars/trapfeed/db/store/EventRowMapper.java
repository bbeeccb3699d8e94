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

import dev.mars.trapfeed.api.event.EventRecord;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps {@code rcv_log} rows to {@link EventRecord}s.
 */
final class EventRowMapper {

    static final String COLUMNS =
        "id, node_id, active, eventname, severity, utctime, traptime, updatetime, hostname, agentip, formatline, updated";

    private EventRowMapper() {
    }

    static EventRecord map(Row row) {
        Integer severity = row.getInteger("severity");
        return new EventRecord(
            row.getLong("id"),
            row.getLong("node_id"),
            Boolean.TRUE.equals(row.getBoolean("active")),
            severity == null ? 0 : severity,
            row.getString("eventname"),
            row.getLocalDateTime("utctime"),
            row.getLocalDateTime("traptime"),
            row.getLocalDateTime("updatetime"),
            row.getString("hostname"),
            row.getString("agentip"),
            row.getString("formatline"),
            Boolean.TRUE.equals(row.getBoolean("updated")));
    }

    static List<EventRecord> mapAll(RowSet<Row> rows) {
        List<EventRecord> records = new ArrayList<>(rows.size());
        for (Row row : rows) {
            records.add(map(row));
        }
        return records;
    }
}
