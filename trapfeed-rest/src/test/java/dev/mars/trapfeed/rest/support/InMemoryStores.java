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

package dev.mars.trapfeed.rest.support;

import dev.mars.trapfeed.api.event.CheckpointSnapshot;
import dev.mars.trapfeed.api.event.EventRecord;
import dev.mars.trapfeed.api.event.PageFilter;
import dev.mars.trapfeed.api.store.EventStore;
import dev.mars.trapfeed.api.store.InventoryStore;
import dev.mars.trapfeed.api.store.LookupStore;
import dev.mars.trapfeed.rest.FeedStores;
import io.vertx.core.Future;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Event log, inventory and lookup tables held in memory, for exercising the server without
 * a database.
 */
public class InMemoryStores implements EventStore, InventoryStore, LookupStore {

    public static final LocalDateTime BASE_TIME = LocalDateTime.of(2026, 4, 1, 8, 0, 0);

    private final ConcurrentSkipListMap<Long, EventRecord> rows = new ConcurrentSkipListMap<>();
    private final List<List<Long>> clearedNodes = new CopyOnWriteArrayList<>();
    private volatile boolean lookupsUnavailable;
    private volatile boolean pagesUnavailable;

    public static EventRecord row(long id, int severity) {
        LocalDateTime time = BASE_TIME.plusMinutes(id);
        return new EventRecord(id, 100 + id, true, severity, "linkDown", time, time, null,
            "sw-" + id, "10.9.0." + id, "interface down on sw-" + id, false);
    }

    public InMemoryStores insert(EventRecord... records) {
        for (EventRecord record : records) {
            rows.put(record.id(), record);
        }
        return this;
    }

    public List<List<Long>> clearedNodes() {
        return clearedNodes;
    }

    public void setLookupsUnavailable(boolean unavailable) {
        this.lookupsUnavailable = unavailable;
    }

    public void setPagesUnavailable(boolean unavailable) {
        this.pagesUnavailable = unavailable;
    }

    public FeedStores asFeedStores() {
        return new FeedStores(this, this, this, Map.of("memory", () -> Future.succeededFuture(true)));
    }

    @Override
    public Future<CheckpointSnapshot> fetchCheckpoint() {
        return Future.succeededFuture(rows.isEmpty()
            ? CheckpointSnapshot.EMPTY
            : new CheckpointSnapshot(rows.lastKey(), null));
    }

    @Override
    public Future<List<EventRecord>> fetchNewRows(long afterId, int limit) {
        return Future.succeededFuture(rows.tailMap(afterId, false).values().stream()
            .limit(limit)
            .collect(Collectors.toList()));
    }

    @Override
    public Future<List<EventRecord>> fetchUpdatedRows(int limit) {
        return Future.succeededFuture(rows.values().stream()
            .filter(EventRecord::updated)
            .limit(limit)
            .collect(Collectors.toList()));
    }

    @Override
    public Future<Integer> clearUpdatedFlags(Collection<Long> ids) {
        ids.forEach(id -> rows.computeIfPresent(id, (key, row) -> copy(row, row.active(), false)));
        return Future.succeededFuture(ids.size());
    }

    @Override
    public Future<List<EventRecord>> fetchPage(PageFilter filter, int offset, int limit) {
        if (pagesUnavailable) {
            return Future.failedFuture(new IllegalStateException("event store unavailable"));
        }
        return Future.succeededFuture(rows.descendingMap().values().stream()
            .filter(row -> !filter.hasSeverity() || row.severity() == filter.severity())
            .filter(row -> !filter.activeOnly() || row.active())
            .skip(offset)
            .limit(limit)
            .collect(Collectors.toList()));
    }

    @Override
    public Future<Integer> resolveRows(Collection<Long> ids) {
        ids.forEach(id -> rows.computeIfPresent(id, (key, row) -> copy(row, false, true)));
        return Future.succeededFuture(ids.size());
    }

    @Override
    public Future<Integer> clearNodeState(Collection<Long> nodeIds) {
        clearedNodes.add(List.copyOf(nodeIds));
        return Future.succeededFuture(nodeIds.size());
    }

    @Override
    public Future<JsonArray> listMibObjects() {
        if (lookupsUnavailable) {
            return Future.failedFuture(new IllegalStateException("lookup tables unavailable"));
        }
        return Future.succeededFuture(new JsonArray()
            .add(new JsonObject().put("id", 1).put("oid", "1.3.6.1.6.3.1.1.5.3").put("name", "linkDown").put("severity", 4)));
    }

    @Override
    public Future<JsonArray> listNodes() {
        if (lookupsUnavailable) {
            return Future.failedFuture(new IllegalStateException("lookup tables unavailable"));
        }
        return Future.succeededFuture(new JsonArray()
            .add(new JsonObject().put("node_name", "core-1").put("target", "10.9.0.1").put("poll_interval", 60)));
    }

    private static EventRecord copy(EventRecord row, boolean active, boolean updated) {
        return new EventRecord(row.id(), row.nodeId(), active, row.severity(), row.eventName(),
            row.utcTime(), row.trapTime(), updated ? BASE_TIME.plusDays(1) : row.updateTime(),
            row.hostname(), row.agentIp(), row.formatLine(), updated);
    }
}
