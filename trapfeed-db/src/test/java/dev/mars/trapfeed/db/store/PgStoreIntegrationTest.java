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

package dev.mars.trapfeed.db.store;

import dev.mars.trapfeed.api.event.CheckpointSnapshot;
import dev.mars.trapfeed.api.event.EventRecord;
import dev.mars.trapfeed.api.event.PageFilter;
import dev.mars.trapfeed.db.TrapFeedDefaults;
import dev.mars.trapfeed.db.config.PgConnectionConfig;
import dev.mars.trapfeed.db.connection.PgConnectionManager;
import dev.mars.trapfeed.test.PostgreSQLTestConstants;
import dev.mars.trapfeed.test.categories.TestCategories;
import dev.mars.trapfeed.test.schema.TrapFeedTestSchemaInitializer;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the PostgreSQL store adapters against a real database.
 *
 * <p>Both pools point at the same container here; in production the event store and the
 * inventory are separate databases.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-14
 * @version 1.0
 */
@Tag(TestCategories.INTEGRATION)
@Testcontainers
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class PgStoreIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = PostgreSQLTestConstants.createStandardContainer();

    private Vertx vertx;
    private PgConnectionManager connectionManager;
    private PgEventStore eventStore;
    private PgInventoryStore inventoryStore;
    private PgLookupStore lookupStore;

    @BeforeAll
    void setUpStores() {
        TrapFeedTestSchemaInitializer.initializeSchema(postgres);

        vertx = Vertx.vertx();
        connectionManager = new PgConnectionManager(vertx);
        PgConnectionConfig config = PgConnectionConfig.builder()
            .host(postgres.getHost())
            .port(postgres.getFirstMappedPort())
            .database(postgres.getDatabaseName())
            .username(postgres.getUsername())
            .password(postgres.getPassword())
            .build();
        connectionManager.getOrCreatePool(TrapFeedDefaults.EVENT_STORE_POOL_ID, config);
        connectionManager.getOrCreatePool(TrapFeedDefaults.INVENTORY_POOL_ID, config);

        eventStore = new PgEventStore(connectionManager);
        inventoryStore = new PgInventoryStore(connectionManager);
        lookupStore = new PgLookupStore(connectionManager);
    }

    @AfterAll
    void tearDownStores() throws Exception {
        connectionManager.close();
        vertx.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }

    @BeforeEach
    void resetData() {
        TrapFeedTestSchemaInitializer.cleanupTestData(postgres);
    }

    @Test
    void testCheckpointOnEmptyTable() throws Exception {
        CheckpointSnapshot snapshot = await(eventStore.fetchCheckpoint());

        assertEquals(0L, snapshot.maxId());
        assertNull(snapshot.maxUpdateTime());
    }

    @Test
    void testCheckpointReadsMaxIdAndUpdateTime() throws Exception {
        insertEvents(3);
        TrapFeedTestSchemaInitializer.execute(postgres,
            "UPDATE rcv_log SET updatetime = '2026-03-04 05:06:07' WHERE id = 2");

        CheckpointSnapshot snapshot = await(eventStore.fetchCheckpoint());

        assertEquals(3L, snapshot.maxId());
        assertEquals(LocalDateTime.of(2026, 3, 4, 5, 6, 7), snapshot.maxUpdateTime());
    }

    @Test
    void testNewRowsAreAboveCheckpointAscendingAndCapped() throws Exception {
        insertEvents(6);

        List<EventRecord> rows = await(eventStore.fetchNewRows(2, 3));

        assertEquals(List.of(3L, 4L, 5L), rows.stream().map(EventRecord::id).toList());
        EventRecord first = rows.get(0);
        assertEquals("host-3", first.hostname());
        assertEquals("10.0.0.3", first.agentIp());
        assertEquals(LocalDateTime.of(2026, 1, 1, 10, 0, 3), first.trapTime());
        assertTrue(first.active());
    }

    @Test
    void testUpdatedRowsIgnoreCheckpointAndClearFlags() throws Exception {
        insertEvents(4);
        TrapFeedTestSchemaInitializer.execute(postgres, "UPDATE rcv_log SET updated = TRUE WHERE id IN (1, 3)");

        List<EventRecord> updated = await(eventStore.fetchUpdatedRows(5000));
        assertEquals(List.of(1L, 3L), updated.stream().map(EventRecord::id).toList());
        assertTrue(updated.get(0).updated());

        int cleared = await(eventStore.clearUpdatedFlags(List.of(1L, 3L, 4L)));
        assertEquals(3, cleared);
        assertTrue(await(eventStore.fetchUpdatedRows(5000)).isEmpty());
    }

    @Test
    void testResolveRowsTouchesOnlyTargetedRows() throws Exception {
        insertEvents(10);

        int resolved = await(eventStore.resolveRows(List.of(5L, 9L)));

        assertEquals(2, resolved);
        List<EventRecord> updated = await(eventStore.fetchUpdatedRows(5000));
        assertEquals(List.of(5L, 9L), updated.stream().map(EventRecord::id).toList());
        assertTrue(updated.stream().noneMatch(EventRecord::active));
        List<EventRecord> all = await(eventStore.fetchNewRows(0, 100));
        assertEquals(8, all.stream().filter(EventRecord::active).count());
    }

    @Test
    void testEmptyIdCollectionsDoNotHitTheStore() throws Exception {
        assertEquals(0, await(eventStore.resolveRows(List.of())));
        assertEquals(0, await(eventStore.clearUpdatedFlags(List.of())));
        assertEquals(0, await(inventoryStore.clearNodeState(List.of())));
    }

    @Test
    void testPageIsDescendingAndFiltered() throws Exception {
        insertEvents(12);
        TrapFeedTestSchemaInitializer.execute(postgres, "UPDATE rcv_log SET active = FALSE WHERE id = 12");

        List<EventRecord> page = await(eventStore.fetchPage(PageFilter.NONE, 2, 3));
        assertEquals(List.of(10L, 9L, 8L), page.stream().map(EventRecord::id).toList());

        PageFilter severityTwoActive = PageFilter.builder().severity(2).activeOnly(true).build();
        List<EventRecord> filtered = await(eventStore.fetchPage(severityTwoActive, 0, 50));
        assertEquals(List.of(11L, 8L, 5L, 2L), filtered.stream().map(EventRecord::id).toList());

        PageFilter host = PageFilter.builder().hostname("HOST-1").build();
        List<EventRecord> byHost = await(eventStore.fetchPage(host, 0, 50));
        assertEquals(List.of(12L, 11L, 10L, 1L), byHost.stream().map(EventRecord::id).toList());

        PageFilter address = PageFilter.builder().agentIp("10.0.0.7").build();
        assertEquals(List.of(7L), await(eventStore.fetchPage(address, 0, 50)).stream().map(EventRecord::id).toList());

        PageFilter window = PageFilter.builder()
            .timeFrom(LocalDateTime.of(2026, 1, 1, 10, 0, 4))
            .timeTo(LocalDateTime.of(2026, 1, 1, 10, 0, 6))
            .build();
        assertEquals(List.of(6L, 5L, 4L), await(eventStore.fetchPage(window, 0, 50)).stream().map(EventRecord::id).toList());
    }

    @Test
    void testClearNodeStateMergesIntoCustomFields() throws Exception {
        TrapFeedTestSchemaInitializer.execute(postgres,
            "INSERT INTO dcim_device (id, name, custom_field_data) VALUES "
                + "(1, 'sw-1', '{\"node_state\": 2, \"rack\": \"R1\"}'), "
                + "(2, 'sw-2', NULL), "
                + "(3, 'sw-3', '{\"node_state\": 1}')");

        int touched = await(inventoryStore.clearNodeState(List.of(1L, 2L)));
        assertEquals(2, touched);

        JsonArray devices = await(connectionManager.withConnection(TrapFeedDefaults.INVENTORY_POOL_ID, conn ->
            conn.query("SELECT id, custom_field_data::text AS cf FROM dcim_device ORDER BY id").execute()
                .map(rows -> {
                    JsonArray out = new JsonArray();
                    rows.forEach(row -> out.add(new JsonObject(row.getString("cf"))));
                    return out;
                })));

        assertEquals(new JsonObject().put("node_state", 0).put("rack", "R1"), devices.getJsonObject(0));
        assertEquals(new JsonObject().put("node_state", 0), devices.getJsonObject(1));
        assertEquals(new JsonObject().put("node_state", 1), devices.getJsonObject(2));
    }

    @Test
    void testLookups() throws Exception {
        TrapFeedTestSchemaInitializer.execute(postgres,
            "INSERT INTO mib_oid (oid, name, severity) VALUES ('1.3.6.1.6.3.1.1.5.3', 'linkDown', 4)");
        TrapFeedTestSchemaInitializer.execute(postgres,
            "INSERT INTO nodes (node_name, target, site, node_type, node_model, poll_interval, poll_retry, poll_timeout) "
                + "VALUES ('core-1', '10.0.0.1', 'MIL', 'switch', 'C9300', 60, 3, 5)");

        JsonArray mibs = await(lookupStore.listMibObjects());
        assertEquals(1, mibs.size());
        assertEquals("linkDown", mibs.getJsonObject(0).getString("name"));

        JsonArray nodes = await(lookupStore.listNodes());
        assertEquals(1, nodes.size());
        JsonObject node = nodes.getJsonObject(0);
        assertEquals("core-1", node.getString("node_name"));
        assertFalse(node.containsKey("id"));
    }

    /**
     * Inserts rows 1..count with severity (i % 3), host-i and 10.0.0.i.
     */
    private void insertEvents(int count) {
        StringBuilder sql = new StringBuilder(
            "INSERT INTO rcv_log (node_id, active, eventname, severity, utctime, traptime, hostname, agentip, formatline) VALUES ");
        for (int i = 1; i <= count; i++) {
            if (i > 1) {
                sql.append(", ");
            }
            String ts = String.format("'2026-01-01 10:00:%02d'", i);
            sql.append("(").append(i).append(", TRUE, 'linkDown', ").append(i % 3).append(", ")
                .append(ts).append(", ").append(ts).append(", 'host-").append(i).append("', '10.0.0.")
                .append(i).append("', 'line ").append(i).append("')");
        }
        TrapFeedTestSchemaInitializer.execute(postgres, sql.toString());
    }

    private static <T> T await(Future<T> future) throws Exception {
        return future.toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
    }
}
