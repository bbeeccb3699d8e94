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

package dev.mars.trapfeed.feed.poller;

import dev.mars.trapfeed.api.acknowledge.AcknowledgeRequest;
import dev.mars.trapfeed.api.event.EventRecord;
import dev.mars.trapfeed.feed.acknowledge.AcknowledgeHandler;
import dev.mars.trapfeed.feed.broadcast.FanOutBroadcaster;
import dev.mars.trapfeed.feed.checkpoint.CheckpointTracker;
import dev.mars.trapfeed.feed.metrics.FeedMetrics;
import dev.mars.trapfeed.feed.protocol.FeedMessages;
import dev.mars.trapfeed.feed.subscriber.SubscriberRegistry;
import dev.mars.trapfeed.feed.support.Await;
import dev.mars.trapfeed.feed.support.FakeEventStore;
import dev.mars.trapfeed.feed.support.FakeInventoryStore;
import dev.mars.trapfeed.feed.support.RecordingConnection;
import dev.mars.trapfeed.feed.support.TestRows;
import dev.mars.trapfeed.test.categories.TestCategories;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the change poller against an in-memory event log.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
@Tag(TestCategories.CORE)
@ExtendWith(VertxExtension.class)
class ChangePollerTest {

    private FakeEventStore store;
    private FeedMetrics metrics;
    private SubscriberRegistry registry;
    private CheckpointTracker checkpoint;
    private ChangePoller poller;

    @BeforeEach
    void setUp(Vertx vertx) {
        store = new FakeEventStore();
        metrics = FeedMetrics.inMemory();
        registry = new SubscriberRegistry();
        checkpoint = new CheckpointTracker(store);
        poller = newPoller(vertx, 20);
    }

    @AfterEach
    void tearDown() {
        poller.stop();
    }

    @Test
    void testFilteredSubscriberScenario() throws Exception {
        store.insert(TestRows.row(50, 1), TestRows.row(101, 1), TestRows.row(102, 2), TestRows.row(103, 1));
        store.touch(50);
        checkpoint.advance(100, null);
        RecordingConnection severityOne = new RecordingConnection("sev-1");
        registry.register(severityOne).setSeverityFilter(1);

        PollCycleResult result = Await.result(poller.runCycle());

        assertEquals(List.of(101L, 103L, 50L), severityOne.receivedRowIds());
        assertEquals(103L, checkpoint.highWaterMark());
        assertEquals(103L, result.highWaterMark());
        assertEquals(List.of(List.of(101L, 102L, 103L, 50L)), store.clearedBatches());
        assertFalse(store.get(50).updated());
    }

    @Test
    void testRowBothNewAndUpdatedIsEmittedOnceWithUpdatedValues() throws Exception {
        store.insert(TestRows.row(1, 1), TestRows.row(2, 1), TestRows.row(3, 1));
        store.insert(TestRows.withFormatLine(TestRows.updated(TestRows.row(2, 1)), "changed"));
        RecordingConnection connection = new RecordingConnection("a");
        registry.register(connection);

        PollCycleResult result = Await.result(poller.runCycle());

        assertEquals(List.of(1L, 2L, 3L), connection.receivedRowIds());
        JsonObject second = connection.messages().get(0).getJsonArray("rows").getJsonObject(1);
        assertEquals("changed", second.getString("formatline"));
        assertTrue(second.getBoolean("updated"));
        assertEquals(List.of(1L, 2L, 3L), result.emittedIds());
        assertEquals(3, result.newRows());
        assertEquals(1, result.updatedRows());
        assertEquals(store.get(2).updateTime(), checkpoint.lastChangeTime());
    }

    @Test
    void testMergeKeepsFirstPositionAndUpdatedValues() {
        EventRecord original = TestRows.row(5, 1);
        EventRecord changed = TestRows.withFormatLine(original, "changed");

        List<EventRecord> merged = ChangePoller.merge(
            List.of(TestRows.row(4, 1), original, TestRows.row(6, 1)),
            List.of(TestRows.row(2, 1), changed));

        assertEquals(List.of(4L, 5L, 6L, 2L), merged.stream().map(EventRecord::id).toList());
        assertEquals("changed", merged.get(1).formatLine());
    }

    @Test
    void testIdleCycleDoesNothing() throws Exception {
        store.insert(TestRows.row(1, 1));
        checkpoint.advance(1, null);
        RecordingConnection connection = new RecordingConnection("a");
        registry.register(connection);

        PollCycleResult result = Await.result(poller.runCycle());

        assertTrue(result.isIdle());
        assertTrue(connection.sent().isEmpty());
        assertTrue(store.clearedBatches().isEmpty());
        assertEquals(1.0, metrics.registry().counter("trapfeed.poll.cycles").count());
    }

    @Test
    void testCheckpointIsNonDecreasingAcrossCycles() throws Exception {
        long previous = checkpoint.highWaterMark();
        for (int cycle = 0; cycle < 5; cycle++) {
            store.insert(TestRows.row(cycle * 10L + 1, 1), TestRows.row(cycle * 10L + 2, 1));
            // an old row mutated again must not pull the mark back
            store.touch(1);
            Await.result(poller.runCycle());
            assertTrue(checkpoint.highWaterMark() >= previous);
            previous = checkpoint.highWaterMark();
        }
        assertEquals(42L, checkpoint.highWaterMark());
    }

    @Test
    void testRestartRederivesCheckpointAndReemitsOnlyUpdatedRows(Vertx vertx) throws Exception {
        store.insert(TestRows.row(1, 1), TestRows.row(2, 1), TestRows.row(3, 1));
        store.touch(2);

        CheckpointTracker restarted = new CheckpointTracker(store);
        Await.result(restarted.initialize());
        ChangePoller afterRestart = new ChangePoller(vertx, store, restarted,
            new FanOutBroadcaster(registry, new FeedMessages(), metrics, 250), metrics, 20, 5000);
        RecordingConnection connection = new RecordingConnection("a");
        registry.register(connection);

        Await.result(afterRestart.runCycle());

        assertEquals(3L, restarted.highWaterMark());
        assertEquals(List.of(2L), connection.receivedRowIds());
    }

    @Test
    void testAcknowledgedRowsAppearInNextCycleAsInactive() throws Exception {
        for (long id = 1; id <= 10; id++) {
            store.insert(TestRows.row(id, 1));
        }
        checkpoint.advance(10, null);
        RecordingConnection connection = new RecordingConnection("a");
        registry.register(connection);
        AcknowledgeHandler acknowledge = new AcknowledgeHandler(store, new FakeInventoryStore(), metrics);

        Await.result(acknowledge.acknowledge(new AcknowledgeRequest(List.of(5L, 9L), List.of(), List.of())));
        Await.result(poller.runCycle());

        assertEquals(List.of(5L, 9L), connection.receivedRowIds());
        assertTrue(connection.messages().get(0).getJsonArray("rows").stream()
            .map(JsonObject.class::cast)
            .noneMatch(row -> row.getBoolean("active")));
        assertEquals(10L, checkpoint.highWaterMark());
    }

    @Test
    void testFailedCycleIsReportedAndNothingIsCleared() throws Exception {
        store.insert(TestRows.row(1, 1));
        store.failNextNewRowFetches(1);

        Throwable failure = Await.failure(poller.runCycle());

        assertEquals("connection refused", failure.getMessage());
        assertEquals(0L, checkpoint.highWaterMark());
        assertTrue(store.clearedBatches().isEmpty());
        assertEquals(1.0, metrics.registry().counter("trapfeed.poll.failures").count());
    }

    @Test
    void testLoopSurvivesFailedCycles(Vertx vertx, VertxTestContext testContext) throws Exception {
        store.insert(TestRows.row(1, 1), TestRows.row(2, 3));
        store.failNextNewRowFetches(2);
        RecordingConnection connection = new RecordingConnection("a");
        registry.register(connection);

        poller.start();
        vertx.setPeriodic(10, timer -> {
            if (!connection.sent().isEmpty()) {
                vertx.cancelTimer(timer);
                testContext.verify(() -> {
                    assertTrue(store.fetchNewRowsCalls() >= 3);
                    assertEquals(List.of(1L, 2L), connection.receivedRowIds());
                    assertEquals(2.0, metrics.registry().counter("trapfeed.poll.failures").count());
                    assertTrue(poller.isRunning());
                });
                testContext.completeNow();
            }
        });

        assertTrue(testContext.awaitCompletion(5, TimeUnit.SECONDS));
    }

    @Test
    void testStopHaltsTheLoop(Vertx vertx, VertxTestContext testContext) throws Exception {
        poller.start();
        vertx.setTimer(100, started -> {
            poller.stop();
            int callsAtStop = store.fetchNewRowsCalls();
            vertx.setTimer(150, later -> {
                testContext.verify(() -> {
                    assertFalse(poller.isRunning());
                    assertTrue(store.fetchNewRowsCalls() <= callsAtStop + 1);
                });
                testContext.completeNow();
            });
        });

        assertTrue(testContext.awaitCompletion(5, TimeUnit.SECONDS));
    }

    @Test
    void testInvalidConfigurationIsRejected(Vertx vertx) {
        FanOutBroadcaster broadcaster = new FanOutBroadcaster(registry, new FeedMessages(), metrics, 250);
        assertThrows(IllegalArgumentException.class,
            () -> new ChangePoller(vertx, store, checkpoint, broadcaster, metrics, 0, 5000));
        assertThrows(IllegalArgumentException.class,
            () -> new ChangePoller(vertx, store, checkpoint, broadcaster, metrics, 2000, 0));
    }

    private ChangePoller newPoller(Vertx vertx, long intervalMs) {
        FanOutBroadcaster broadcaster = new FanOutBroadcaster(registry, new FeedMessages(), metrics, 250);
        return new ChangePoller(vertx, store, checkpoint, broadcaster, metrics, intervalMs, 5000);
    }
}
