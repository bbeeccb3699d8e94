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

import dev.mars.trapfeed.api.event.EventRecord;
import dev.mars.trapfeed.api.store.EventStore;
import dev.mars.trapfeed.feed.broadcast.BroadcastReport;
import dev.mars.trapfeed.feed.broadcast.FanOutBroadcaster;
import dev.mars.trapfeed.feed.checkpoint.CheckpointTracker;
import dev.mars.trapfeed.feed.metrics.FeedMetrics;
import dev.mars.trapfeed.feed.protocol.MessageType;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic change detection over the event log.
 *
 * <p>Each cycle reads the rows above the checkpoint and the rows flagged updated, merges
 * them by id, broadcasts the merged rows as one {@code update}, advances the checkpoint and
 * clears the updated flag of every emitted row. The next cycle is scheduled with a one-shot
 * timer once the current one has finished, whatever its outcome, so cycles never overlap and
 * a failing store only delays the feed.</p>
 *
 * <p>Delivery is at-least-once: if the process stops between the broadcast and the flag
 * clear, the same rows are emitted again by the next cycle.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-15
 * @version 1.0
 */
public class ChangePoller {

    private static final Logger logger = LoggerFactory.getLogger(ChangePoller.class);

    public static final long DEFAULT_INTERVAL_MS = 2000L;
    public static final int DEFAULT_BATCH_LIMIT = 5000;

    private final Vertx vertx;
    private final EventStore eventStore;
    private final CheckpointTracker checkpoint;
    private final FanOutBroadcaster broadcaster;
    private final FeedMetrics metrics;
    private final long intervalMs;
    private final int batchLimit;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile long timerId = -1;

    public ChangePoller(Vertx vertx, EventStore eventStore, CheckpointTracker checkpoint,
                        FanOutBroadcaster broadcaster, FeedMetrics metrics,
                        long intervalMs, int batchLimit) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive, got " + intervalMs);
        }
        if (batchLimit <= 0) {
            throw new IllegalArgumentException("batchLimit must be positive, got " + batchLimit);
        }
        this.vertx = Objects.requireNonNull(vertx, "vertx");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.checkpoint = Objects.requireNonNull(checkpoint, "checkpoint");
        this.broadcaster = Objects.requireNonNull(broadcaster, "broadcaster");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalMs = intervalMs;
        this.batchLimit = batchLimit;
    }

    /**
     * Starts the loop. The first cycle runs one interval after this call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            logger.info("Change poller started: interval={}ms, batchLimit={}, checkpoint={}",
                intervalMs, batchLimit, checkpoint.highWaterMark());
            scheduleNext();
        }
    }

    /**
     * Stops the loop. A cycle already in flight completes but schedules nothing further.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            long id = timerId;
            if (id != -1) {
                vertx.cancelTimer(id);
                timerId = -1;
            }
            logger.info("Change poller stopped at checkpoint {}", checkpoint.highWaterMark());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Runs one detection cycle now.
     *
     * @return the cycle outcome; failed if any store call failed
     */
    public Future<PollCycleResult> runCycle() {
        Future<PollCycleResult> cycle;
        try {
            cycle = detectAndEmit();
        } catch (RuntimeException e) {
            cycle = Future.failedFuture(e);
        }
        return cycle
            .onSuccess(result -> {
                metrics.pollCompleted();
                if (!result.isIdle()) {
                    logger.debug("Poll cycle emitted {} rows ({} new, {} updated), checkpoint={}",
                        result.emittedIds().size(), result.newRows(), result.updatedRows(), result.highWaterMark());
                }
            })
            .onFailure(error -> {
                metrics.pollFailed();
                logger.error("Poll cycle failed at checkpoint {}: {}", checkpoint.highWaterMark(), error.getMessage(), error);
            });
    }

    private void scheduleNext() {
        if (!running.get()) {
            return;
        }
        timerId = vertx.setTimer(intervalMs, id -> {
            timerId = -1;
            if (!running.get()) {
                return;
            }
            runCycle().onComplete(ar -> scheduleNext());
        });
    }

    private Future<PollCycleResult> detectAndEmit() {
        long afterId = checkpoint.highWaterMark();
        return eventStore.fetchNewRows(afterId, batchLimit)
            .compose(newRows -> eventStore.fetchUpdatedRows(batchLimit)
                .compose(updatedRows -> emit(newRows, updatedRows)));
    }

    private Future<PollCycleResult> emit(List<EventRecord> newRows, List<EventRecord> updatedRows) {
        List<EventRecord> merged = merge(newRows, updatedRows);
        if (merged.isEmpty()) {
            return Future.succeededFuture(PollCycleResult.idle(checkpoint.highWaterMark()));
        }

        BroadcastReport report = broadcaster.broadcast(merged, MessageType.UPDATE);

        long maxId = Long.MIN_VALUE;
        LocalDateTime maxUpdateTime = null;
        List<Long> ids = new ArrayList<>(merged.size());
        for (EventRecord row : merged) {
            ids.add(row.id());
            maxId = Math.max(maxId, row.id());
            LocalDateTime updateTime = row.updateTime();
            if (updateTime != null && (maxUpdateTime == null || updateTime.isAfter(maxUpdateTime))) {
                maxUpdateTime = updateTime;
            }
        }
        long mark = checkpoint.advance(maxId, maxUpdateTime);

        return eventStore.clearUpdatedFlags(ids)
            .map(cleared -> new PollCycleResult(newRows.size(), updatedRows.size(), ids, report, mark));
    }

    /**
     * Merges by id in first-seen order. New rows go in first and updated rows second, so a row
     * present in both keeps its position but carries the updated values.
     */
    static List<EventRecord> merge(List<EventRecord> newRows, List<EventRecord> updatedRows) {
        Map<Long, EventRecord> byId = new LinkedHashMap<>();
        for (EventRecord row : newRows) {
            byId.put(row.id(), row);
        }
        for (EventRecord row : updatedRows) {
            byId.put(row.id(), row);
        }
        return new ArrayList<>(byId.values());
    }
}
